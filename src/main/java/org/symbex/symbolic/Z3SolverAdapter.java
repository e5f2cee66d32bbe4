package org.symbex.symbolic;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.expressions.Term;
import org.symbex.expressions.UnsupportedConstructException;
import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 Z3 的求解器适配器。一个实例持有一个 Z3 Context 和一个 Solver，
 * 每次检查在独立的 push/pop 作用域中进行，并单独设置超时。
 * <p>
 * 此类不是线程安全的。
 */
@Getter
public class Z3SolverAdapter implements SolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverAdapter.class);

    /** 模型中列表元素的最大提取个数 */
    static final int MAX_EXTRACTED_ELEMENTS = 1000;

    private static final Pattern ESCAPE = Pattern.compile("\\\\u\\{([0-9a-fA-F]+)}");

    private final Context ctx;
    private final Solver solver;
    private final Z3VariableManager varManager;

    private long checks;

    public Z3SolverAdapter() {
        this.ctx = new Context();
        this.solver = ctx.mkSolver();
        this.varManager = new Z3VariableManager(ctx);
        logger.debug("Z3 求解器会话已创建");
    }

    @Override
    public CheckResult check(List<Term> constraints, Duration timeout) {
        Objects.requireNonNull(constraints, "Constraints cannot be null.");
        Objects.requireNonNull(timeout, "Timeout cannot be null.");
        checks++;
        Z3TermLowering lowering = new Z3TermLowering(ctx, varManager);
        BoolExpr[] assertions = new BoolExpr[constraints.size()];
        try {
            for (int i = 0; i < assertions.length; i++) {
                assertions[i] = lowering.lowerBool(constraints.get(i));
            }
        } catch (UnsupportedConstructException e) {
            logger.warn("约束无法交给 Z3: {}，检查结果记为 UNKNOWN", e.getConstruct());
            return CheckResult.unknown("unsupported: " + e.getConstruct());
        } catch (Z3Exception e) {
            logger.warn("构造 Z3 约束失败: {}", e.getMessage());
            return CheckResult.unknown(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("降级约束时出现意外错误，检查结果记为 UNKNOWN", e);
            return CheckResult.unknown("lowering failed: " + e);
        }

        Params params = ctx.mkParams();
        params.add("timeout", (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis())));
        solver.setParameters(params);

        solver.push();
        try {
            solver.add(assertions);
            Status status = solver.check();
            logger.debug("第 {} 次检查，{} 条约束: {}", checks, assertions.length, status);
            switch (status) {
                case SATISFIABLE:
                    return CheckResult.sat(new Z3SolverModel(solver.getModel(), lowering));
                case UNSATISFIABLE:
                    return CheckResult.unsat();
                default:
                    String reason = solver.getReasonUnknown();
                    logger.warn("Z3 无法判定（{}），约束: {}", reason, constraints);
                    return CheckResult.unknown(reason);
            }
        } catch (Z3Exception e) {
            logger.warn("Z3 检查失败: {}", e.getMessage());
            return CheckResult.unknown(e.getMessage());
        } finally {
            solver.pop();
        }
    }

    @Override
    public Object toPortable(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Expr) {
            return portableScalar((Expr) value);
        }
        if (value instanceof BigInteger) {
            BigInteger b = (BigInteger) value;
            return b.bitLength() < Long.SIZE ? (Object) b.longValueExact() : b;
        }
        if (value instanceof Rational) {
            return ((Rational) value).toDecimalString();
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object o : (List<?>) value) {
                out.add(toPortable(o));
            }
            return out;
        }
        if (value instanceof Map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> out.put(toPortable(k), toPortable(v)));
            return out;
        }
        return value;
    }

    private Object portableScalar(Expr e) {
        if (e.isTrue()) {
            return Boolean.TRUE;
        }
        if (e.isFalse()) {
            return Boolean.FALSE;
        }
        if (e.isIntNum()) {
            return toPortable(((IntNum) e).getBigInteger());
        }
        if (e.isRatNum()) {
            RatNum r = (RatNum) e;
            return Rational.valueOf(r.getBigIntNumerator(), r.getBigIntDenominator()).toDecimalString();
        }
        if (e.isAlgebraicNumber()) {
            return ((AlgebraicNum) e).toDecimal(Rational.DECIMAL_PRECISION);
        }
        if (e.isString()) {
            return unescape(e.getString());
        }
        logger.debug("模型值 {} 不是可移植标量", e);
        return null;
    }

    /**
     * 还原 Z3 字符串中的转义：不可打印字符写作反斜杠、字母 u 和花括号包住的十六进制码点。
     */
    static String unescape(String z3String) {
        Matcher m = ESCAPE.matcher(z3String);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(
                    new String(Character.toChars(Integer.parseInt(m.group(1), 16)))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public void close() {
        logger.debug("关闭 Z3 求解器会话，共 {} 次检查", checks);
        ctx.close();
    }

    /**
     * 一次 SAT 检查得到的模型。模型对象在 pop 之后仍然有效。
     */
    private final class Z3SolverModel implements SolverModel {

        private final Model model;
        private final Z3TermLowering lowering;

        private Z3SolverModel(Model model, Z3TermLowering lowering) {
            this.model = model;
            this.lowering = lowering;
        }

        @Override
        public Object evaluate(Term term) {
            try {
                return evaluate(lowering.lower(term), term.getDomain());
            } catch (RuntimeException e) {
                logger.debug("无法在模型中求值 {}: {}", term, e.getMessage());
                return null;
            }
        }

        private Object evaluate(Expr e, Domain domain) {
            if (domain.is(DomainKind.LIST)) {
                Object length = portableScalar(model.eval(ctx.mkLength(e), true));
                int n = length instanceof Long ? (int) Math.min((Long) length, MAX_EXTRACTED_ELEMENTS) : 0;
                List<Object> elements = new ArrayList<>(n);
                for (int i = 0; i < n; i++) {
                    elements.add(evaluate(ctx.mkNth(e, ctx.mkInt(i)), domain.getElement()));
                }
                return elements;
            }
            if (domain.is(DomainKind.DICT)) {
                Map<Object, Object> entries = new LinkedHashMap<>();
                Expr keys = varManager.dictKeys(e, domain);
                Expr values = varManager.dictValues(e, domain);
                for (Term keyTerm : lowering.getDictKeys(domain.getKey())) {
                    Expr key = model.eval(lowering.lower(keyTerm), true);
                    if (model.eval(ctx.mkSelect(keys, key), true).isTrue()) {
                        entries.putIfAbsent(portableScalar(key),
                                evaluate(model.eval(ctx.mkSelect(values, key), true), domain.getValue()));
                    }
                }
                return entries;
            }
            return portableScalar(model.eval(e, true));
        }
    }
}
