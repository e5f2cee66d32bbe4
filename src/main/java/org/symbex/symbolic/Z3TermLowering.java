package org.symbex.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.expressions.ApplyTerm;
import org.symbex.expressions.ConstantTerm;
import org.symbex.expressions.Term;
import org.symbex.expressions.TermOperator;
import org.symbex.expressions.TermVisitor;
import org.symbex.expressions.UnsupportedConstructException;
import org.symbex.expressions.VariableTerm;
import org.symbex.utils.Rational;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把与后端无关的 {@link Term} 降级为 Z3 表达式。
 * <p>
 * 整数除法的两种取整方向都由 Z3 的欧几里得 {@code div} 构造：
 * 除数为正时欧几里得商等于向下取整的商，除数为负时对两边取负即可；向零截断的商由绝对值相除再补符号得到。
 * 除数为零时 Z3 的结果不受约束，除零由翻译器产生的错误隐患单独处理。
 * <p>
 * 降级过程中出现的所有字典键项都会被记录，模型提取时用它们枚举字典内容。
 */
public class Z3TermLowering implements TermVisitor<Expr> {

    private final Context ctx;
    private final Z3VariableManager varManager;
    private final Map<Term, Expr> cache = new HashMap<>();
    private final Map<Domain, Set<Term>> dictKeys = new HashMap<>();

    public Z3TermLowering(Context ctx, Z3VariableManager varManager) {
        this.ctx = ctx;
        this.varManager = varManager;
    }

    public Expr lower(Term term) {
        Expr cached = cache.get(term);
        if (cached != null) {
            return cached;
        }
        Expr result = term.accept(this);
        cache.put(term, result);
        return result;
    }

    public BoolExpr lowerBool(Term term) {
        if (!term.getDomain().is(DomainKind.BOOL)) {
            throw new IllegalArgumentException("约束必须是布尔项: " + term);
        }
        return (BoolExpr) lower(term);
    }

    /**
     * 降级过程中见过的、键值域为 {@code keyDomain} 的全部键项，按出现顺序排列。
     */
    public List<Term> getDictKeys(Domain keyDomain) {
        return new ArrayList<>(dictKeys.getOrDefault(keyDomain, Set.of()));
    }

    @Override
    public Expr visitVariable(VariableTerm term) {
        return varManager.getZ3Var(term.getVariable());
    }

    @Override
    public Expr visitConstant(ConstantTerm term) {
        Object v = term.getValue();
        return switch (term.getDomain().getKind()) {
            case INT -> ctx.mkInt(v.toString());
            case REAL -> ((Rational) v).toZ3Real(ctx);
            case BOOL -> ctx.mkBool((Boolean) v);
            case STRING -> ctx.mkString((String) v);
            default -> throw new UnsupportedConstructException("constant of " + term.getDomain());
        };
    }

    @Override
    public Expr visitApply(ApplyTerm term) {
        List<Term> args = term.getArgs();
        Expr[] a = new Expr[args.size()];
        for (int i = 0; i < a.length; i++) {
            a[i] = lower(args.get(i));
        }
        TermOperator op = term.getOperator();
        return switch (op) {
            case ADD -> ctx.mkAdd(a[0], a[1]);
            case SUB -> ctx.mkSub(a[0], a[1]);
            case MUL -> ctx.mkMul(a[0], a[1]);
            case REAL_DIV -> ctx.mkDiv(a[0], a[1]);
            case FLOOR_DIV -> floorDiv(a[0], a[1]);
            case FLOOR_MOD -> ctx.mkSub(a[0], ctx.mkMul(a[1], floorDiv(a[0], a[1])));
            case TRUNC_DIV -> truncDiv(a[0], a[1]);
            case TRUNC_REM -> ctx.mkSub(a[0], ctx.mkMul(a[1], truncDiv(a[0], a[1])));
            case NEG -> ctx.mkUnaryMinus(a[0]);
            case TO_REAL -> ctx.mkInt2Real(a[0]);
            case FLOOR -> ctx.mkReal2Int(a[0]);
            case EQ -> ctx.mkEq(a[0], a[1]);
            case NE -> ctx.mkNot(ctx.mkEq(a[0], a[1]));
            case LT -> ctx.mkLt(a[0], a[1]);
            case LE -> ctx.mkLe(a[0], a[1]);
            case GT -> ctx.mkGt(a[0], a[1]);
            case GE -> ctx.mkGe(a[0], a[1]);
            case NOT -> ctx.mkNot(a[0]);
            case AND -> ctx.mkAnd(a);
            case OR -> ctx.mkOr(a);
            case ITE -> ctx.mkITE(a[0], a[1], a[2]);
            case STR_CONCAT, SEQ_CONCAT -> ctx.mkConcat(a);
            case STR_LENGTH, SEQ_LENGTH -> ctx.mkLength(a[0]);
            case STR_CONTAINS -> ctx.mkContains(a[0], a[1]);
            case STR_PREFIX -> ctx.mkPrefixOf(a[1], a[0]);
            case STR_SUFFIX -> ctx.mkSuffixOf(a[1], a[0]);
            case STR_AT -> ctx.mkAt(a[0], a[1]);
            case STR_FROM_INT -> ctx.intToString(a[0]);
            case SEQ_LITERAL -> sequence(term.getDomain(), a);
            case SEQ_NTH -> ctx.mkNth(a[0], a[1]);
            case SEQ_CONTAINS -> ctx.mkContains(a[0], ctx.mkUnit(a[1]));
            case SEQ_UPDATE -> update(a[0], a[1], a[2]);
            case DICT_GET -> {
                noteKey(args.get(1));
                yield ctx.mkSelect(varManager.dictValues(a[0], args.get(0).getDomain()), a[1]);
            }
            case DICT_HAS -> {
                noteKey(args.get(1));
                yield ctx.mkSelect(varManager.dictKeys(a[0], args.get(0).getDomain()), a[1]);
            }
            case DICT_PUT -> {
                noteKey(args.get(1));
                yield varManager.mkDict(term.getDomain(),
                        ctx.mkStore(varManager.dictKeys(a[0], term.getDomain()), a[1], ctx.mkTrue()),
                        ctx.mkStore(varManager.dictValues(a[0], term.getDomain()), a[1], a[2]));
            }
        };
    }

    private void noteKey(Term key) {
        dictKeys.computeIfAbsent(key.getDomain(), d -> new LinkedHashSet<>()).add(key);
    }

    private Expr floorDiv(Expr a, Expr b) {
        Expr zero = ctx.mkInt(0);
        return ctx.mkITE(ctx.mkGt(b, zero), ctx.mkDiv(a, b), ctx.mkDiv(ctx.mkUnaryMinus(a), ctx.mkUnaryMinus(b)));
    }

    private Expr truncDiv(Expr a, Expr b) {
        Expr zero = ctx.mkInt(0);
        Expr absA = ctx.mkITE(ctx.mkLt(a, zero), ctx.mkUnaryMinus(a), a);
        Expr absB = ctx.mkITE(ctx.mkLt(b, zero), ctx.mkUnaryMinus(b), b);
        Expr q = ctx.mkDiv(absA, absB);
        BoolExpr negative = ctx.mkXor(ctx.mkLt(a, zero), ctx.mkLt(b, zero));
        return ctx.mkITE(negative, ctx.mkUnaryMinus(q), q);
    }

    private Expr sequence(Domain domain, Expr[] elements) {
        if (elements.length == 0) {
            Sort sort = varManager.getSort(domain);
            return ctx.mkEmptySeq(sort);
        }
        Expr[] units = new Expr[elements.length];
        for (int i = 0; i < elements.length; i++) {
            units[i] = ctx.mkUnit(elements[i]);
        }
        return units.length == 1 ? units[0] : ctx.mkConcat(units);
    }

    /**
     * 替换下标 i 处的元素：{@code s[0, i) ++ [v] ++ s[i+1, len)}。
     */
    private Expr update(Expr seq, Expr index, Expr value) {
        Expr one = ctx.mkInt(1);
        Expr rest = ctx.mkSub(ctx.mkSub(ctx.mkLength(seq), index), one);
        return ctx.mkConcat(ctx.mkExtract(seq, ctx.mkInt(0), index), ctx.mkUnit(value),
                ctx.mkExtract(seq, ctx.mkAdd(index, one), rest));
    }
}
