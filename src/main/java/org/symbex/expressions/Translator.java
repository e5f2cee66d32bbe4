package org.symbex.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.core.ErrorKind;
import org.symbex.core.MixedNumericPolicy;
import org.symbex.core.SymbolicVariable;
import org.symbex.core.TheoryFeatures;
import org.symbex.ir.ArithmeticSemantics;
import org.symbex.ir.CfgBuilder;
import org.symbex.ir.ast.BoolOperator;
import org.symbex.ir.ast.Expr;
import org.symbex.ir.ast.ExprVisitor;
import org.symbex.state.SymbolicState;
import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 将 IR 表达式翻译为最窄的、可靠的求解器理论项。
 * <ul>
 *     <li>整数使用整数理论，除法与取模的取整方向由 {@link ArithmeticSemantics} 决定，除零产生错误隐患而非任意值。</li>
 *     <li>小数使用实数理论，舍入推迟到模型提取。</li>
 *     <li>字符串使用序列理论；列表 / 字典在扩展配置下使用序列 / 数组理论。</li>
 *     <li>无法翻译的子表达式得到一个全新的、不受约束的不透明值，路径继续。</li>
 * </ul>
 * 翻译是纯函数：不修改传入的状态，新分配的不透明编号通过 {@link Translation#getNextFresh()} 返回。
 */
public class Translator {

    private static final Logger logger = LoggerFactory.getLogger(Translator.class);

    /** 幂运算展开的最大指数 */
    private static final int MAX_POWER = 64;

    private final ArithmeticSemantics semantics;
    private final TheoryFeatures features;
    private final MixedNumericPolicy mixedNumericPolicy;

    public Translator(ArithmeticSemantics semantics, TheoryFeatures features, MixedNumericPolicy mixedNumericPolicy) {
        this.semantics = Objects.requireNonNull(semantics, "Arithmetic semantics cannot be null.");
        this.features = Objects.requireNonNull(features, "Theory features cannot be null.");
        this.mixedNumericPolicy = Objects.requireNonNull(mixedNumericPolicy, "Mixed numeric policy cannot be null.");
    }

    /**
     * 翻译表达式的值。
     */
    public Translation translate(Expr expr, SymbolicState state) {
        Session s = new Session(state);
        Term term = s.value(expr);
        return s.finish(term);
    }

    /**
     * 翻译表达式作为条件时的真值（布尔项）。
     */
    public Translation translateCondition(Expr expr, SymbolicState state) {
        Session s = new Session(state);
        Term term = s.condition(expr);
        return s.finish(term);
    }

    /**
     * 翻译 {@code target[index] = value}，结果项是 target 的新值。无法建模时结果为不透明值，target 随之失效。
     */
    public Translation translateStore(String target, Expr index, Expr value, SymbolicState state) {
        Session s = new Session(state);
        Term v = s.value(value);
        Term i = s.value(index);
        Term updated;
        try {
            updated = s.store(target, i, v);
        } catch (UnsupportedConstructException e) {
            logger.debug("{}[{}] 的写入无法建模，{} 变为不透明值: {}", target, index, target, e.getConstruct());
            updated = s.opaque(target, Domain.ANY);
        }
        return s.finish(updated);
    }

    /**
     * 为外部调用结果或被写入的变量分配一个新的不透明值。
     */
    public Translation havoc(String origin, SymbolicState state) {
        Session s = new Session(state);
        return s.finish(s.opaque(origin, Domain.ANY));
    }

    /**
     * 把值项转换为指定值域；不透明值在首次使用时确定值域。
     * @throws UnsupportedConstructException 无法转换时。
     */
    public Term coerce(Term term, Domain target) {
        if (term.getDomain().equals(target)) {
            return term;
        }
        if (!features.supports(target)) {
            throw new UnsupportedConstructException("theory disabled for " + target);
        }
        if (term instanceof VariableTerm && ((VariableTerm) term).getVariable().isOpaque()
                && term.getDomain().is(DomainKind.ANY)) {
            return Terms.variable(((VariableTerm) term).getVariable().withDomain(target));
        }
        DomainKind from = term.getDomain().getKind();
        if (target.is(DomainKind.REAL) && (from == DomainKind.INT || from == DomainKind.BOOL)) {
            return Terms.toReal(coerce(term, Domain.INT));
        }
        if (target.is(DomainKind.INT) && from == DomainKind.BOOL) {
            return Terms.ite(term, Terms.ONE, Terms.ZERO);
        }
        throw new UnsupportedConstructException("cannot convert " + term.getDomain() + " to " + target);
    }

    /**
     * 值的真值：数值非零、字符串 / 列表非空、布尔本身、None 为假。
     */
    public Term truthiness(Term t) {
        return switch (t.getDomain().getKind()) {
            case BOOL -> t;
            case INT -> Terms.compare(TermOperator.NE, t, Terms.ZERO);
            case REAL -> Terms.compare(TermOperator.NE, t, Terms.real(Rational.ZERO));
            case STRING, LIST -> Terms.compare(TermOperator.GT, Terms.length(t), Terms.ZERO);
            case NONE -> Terms.FALSE;
            case ANY -> coerce(t, Domain.BOOL);
            case DICT -> throw new UnsupportedConstructException("truthiness of dict");
        };
    }

    /**
     * 单次翻译的可变上下文：不透明编号、已发现的错误隐患和当前的求值前提。
     */
    private final class Session implements ExprVisitor<Term> {

        private final SymbolicState state;
        private final List<Hazard> hazards = new ArrayList<>();
        private final Deque<Term> guards = new ArrayDeque<>();
        private int fresh;

        private Session(SymbolicState state) {
            this.state = state;
            this.fresh = state.getFreshCounter();
        }

        Translation finish(Term term) {
            return new Translation(term, hazards, fresh);
        }

        Term opaque(String origin, Domain domain) {
            SymbolicVariable v = SymbolicVariable.opaque(origin.replaceAll("[^A-Za-z0-9_]", "_"), domain, fresh++);
            return Terms.variable(v);
        }

        /**
         * 翻译子表达式；无法翻译时在此处降级为不透明值。
         */
        Term value(Expr e) {
            try {
                return e.accept(this);
            } catch (UnsupportedConstructException ex) {
                logger.debug("第 {} 行的 {} 无法翻译（{}），使用不透明值", e.getLine(), e, ex.getConstruct());
                return opaque("expr", Domain.ANY);
            }
        }

        Term condition(Expr e) {
            if (e instanceof Expr.BoolOp) {
                Expr.BoolOp b = (Expr.BoolOp) e;
                List<Term> parts = new ArrayList<>();
                int pushed = 0;
                for (Expr operand : b.getValues()) {
                    Term c = condition(operand);
                    parts.add(c);
                    guards.push(b.getOp() == BoolOperator.AND ? c : Terms.not(c));
                    pushed++;
                }
                for (int i = 0; i < pushed; i++) {
                    guards.pop();
                }
                return b.getOp() == BoolOperator.AND ? Terms.and(parts) : Terms.or(parts);
            }
            if (e instanceof Expr.UnaryOp && ((Expr.UnaryOp) e).getOp() == org.symbex.ir.ast.UnaryOperator.NOT) {
                return Terms.not(condition(((Expr.UnaryOp) e).getOperand()));
            }
            Term v = value(e);
            try {
                return truthiness(v);
            } catch (UnsupportedConstructException ex) {
                logger.debug("{} 的真值无法建模，使用不透明布尔值", e);
                return opaque("truth", Domain.BOOL);
            }
        }

        private void hazard(Term condition, ErrorKind kind) {
            Term guarded = guarded(condition);
            if (guarded != null) {
                hazards.add(new Hazard(guarded, kind));
            }
        }

        private void unmodelled(Term condition) {
            Term guarded = guarded(condition);
            if (guarded != null) {
                hazards.add(Hazard.unmodelled(guarded));
            }
        }

        /**
         * 加上当前求值前提后的条件；恒假时返回 null。
         */
        private Term guarded(Term condition) {
            List<Term> parts = new ArrayList<>(guards);
            parts.add(condition);
            Term guarded = Terms.and(parts);
            if (guarded instanceof ConstantTerm && ((ConstantTerm) guarded).isFalse()) {
                return null;
            }
            return guarded;
        }

        // ========== 数值辅助 ==========

        private Term numeric(Term t) {
            return switch (t.getDomain().getKind()) {
                case INT, REAL -> t;
                case BOOL -> coerce(t, Domain.INT);
                case ANY -> coerce(t, semantics.isNumbersAreReal() ? Domain.REAL : Domain.INT);
                default -> throw new UnsupportedConstructException("arithmetic on " + t.getDomain());
            };
        }

        /**
         * 把两个数值项统一到同一值域。整数与实数混合时按策略提升或放弃。
         */
        private Term[] unify(Term a, Term b) {
            if (a.getDomain().is(DomainKind.ANY) && !b.getDomain().is(DomainKind.ANY)) {
                a = coerce(a, numeric(b).getDomain());
            }
            if (b.getDomain().is(DomainKind.ANY) && !a.getDomain().is(DomainKind.ANY)) {
                b = coerce(b, numeric(a).getDomain());
            }
            a = numeric(a);
            b = numeric(b);
            if (a.getDomain().equals(b.getDomain())) {
                return new Term[]{a, b};
            }
            if (mixedNumericPolicy == MixedNumericPolicy.OPAQUE) {
                throw new UnsupportedConstructException("mixed int/real operands");
            }
            return new Term[]{Terms.toReal(a), Terms.toReal(b)};
        }

        private Term zeroOf(Term t) {
            return t.getDomain().is(DomainKind.INT) ? Terms.ZERO : Terms.real(Rational.ZERO);
        }

        /**
         * 除数为零时：会抛出异常的语义产生除零错误；不抛出的语义（实数结果为无穷或 NaN）在此截断路径，
         * 不让 Z3 中不受约束的 {@code x/0} 流入后续约束。
         */
        private void divisorHazard(Term divisor, boolean raises) {
            Term isZero = Terms.compare(TermOperator.EQ, divisor, zeroOf(divisor));
            if (raises) {
                hazard(isZero, ErrorKind.DIVISION_BY_ZERO);
            } else {
                unmodelled(isZero);
            }
        }

        /**
         * 实数向零截断。
         */
        private Term truncateReal(Term x) {
            Term zero = Terms.real(Rational.ZERO);
            return Terms.ite(Terms.compare(TermOperator.GE, x, zero), Terms.floor(x),
                    Terms.negate(Terms.floor(Terms.negate(x))));
        }

        private Term division(Term left, Term right) {
            Term[] ab = unify(left, right);
            if (semantics.isTrueDivision() || ab[0].getDomain().is(DomainKind.REAL)) {
                Term a = Terms.toReal(ab[0]);
                Term b = Terms.toReal(ab[1]);
                boolean raises = ab[0].getDomain().is(DomainKind.INT)
                        ? semantics.integerDivisionByZeroRaises() && semantics.isRealDivisionByZeroRaises()
                        : semantics.isRealDivisionByZeroRaises();
                divisorHazard(b, raises);
                return Terms.arithmetic(TermOperator.REAL_DIV, a, b);
            }
            divisorHazard(ab[1], semantics.integerDivisionByZeroRaises());
            return Terms.arithmetic(TermOperator.TRUNC_DIV, ab[0], ab[1]);
        }

        private Term floorDivision(Term left, Term right) {
            Term[] ab = unify(left, right);
            if (ab[0].getDomain().is(DomainKind.INT)) {
                divisorHazard(ab[1], semantics.integerDivisionByZeroRaises());
                return Terms.arithmetic(TermOperator.FLOOR_DIV, ab[0], ab[1]);
            }
            divisorHazard(ab[1], semantics.isRealDivisionByZeroRaises());
            return Terms.toReal(Terms.floor(Terms.arithmetic(TermOperator.REAL_DIV, ab[0], ab[1])));
        }

        private Term modulo(Term left, Term right) {
            Term[] ab = unify(left, right);
            if (ab[0].getDomain().is(DomainKind.INT)) {
                divisorHazard(ab[1], semantics.integerDivisionByZeroRaises());
                return Terms.arithmetic(semantics.isFlooredModulo() ? TermOperator.FLOOR_MOD : TermOperator.TRUNC_REM,
                        ab[0], ab[1]);
            }
            divisorHazard(ab[1], semantics.isRealDivisionByZeroRaises());
            Term quotient = Terms.arithmetic(TermOperator.REAL_DIV, ab[0], ab[1]);
            Term whole = semantics.isFlooredModulo() ? Terms.toReal(Terms.floor(quotient)) : truncateReal(quotient);
            if (whole.getDomain().is(DomainKind.INT)) {
                whole = Terms.toReal(whole);
            }
            return Terms.arithmetic(TermOperator.SUB, ab[0], Terms.arithmetic(TermOperator.MUL, ab[1], whole));
        }

        private Term power(Term base, Term exponent) {
            if (!(exponent instanceof ConstantTerm) || !exponent.getDomain().is(DomainKind.INT)) {
                throw new UnsupportedConstructException("non-constant exponent");
            }
            BigInteger n = (BigInteger) ((ConstantTerm) exponent).getValue();
            if (n.signum() < 0 || n.compareTo(BigInteger.valueOf(MAX_POWER)) > 0) {
                throw new UnsupportedConstructException("exponent " + n);
            }
            Term b = numeric(base);
            Term result = b.getDomain().is(DomainKind.INT) ? Terms.ONE : Terms.real(Rational.ONE);
            for (int i = 0; i < n.intValue(); i++) {
                result = Terms.arithmetic(TermOperator.MUL, result, b);
            }
            return result;
        }

        // ========== 字符串、序列、字典辅助 ==========

        private Term requireTheory(Term t) {
            if (!features.supports(t.getDomain())) {
                throw new UnsupportedConstructException("theory disabled for " + t.getDomain());
            }
            return t;
        }

        /**
         * 下标访问：越界产生错误隐患；Python 负下标从末尾计数。
         */
        private Term index(Term sequence, Term rawIndex, boolean checked) {
            Term i = coerce(rawIndex.getDomain().is(DomainKind.ANY) ? rawIndex : numeric(rawIndex), Domain.INT);
            Term length = Terms.length(sequence);
            Term idx = i;
            if (checked) {
                Term valid = semantics.isNegativeIndexWraps()
                        ? Terms.and(Terms.compare(TermOperator.GE, i, Terms.negate(length)),
                        Terms.compare(TermOperator.LT, i, length))
                        : Terms.and(Terms.compare(TermOperator.GE, i, Terms.ZERO),
                        Terms.compare(TermOperator.LT, i, length));
                hazard(Terms.not(valid), ErrorKind.INDEX_OUT_OF_RANGE);
                if (semantics.isNegativeIndexWraps()) {
                    idx = Terms.ite(Terms.compare(TermOperator.LT, i, Terms.ZERO),
                            Terms.arithmetic(TermOperator.ADD, i, length), i);
                }
            }
            if (sequence.getDomain().is(DomainKind.STRING)) {
                return Terms.apply(TermOperator.STR_AT, Domain.STRING, sequence, idx);
            }
            return Terms.apply(TermOperator.SEQ_NTH, sequence.getDomain().getElement(), sequence, idx);
        }

        private Term dictGet(Term dict, Term rawKey) {
            Term key = coerce(rawKey, dict.getDomain().getKey());
            hazard(Terms.not(Terms.apply(TermOperator.DICT_HAS, Domain.BOOL, dict, key)), ErrorKind.KEY_NOT_FOUND);
            return Terms.apply(TermOperator.DICT_GET, dict.getDomain().getValue(), dict, key);
        }

        private Term subscript(Term container, Term key) {
            requireTheory(container);
            return switch (container.getDomain().getKind()) {
                case STRING, LIST -> index(container, key, true);
                case DICT -> dictGet(container, key);
                default -> throw new UnsupportedConstructException("subscript of " + container.getDomain());
            };
        }

        Term store(String target, Term index, Term value) {
            Term base = state.lookup(target);
            if (base == null) {
                throw new UnsupportedConstructException("store into unbound " + target);
            }
            requireTheory(base);
            if (base.getDomain().is(DomainKind.LIST)) {
                Term i = coerce(numeric(index), Domain.INT);
                Term length = Terms.length(base);
                Term valid = semantics.isNegativeIndexWraps()
                        ? Terms.and(Terms.compare(TermOperator.GE, i, Terms.negate(length)),
                        Terms.compare(TermOperator.LT, i, length))
                        : Terms.and(Terms.compare(TermOperator.GE, i, Terms.ZERO),
                        Terms.compare(TermOperator.LT, i, length));
                hazard(Terms.not(valid), ErrorKind.INDEX_OUT_OF_RANGE);
                Term idx = semantics.isNegativeIndexWraps()
                        ? Terms.ite(Terms.compare(TermOperator.LT, i, Terms.ZERO),
                        Terms.arithmetic(TermOperator.ADD, i, length), i)
                        : i;
                Term element = coerce(value, base.getDomain().getElement());
                return Terms.apply(TermOperator.SEQ_UPDATE, base.getDomain(), base, idx, element);
            }
            if (base.getDomain().is(DomainKind.DICT)) {
                Term key = coerce(index, base.getDomain().getKey());
                Term element = coerce(value, base.getDomain().getValue());
                return Terms.apply(TermOperator.DICT_PUT, base.getDomain(), base, key, element);
            }
            throw new UnsupportedConstructException("item assignment on " + base.getDomain());
        }

        private Term membership(Term item, Term container) {
            requireTheory(container);
            return switch (container.getDomain().getKind()) {
                case STRING -> Terms.apply(TermOperator.STR_CONTAINS, Domain.BOOL, container,
                        coerce(item, Domain.STRING));
                case LIST -> Terms.apply(TermOperator.SEQ_CONTAINS, Domain.BOOL, container,
                        coerce(item, container.getDomain().getElement()));
                case DICT -> Terms.apply(TermOperator.DICT_HAS, Domain.BOOL, container,
                        coerce(item, container.getDomain().getKey()));
                default -> throw new UnsupportedConstructException("membership in " + container.getDomain());
            };
        }

        private Term equality(Term a, Term b) {
            DomainKind ka = a.getDomain().getKind();
            DomainKind kb = b.getDomain().getKind();
            if (ka == DomainKind.ANY && kb == DomainKind.ANY) {
                a = coerce(a, Domain.INT);
                b = coerce(b, Domain.INT);
            } else if (ka == DomainKind.ANY) {
                a = coerce(a, b.getDomain().is(DomainKind.NONE) ? Domain.INT : b.getDomain());
                if (kb == DomainKind.NONE) {
                    return Terms.FALSE;
                }
            } else if (kb == DomainKind.ANY) {
                b = coerce(b, a.getDomain().is(DomainKind.NONE) ? Domain.INT : a.getDomain());
                if (ka == DomainKind.NONE) {
                    return Terms.FALSE;
                }
            }
            ka = a.getDomain().getKind();
            kb = b.getDomain().getKind();
            boolean numericA = ka.isNumeric() || ka == DomainKind.BOOL;
            boolean numericB = kb.isNumeric() || kb == DomainKind.BOOL;
            if (ka == DomainKind.BOOL && kb == DomainKind.BOOL) {
                return Terms.compare(TermOperator.EQ, a, b);
            }
            if (numericA && numericB) {
                Term[] ab = unify(a, b);
                return Terms.compare(TermOperator.EQ, ab[0], ab[1]);
            }
            if (ka == DomainKind.NONE && kb == DomainKind.NONE) {
                return Terms.TRUE;
            }
            if (!a.getDomain().equals(b.getDomain())) {
                // 不同种类的值从不相等
                return Terms.FALSE;
            }
            if (ka == DomainKind.DICT) {
                throw new UnsupportedConstructException("dict equality");
            }
            requireTheory(a);
            return Terms.compare(TermOperator.EQ, a, b);
        }

        private Term ordering(TermOperator op, Term a, Term b) {
            Term[] ab = unify(a, b);
            return Terms.compare(op, ab[0], ab[1]);
        }

        // ========== 访问者 ==========

        @Override
        public Term visitConstant(Expr.Constant node) {
            Object v = node.getValue();
            if (v == null) {
                return Terms.NONE;
            }
            if (v instanceof BigInteger) {
                return semantics.isNumbersAreReal()
                        ? Terms.real(Rational.valueOf((BigInteger) v))
                        : Terms.integer((BigInteger) v);
            }
            if (v instanceof Rational) {
                return Terms.real((Rational) v);
            }
            if (v instanceof Boolean) {
                return Terms.bool((Boolean) v);
            }
            return requireTheory(Terms.string((String) v));
        }

        @Override
        public Term visitName(Expr.Name node) {
            Term bound = state.lookup(node.getId());
            if (bound == null) {
                throw new UnsupportedConstructException("unbound name " + node.getId());
            }
            return requireTheory(bound);
        }

        @Override
        public Term visitBinOp(Expr.BinOp node) {
            Term l = value(node.getLeft());
            Term r = value(node.getRight());
            return switch (node.getOp()) {
                case ADD -> addition(l, r);
                case SUB -> {
                    Term[] ab = unify(l, r);
                    yield Terms.arithmetic(TermOperator.SUB, ab[0], ab[1]);
                }
                case MUL -> {
                    Term[] ab = unify(l, r);
                    yield Terms.arithmetic(TermOperator.MUL, ab[0], ab[1]);
                }
                case DIV -> division(l, r);
                case FLOOR_DIV -> floorDivision(l, r);
                case MOD -> modulo(l, r);
                case POW -> power(l, r);
            };
        }

        private Term addition(Term l, Term r) {
            DomainKind kl = l.getDomain().getKind();
            DomainKind kr = r.getDomain().getKind();
            if (kl == DomainKind.STRING || kr == DomainKind.STRING) {
                return Terms.concat(coerce(l, Domain.STRING), coerce(r, Domain.STRING));
            }
            if (kl == DomainKind.LIST || kr == DomainKind.LIST) {
                Domain d = kl == DomainKind.LIST ? l.getDomain() : r.getDomain();
                return Terms.concat(requireTheory(coerce(l, d)), coerce(r, d));
            }
            Term[] ab = unify(l, r);
            return Terms.arithmetic(TermOperator.ADD, ab[0], ab[1]);
        }

        @Override
        public Term visitUnaryOp(Expr.UnaryOp node) {
            return switch (node.getOp()) {
                case NOT -> Terms.not(condition(node.getOperand()));
                case NEG -> Terms.negate(numeric(value(node.getOperand())));
                case POS -> numeric(value(node.getOperand()));
            };
        }

        @Override
        public Term visitCompare(Expr.Compare node) {
            Term l = value(node.getLeft());
            Term r = value(node.getRight());
            return switch (node.getOp()) {
                case EQ -> equality(l, r);
                case NE -> Terms.not(equality(l, r));
                case LT -> ordering(TermOperator.LT, l, r);
                case LE -> ordering(TermOperator.LE, l, r);
                case GT -> ordering(TermOperator.GT, l, r);
                case GE -> ordering(TermOperator.GE, l, r);
                case IN -> membership(l, r);
                case NOT_IN -> Terms.not(membership(l, r));
            };
        }

        /**
         * 值语境下的 and / or 返回操作数本身：{@code a and b} 在 a 为假时得 a，否则得 b。
         */
        @Override
        public Term visitBoolOp(Expr.BoolOp node) {
            List<Term> values = new ArrayList<>();
            List<Term> truths = new ArrayList<>();
            int pushed = 0;
            for (Expr operand : node.getValues()) {
                Term v = value(operand);
                Term t;
                try {
                    t = truthiness(v);
                } catch (UnsupportedConstructException ex) {
                    t = opaque("truth", Domain.BOOL);
                }
                values.add(v);
                truths.add(t);
                guards.push(node.getOp() == BoolOperator.AND ? t : Terms.not(t));
                pushed++;
            }
            for (int i = 0; i < pushed; i++) {
                guards.pop();
            }
            boolean allBool = values.stream().allMatch(v -> v.getDomain().is(DomainKind.BOOL));
            if (allBool) {
                return node.getOp() == BoolOperator.AND ? Terms.and(values) : Terms.or(values);
            }
            Domain d = values.get(0).getDomain();
            for (Term v : values) {
                if (!v.getDomain().equals(d)) {
                    throw new UnsupportedConstructException("and/or over mixed domains");
                }
            }
            int last = values.size() - 1;
            Term result = values.get(last);
            for (int i = last - 1; i >= 0; i--) {
                result = node.getOp() == BoolOperator.AND
                        ? Terms.ite(truths.get(i), result, values.get(i))
                        : Terms.ite(truths.get(i), values.get(i), result);
            }
            return result;
        }

        @Override
        public Term visitIfExp(Expr.IfExp node) {
            Term test = condition(node.getTest());
            guards.push(test);
            Term a = value(node.getBody());
            guards.pop();
            guards.push(Terms.not(test));
            Term b = value(node.getOrElse());
            guards.pop();
            if (!a.getDomain().equals(b.getDomain())) {
                if ((a.getDomain().isNumeric() || a.getDomain().is(DomainKind.ANY))
                        && (b.getDomain().isNumeric() || b.getDomain().is(DomainKind.ANY))) {
                    Term[] ab = unify(a, b);
                    a = ab[0];
                    b = ab[1];
                } else {
                    throw new UnsupportedConstructException("conditional expression over mixed domains");
                }
            }
            return Terms.ite(test, a, b);
        }

        @Override
        public Term visitCall(Expr.Call node) {
            Term receiver = node.isMethodCall() ? value(node.getReceiver()) : null;
            List<Term> args = new ArrayList<>();
            for (Expr a : node.getArgs()) {
                args.add(value(a));
            }
            try {
                return receiver == null ? function(node.getFunction(), args) : method(node.getFunction(), receiver, args);
            } catch (UnsupportedConstructException e) {
                logger.debug("调用 {} 按不透明值处理: {}", node, e.getConstruct());
                return opaque(node.getFunction(), Domain.ANY);
            }
        }

        private Term function(String name, List<Term> args) {
            switch (name) {
                case CfgBuilder.LEN -> {
                    Term seq = args.get(0);
                    if (seq.getDomain().is(DomainKind.STRING) || seq.getDomain().is(DomainKind.LIST)) {
                        return Terms.length(requireTheory(seq));
                    }
                    return opaque("len", Domain.INT);
                }
                case CfgBuilder.ITEM -> {
                    Term seq = args.get(0);
                    if (seq.getDomain().is(DomainKind.STRING) || seq.getDomain().is(DomainKind.LIST)) {
                        return index(requireTheory(seq), args.get(1), false);
                    }
                    return opaque("item", Domain.ANY);
                }
                case CfgBuilder.APPEND -> {
                    Term seq = requireTheory(args.get(0));
                    if (!seq.getDomain().is(DomainKind.LIST)) {
                        throw new UnsupportedConstructException("append to " + seq.getDomain());
                    }
                    Term item = coerce(args.get(1), seq.getDomain().getElement());
                    return Terms.concat(seq, Terms.apply(TermOperator.SEQ_LITERAL, seq.getDomain(), item));
                }
                default -> {
                    // 内置函数按名称分派
                }
            }
            if (CfgBuilder.BUILTINS.contains(name)) {
                return builtin(name, args);
            }
            // 短路操作数中的用户函数 / 外部函数调用
            throw new UnsupportedConstructException("call " + name);
        }

        private Term builtin(String name, List<Term> args) {
            if (args.isEmpty()) {
                throw new UnsupportedConstructException(name + "()");
            }
            Term x = args.get(0);
            switch (name) {
                case "len": {
                    if (args.size() != 1 || !(x.getDomain().is(DomainKind.STRING) || x.getDomain().is(DomainKind.LIST))) {
                        throw new UnsupportedConstructException("len of " + x.getDomain());
                    }
                    return Terms.length(requireTheory(x));
                }
                case "abs": {
                    Term n = numeric(x);
                    return Terms.ite(Terms.compare(TermOperator.LT, n, zeroOf(n)), Terms.negate(n), n);
                }
                case "min":
                case "max": {
                    if (args.size() < 2) {
                        throw new UnsupportedConstructException(name + " over a collection");
                    }
                    Term best = numeric(x);
                    for (int i = 1; i < args.size(); i++) {
                        Term[] ab = unify(best, args.get(i));
                        // Python 在相等时保留先出现的参数
                        TermOperator better = "min".equals(name) ? TermOperator.LT : TermOperator.GT;
                        best = Terms.ite(Terms.compare(better, ab[1], ab[0]), ab[1], ab[0]);
                    }
                    return best;
                }
                case "int": {
                    Term n = x.getDomain().is(DomainKind.ANY) ? coerce(x, Domain.INT) : x;
                    return switch (n.getDomain().getKind()) {
                        case INT -> n;
                        case BOOL -> coerce(n, Domain.INT);
                        case REAL -> truncateReal(n);
                        default -> throw new UnsupportedConstructException("int() of " + n.getDomain());
                    };
                }
                case "float":
                    return Terms.toReal(coerce(numeric(x), Domain.REAL));
                case "str": {
                    Term s = x.getDomain().is(DomainKind.ANY) ? coerce(x, Domain.STRING) : x;
                    return switch (s.getDomain().getKind()) {
                        case STRING -> s;
                        case BOOL -> Terms.ite(s, requireTheory(Terms.string("True")), Terms.string("False"));
                        case INT -> {
                            requireTheory(Terms.string(""));
                            Term digits = Terms.apply(TermOperator.STR_FROM_INT, Domain.STRING, s);
                            Term negDigits = Terms.apply(TermOperator.STR_FROM_INT, Domain.STRING, Terms.negate(s));
                            yield Terms.ite(Terms.compare(TermOperator.GE, s, Terms.ZERO), digits,
                                    Terms.concat(Terms.string("-"), negDigits));
                        }
                        default -> throw new UnsupportedConstructException("str() of " + s.getDomain());
                    };
                }
                case "bool":
                    return truthiness(x);
                default:
                    throw new UnsupportedConstructException(name);
            }
        }

        private Term method(String name, Term receiver, List<Term> args) {
            Term r = receiver;
            if (r.getDomain().is(DomainKind.ANY)) {
                r = coerce(r, Domain.STRING);
            }
            requireTheory(r);
            Term arg = args.isEmpty() ? null : args.get(0);
            switch (r.getDomain().getKind()) {
                case STRING:
                    switch (name) {
                        case "startswith", "startsWith":
                            return Terms.apply(TermOperator.STR_PREFIX, Domain.BOOL, r, coerce(required(arg), Domain.STRING));
                        case "endswith", "endsWith":
                            return Terms.apply(TermOperator.STR_SUFFIX, Domain.BOOL, r, coerce(required(arg), Domain.STRING));
                        case "contains", "includes":
                            return Terms.apply(TermOperator.STR_CONTAINS, Domain.BOOL, r, coerce(required(arg), Domain.STRING));
                        case "equals":
                            return equality(r, required(arg));
                        case "isEmpty":
                            return Terms.compare(TermOperator.EQ, Terms.length(r), Terms.ZERO);
                        case "length":
                            return Terms.length(r);
                        case "charAt":
                            return index(r, required(arg), true);
                        default:
                            throw new UnsupportedConstructException("str." + name);
                    }
                case LIST:
                    switch (name) {
                        case "contains", "includes":
                            return membership(required(arg), r);
                        case "get":
                            return index(r, required(arg), true);
                        case "size":
                            return Terms.length(r);
                        case "isEmpty":
                            return Terms.compare(TermOperator.EQ, Terms.length(r), Terms.ZERO);
                        default:
                            throw new UnsupportedConstructException("list." + name);
                    }
                case DICT:
                    switch (name) {
                        case "containsKey", "has":
                            return membership(required(arg), r);
                        default:
                            // get() 在键缺失时返回空值而非抛出，结果按不透明值处理
                            throw new UnsupportedConstructException("dict." + name);
                    }
                default:
                    throw new UnsupportedConstructException(r.getDomain() + "." + name);
            }
        }

        private Term required(Term arg) {
            if (arg == null) {
                throw new UnsupportedConstructException("missing argument");
            }
            return arg;
        }

        @Override
        public Term visitSubscript(Expr.Subscript node) {
            Term container = value(node.getValue());
            Term key = value(node.getIndex());
            if (container.getDomain().is(DomainKind.ANY)) {
                throw new UnsupportedConstructException("subscript of opaque value");
            }
            return subscript(container, key);
        }

        @Override
        public Term visitListLiteral(Expr.ListLiteral node) {
            List<Term> elements = new ArrayList<>();
            for (Expr e : node.getElements()) {
                elements.add(value(e));
            }
            Domain element = features.getUntypedParameterDomain();
            if (!elements.isEmpty()) {
                element = elements.get(0).getDomain();
                for (Term t : elements) {
                    if (!t.getDomain().equals(element)) {
                        element = t.getDomain().isNumeric() && element.isNumeric() ? Domain.REAL : null;
                        if (element == null) {
                            throw new UnsupportedConstructException("heterogeneous list");
                        }
                    }
                }
            }
            if (!element.getKind().isScalar()) {
                throw new UnsupportedConstructException("list of " + element);
            }
            Domain listDomain = Domain.listOf(element);
            if (!features.supports(listDomain)) {
                throw new UnsupportedConstructException("theory disabled for " + listDomain);
            }
            List<Term> coerced = new ArrayList<>();
            for (Term t : elements) {
                coerced.add(coerce(t, element));
            }
            return Terms.apply(TermOperator.SEQ_LITERAL, listDomain, coerced);
        }

        @Override
        public Term visitUnsupported(Expr.Unsupported node) {
            throw new UnsupportedConstructException(node.getDescription());
        }
    }
}
