package org.symbex.expressions;

import org.symbex.core.Domain;
import org.symbex.core.DomainKind;
import org.symbex.core.SymbolicVariable;
import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 项的工厂方法。常量参数在构造时折叠，使恒真 / 恒假的条件无需经过求解器。
 */
public final class Terms {

    public static final ConstantTerm TRUE = new ConstantTerm(Boolean.TRUE, Domain.BOOL);
    public static final ConstantTerm FALSE = new ConstantTerm(Boolean.FALSE, Domain.BOOL);
    public static final ConstantTerm NONE = new ConstantTerm(null, Domain.NONE);
    public static final ConstantTerm ZERO = new ConstantTerm(BigInteger.ZERO, Domain.INT);
    public static final ConstantTerm ONE = new ConstantTerm(BigInteger.ONE, Domain.INT);

    private Terms() {
    }

    // ========== 叶子 ==========

    public static ConstantTerm integer(BigInteger value) {
        return new ConstantTerm(Objects.requireNonNull(value, "Value cannot be null."), Domain.INT);
    }

    public static ConstantTerm integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static ConstantTerm real(Rational value) {
        return new ConstantTerm(Objects.requireNonNull(value, "Value cannot be null."), Domain.REAL);
    }

    public static ConstantTerm bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ConstantTerm string(String value) {
        return new ConstantTerm(Objects.requireNonNull(value, "Value cannot be null."), Domain.STRING);
    }

    public static VariableTerm variable(SymbolicVariable variable) {
        return new VariableTerm(variable);
    }

    /**
     * 不做任何折叠的通用构造。
     */
    public static Term apply(TermOperator operator, Domain domain, Term... args) {
        return new ApplyTerm(operator, Arrays.asList(args), domain);
    }

    public static Term apply(TermOperator operator, Domain domain, List<Term> args) {
        return new ApplyTerm(operator, args, domain);
    }

    // ========== 算术 ==========

    /**
     * 同一数值值域（INT 或 REAL）上的二元算术。
     */
    public static Term arithmetic(TermOperator op, Term left, Term right) {
        Domain domain = left.getDomain();
        if (!domain.isNumeric() || !domain.equals(right.getDomain())) {
            throw new IllegalArgumentException("算术运算的操作数值域不一致: " + left + " " + op + " " + right);
        }
        if (left instanceof ConstantTerm && right instanceof ConstantTerm) {
            Term folded = foldArithmetic(op, (ConstantTerm) left, (ConstantTerm) right);
            if (folded != null) {
                return folded;
            }
        }
        if (op == TermOperator.ADD && isZero(right) || op == TermOperator.SUB && isZero(right)) {
            return left;
        }
        if (op == TermOperator.ADD && isZero(left)) {
            return right;
        }
        if (op == TermOperator.MUL && isOne(right)) {
            return left;
        }
        if (op == TermOperator.MUL && isOne(left)) {
            return right;
        }
        return new ApplyTerm(op, List.of(left, right), domain);
    }

    private static Term foldArithmetic(TermOperator op, ConstantTerm left, ConstantTerm right) {
        if (left.getDomain().is(DomainKind.INT)) {
            BigInteger a = (BigInteger) left.getValue();
            BigInteger b = (BigInteger) right.getValue();
            return switch (op) {
                case ADD -> integer(a.add(b));
                case SUB -> integer(a.subtract(b));
                case MUL -> integer(a.multiply(b));
                case FLOOR_DIV -> b.signum() == 0 ? null : integer(floorDiv(a, b));
                case FLOOR_MOD -> b.signum() == 0 ? null : integer(a.subtract(b.multiply(floorDiv(a, b))));
                case TRUNC_DIV -> b.signum() == 0 ? null : integer(a.divide(b));
                case TRUNC_REM -> b.signum() == 0 ? null : integer(a.remainder(b));
                default -> null;
            };
        }
        Rational a = (Rational) left.getValue();
        Rational b = (Rational) right.getValue();
        return switch (op) {
            case ADD -> real(a.add(b));
            case SUB -> real(a.subtract(b));
            case MUL -> real(a.multiply(b));
            case REAL_DIV -> b.isZero() ? null : real(a.divide(b));
            default -> null;
        };
    }

    private static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    public static Term negate(Term operand) {
        if (!operand.getDomain().isNumeric()) {
            throw new IllegalArgumentException("取负需要数值操作数: " + operand);
        }
        if (operand instanceof ConstantTerm) {
            ConstantTerm c = (ConstantTerm) operand;
            return c.getDomain().is(DomainKind.INT)
                    ? integer(((BigInteger) c.getValue()).negate())
                    : real(((Rational) c.getValue()).negate());
        }
        if (operand instanceof ApplyTerm && ((ApplyTerm) operand).getOperator() == TermOperator.NEG) {
            return ((ApplyTerm) operand).arg(0);
        }
        return new ApplyTerm(TermOperator.NEG, List.of(operand), operand.getDomain());
    }

    public static Term toReal(Term operand) {
        if (operand.getDomain().is(DomainKind.REAL)) {
            return operand;
        }
        if (operand instanceof ConstantTerm) {
            return real(Rational.valueOf((BigInteger) ((ConstantTerm) operand).getValue()));
        }
        return new ApplyTerm(TermOperator.TO_REAL, List.of(operand), Domain.REAL);
    }

    /**
     * 实数向下取整。
     */
    public static Term floor(Term operand) {
        if (operand.getDomain().is(DomainKind.INT)) {
            return operand;
        }
        if (operand instanceof ConstantTerm) {
            return integer(((Rational) ((ConstantTerm) operand).getValue()).floor());
        }
        return new ApplyTerm(TermOperator.FLOOR, List.of(operand), Domain.INT);
    }

    private static boolean isZero(Term t) {
        return t instanceof ConstantTerm && ((ConstantTerm) t).asRational() != null
                && ((ConstantTerm) t).asRational().isZero();
    }

    private static boolean isOne(Term t) {
        return t instanceof ConstantTerm && Rational.ONE.equals(((ConstantTerm) t).asRational());
    }

    // ========== 比较与逻辑 ==========

    public static Term compare(TermOperator op, Term left, Term right) {
        if (!op.isComparison()) {
            throw new IllegalArgumentException("不是比较运算符: " + op);
        }
        if (left instanceof ConstantTerm && right instanceof ConstantTerm) {
            Term folded = foldComparison(op, (ConstantTerm) left, (ConstantTerm) right);
            if (folded != null) {
                return folded;
            }
        }
        if ((op == TermOperator.EQ || op == TermOperator.NE) && left.equals(right)) {
            return bool(op == TermOperator.EQ);
        }
        return new ApplyTerm(op, List.of(left, right), Domain.BOOL);
    }

    private static Term foldComparison(TermOperator op, ConstantTerm left, ConstantTerm right) {
        Rational a = left.asRational();
        Rational b = right.asRational();
        if (a != null && b != null) {
            int c = a.compareTo(b);
            return bool(switch (op) {
                case EQ -> c == 0;
                case NE -> c != 0;
                case LT -> c < 0;
                case LE -> c <= 0;
                case GT -> c > 0;
                case GE -> c >= 0;
                default -> throw new IllegalStateException("不是比较运算符: " + op);
            });
        }
        if (op == TermOperator.EQ) {
            return bool(Objects.equals(left.getValue(), right.getValue()));
        }
        if (op == TermOperator.NE) {
            return bool(!Objects.equals(left.getValue(), right.getValue()));
        }
        return null;
    }

    public static Term not(Term operand) {
        requireBool(operand);
        if (operand instanceof ConstantTerm) {
            return bool(!((ConstantTerm) operand).isTrue());
        }
        if (operand instanceof ApplyTerm && ((ApplyTerm) operand).getOperator() == TermOperator.NOT) {
            return ((ApplyTerm) operand).arg(0);
        }
        return new ApplyTerm(TermOperator.NOT, List.of(operand), Domain.BOOL);
    }

    public static Term and(Term... operands) {
        return junction(TermOperator.AND, Arrays.asList(operands));
    }

    public static Term and(List<Term> operands) {
        return junction(TermOperator.AND, operands);
    }

    public static Term or(Term... operands) {
        return junction(TermOperator.OR, Arrays.asList(operands));
    }

    public static Term or(List<Term> operands) {
        return junction(TermOperator.OR, operands);
    }

    private static Term junction(TermOperator op, List<Term> operands) {
        ConstantTerm identity = op == TermOperator.AND ? TRUE : FALSE;
        ConstantTerm absorbing = op == TermOperator.AND ? FALSE : TRUE;
        List<Term> kept = new ArrayList<>();
        for (Term t : operands) {
            requireBool(t);
            if (t.equals(absorbing)) {
                return absorbing;
            }
            if (t.equals(identity)) {
                continue;
            }
            if (t instanceof ApplyTerm && ((ApplyTerm) t).getOperator() == op) {
                kept.addAll(((ApplyTerm) t).getArgs());
            } else {
                kept.add(t);
            }
        }
        if (kept.isEmpty()) {
            return identity;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return new ApplyTerm(op, kept, Domain.BOOL);
    }

    public static Term implies(Term premise, Term conclusion) {
        return or(not(premise), conclusion);
    }

    public static Term ite(Term condition, Term whenTrue, Term whenFalse) {
        requireBool(condition);
        if (!whenTrue.getDomain().equals(whenFalse.getDomain())) {
            throw new IllegalArgumentException("条件项两个分支的值域不一致: " + whenTrue + " / " + whenFalse);
        }
        if (condition instanceof ConstantTerm) {
            return ((ConstantTerm) condition).isTrue() ? whenTrue : whenFalse;
        }
        if (whenTrue.equals(whenFalse)) {
            return whenTrue;
        }
        if (whenTrue.equals(TRUE) && whenFalse.equals(FALSE)) {
            return condition;
        }
        return new ApplyTerm(TermOperator.ITE, List.of(condition, whenTrue, whenFalse), whenTrue.getDomain());
    }

    private static void requireBool(Term t) {
        if (!t.getDomain().is(DomainKind.BOOL)) {
            throw new IllegalArgumentException("需要布尔项: " + t + " : " + t.getDomain());
        }
    }

    // ========== 字符串与序列 ==========

    public static Term concat(Term left, Term right) {
        if (left.getDomain().is(DomainKind.STRING)) {
            if (left instanceof ConstantTerm && right instanceof ConstantTerm) {
                return string((String) ((ConstantTerm) left).getValue() + ((ConstantTerm) right).getValue());
            }
            if (left.equals(string(""))) {
                return right;
            }
            if (right.equals(string(""))) {
                return left;
            }
            return new ApplyTerm(TermOperator.STR_CONCAT, List.of(left, right), Domain.STRING);
        }
        return new ApplyTerm(TermOperator.SEQ_CONCAT, List.of(left, right), left.getDomain());
    }

    public static Term length(Term operand) {
        if (operand.getDomain().is(DomainKind.STRING)) {
            if (operand instanceof ConstantTerm) {
                String s = (String) ((ConstantTerm) operand).getValue();
                return integer(s.codePointCount(0, s.length()));
            }
            return new ApplyTerm(TermOperator.STR_LENGTH, List.of(operand), Domain.INT);
        }
        if (operand instanceof ApplyTerm && ((ApplyTerm) operand).getOperator() == TermOperator.SEQ_LITERAL) {
            return integer(((ApplyTerm) operand).getArgs().size());
        }
        return new ApplyTerm(TermOperator.SEQ_LENGTH, List.of(operand), Domain.INT);
    }
}
