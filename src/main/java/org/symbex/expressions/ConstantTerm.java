package org.symbex.expressions;

import lombok.Getter;
import org.symbex.core.Domain;
import org.symbex.core.SymbolicVariable;
import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

/**
 * 标量常量：BigInteger (INT)、Rational (REAL)、Boolean (BOOL)、String (STRING) 或 null (NONE)。
 */
@Getter
public final class ConstantTerm extends Term {

    private final Object value;
    private final Domain domain;

    private final int hashCode;

    ConstantTerm(Object value, Domain domain) {
        this.domain = Objects.requireNonNull(domain, "Domain cannot be null.");
        boolean consistent = switch (domain.getKind()) {
            case INT -> value instanceof BigInteger;
            case REAL -> value instanceof Rational;
            case BOOL -> value instanceof Boolean;
            case STRING -> value instanceof String;
            case NONE -> value == null;
            default -> false;
        };
        if (!consistent) {
            throw new IllegalArgumentException("常量值与值域不一致: " + value + " : " + domain);
        }
        this.value = value;
        this.hashCode = Objects.hash(value, domain);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public void collectVariables(Set<SymbolicVariable> into) {
        // 常量不含变量
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    public boolean isFalse() {
        return Boolean.FALSE.equals(value);
    }

    /**
     * 数值常量的有理数形式，非数值返回 null。
     */
    public Rational asRational() {
        if (value instanceof BigInteger) {
            return Rational.valueOf((BigInteger) value);
        }
        if (value instanceof Rational) {
            return (Rational) value;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstantTerm that = (ConstantTerm) o;
        return Objects.equals(value, that.value) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (value == null) {
            return "None";
        }
        if (value instanceof String) {
            return "\"" + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        if (value instanceof Rational) {
            return ((Rational) value).toDecimalString();
        }
        return value.toString();
    }
}
