package org.symbex.expressions;

import lombok.Getter;
import org.symbex.core.Domain;
import org.symbex.core.SymbolicVariable;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 运算符应用于若干参数项。结果值域由构造方显式给出。
 */
@Getter
public final class ApplyTerm extends Term {

    private final TermOperator operator;
    private final List<Term> args;
    private final Domain domain;

    private final int hashCode;

    ApplyTerm(TermOperator operator, List<Term> args, Domain domain) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null.");
        this.args = List.copyOf(args);
        this.domain = Objects.requireNonNull(domain, "Domain cannot be null.");
        this.hashCode = Objects.hash(operator, this.args, domain);
    }

    public Term arg(int i) {
        return args.get(i);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visitApply(this);
    }

    @Override
    public void collectVariables(Set<SymbolicVariable> into) {
        for (Term a : args) {
            a.collectVariables(into);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ApplyTerm that = (ApplyTerm) o;
        return hashCode == that.hashCode && operator == that.operator
                && args.equals(that.args) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (operator.getStyle()) {
            case INFIX -> args.stream().map(Object::toString)
                    .collect(Collectors.joining(" " + operator.getSymbol() + " ", "(", ")"));
            case PREFIX -> operator.getSymbol() + args.get(0);
            case CALL -> operator.getSymbol()
                    + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        };
    }
}
