package org.symbex.expressions;

import lombok.Getter;
import org.symbex.core.Domain;
import org.symbex.core.SymbolicVariable;

import java.util.Objects;
import java.util.Set;

@Getter
public final class VariableTerm extends Term {

    private final SymbolicVariable variable;

    VariableTerm(SymbolicVariable variable) {
        this.variable = Objects.requireNonNull(variable, "Variable cannot be null.");
    }

    @Override
    public Domain getDomain() {
        return variable.getDomain();
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public void collectVariables(Set<SymbolicVariable> into) {
        into.add(variable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return variable.equals(((VariableTerm) o).variable);
    }

    @Override
    public int hashCode() {
        return variable.hashCode();
    }

    @Override
    public String toString() {
        return variable.getSolverName();
    }
}
