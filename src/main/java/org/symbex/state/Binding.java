package org.symbex.state;

import lombok.Getter;
import org.symbex.expressions.Term;

import java.util.Objects;

/**
 * 变量的当前绑定：符号项及其世代号。每次赋值世代号加一。
 */
@Getter
public final class Binding {

    private final Term term;
    private final int generation;

    public Binding(Term term, int generation) {
        this.term = Objects.requireNonNull(term, "Bound term cannot be null.");
        this.generation = generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Binding binding = (Binding) o;
        return generation == binding.generation && term.equals(binding.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, generation);
    }

    @Override
    public String toString() {
        return term + "@" + generation;
    }
}
