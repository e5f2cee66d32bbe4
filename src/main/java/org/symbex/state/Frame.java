package org.symbex.state;

import lombok.Getter;

import java.util.Objects;

/**
 * 内联调用时保存的调用者栈帧：返回位置、接收返回值的变量和调用者的绑定。
 */
@Getter
public final class Frame {

    private final ProgramPoint returnPoint;
    private final String resultTarget;
    private final PersistentMap<String, Binding> savedBindings;

    public Frame(ProgramPoint returnPoint, String resultTarget, PersistentMap<String, Binding> savedBindings) {
        this.returnPoint = Objects.requireNonNull(returnPoint, "Return point cannot be null.");
        this.resultTarget = Objects.requireNonNull(resultTarget, "Result target cannot be null.");
        this.savedBindings = Objects.requireNonNull(savedBindings, "Saved bindings cannot be null.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Frame that = (Frame) o;
        return returnPoint.equals(that.returnPoint) && resultTarget.equals(that.resultTarget)
                && savedBindings.equals(that.savedBindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(returnPoint, resultTarget, savedBindings);
    }

    @Override
    public String toString() {
        return "Frame(" + returnPoint + " -> " + resultTarget + ")";
    }
}
