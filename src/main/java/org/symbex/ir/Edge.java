package org.symbex.ir;

import lombok.Getter;

import java.util.Objects;

/**
 * 指向平坦块数组中某个下标的带标签边。
 */
@Getter
public final class Edge {

    private final int target;
    private final EdgeLabel label;

    public Edge(int target, EdgeLabel label) {
        if (target < 0) {
            throw new IllegalArgumentException("边的目标下标不能为负: " + target);
        }
        this.target = target;
        this.label = Objects.requireNonNull(label, "Edge label cannot be null.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Edge edge = (Edge) o;
        return target == edge.target && label == edge.label;
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, label);
    }

    @Override
    public String toString() {
        return label + "->B" + target;
    }
}
