package org.symbex.state;

import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * 循环迭代计数的键：调用深度、函数名、循环头块下标。
 * 带上调用深度，使递归调用中的同一循环各自计数。
 */
@Getter
public final class LoopKey implements Comparable<LoopKey> {

    private static final Comparator<LoopKey> ORDER = Comparator
            .comparingInt(LoopKey::getDepth)
            .thenComparing(LoopKey::getFunction)
            .thenComparingInt(LoopKey::getHeader);

    private final int depth;
    private final String function;
    private final int header;

    public LoopKey(int depth, String function, int header) {
        this.depth = depth;
        this.function = Objects.requireNonNull(function, "Function name cannot be null.");
        this.header = header;
    }

    @Override
    public int compareTo(LoopKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LoopKey that = (LoopKey) o;
        return depth == that.depth && header == that.header && function.equals(that.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(depth, function, header);
    }

    @Override
    public String toString() {
        return depth + ":" + function + "#B" + header;
    }
}
