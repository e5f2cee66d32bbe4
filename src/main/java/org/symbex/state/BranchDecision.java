package org.symbex.state;

import lombok.Getter;
import org.symbex.ir.EdgeLabel;

import java.util.Objects;

/**
 * 路径在一个分支点上选择的出边，渲染为 {@code function#block:LABEL}。
 */
@Getter
public final class BranchDecision {

    /** 循环因展开上限被强制退出时使用的标签 */
    public static final String LOOP_BOUND = "LOOP_BOUND";

    private final String function;
    private final int block;
    private final String label;

    public BranchDecision(String function, int block, EdgeLabel label) {
        this(function, block, label.name());
    }

    private BranchDecision(String function, int block, String label) {
        this.function = Objects.requireNonNull(function, "Function name cannot be null.");
        this.block = block;
        this.label = Objects.requireNonNull(label, "Label cannot be null.");
    }

    public static BranchDecision loopBound(String function, int block) {
        return new BranchDecision(function, block, LOOP_BOUND);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BranchDecision that = (BranchDecision) o;
        return block == that.block && function.equals(that.function) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, block, label);
    }

    @Override
    public String toString() {
        return function + "#" + block + ":" + label;
    }
}
