package org.symbex.ir;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 基本块：直线语句序列加一个终结指令。此类是不可变的。
 */
@Getter
public final class BasicBlock {

    private final int index;
    private final List<IrStatement> statements;
    private final Terminator terminator;

    public BasicBlock(int index, List<IrStatement> statements, Terminator terminator) {
        this.index = index;
        this.statements = List.copyOf(statements);
        this.terminator = Objects.requireNonNull(terminator, "Terminator cannot be null.");
    }

    public List<Edge> getSuccessors() {
        return terminator.getEdges();
    }

    public boolean isLoopHeader() {
        return terminator.getKind() == Terminator.Kind.LOOP_TEST;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("B").append(index).append(":\n");
        for (IrStatement s : statements) {
            sb.append("  ").append(s).append('\n');
        }
        sb.append("  ").append(terminator);
        return sb.toString();
    }
}
