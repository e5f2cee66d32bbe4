package org.symbex.state;

import lombok.Getter;

import java.util.Objects;

/**
 * 程序位置：函数名、块下标、块内语句下标。语句下标等于语句数时指向终结指令。
 */
@Getter
public final class ProgramPoint {

    private final String function;
    private final int block;
    private final int statement;

    private final int hashCode;

    public ProgramPoint(String function, int block, int statement) {
        this.function = Objects.requireNonNull(function, "Function name cannot be null.");
        if (block < 0 || statement < 0) {
            throw new IllegalArgumentException("非法的程序位置: B" + block + "#" + statement);
        }
        this.block = block;
        this.statement = statement;
        this.hashCode = Objects.hash(function, block, statement);
    }

    public static ProgramPoint entryOf(String function) {
        return new ProgramPoint(function, 0, 0);
    }

    public ProgramPoint next() {
        return new ProgramPoint(function, block, statement + 1);
    }

    public ProgramPoint jumpTo(int targetBlock) {
        return new ProgramPoint(function, targetBlock, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProgramPoint that = (ProgramPoint) o;
        return block == that.block && statement == that.statement && function.equals(that.function);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return function + "#B" + block + "." + statement;
    }
}
