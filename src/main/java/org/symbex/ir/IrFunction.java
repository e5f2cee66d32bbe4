package org.symbex.ir;

import lombok.Getter;
import org.symbex.core.SymbolicVariable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一个函数的 IR：参数（第 0 代符号变量）加平坦的基本块数组，入口为块 0。
 * 构建后不可变，控制流图用下标邻接表示，允许存在环。
 */
@Getter
public final class IrFunction {

    public static final int ENTRY = 0;

    private final String name;
    private final List<SymbolicVariable> parameters;
    private final List<BasicBlock> blocks;
    private final int line;

    public IrFunction(String name, List<SymbolicVariable> parameters, List<BasicBlock> blocks, int line) {
        this.name = Objects.requireNonNull(name, "Function name cannot be null.");
        this.parameters = List.copyOf(parameters);
        this.blocks = List.copyOf(blocks);
        if (this.blocks.isEmpty()) {
            throw new IllegalArgumentException("函数 " + name + " 没有基本块");
        }
        for (int i = 0; i < this.blocks.size(); i++) {
            if (this.blocks.get(i).getIndex() != i) {
                throw new IllegalArgumentException("块下标与位置不一致: " + i);
            }
            for (Edge e : this.blocks.get(i).getSuccessors()) {
                if (e.getTarget() >= this.blocks.size()) {
                    throw new IllegalArgumentException("块 " + i + " 的边越界: " + e);
                }
            }
        }
        this.line = line;
    }

    public BasicBlock getBlock(int index) {
        return blocks.get(index);
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public String toString() {
        return "function " + name + parameters + "\n"
                + blocks.stream().map(BasicBlock::toString).collect(Collectors.joining("\n"));
    }
}
