package org.symbex.ir;

import lombok.Getter;

/**
 * 函数体无法降级为 IR 时抛出。这是唯一会中止整个分析调用的错误。
 */
@Getter
public class IrBuildException extends Exception {

    /** 无法降级的构造种类，如 "try"、"break outside loop" */
    private final String construct;
    private final int line;

    public IrBuildException(String construct, int line, String message) {
        super(message + " (line " + line + ", construct: " + construct + ")");
        this.construct = construct;
        this.line = line;
    }
}
