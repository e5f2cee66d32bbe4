package org.symbex.ir.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 形参：名称和可选的声明类型（前端原样给出的类型文本，如 "int"、"List[int]"、"String"）。
 */
@Getter
public final class ParameterAst {

    private final String name;
    private final String declaredType;

    public ParameterAst(String name, String declaredType) {
        this.name = Objects.requireNonNull(name, "Parameter name cannot be null.");
        this.declaredType = declaredType;
    }

    public boolean isTyped() {
        return declaredType != null && !declaredType.isBlank();
    }

    @Override
    public String toString() {
        return isTyped() ? name + ": " + declaredType : name;
    }
}
