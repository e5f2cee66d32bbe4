package org.symbex.ir.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 一个函数定义的规范化 AST。
 */
@Getter
public final class FunctionAst {

    private final String name;
    private final List<ParameterAst> parameters;
    private final List<Stmt> body;
    private final int line;

    public FunctionAst(String name, List<ParameterAst> parameters, List<Stmt> body, int line) {
        this.name = Objects.requireNonNull(name, "Function name cannot be null.");
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
        this.line = line;
    }

    @Override
    public String toString() {
        return "def " + name + parameters;
    }
}
