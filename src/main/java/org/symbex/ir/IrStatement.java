package org.symbex.ir;

import lombok.Getter;
import org.symbex.ir.ast.Expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 基本块中的一条直线语句。此类是不可变的。
 */
@Getter
public final class IrStatement {

    public enum Kind {
        /** target = value */
        ASSIGN,
        /** target[index] = value */
        STORE,
        /** target = callee(args)，callee 可能是可内联的用户函数，也可能是不可见的外部函数 */
        CALL,
        /** 只为副作用和潜在错误求值的表达式 */
        EVALUATE,
        /** value 为假时以断言错误终止 */
        ASSERT,
        /** 无法翻译的语句：写入的变量全部变为不透明值 */
        OPAQUE
    }

    private final Kind kind;
    private final String target;
    private final Expr index;
    private final Expr value;
    private final String callee;
    private final List<Expr> args;
    private final List<String> havocNames;
    private final String description;
    private final int line;

    private IrStatement(Kind kind, String target, Expr index, Expr value, String callee, List<Expr> args,
                        List<String> havocNames, String description, int line) {
        this.kind = kind;
        this.target = target;
        this.index = index;
        this.value = value;
        this.callee = callee;
        this.args = args;
        this.havocNames = havocNames;
        this.description = description;
        this.line = line;
    }

    public static IrStatement assign(String target, Expr value, int line) {
        return new IrStatement(Kind.ASSIGN, Objects.requireNonNull(target, "Target cannot be null."),
                null, Objects.requireNonNull(value, "Value cannot be null."), null, List.of(), List.of(), null, line);
    }

    public static IrStatement store(String target, Expr index, Expr value, int line) {
        return new IrStatement(Kind.STORE, Objects.requireNonNull(target, "Target cannot be null."),
                Objects.requireNonNull(index, "Index cannot be null."),
                Objects.requireNonNull(value, "Value cannot be null."), null, List.of(), List.of(), null, line);
    }

    public static IrStatement call(String target, String callee, List<Expr> args, int line) {
        return new IrStatement(Kind.CALL, Objects.requireNonNull(target, "Target cannot be null."), null, null,
                Objects.requireNonNull(callee, "Callee cannot be null."), List.copyOf(args), List.of(), null, line);
    }

    public static IrStatement evaluate(Expr value, int line) {
        return new IrStatement(Kind.EVALUATE, null, null, Objects.requireNonNull(value, "Value cannot be null."),
                null, List.of(), List.of(), null, line);
    }

    public static IrStatement assertion(Expr test, int line) {
        return new IrStatement(Kind.ASSERT, null, null, Objects.requireNonNull(test, "Test cannot be null."),
                null, List.of(), List.of(), null, line);
    }

    public static IrStatement opaque(List<String> havocNames, String description, int line) {
        return new IrStatement(Kind.OPAQUE, null, null, null, null, List.of(), List.copyOf(havocNames),
                Objects.requireNonNull(description, "Description cannot be null."), line);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ASSIGN -> target + " = " + value;
            case STORE -> target + "[" + index + "] = " + value;
            case CALL -> target + " = call " + callee
                    + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
            case EVALUATE -> "eval " + value;
            case ASSERT -> "assert " + value;
            case OPAQUE -> "opaque<" + description + "> havoc " + havocNames;
        };
    }
}
