package org.symbex.ir.ast;

import org.symbex.utils.Rational;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * 构造规范化 AST 的静态工厂，供语言前端和测试使用。
 * 语句工厂的第一个参数是源代码行号；表达式不记录行号。
 */
public final class Ast {

    private Ast() {
    }

    // ========== 表达式 ==========

    public static Expr num(long value) {
        return new Expr.Constant(BigInteger.valueOf(value), 0);
    }

    public static Expr num(BigInteger value) {
        return new Expr.Constant(value, 0);
    }

    /**
     * 小数常量，按十进制文本精确解析。
     */
    public static Expr real(String decimal) {
        return new Expr.Constant(Rational.valueOf(decimal), 0);
    }

    public static Expr bool(boolean value) {
        return new Expr.Constant(value, 0);
    }

    public static Expr str(String value) {
        return new Expr.Constant(value, 0);
    }

    public static Expr none() {
        return new Expr.Constant(null, 0);
    }

    public static Expr name(String id) {
        return new Expr.Name(id, 0);
    }

    public static Expr bin(BinaryOperator op, Expr left, Expr right) {
        return new Expr.BinOp(op, left, right, 0);
    }

    public static Expr add(Expr left, Expr right) {
        return bin(BinaryOperator.ADD, left, right);
    }

    public static Expr sub(Expr left, Expr right) {
        return bin(BinaryOperator.SUB, left, right);
    }

    public static Expr mul(Expr left, Expr right) {
        return bin(BinaryOperator.MUL, left, right);
    }

    public static Expr div(Expr left, Expr right) {
        return bin(BinaryOperator.DIV, left, right);
    }

    public static Expr floorDiv(Expr left, Expr right) {
        return bin(BinaryOperator.FLOOR_DIV, left, right);
    }

    public static Expr mod(Expr left, Expr right) {
        return bin(BinaryOperator.MOD, left, right);
    }

    public static Expr neg(Expr operand) {
        return new Expr.UnaryOp(UnaryOperator.NEG, operand, 0);
    }

    public static Expr not(Expr operand) {
        return new Expr.UnaryOp(UnaryOperator.NOT, operand, 0);
    }

    public static Expr cmp(CompareOperator op, Expr left, Expr right) {
        return new Expr.Compare(op, left, right, 0);
    }

    public static Expr eq(Expr left, Expr right) {
        return cmp(CompareOperator.EQ, left, right);
    }

    public static Expr ne(Expr left, Expr right) {
        return cmp(CompareOperator.NE, left, right);
    }

    public static Expr lt(Expr left, Expr right) {
        return cmp(CompareOperator.LT, left, right);
    }

    public static Expr le(Expr left, Expr right) {
        return cmp(CompareOperator.LE, left, right);
    }

    public static Expr gt(Expr left, Expr right) {
        return cmp(CompareOperator.GT, left, right);
    }

    public static Expr ge(Expr left, Expr right) {
        return cmp(CompareOperator.GE, left, right);
    }

    public static Expr in(Expr item, Expr container) {
        return cmp(CompareOperator.IN, item, container);
    }

    public static Expr and(Expr... values) {
        return new Expr.BoolOp(BoolOperator.AND, Arrays.asList(values), 0);
    }

    public static Expr or(Expr... values) {
        return new Expr.BoolOp(BoolOperator.OR, Arrays.asList(values), 0);
    }

    public static Expr ifExp(Expr test, Expr body, Expr orElse) {
        return new Expr.IfExp(test, body, orElse, 0);
    }

    public static Expr call(String function, Expr... args) {
        return new Expr.Call(function, null, Arrays.asList(args), 0);
    }

    public static Expr method(Expr receiver, String method, Expr... args) {
        return new Expr.Call(method, receiver, Arrays.asList(args), 0);
    }

    public static Expr index(Expr value, Expr index) {
        return new Expr.Subscript(value, index, 0);
    }

    public static Expr list(Expr... elements) {
        return new Expr.ListLiteral(Arrays.asList(elements), 0);
    }

    public static Expr unsupported(String description) {
        return new Expr.Unsupported(description, 0);
    }

    // ========== 语句 ==========

    public static Stmt assign(int line, String target, Expr value) {
        return new Stmt.Assign(name(target), value, line);
    }

    public static Stmt store(int line, String target, Expr index, Expr value) {
        return new Stmt.Assign(index(name(target), index), value, line);
    }

    public static Stmt augAssign(int line, String target, BinaryOperator op, Expr value) {
        return new Stmt.AugAssign(name(target), op, value, line);
    }

    public static Stmt ifStmt(int line, Expr test, List<Stmt> body, List<Stmt> orElse) {
        return new Stmt.If(test, body, orElse, line);
    }

    public static Stmt ifStmt(int line, Expr test, List<Stmt> body) {
        return new Stmt.If(test, body, List.of(), line);
    }

    public static Stmt whileLoop(int line, Expr test, List<Stmt> body) {
        return new Stmt.While(test, body, List.of(), line);
    }

    public static Stmt whileLoop(int line, Expr test, List<Stmt> body, List<Stmt> orElse) {
        return new Stmt.While(test, body, orElse, line);
    }

    public static Stmt forLoop(int line, String target, Expr iterable, List<Stmt> body) {
        return new Stmt.For(target, iterable, body, line);
    }

    public static Stmt ret(int line, Expr value) {
        return new Stmt.Return(value, line);
    }

    public static Stmt ret(int line) {
        return new Stmt.Return(null, line);
    }

    public static Stmt raise(int line, String exceptionType, String message) {
        return new Stmt.Raise(exceptionType, message, line);
    }

    public static Stmt assertThat(int line, Expr test) {
        return new Stmt.Assert(test, line);
    }

    public static Stmt expr(int line, Expr expr) {
        return new Stmt.ExprStmt(expr, line);
    }

    public static Stmt pass(int line) {
        return new Stmt.Jump(Stmt.Jump.Kind.PASS, line);
    }

    public static Stmt breakLoop(int line) {
        return new Stmt.Jump(Stmt.Jump.Kind.BREAK, line);
    }

    public static Stmt continueLoop(int line) {
        return new Stmt.Jump(Stmt.Jump.Kind.CONTINUE, line);
    }

    public static Stmt unsupportedStmt(int line, String kind, String... assignedNames) {
        return new Stmt.Unsupported(kind, Arrays.asList(assignedNames), line);
    }

    // ========== 函数 ==========

    public static ParameterAst param(String name) {
        return new ParameterAst(name, null);
    }

    public static ParameterAst param(String name, String declaredType) {
        return new ParameterAst(name, declaredType);
    }

    public static FunctionAst function(String name, List<ParameterAst> parameters, Stmt... body) {
        return new FunctionAst(name, parameters, Arrays.asList(body), 1);
    }
}
