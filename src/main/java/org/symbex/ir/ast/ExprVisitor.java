package org.symbex.ir.ast;

/**
 * 表达式节点的访问者。
 * @param <R> 访问结果类型
 */
public interface ExprVisitor<R> {

    R visitConstant(Expr.Constant node);

    R visitName(Expr.Name node);

    R visitBinOp(Expr.BinOp node);

    R visitUnaryOp(Expr.UnaryOp node);

    R visitCompare(Expr.Compare node);

    R visitBoolOp(Expr.BoolOp node);

    R visitIfExp(Expr.IfExp node);

    R visitCall(Expr.Call node);

    R visitSubscript(Expr.Subscript node);

    R visitListLiteral(Expr.ListLiteral node);

    R visitUnsupported(Expr.Unsupported node);
}
