package org.symbex.ir.ast;

/**
 * 语句节点的访问者。
 * @param <R> 访问结果类型
 */
public interface StmtVisitor<R> {

    R visitAssign(Stmt.Assign node);

    R visitAugAssign(Stmt.AugAssign node);

    R visitIf(Stmt.If node);

    R visitWhile(Stmt.While node);

    R visitFor(Stmt.For node);

    R visitReturn(Stmt.Return node);

    R visitRaise(Stmt.Raise node);

    R visitAssert(Stmt.Assert node);

    R visitExprStmt(Stmt.ExprStmt node);

    R visitJump(Stmt.Jump node);

    R visitUnsupported(Stmt.Unsupported node);
}
