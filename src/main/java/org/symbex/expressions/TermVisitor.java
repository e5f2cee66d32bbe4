package org.symbex.expressions;

/**
 * 项的访问者，求解器后端通过它把项降级为自身的表示。
 * @param <R> 访问结果类型
 */
public interface TermVisitor<R> {

    R visitVariable(VariableTerm term);

    R visitConstant(ConstantTerm term);

    R visitApply(ApplyTerm term);
}
