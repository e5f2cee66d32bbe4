package org.symbex.expressions;

import org.symbex.core.Domain;
import org.symbex.core.SymbolicVariable;

import java.util.Set;

/**
 * 求解器理论中的项。与具体求解器无关，由求解器适配器降级为后端表示。
 * 所有实现都是不可变的，按结构比较相等。
 */
public abstract class Term {

    public abstract Domain getDomain();

    public abstract <R> R accept(TermVisitor<R> visitor);

    public boolean isConstant() {
        return false;
    }

    /**
     * 收集此项中出现的全部符号变量。
     */
    public abstract void collectVariables(Set<SymbolicVariable> into);
}
