package org.symbex.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Objects;

/**
 * 符号变量：名称、值域和世代号。
 * 函数参数是第 0 代变量；不透明值（外部调用结果、无法翻译的表达式）以递增的世代号区分。
 * 此类是不可变的。
 */
@Getter
public final class SymbolicVariable implements Comparable<SymbolicVariable> {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicVariable.class);

    private static final Comparator<SymbolicVariable> ORDER = Comparator
            .comparing(SymbolicVariable::getName)
            .thenComparingInt(SymbolicVariable::getGeneration)
            .thenComparing(v -> v.getDomain().toString());

    private final String name;
    private final Domain domain;
    private final int generation;
    private final boolean opaque;

    private final int hashCode;

    private SymbolicVariable(String name, Domain domain, int generation, boolean opaque) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null.");
        this.domain = Objects.requireNonNull(domain, "Variable domain cannot be null.");
        if (generation < 0) {
            throw new IllegalArgumentException("世代号不能为负: " + generation);
        }
        this.generation = generation;
        this.opaque = opaque;
        this.hashCode = Objects.hash(name, domain, generation, opaque);
        logger.debug("创建了一个SymbolicVariable: {} ({}) 第{}代", name, domain, generation);
    }

    /**
     * 创建第 0 代的参数变量。
     */
    public static SymbolicVariable parameter(String name, Domain domain) {
        return new SymbolicVariable(name, domain, 0, false);
    }

    /**
     * 创建一个完全不受约束的不透明变量。
     * @param origin 来源描述，用于可读输出（如被调用的函数名）。
     * @param domain 值域，未知时为 {@link Domain#ANY}。
     * @param generation 在当前路径内唯一的编号。
     */
    public static SymbolicVariable opaque(String origin, Domain domain, int generation) {
        return new SymbolicVariable("opaque_" + origin, domain, generation, true);
    }

    /**
     * 同名同代、不同值域的变量。用于不透明值在首次使用时确定值域。
     */
    public SymbolicVariable withDomain(Domain newDomain) {
        if (domain.equals(newDomain)) {
            return this;
        }
        return new SymbolicVariable(name, newDomain, generation, opaque);
    }

    /**
     * 在求解器中使用的唯一名称。
     */
    public String getSolverName() {
        if (!opaque && generation == 0) {
            return name;
        }
        return name + "#" + generation;
    }

    @Override
    public int compareTo(SymbolicVariable o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicVariable that = (SymbolicVariable) o;
        return generation == that.generation && opaque == that.opaque
                && name.equals(that.name) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return getSolverName();
    }
}
