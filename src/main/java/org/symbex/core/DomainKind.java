package org.symbex.core;

/**
 * 符号变量的值域种类。
 */
public enum DomainKind {

    INT("int"),
    BOOL("bool"),
    REAL("real"),
    STRING("str"),
    /** 扩展配置：序列（列表） */
    LIST("list"),
    /** 扩展配置：映射（字典） */
    DICT("dict"),
    /** 无返回值 / None，仅作为返回值出现 */
    NONE("none"),
    /** 尚未确定值域的不透明值，在首次参与运算时再确定 */
    ANY("any");

    private final String label;

    DomainKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNumeric() {
        return this == INT || this == REAL;
    }

    public boolean isScalar() {
        return this == INT || this == BOOL || this == REAL || this == STRING;
    }
}
