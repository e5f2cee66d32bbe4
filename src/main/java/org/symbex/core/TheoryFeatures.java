package org.symbex.core;

import lombok.Getter;
import lombok.With;

import java.util.Objects;

/**
 * 翻译器可使用的求解器理论开关。
 * 此类是不可变的，修改通过 {@code withXxx} 返回新实例。
 */
@Getter
@With
public final class TheoryFeatures {

    /** 默认：开启字符串理论，关闭序列 / 数组理论，字符串长度不设上限，无类型参数视为整数 */
    public static final TheoryFeatures DEFAULT = new TheoryFeatures(true, false, 0, 0, Domain.INT);

    /** 扩展配置：同时开启序列 / 数组理论 */
    public static final TheoryFeatures EXTENDED = DEFAULT.withSequences(true);

    private final boolean strings;
    private final boolean sequences;
    /** 字符串参数长度上限，0 表示不限制 */
    private final int maxStringLength;
    /** 序列参数长度上限，0 表示不限制 */
    private final int maxSequenceLength;
    /** 未声明类型的参数使用的值域 */
    private final Domain untypedParameterDomain;

    public TheoryFeatures(boolean strings, boolean sequences, int maxStringLength, int maxSequenceLength,
                          Domain untypedParameterDomain) {
        if (maxStringLength < 0 || maxSequenceLength < 0) {
            throw new IllegalArgumentException("长度上限不能为负: " + maxStringLength + ", " + maxSequenceLength);
        }
        this.untypedParameterDomain = Objects.requireNonNull(untypedParameterDomain,
                "Untyped parameter domain cannot be null.");
        if (!untypedParameterDomain.getKind().isScalar()) {
            throw new IllegalArgumentException("无类型参数只能取标量值域: " + untypedParameterDomain);
        }
        this.strings = strings;
        this.sequences = sequences;
        this.maxStringLength = maxStringLength;
        this.maxSequenceLength = maxSequenceLength;
    }

    /**
     * 判断给定值域的运算能否交给求解器建模。
     */
    public boolean supports(Domain domain) {
        return switch (domain.getKind()) {
            case STRING -> strings;
            case LIST -> sequences && supports(domain.getElement());
            case DICT -> sequences && supports(domain.getKey()) && supports(domain.getValue());
            default -> true;
        };
    }

    @Override
    public String toString() {
        return "TheoryFeatures(strings=" + strings + ", sequences=" + sequences
                + ", maxStringLength=" + maxStringLength + ", maxSequenceLength=" + maxSequenceLength
                + ", untyped=" + untypedParameterDomain + ")";
    }
}
