package org.symbex.ir;

import org.symbex.core.Domain;

/**
 * 语言前端能力。每种源语言是一个变体，在引擎运行前选定；引擎只通过此接口感知语言差异。
 */
public interface Frontend {

    /**
     * @return 语言名称，用于日志和结果元数据。
     */
    String getLanguage();

    /**
     * @return 该语言的算术与下标语义。
     */
    ArithmeticSemantics getSemantics();

    /**
     * 将前端给出的声明类型文本解析为值域。
     * @param declaredType 类型文本，如 "int"、"List[str]"、"Map&lt;String, Integer&gt;"。
     * @return 对应的值域；无法识别时返回 null，调用方改用无类型参数的默认值域。
     */
    Domain parseDeclaredType(String declaredType);
}
