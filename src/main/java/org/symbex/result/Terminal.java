package org.symbex.result;

import lombok.Getter;
import org.symbex.core.TerminalKind;
import org.symbex.core.TruncationReason;

/**
 * 路径终点的可移植描述。
 * RETURN 带返回值（模型下的具体值）和返回值的符号形式；ERROR 带错误种类和消息；TRUNCATED 带截断原因。
 */
@Getter
public final class Terminal {

    private final TerminalKind kind;
    private final Object value;
    private final String symbolicValue;
    private final String errorKind;
    private final String message;
    private final TruncationReason truncation;

    Terminal(TerminalKind kind, Object value, String symbolicValue, String errorKind, String message,
             TruncationReason truncation) {
        this.kind = kind;
        this.value = value;
        this.symbolicValue = symbolicValue;
        this.errorKind = errorKind;
        this.message = message;
        this.truncation = truncation;
    }

    public boolean isError() {
        return kind == TerminalKind.ERROR;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case RETURN -> "return " + (value == null ? symbolicValue : value);
            case ERROR -> "error " + errorKind;
            case TRUNCATED -> "truncated " + truncation.getLabel();
        };
    }
}
