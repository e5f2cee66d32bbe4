package org.symbex.state;

import lombok.Getter;
import org.symbex.core.ErrorKind;
import org.symbex.core.TerminalKind;
import org.symbex.core.TruncationReason;
import org.symbex.expressions.Term;

import java.util.Objects;

/**
 * 终止状态的分类：返回值项、错误种类或截断原因。此类是不可变的。
 */
@Getter
public final class TerminalInfo {

    private final TerminalKind kind;
    private final Term value;
    private final ErrorKind error;
    private final String message;
    private final TruncationReason truncation;

    private TerminalInfo(TerminalKind kind, Term value, ErrorKind error, String message, TruncationReason truncation) {
        this.kind = kind;
        this.value = value;
        this.error = error;
        this.message = message;
        this.truncation = truncation;
    }

    public static TerminalInfo returned(Term value) {
        return new TerminalInfo(TerminalKind.RETURN, Objects.requireNonNull(value, "Return value cannot be null."),
                null, null, null);
    }

    public static TerminalInfo error(ErrorKind error, String message) {
        return new TerminalInfo(TerminalKind.ERROR, null, Objects.requireNonNull(error, "Error kind cannot be null."),
                message, null);
    }

    public static TerminalInfo truncated(TruncationReason reason) {
        return new TerminalInfo(TerminalKind.TRUNCATED, null, null, null,
                Objects.requireNonNull(reason, "Truncation reason cannot be null."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TerminalInfo that = (TerminalInfo) o;
        return kind == that.kind && truncation == that.truncation && Objects.equals(value, that.value)
                && Objects.equals(error, that.error) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, error, message, truncation);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case RETURN -> "return " + value;
            case ERROR -> "error " + error + (message == null ? "" : " (" + message + ")");
            case TRUNCATED -> "truncated " + truncation.getLabel();
        };
    }
}
