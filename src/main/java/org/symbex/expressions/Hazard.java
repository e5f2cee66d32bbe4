package org.symbex.expressions;

import lombok.Getter;
import org.symbex.core.ErrorKind;
import org.symbex.core.TruncationReason;

import java.util.Objects;

/**
 * 表达式求值中的危险条件：condition 成立时，路径以错误 kind 终止，
 * 或者（结果超出可建模范围时）以截断原因 truncation 终止。两者恰有一个非空。
 * 条件已经包含了求值该子表达式所需的前提（短路操作数、条件表达式分支）。
 */
@Getter
public final class Hazard {

    private final Term condition;
    private final ErrorKind kind;
    private final TruncationReason truncation;

    public Hazard(Term condition, ErrorKind kind) {
        this.condition = Objects.requireNonNull(condition, "Hazard condition cannot be null.");
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null.");
        this.truncation = null;
    }

    private Hazard(Term condition, TruncationReason truncation) {
        this.condition = Objects.requireNonNull(condition, "Hazard condition cannot be null.");
        this.kind = null;
        this.truncation = Objects.requireNonNull(truncation, "Truncation reason cannot be null.");
    }

    /**
     * condition 成立时求值结果无法建模（例如 Java 中实数除以零得到的无穷或 NaN），路径在此截断。
     */
    public static Hazard unmodelled(Term condition) {
        return new Hazard(condition, TruncationReason.UNMODELLED_VALUE);
    }

    public boolean isError() {
        return kind != null;
    }

    @Override
    public String toString() {
        return (isError() ? kind.toString() : truncation.getLabel()) + " when " + condition;
    }
}
