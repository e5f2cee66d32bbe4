package org.symbex.symbolic;

import lombok.Getter;

import java.util.Objects;

/**
 * 可满足性检查的结果：状态，SAT 时的模型，UNKNOWN 时的原因。
 */
@Getter
public final class CheckResult {

    private static final CheckResult UNSAT = new CheckResult(SolverStatus.UNSAT, null, null);

    private final SolverStatus status;
    private final SolverModel model;
    private final String reasonUnknown;

    private CheckResult(SolverStatus status, SolverModel model, String reasonUnknown) {
        this.status = status;
        this.model = model;
        this.reasonUnknown = reasonUnknown;
    }

    public static CheckResult sat(SolverModel model) {
        return new CheckResult(SolverStatus.SAT, Objects.requireNonNull(model, "Model cannot be null."), null);
    }

    public static CheckResult unsat() {
        return UNSAT;
    }

    public static CheckResult unknown(String reason) {
        return new CheckResult(SolverStatus.UNKNOWN, null, reason == null ? "unknown" : reason);
    }

    public boolean isSat() {
        return status == SolverStatus.SAT;
    }

    public boolean isUnsat() {
        return status == SolverStatus.UNSAT;
    }

    public boolean isUnknown() {
        return status == SolverStatus.UNKNOWN;
    }

    @Override
    public String toString() {
        return status == SolverStatus.UNKNOWN ? "UNKNOWN(" + reasonUnknown + ")" : status.name();
    }
}
