package org.symbex.explorer;

import lombok.Getter;

import java.util.Map;

/**
 * {@link ConstraintQueries#prove} 的结果。INVALID 时带一个按参数顺序排列的反例。
 */
@Getter
public final class ProofResult {

    private final ProofStatus status;
    private final Map<String, Object> counterexample;
    private final String reason;

    ProofResult(ProofStatus status, Map<String, Object> counterexample, String reason) {
        this.status = status;
        this.counterexample = counterexample;
        this.reason = reason;
    }

    public boolean isValid() {
        return status == ProofStatus.VALID;
    }

    @Override
    public String toString() {
        return switch (status) {
            case VALID -> "VALID";
            case INVALID -> "INVALID " + counterexample;
            case UNKNOWN -> "UNKNOWN (" + reason + ")";
        };
    }
}
