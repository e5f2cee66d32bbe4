package org.symbex.result;

import lombok.Getter;
import org.symbex.core.TruncationReason;

import java.util.List;

/**
 * 一次分析的统计信息和截断状态。
 * {@code reason} 是观察到的最严重的截断原因（超时 &gt; 路径数 &gt; 深度 &gt; 循环上限 &gt; 无法建模的值），{@code reasons} 列出全部。
 */
@Getter
public final class BatchMetadata {

    private final int discovered;
    private final int pruned;
    private final int unknown;
    private final int duplicatesDropped;
    private final long solverCalls;
    private final long elapsedMs;
    private final boolean truncated;
    private final TruncationReason reason;
    private final List<TruncationReason> reasons;

    public BatchMetadata(int discovered, int pruned, int unknown, int duplicatesDropped, long solverCalls,
                         long elapsedMs, List<TruncationReason> reasons) {
        this.discovered = discovered;
        this.pruned = pruned;
        this.unknown = unknown;
        this.duplicatesDropped = duplicatesDropped;
        this.solverCalls = solverCalls;
        this.elapsedMs = elapsedMs;
        this.reasons = reasons.stream().sorted().distinct().toList();
        this.truncated = !this.reasons.isEmpty();
        this.reason = this.truncated ? this.reasons.get(0) : null;
    }

    @Override
    public String toString() {
        return "BatchMetadata(discovered=" + discovered + ", pruned=" + pruned + ", unknown=" + unknown
                + ", solverCalls=" + solverCalls + ", elapsedMs=" + elapsedMs
                + (truncated ? ", truncated=" + reasons : "") + ")";
    }
}
