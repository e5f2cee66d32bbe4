package org.symbex.result;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一条报告路径：发现顺序编号、可读的路径条件、按参数顺序排列的模型、终点分类、分支轨迹和覆盖行号。
 * 所有值都是可移植标量，不含任何求解器内部对象。
 */
@Getter
public final class ExecutionPath {

    private final int pathId;
    private final PathStatus status;
    private final List<String> constraints;
    /** 无模型时为 null */
    private final Map<String, Object> model;
    private final Terminal terminal;
    private final List<String> branchTrace;
    private final List<Integer> visitedLines;

    ExecutionPath(int pathId, PathStatus status, List<String> constraints, Map<String, Object> model,
                  Terminal terminal, List<String> branchTrace, List<Integer> visitedLines) {
        this.pathId = pathId;
        this.status = Objects.requireNonNull(status, "Path status cannot be null.");
        this.constraints = List.copyOf(constraints);
        this.model = model == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(model));
        this.terminal = Objects.requireNonNull(terminal, "Terminal cannot be null.");
        this.branchTrace = List.copyOf(branchTrace);
        this.visitedLines = List.copyOf(visitedLines);
    }

    public boolean isSatisfied() {
        return status == PathStatus.SATISFIED;
    }

    @Override
    public String toString() {
        return "Path " + pathId + " [" + status.getLabel() + "] " + terminal + " model=" + model;
    }
}
