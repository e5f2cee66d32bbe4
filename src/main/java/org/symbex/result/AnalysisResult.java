package org.symbex.result;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 一次分析的完整输出：按发现顺序排列的路径和批次元数据。
 */
@Getter
public final class AnalysisResult {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private final String function;
    private final String language;
    private final List<ExecutionPath> paths;
    private final BatchMetadata metadata;

    public AnalysisResult(String function, String language, List<ExecutionPath> paths, BatchMetadata metadata) {
        this.function = Objects.requireNonNull(function, "Function name cannot be null.");
        this.language = Objects.requireNonNull(language, "Language cannot be null.");
        this.paths = List.copyOf(paths);
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null.");
    }

    public List<ExecutionPath> satisfiedPaths() {
        return paths.stream().filter(ExecutionPath::isSatisfied).toList();
    }

    public boolean isTruncated() {
        return metadata.isTruncated();
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return "AnalysisResult(" + function + ", " + paths.size() + " paths, " + metadata + ")";
    }
}
