package org.symbex.core;

import lombok.Getter;
import lombok.With;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * 一次探索运行的全部预算与开关。显式传入每次调用，运行期间从不修改。
 * 此类是不可变的。
 */
@Getter
@With
public final class ExplorationBudget {

    private static final Logger logger = LoggerFactory.getLogger(ExplorationBudget.class);

    public static final String PREFIX = "symbex.";

    /** 调用深度上限（内联用户函数的嵌套层数） */
    private final int maxDepth;
    /** 报告路径数量上限 */
    private final int maxPaths;
    /** 每个循环头的展开次数上限 */
    private final int maxLoopIterations;
    /** 会话墙钟超时 */
    private final Duration sessionTimeout;
    /** 单次求解器检查的超时 */
    private final Duration solverTimeout;
    private final TheoryFeatures features;
    private final MixedNumericPolicy mixedNumericPolicy;
    /** 是否报告终止检查为 UNSAT 的路径 */
    private final boolean includeUnreachable;
    /** 是否丢弃模型与先前路径完全相同的路径 */
    private final boolean deduplicateModels;

    public ExplorationBudget(int maxDepth, int maxPaths, int maxLoopIterations, Duration sessionTimeout,
                             Duration solverTimeout, TheoryFeatures features, MixedNumericPolicy mixedNumericPolicy,
                             boolean includeUnreachable, boolean deduplicateModels) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth 不能为负: " + maxDepth);
        }
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths 必须为正: " + maxPaths);
        }
        if (maxLoopIterations < 0) {
            throw new IllegalArgumentException("maxLoopIterations 不能为负: " + maxLoopIterations);
        }
        this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "Session timeout cannot be null.");
        this.solverTimeout = Objects.requireNonNull(solverTimeout, "Solver timeout cannot be null.");
        if (sessionTimeout.isNegative() || sessionTimeout.isZero() || solverTimeout.isNegative() || solverTimeout.isZero()) {
            throw new IllegalArgumentException("超时必须为正: session=" + sessionTimeout + ", solver=" + solverTimeout);
        }
        this.features = Objects.requireNonNull(features, "Theory features cannot be null.");
        this.mixedNumericPolicy = Objects.requireNonNull(mixedNumericPolicy, "Mixed numeric policy cannot be null.");
        this.maxDepth = maxDepth;
        this.maxPaths = maxPaths;
        this.maxLoopIterations = maxLoopIterations;
        this.includeUnreachable = includeUnreachable;
        this.deduplicateModels = deduplicateModels;
    }

    public static ExplorationBudget defaults() {
        return new ExplorationBudget(8, 1000, 10, Duration.ofSeconds(30), Duration.ofMillis(2000),
                TheoryFeatures.DEFAULT, MixedNumericPolicy.PROMOTE_TO_REAL, false, false);
    }

    /**
     * 从 {@code symbex.*} 键构造预算，缺失的键取默认值。本方法不访问文件，由调用方负责加载 Properties。
     * <p>
     * 支持的键：maxDepth, maxPaths, maxLoopIterations, sessionTimeoutMs, solverTimeoutMs,
     * strings, sequences, maxStringLength, maxSequenceLength, untypedDomain (int|real|bool|str),
     * mixedNumericPolicy, includeUnreachable, deduplicateModels。
     */
    public static ExplorationBudget fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null.");
        ExplorationBudget d = defaults();
        TheoryFeatures f = d.getFeatures();
        TheoryFeatures features = new TheoryFeatures(
                bool(properties, "strings", f.isStrings()),
                bool(properties, "sequences", f.isSequences()),
                integer(properties, "maxStringLength", f.getMaxStringLength()),
                integer(properties, "maxSequenceLength", f.getMaxSequenceLength()),
                scalarDomain(properties.getProperty(PREFIX + "untypedDomain"), f.getUntypedParameterDomain()));
        String policy = properties.getProperty(PREFIX + "mixedNumericPolicy");
        ExplorationBudget budget = new ExplorationBudget(
                integer(properties, "maxDepth", d.getMaxDepth()),
                integer(properties, "maxPaths", d.getMaxPaths()),
                integer(properties, "maxLoopIterations", d.getMaxLoopIterations()),
                Duration.ofMillis(integer(properties, "sessionTimeoutMs", (int) d.getSessionTimeout().toMillis())),
                Duration.ofMillis(integer(properties, "solverTimeoutMs", (int) d.getSolverTimeout().toMillis())),
                features,
                policy == null ? d.getMixedNumericPolicy() : MixedNumericPolicy.valueOf(policy.trim().toUpperCase()),
                bool(properties, "includeUnreachable", d.isIncludeUnreachable()),
                bool(properties, "deduplicateModels", d.isDeduplicateModels()));
        logger.debug("从配置构造 ExplorationBudget: {}", budget);
        return budget;
    }

    private static int integer(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + PREFIX + key + " 不是整数: " + raw, e);
        }
    }

    private static boolean bool(Properties properties, String key, boolean fallback) {
        String raw = properties.getProperty(PREFIX + key);
        return raw == null ? fallback : Boolean.parseBoolean(raw.trim());
    }

    private static Domain scalarDomain(String raw, Domain fallback) {
        if (raw == null) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase()) {
            case "int" -> Domain.INT;
            case "real" -> Domain.REAL;
            case "bool" -> Domain.BOOL;
            case "str", "string" -> Domain.STRING;
            default -> throw new IllegalArgumentException("未知的值域: " + raw);
        };
    }

    @Override
    public String toString() {
        return "ExplorationBudget(maxDepth=" + maxDepth + ", maxPaths=" + maxPaths
                + ", maxLoopIterations=" + maxLoopIterations + ", sessionTimeout=" + sessionTimeout
                + ", solverTimeout=" + solverTimeout + ", " + features + ", mixed=" + mixedNumericPolicy
                + ", includeUnreachable=" + includeUnreachable + ", deduplicateModels=" + deduplicateModels + ")";
    }
}
