package org.symbex.result;

import com.google.gson.annotations.SerializedName;

/**
 * 报告路径的状态。
 */
public enum PathStatus {

    /** 求解器找到了满足路径条件的输入 */
    @SerializedName("satisfied")
    SATISFIED("satisfied"),
    /** 最终检查证明路径条件不可满足，仅在开启 includeUnreachable 时报告 */
    @SerializedName("proven-unreachable")
    PROVEN_UNREACHABLE("proven-unreachable"),
    /** 最终检查超时或求解器放弃 */
    @SerializedName("unknown-timeout")
    UNKNOWN_TIMEOUT("unknown-timeout"),
    /** 路径因调用深度上限被截断 */
    @SerializedName("budget-exceeded")
    BUDGET_EXCEEDED("budget-exceeded");

    private final String label;

    PathStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
