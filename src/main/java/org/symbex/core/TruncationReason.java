package org.symbex.core;

import com.google.gson.annotations.SerializedName;

/**
 * 批次被截断的原因，按严重程度从高到低排列。
 */
public enum TruncationReason {

    /** 会话墙钟超时 */
    @SerializedName("timeout")
    TIMEOUT("timeout"),
    /** 路径数量上限 */
    @SerializedName("path-count")
    PATH_COUNT("path-count"),
    /** 调用深度上限 */
    @SerializedName("depth")
    DEPTH("depth"),
    /** 循环展开上限 */
    @SerializedName("loop-bound")
    LOOP_BOUND("loop-bound"),
    /** 求值结果超出可建模范围（非有限实数） */
    @SerializedName("unmodelled-value")
    UNMODELLED_VALUE("unmodelled-value");

    private final String label;

    TruncationReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
