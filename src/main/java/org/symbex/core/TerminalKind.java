package org.symbex.core;

import com.google.gson.annotations.SerializedName;

/**
 * 路径终止的方式。
 */
public enum TerminalKind {

    /** 正常返回 */
    @SerializedName("return")
    RETURN,
    /** 以具名错误终止（除零、越界、断言失败、显式 raise） */
    @SerializedName("error")
    ERROR,
    /** 因预算（循环展开上限、调用深度）被截断 */
    @SerializedName("truncated")
    TRUNCATED
}
