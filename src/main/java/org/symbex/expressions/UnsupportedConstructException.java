package org.symbex.expressions;

import lombok.Getter;

/**
 * 某个表达式无法翻译为求解器理论中的项。总是在翻译器内部被捕获并替换为新的不透明值，不会逃出引擎的公开操作。
 */
@Getter
public class UnsupportedConstructException extends RuntimeException {

    private final String construct;

    public UnsupportedConstructException(String construct) {
        super("无法翻译: " + construct);
        this.construct = construct;
    }
}
