package org.symbex.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 路径以错误终止时的错误种类。内置种类由翻译器产生，其余来自源程序的 raise / throw 语句。
 */
@Getter
public final class ErrorKind {

    public static final ErrorKind DIVISION_BY_ZERO = new ErrorKind("division-by-zero");
    public static final ErrorKind INDEX_OUT_OF_RANGE = new ErrorKind("index-out-of-range");
    public static final ErrorKind KEY_NOT_FOUND = new ErrorKind("key-error");
    public static final ErrorKind ASSERTION_FAILED = new ErrorKind("assertion-error");

    private final String name;

    private ErrorKind(String name) {
        this.name = Objects.requireNonNull(name, "Error kind name cannot be null.");
    }

    /**
     * 源程序显式抛出的异常，名称取异常类型名。
     */
    public static ErrorKind raised(String exceptionType) {
        if (exceptionType == null || exceptionType.isBlank()) {
            return new ErrorKind("error");
        }
        return new ErrorKind(exceptionType.trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((ErrorKind) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
