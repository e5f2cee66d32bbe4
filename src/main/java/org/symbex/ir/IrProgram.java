package org.symbex.ir;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次分析调用的全部 IR：入口函数以及可被内联的用户函数。
 */
@Getter
public final class IrProgram {

    private final String entry;
    private final Map<String, IrFunction> functions;
    private final ArithmeticSemantics semantics;

    public IrProgram(String entry, Map<String, IrFunction> functions, ArithmeticSemantics semantics) {
        this.entry = Objects.requireNonNull(entry, "Entry function name cannot be null.");
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.semantics = Objects.requireNonNull(semantics, "Arithmetic semantics cannot be null.");
        if (!this.functions.containsKey(entry)) {
            throw new IllegalArgumentException("入口函数不存在: " + entry);
        }
    }

    public IrFunction getEntryFunction() {
        return functions.get(entry);
    }

    /**
     * @return 同名的用户函数，不可见时返回 null。
     */
    public IrFunction resolve(String name) {
        return functions.get(name);
    }
}
