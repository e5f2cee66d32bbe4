package org.symbex.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 值域。标量值域只有种类；LIST 带元素值域，DICT 带键、值值域。
 * 此类是不可变的。
 */
@Getter
public final class Domain {

    public static final Domain INT = new Domain(DomainKind.INT, null, null);
    public static final Domain BOOL = new Domain(DomainKind.BOOL, null, null);
    public static final Domain REAL = new Domain(DomainKind.REAL, null, null);
    public static final Domain STRING = new Domain(DomainKind.STRING, null, null);
    public static final Domain NONE = new Domain(DomainKind.NONE, null, null);
    public static final Domain ANY = new Domain(DomainKind.ANY, null, null);

    private final DomainKind kind;
    /** LIST 的元素值域，或 DICT 的键值域 */
    private final Domain first;
    /** DICT 的值值域 */
    private final Domain second;

    private final int hashCode;

    private Domain(DomainKind kind, Domain first, Domain second) {
        this.kind = Objects.requireNonNull(kind, "Domain kind cannot be null.");
        this.first = first;
        this.second = second;
        this.hashCode = Objects.hash(kind, first, second);
    }

    public static Domain listOf(Domain element) {
        Objects.requireNonNull(element, "Element domain cannot be null.");
        if (!element.getKind().isScalar()) {
            throw new IllegalArgumentException("列表元素只支持标量值域: " + element);
        }
        return new Domain(DomainKind.LIST, element, null);
    }

    public static Domain dictOf(Domain key, Domain value) {
        Objects.requireNonNull(key, "Key domain cannot be null.");
        Objects.requireNonNull(value, "Value domain cannot be null.");
        if (!key.getKind().isScalar() || !value.getKind().isScalar()) {
            throw new IllegalArgumentException("字典键和值只支持标量值域: " + key + ", " + value);
        }
        return new Domain(DomainKind.DICT, key, value);
    }

    public Domain getElement() {
        if (kind != DomainKind.LIST) {
            throw new IllegalStateException(this + " 不是列表值域");
        }
        return first;
    }

    public Domain getKey() {
        if (kind != DomainKind.DICT) {
            throw new IllegalStateException(this + " 不是字典值域");
        }
        return first;
    }

    public Domain getValue() {
        if (kind != DomainKind.DICT) {
            throw new IllegalStateException(this + " 不是字典值域");
        }
        return second;
    }

    public boolean is(DomainKind other) {
        return kind == other;
    }

    public boolean isNumeric() {
        return kind.isNumeric();
    }

    /**
     * 是否需要扩展理论（序列 / 数组）支持。
     */
    public boolean isCollection() {
        return kind == DomainKind.LIST || kind == DomainKind.DICT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Domain domain = (Domain) o;
        return kind == domain.kind && Objects.equals(first, domain.first) && Objects.equals(second, domain.second);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case LIST -> "list[" + first + "]";
            case DICT -> "dict[" + first + ", " + second + "]";
            default -> kind.getLabel();
        };
    }
}
