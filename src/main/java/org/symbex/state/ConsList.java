package org.symbex.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 持久化单链表。在头部追加，分叉后的两个版本共享已有的尾部。
 * {@link #toList()} 按追加顺序返回元素。此类是不可变的。
 * @param <T> 元素类型
 */
public final class ConsList<T> {

    private static final ConsList<?> EMPTY = new ConsList<>(null, null, 0);

    private final T head;
    private final ConsList<T> tail;
    private final int size;

    private ConsList(T head, ConsList<T> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <T> ConsList<T> empty() {
        return (ConsList<T>) EMPTY;
    }

    public ConsList<T> append(T element) {
        return new ConsList<>(Objects.requireNonNull(element, "Element cannot be null."), this, size + 1);
    }

    /**
     * @return 最后追加的元素。
     */
    public T last() {
        if (size == 0) {
            throw new IllegalStateException("空列表没有元素");
        }
        return head;
    }

    /**
     * @return 去掉最后追加的元素后的列表。
     */
    public ConsList<T> dropLast() {
        if (size == 0) {
            throw new IllegalStateException("空列表没有元素");
        }
        return tail;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public List<T> toList() {
        List<T> out = new ArrayList<>(size);
        for (ConsList<T> c = this; c.size > 0; c = c.tail) {
            out.add(c.head);
        }
        Collections.reverse(out);
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConsList<?> that = (ConsList<?>) o;
        return size == that.size && toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
