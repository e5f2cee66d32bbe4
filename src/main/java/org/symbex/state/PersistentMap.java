package org.symbex.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * 持久化有序映射（AVL 树，路径复制）。
 * 每次更新返回新映射，只复制从根到被修改节点的路径，其余子树在新旧版本之间共享。
 * 按键的自然顺序迭代，保证输出确定。此类是不可变的。
 * @param <K> 键类型
 * @param <V> 值类型
 */
public final class PersistentMap<K extends Comparable<? super K>, V> {

    private static final PersistentMap<?, ?> EMPTY = new PersistentMap<>(null);

    private final Node<K, V> root;

    private static final class Node<K, V> {
        private final K key;
        private final V value;
        private final Node<K, V> left;
        private final Node<K, V> right;
        private final int height;
        private final int size;

        private Node(K key, V value, Node<K, V> left, Node<K, V> right) {
            this.key = key;
            this.value = value;
            this.left = left;
            this.right = right;
            this.height = Math.max(height(left), height(right)) + 1;
            this.size = size(left) + size(right) + 1;
        }
    }

    private PersistentMap(Node<K, V> root) {
        this.root = root;
    }

    @SuppressWarnings("unchecked")
    public static <K extends Comparable<? super K>, V> PersistentMap<K, V> empty() {
        return (PersistentMap<K, V>) EMPTY;
    }

    public static <K extends Comparable<? super K>, V> PersistentMap<K, V> copyOf(Map<K, V> source) {
        PersistentMap<K, V> result = empty();
        for (Map.Entry<K, V> e : source.entrySet()) {
            result = result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    public int size() {
        return size(root);
    }

    public boolean isEmpty() {
        return root == null;
    }

    public V get(K key) {
        Objects.requireNonNull(key, "Key cannot be null.");
        Node<K, V> n = root;
        while (n != null) {
            int c = key.compareTo(n.key);
            if (c == 0) {
                return n.value;
            }
            n = c < 0 ? n.left : n.right;
        }
        return null;
    }

    public V getOrDefault(K key, V fallback) {
        V v = get(key);
        return v == null ? fallback : v;
    }

    public boolean containsKey(K key) {
        return get(key) != null;
    }

    /**
     * @return 插入或替换后的新映射；值不允许为 null。
     */
    public PersistentMap<K, V> put(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null.");
        Objects.requireNonNull(value, "Value cannot be null.");
        Node<K, V> updated = insert(root, key, value);
        return updated == root ? this : new PersistentMap<>(updated);
    }

    public PersistentMap<K, V> remove(K key) {
        Objects.requireNonNull(key, "Key cannot be null.");
        if (!containsKey(key)) {
            return this;
        }
        return new PersistentMap<>(delete(root, key));
    }

    /**
     * 删除所有满足条件的键。
     */
    public PersistentMap<K, V> removeIf(Predicate<K> condition) {
        PersistentMap<K, V> result = this;
        for (K key : keys()) {
            if (condition.test(key)) {
                result = result.remove(key);
            }
        }
        return result;
    }

    /**
     * 按键升序遍历。
     */
    public void forEach(BiConsumer<K, V> action) {
        walk(root, action);
    }

    public List<K> keys() {
        List<K> out = new ArrayList<>(size());
        forEach((k, v) -> out.add(k));
        return Collections.unmodifiableList(out);
    }

    private static <K, V> void walk(Node<K, V> n, BiConsumer<K, V> action) {
        if (n == null) {
            return;
        }
        walk(n.left, action);
        action.accept(n.key, n.value);
        walk(n.right, action);
    }

    private static int height(Node<?, ?> n) {
        return n == null ? 0 : n.height;
    }

    private static int size(Node<?, ?> n) {
        return n == null ? 0 : n.size;
    }

    private static <K extends Comparable<? super K>, V> Node<K, V> insert(Node<K, V> n, K key, V value) {
        if (n == null) {
            return new Node<>(key, value, null, null);
        }
        int c = key.compareTo(n.key);
        if (c == 0) {
            return n.value == value ? n : new Node<>(key, value, n.left, n.right);
        }
        if (c < 0) {
            Node<K, V> left = insert(n.left, key, value);
            return left == n.left ? n : balance(n.key, n.value, left, n.right);
        }
        Node<K, V> right = insert(n.right, key, value);
        return right == n.right ? n : balance(n.key, n.value, n.left, right);
    }

    private static <K extends Comparable<? super K>, V> Node<K, V> delete(Node<K, V> n, K key) {
        int c = key.compareTo(n.key);
        if (c < 0) {
            return balance(n.key, n.value, delete(n.left, key), n.right);
        }
        if (c > 0) {
            return balance(n.key, n.value, n.left, delete(n.right, key));
        }
        if (n.left == null) {
            return n.right;
        }
        if (n.right == null) {
            return n.left;
        }
        Node<K, V> min = n.right;
        while (min.left != null) {
            min = min.left;
        }
        return balance(min.key, min.value, n.left, delete(n.right, min.key));
    }

    private static <K, V> Node<K, V> balance(K key, V value, Node<K, V> left, Node<K, V> right) {
        int diff = height(left) - height(right);
        if (diff > 1) {
            if (height(left.left) < height(left.right)) {
                left = rotateLeft(left.key, left.value, left.left, left.right);
            }
            return rotateRight(key, value, left, right);
        }
        if (diff < -1) {
            if (height(right.right) < height(right.left)) {
                right = rotateRight(right.key, right.value, right.left, right.right);
            }
            return rotateLeft(key, value, left, right);
        }
        return new Node<>(key, value, left, right);
    }

    private static <K, V> Node<K, V> rotateRight(K key, V value, Node<K, V> left, Node<K, V> right) {
        return new Node<>(left.key, left.value, left.left, new Node<>(key, value, left.right, right));
    }

    private static <K, V> Node<K, V> rotateLeft(K key, V value, Node<K, V> left, Node<K, V> right) {
        return new Node<>(right.key, right.value, new Node<>(key, value, left, right.left), right.right);
    }

    /**
     * 根节点引用相同说明两个版本完全共享存储，用于验证分叉的结构共享。
     */
    boolean sharesRootWith(PersistentMap<K, V> other) {
        return root == other.root;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PersistentMap<?, ?> that = (PersistentMap<?, ?>) o;
        if (size() != that.size()) {
            return false;
        }
        List<Object> mine = new ArrayList<>();
        List<Object> theirs = new ArrayList<>();
        walk(root, (k, v) -> {
            mine.add(k);
            mine.add(v);
        });
        walk(that.root, (k, v) -> {
            theirs.add(k);
            theirs.add(v);
        });
        return mine.equals(theirs);
    }

    @Override
    public int hashCode() {
        int[] h = {1};
        forEach((k, v) -> h[0] = 31 * h[0] + k.hashCode() * 17 + v.hashCode());
        return h[0];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        forEach((k, v) -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(k).append('=').append(v);
        });
        return sb.append('}').toString();
    }
}
