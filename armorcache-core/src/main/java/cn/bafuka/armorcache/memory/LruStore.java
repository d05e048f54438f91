package cn.bafuka.armorcache.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * 有界 LRU 存储
 * 哈希索引 + 双向链表，get/set/delete/淘汰均为 O(1)
 *
 * <p>链表头部为最近使用，尾部为最久未使用。{@link #get} 会调整顺序，
 * 因此与写操作一样持有写锁；{@link #peek}、{@link #size}、{@link #keys} 只持有读锁。
 * 不接受 null 值，{@link #get} 返回 null 表示不存在。</p>
 *
 * @param <K> 键类型
 * @param <V> 值类型
 */
public class LruStore<K, V> {

    /**
     * 链表节点
     */
    private static final class Node<K, V> {
        final K key;
        V value;
        Node<K, V> prev;
        Node<K, V> next;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    /**
     * 容量，小于等于 0 表示不限
     */
    private final int capacity;

    private final Map<K, Node<K, V>> index = new HashMap<>();

    /**
     * 哨兵节点：head.next 为最近使用，tail.prev 为最久未使用
     */
    private final Node<K, V> head = new Node<>(null, null);
    private final Node<K, V> tail = new Node<>(null, null);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 容量淘汰回调，在写锁内调用
     */
    private final BiConsumer<K, V> evictionListener;

    public LruStore(int capacity) {
        this(capacity, null);
    }

    public LruStore(int capacity, BiConsumer<K, V> evictionListener) {
        this.capacity = capacity;
        this.evictionListener = evictionListener;
        head.next = tail;
        tail.prev = head;
    }

    /**
     * 获取值并标记为最近使用
     */
    public V get(K key) {
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            if (node == null) {
                return null;
            }
            moveToFront(node);
            return node.value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 获取值，不调整顺序
     */
    public V peek(K key) {
        lock.readLock().lock();
        try {
            Node<K, V> node = index.get(key);
            return node == null ? null : node.value;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 插入或替换并标记为最近使用；新键且已满时先淘汰最久未使用的条目
     */
    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            if (node != null) {
                node.value = value;
                moveToFront(node);
                return;
            }

            if (capacity > 0 && index.size() >= capacity) {
                evictOldest();
            }

            node = new Node<>(key, value);
            index.put(key, node);
            linkFirst(node);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 删除
     *
     * @return 是否删除了条目
     */
    public boolean delete(K key) {
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.remove(key);
            if (node == null) {
                return false;
            }
            unlink(node);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 条件删除：仅当当前值满足条件时删除
     */
    public boolean removeIf(K key, Predicate<? super V> condition) {
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            if (node == null || !condition.test(node.value)) {
                return false;
            }
            index.remove(key);
            unlink(node);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 批量条件删除
     *
     * @return 删除的条目数
     */
    public int removeAll(BiPredicate<? super K, ? super V> condition) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Node<K, V> node = head.next;
            while (node != tail) {
                Node<K, V> next = node.next;
                if (condition.test(node.key, node.value)) {
                    index.remove(node.key);
                    unlink(node);
                    removed++;
                }
                node = next;
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            index.clear();
            head.next = tail;
            tail.prev = head;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 所有键，从最近使用到最久未使用
     */
    public List<K> keys() {
        lock.readLock().lock();
        try {
            List<K> keys = new ArrayList<>(index.size());
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                keys.add(node.key);
            }
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    // must hold write lock
    private void evictOldest() {
        Node<K, V> oldest = tail.prev;
        if (oldest == head) {
            return;
        }
        index.remove(oldest.key);
        unlink(oldest);
        if (evictionListener != null) {
            evictionListener.accept(oldest.key, oldest.value);
        }
    }

    private void moveToFront(Node<K, V> node) {
        if (head.next == node) {
            return;
        }
        unlink(node);
        linkFirst(node);
    }

    private void linkFirst(Node<K, V> node) {
        node.prev = head;
        node.next = head.next;
        head.next.prev = node;
        head.next = node;
    }

    private void unlink(Node<K, V> node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
    }
}
