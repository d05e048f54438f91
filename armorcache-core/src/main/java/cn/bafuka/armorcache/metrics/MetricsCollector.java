package cn.bafuka.armorcache.metrics;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 操作指标收集器
 * 按操作名统计调用次数、条目数、耗时极值/均值、命中、未命中与错误次数
 *
 * <p>内部状态由自身的读写锁保护，与缓存存储的锁相互独立。</p>
 */
public class MetricsCollector {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, OperationStats> operations = new HashMap<>();

    private final Map<String, Long> errors = new HashMap<>();

    private volatile boolean enabled = true;

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 记录一次操作
     *
     * @param op        操作名
     * @param duration  耗时
     * @param itemCount 涉及条目数，小于等于 0 时忽略
     */
    public void recordOperation(String op, Duration duration, int itemCount) {
        if (!enabled || isBlank(op) || itemCount <= 0) {
            return;
        }
        long nanos = duration == null ? 0L : Math.max(0L, duration.toNanos());
        record(op, s -> {
            s.count++;
            s.totalItems += itemCount;
            s.recordDuration(nanos);
        });
    }

    public void recordHit(String op, long count) {
        if (!enabled || isBlank(op) || count <= 0) {
            return;
        }
        record(op, s -> s.hits += count);
    }

    public void recordMiss(String op, long count) {
        if (!enabled || isBlank(op) || count <= 0) {
            return;
        }
        record(op, s -> s.misses += count);
    }

    public void recordError(String op) {
        if (!enabled || isBlank(op)) {
            return;
        }
        lock.writeLock().lock();
        try {
            errors.merge(op, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 获取所有操作的指标快照，禁用时返回空表
     */
    public Map<String, OperationSnapshot> snapshot() {
        Map<String, OperationSnapshot> out = new HashMap<>();
        if (!enabled) {
            return out;
        }

        lock.readLock().lock();
        try {
            Set<String> names = new LinkedHashSet<>(operations.keySet());
            names.addAll(errors.keySet());
            for (String op : names) {
                OperationStats stats = operations.get(op);
                long errorCount = errors.getOrDefault(op, 0L);
                if (stats == null) {
                    stats = new OperationStats();
                }
                out.put(op, stats.toSnapshot(errorCount));
            }
        } finally {
            lock.readLock().unlock();
        }
        return out;
    }

    /**
     * 获取单个操作的快照，不存在返回 null
     */
    public OperationSnapshot snapshot(String op) {
        return snapshot().get(op);
    }

    /**
     * 所有操作的命中总数
     */
    public long totalHits() {
        lock.readLock().lock();
        try {
            long total = 0;
            for (OperationStats s : operations.values()) {
                total += s.hits;
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 所有操作的未命中总数
     */
    public long totalMisses() {
        lock.readLock().lock();
        try {
            long total = 0;
            for (OperationStats s : operations.values()) {
                total += s.misses;
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            operations.clear();
            errors.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void record(String op, Consumer<OperationStats> fn) {
        lock.writeLock().lock();
        try {
            fn.accept(operations.computeIfAbsent(op, k -> new OperationStats()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }
}
