package cn.bafuka.armorcache.metrics;

import java.time.Duration;

/**
 * 单个操作的累计统计
 * 非线程安全，只能在 {@link MetricsCollector} 的锁内修改
 */
class OperationStats {

    long count;
    long totalItems;
    long totalNanos;
    long minNanos;
    long maxNanos;
    long hits;
    long misses;

    /**
     * 调用前 count 已计入本次操作
     */
    void recordDuration(long nanos) {
        totalNanos += nanos;
        if (count == 1 || nanos < minNanos) {
            minNanos = nanos;
        }
        if (nanos > maxNanos) {
            maxNanos = nanos;
        }
    }

    OperationSnapshot toSnapshot(long errors) {
        return OperationSnapshot.builder()
                .count(count)
                .totalItems(totalItems)
                .minDuration(Duration.ofNanos(minNanos))
                .maxDuration(Duration.ofNanos(maxNanos))
                .avgDuration(count > 0 ? Duration.ofNanos(totalNanos / count) : Duration.ZERO)
                .hits(hits)
                .misses(misses)
                .errors(errors)
                .build();
    }
}
