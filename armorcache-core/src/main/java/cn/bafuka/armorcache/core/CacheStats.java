package cn.bafuka.armorcache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 缓存统计信息
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    /**
     * 后端名称
     */
    private String backend;

    private long items;
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    /**
     * 运行时长
     */
    @Builder.Default
    private Duration uptime = Duration.ZERO;

    private boolean refreshTtlOnHit;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0），无请求时为 0
     */
    public double hitRate() {
        return calculateHitRate(hits, misses);
    }

    public static double calculateHitRate(long hits, long misses) {
        if (hits < 0 || misses < 0) {
            return 0.0;
        }
        long requestCount = hits + misses;
        return requestCount == 0 ? 0.0 : (double) hits / requestCount;
    }

    /**
     * 合并多个统计信息：计数累加，运行时长取最大值
     */
    public static CacheStats merge(CacheStats... stats) {
        CacheStats merged = CacheStats.builder().backend("merged").build();
        if (stats == null) {
            return merged;
        }
        for (CacheStats s : stats) {
            if (s == null) {
                continue;
            }
            merged.items += Math.max(0, s.items);
            merged.hits += Math.max(0, s.hits);
            merged.misses += Math.max(0, s.misses);
            merged.evictions += Math.max(0, s.evictions);
            merged.expirations += Math.max(0, s.expirations);
            if (s.uptime != null && s.uptime.compareTo(merged.uptime) > 0) {
                merged.uptime = s.uptime;
            }
            merged.refreshTtlOnHit = merged.refreshTtlOnHit || s.refreshTtlOnHit;
        }
        return merged;
    }
}
