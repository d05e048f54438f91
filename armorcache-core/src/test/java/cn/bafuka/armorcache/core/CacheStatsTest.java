package cn.bafuka.armorcache.core;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * CacheStats 单元测试
 */
public class CacheStatsTest {

    @Test
    public void testHitRate() {
        assertEquals(0.0, CacheStats.calculateHitRate(0, 0), 0.0);
        assertEquals(0.75, CacheStats.calculateHitRate(3, 1), 0.0001);
        assertEquals(0.0, CacheStats.calculateHitRate(-1, 1), 0.0);
    }

    @Test
    public void testMerge() {
        CacheStats a = CacheStats.builder().items(2).hits(3).misses(1).uptime(Duration.ofSeconds(5)).build();
        CacheStats b = CacheStats.builder().items(1).hits(1).evictions(4).uptime(Duration.ofSeconds(9))
                .refreshTtlOnHit(true).build();

        CacheStats merged = CacheStats.merge(a, null, b);

        assertEquals("merged", merged.getBackend());
        assertEquals(3, merged.getItems());
        assertEquals(4, merged.getHits());
        assertEquals(1, merged.getMisses());
        assertEquals(4, merged.getEvictions());
        assertEquals(Duration.ofSeconds(9), merged.getUptime());
        assertTrue(merged.isRefreshTtlOnHit());
        assertEquals(0.8, merged.hitRate(), 0.0001);
    }
}
