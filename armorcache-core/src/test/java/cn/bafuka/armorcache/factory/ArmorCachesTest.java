package cn.bafuka.armorcache.factory;

import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import cn.bafuka.armorcache.memory.MemoryCache;
import cn.bafuka.armorcache.model.CacheConfig;
import cn.bafuka.armorcache.model.CacheType;
import cn.bafuka.armorcache.model.EvictionPolicy;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * ArmorCaches / CacheConfigValidator 单元测试
 */
public class ArmorCachesTest {

    private static void assertInvalid(CacheConfig config) {
        try {
            CacheConfigValidator.validate(config);
            fail("expected invalid config");
        } catch (CacheException e) {
            assertEquals(ErrorKind.INVALID_CONFIG, e.getKind());
            assertEquals("init", e.getOperation());
        }
    }

    @Test
    public void testDefaultConfigIsValid() {
        CacheConfigValidator.validate(new CacheConfig());
    }

    @Test
    public void testValidation() {
        assertInvalid(null);
        assertInvalid(CacheConfig.builder().type(null).build());
        assertInvalid(CacheConfig.builder().ttl(Duration.ZERO).build());
        assertInvalid(CacheConfig.builder().ttl(null).build());
        assertInvalid(CacheConfig.builder()
                .memory(CacheConfig.MemoryConfig.builder().maxEntries(0).build())
                .build());
        assertInvalid(CacheConfig.builder()
                .memory(CacheConfig.MemoryConfig.builder().evictionPolicy(EvictionPolicy.ARC).build())
                .build());
    }

    @Test
    public void testRedisValidation() {
        assertInvalid(CacheConfig.builder().type(CacheType.REDIS).build());
        assertInvalid(CacheConfig.builder()
                .type(CacheType.REDIS)
                .redis(CacheConfig.RedisConfig.builder().url("redis://localhost:6379").poolSize(0).build())
                .build());
        assertInvalid(CacheConfig.builder()
                .type(CacheType.REDIS)
                .redis(CacheConfig.RedisConfig.builder().url("redis://localhost:6379").connectTimeout(Duration.ZERO).build())
                .build());
    }

    /**
     * Redis 配置只在 type=REDIS 时校验
     */
    @Test
    public void testRedisSectionIgnoredForMemory() {
        CacheConfig config = CacheConfig.builder()
                .redis(CacheConfig.RedisConfig.builder().poolSize(-1).build())
                .build();
        CacheConfigValidator.validate(config);
    }

    @Test
    public void testNewCacheMemory() {
        Cache<String> cache = ArmorCaches.newCache(new CacheConfig(), String.class);
        try {
            assertTrue(cache instanceof MemoryCache);
            cache.set(CacheContext.background(), "k", "v", null);
            assertEquals("v", cache.get(CacheContext.background(), "k"));
        } finally {
            cache.close();
        }
    }

    @Test
    public void testNewAdvancedMemory() {
        AdvancedCache<Integer> cache = ArmorCaches.newAdvancedMemory();
        try {
            assertEquals(Integer.valueOf(42), cache.getOrSet(CacheContext.background(), "answer", null, () -> 42));
            assertEquals(1, cache.len(CacheContext.background()));
        } finally {
            cache.close();
        }
    }

    @Test
    public void testInvalidConfigBuildsNothing() {
        try {
            ArmorCaches.newAdvanced(CacheConfig.builder().ttl(Duration.ofSeconds(-1)).build(), String.class);
            fail();
        } catch (CacheException e) {
            assertEquals(ErrorKind.INVALID_CONFIG, e.getKind());
        }
    }

    @Test
    public void testWrapRequiresStore() {
        try {
            ArmorCaches.wrap(null, new CacheConfig());
            fail();
        } catch (CacheException e) {
            assertEquals(ErrorKind.INVALID_CONFIG, e.getKind());
        }
    }
}
