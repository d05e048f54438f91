package cn.bafuka.armorcache.factory;

import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.model.CacheConfig;
import cn.bafuka.armorcache.model.CacheType;
import cn.bafuka.armorcache.model.EvictionPolicy;

import java.time.Duration;

/**
 * 缓存配置校验
 */
public final class CacheConfigValidator {

    private CacheConfigValidator() {
    }

    /**
     * 校验配置，不合法时抛出 INVALID_CONFIG
     */
    public static void validate(CacheConfig config) {
        if (config == null) {
            throw CacheException.invalidConfig("config is required");
        }
        if (config.getType() == null) {
            throw CacheException.invalidConfig("cache type is required");
        }
        if (!isPositive(config.getTtl())) {
            throw CacheException.invalidConfig("ttl must be positive");
        }

        if (config.getType() == CacheType.MEMORY) {
            validateMemory(config.getMemory());
        } else if (config.getType() == CacheType.REDIS) {
            validateRedis(config.getRedis());
        }
    }

    private static void validateMemory(CacheConfig.MemoryConfig memory) {
        if (memory == null) {
            return;
        }
        if (memory.getMaxEntries() <= 0) {
            throw CacheException.invalidConfig("memory.maxEntries must be positive");
        }
        EvictionPolicy policy = memory.getEvictionPolicy();
        if (policy != null && !policy.isSupported()) {
            throw CacheException.invalidConfig("unsupported eviction policy: " + policy);
        }
    }

    private static void validateRedis(CacheConfig.RedisConfig redis) {
        if (redis == null || redis.getUrl() == null || redis.getUrl().trim().isEmpty()) {
            throw CacheException.invalidConfig("redis.url is required");
        }
        if (redis.getPoolSize() <= 0) {
            throw CacheException.invalidConfig("redis.poolSize must be positive");
        }
        if (!isPositive(redis.getConnectTimeout())) {
            throw CacheException.invalidConfig("redis.connectTimeout must be positive");
        }
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }
}
