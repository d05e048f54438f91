package cn.bafuka.armorcache.factory;

import cn.bafuka.armorcache.advanced.DefaultAdvancedCache;
import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.memory.MemoryCache;
import cn.bafuka.armorcache.model.CacheConfig;
import cn.bafuka.armorcache.model.CacheType;
import cn.bafuka.armorcache.redis.RedissonCache;
import cn.bafuka.armorcache.serializer.FastJsonSerializer;
import cn.bafuka.armorcache.serializer.ValueSerializer;
import lombok.extern.slf4j.Slf4j;

/**
 * 缓存工厂
 * 根据配置显式构建缓存实例，不持有任何全局单例
 */
@Slf4j
public final class ArmorCaches {

    private ArmorCaches() {
    }

    /**
     * 按配置构建基础缓存，Redis 后端使用 fastjson 序列化
     */
    public static <V> Cache<V> newCache(CacheConfig config, Class<V> valueType) {
        return newCache(config, new FastJsonSerializer<>(valueType));
    }

    /**
     * 按配置构建基础缓存，Redis 后端使用给定的序列化器
     */
    public static <V> Cache<V> newCache(CacheConfig config, ValueSerializer<V> serializer) {
        CacheConfigValidator.validate(config);

        if (config.getType() == CacheType.MEMORY) {
            return new MemoryCache<>(config);
        }
        if (config.getType() == CacheType.REDIS) {
            return RedissonCache.create(config, serializer);
        }
        throw CacheException.invalidConfig("unsupported cache type: " + config.getType());
    }

    /**
     * 构建带高级装饰器的缓存
     */
    public static <V> AdvancedCache<V> newAdvanced(CacheConfig config, Class<V> valueType) {
        return wrap(newCache(config, valueType), config);
    }

    /**
     * 用高级装饰器包装已有后端
     */
    public static <V> AdvancedCache<V> wrap(Cache<V> store, CacheConfig config) {
        if (store == null) {
            throw CacheException.invalidConfig("store is required");
        }
        CacheConfig cfg = config != null ? config : new CacheConfig();
        return new DefaultAdvancedCache<>(store, cfg);
    }

    /**
     * 默认配置的本地缓存
     */
    public static <V> Cache<V> newMemory() {
        return new MemoryCache<>(new CacheConfig());
    }

    /**
     * 默认配置的本地高级缓存
     */
    public static <V> AdvancedCache<V> newAdvancedMemory() {
        CacheConfig config = new CacheConfig();
        return new DefaultAdvancedCache<>(new MemoryCache<>(config), config);
    }

    /**
     * 指定地址、其余使用默认配置的 Redis 缓存
     */
    public static <V> Cache<V> newRedis(String url, Class<V> valueType) {
        CacheConfig config = CacheConfig.builder()
                .type(CacheType.REDIS)
                .redis(CacheConfig.RedisConfig.builder().url(url).build())
                .build();
        return newCache(config, valueType);
    }
}
