package cn.bafuka.armorcache.core;

import java.time.Duration;

/**
 * 缓存核心接口
 * 所有后端（本地内存、Redis）都实现同一套契约
 *
 * <p>失败统一以 {@link cn.bafuka.armorcache.exception.CacheException} 抛出；
 * 未命中同样以异常表示，错误类型为 CACHE_MISS。</p>
 *
 * @param <V> 缓存值类型
 */
public interface Cache<V> extends AutoCloseable {

    /**
     * 获取缓存值
     *
     * @param ctx 调用上下文
     * @param key 缓存键
     * @return 缓存值
     */
    V get(CacheContext ctx, String key);

    /**
     * 写入缓存
     *
     * @param ctx   调用上下文
     * @param key   缓存键
     * @param value 缓存值
     * @param ttl   过期时间，零/负数/null 使用默认值
     */
    void set(CacheContext ctx, String key, V value, Duration ttl);

    /**
     * 删除缓存，不存在的键被忽略
     *
     * @param ctx  调用上下文
     * @param keys 缓存键
     */
    void delete(CacheContext ctx, String... keys);

    /**
     * 判断键是否存在（已过期视为不存在）
     */
    boolean exists(CacheContext ctx, String key);

    /**
     * 清空缓存
     */
    void clear(CacheContext ctx);

    /**
     * 当前条目数
     */
    int len(CacheContext ctx);

    /**
     * 健康检查
     */
    void ping(CacheContext ctx);

    /**
     * 释放资源，只能调用一次
     */
    @Override
    void close();
}
