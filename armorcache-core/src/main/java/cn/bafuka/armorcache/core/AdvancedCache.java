package cn.bafuka.armorcache.core;

import cn.bafuka.armorcache.metrics.MetricsCollector;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 高级缓存接口
 * 在基础契约之上提供防击穿回源、批量管道操作以及指标统计
 *
 * @param <V> 缓存值类型
 */
public interface AdvancedCache<V> extends Cache<V> {

    /**
     * 读取缓存，未命中时调用 loader 计算并回写（不加锁）
     */
    V getOrSet(CacheContext ctx, String key, Duration ttl, Callable<V> loader);

    /**
     * 与 {@link #getOrSet} 相同，但在回源前尝试获取键级互斥锁
     * 后端不支持锁时退化为 getOrSet
     */
    V getOrSetLocked(CacheContext ctx, String key, Duration ttl, Callable<V> loader);

    /**
     * 批量读取，未命中的键不出现在结果中
     */
    Map<String, V> getManyPipeline(CacheContext ctx, Iterable<String> keys);

    /**
     * 批量写入，任一失败即整体失败
     */
    void setManyPipeline(CacheContext ctx, Map<String, V> items, Duration ttl);

    /**
     * 按前缀删除
     *
     * @return 删除的条目数
     */
    long deleteByPrefix(CacheContext ctx, String prefix);

    /**
     * 汇总统计信息
     */
    CacheStats stats(CacheContext ctx);

    /**
     * 操作指标
     */
    MetricsCollector metrics();
}
