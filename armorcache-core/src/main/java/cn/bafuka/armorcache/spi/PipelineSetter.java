package cn.bafuka.armorcache.spi;

import cn.bafuka.armorcache.core.CacheContext;

import java.time.Duration;
import java.util.Map;

/**
 * 管道批量写入能力
 *
 * @param <V> 缓存值类型
 */
public interface PipelineSetter<V> {

    void setManyPipeline(CacheContext ctx, Map<String, V> items, Duration ttl);
}
