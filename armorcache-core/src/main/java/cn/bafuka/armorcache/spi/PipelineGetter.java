package cn.bafuka.armorcache.spi;

import cn.bafuka.armorcache.core.CacheContext;

import java.util.Map;

/**
 * 管道批量读取能力
 *
 * @param <V> 缓存值类型
 */
public interface PipelineGetter<V> {

    /**
     * 一次往返读取多个键，未命中的键不出现在结果中
     */
    Map<String, V> getManyPipeline(CacheContext ctx, Iterable<String> keys);
}
