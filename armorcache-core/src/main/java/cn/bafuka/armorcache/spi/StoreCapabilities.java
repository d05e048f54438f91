package cn.bafuka.armorcache.spi;

import cn.bafuka.armorcache.core.Cache;

/**
 * 后端能力描述
 * 在装饰器构造时探测一次，之后每次调用不再重复判断
 *
 * @param <V> 缓存值类型
 */
public final class StoreCapabilities<V> {

    private final PipelineGetter<V> pipelineGetter;
    private final PipelineSetter<V> pipelineSetter;
    private final PrefixDeleter prefixDeleter;
    private final StatsProvider statsProvider;
    private final DistributedLocker locker;

    private StoreCapabilities(PipelineGetter<V> pipelineGetter,
                              PipelineSetter<V> pipelineSetter,
                              PrefixDeleter prefixDeleter,
                              StatsProvider statsProvider,
                              DistributedLocker locker) {
        this.pipelineGetter = pipelineGetter;
        this.pipelineSetter = pipelineSetter;
        this.prefixDeleter = prefixDeleter;
        this.statsProvider = statsProvider;
        this.locker = locker;
    }

    /**
     * 探测后端实现了哪些可选能力
     */
    @SuppressWarnings("unchecked")
    public static <V> StoreCapabilities<V> probe(Cache<V> store) {
        return new StoreCapabilities<>(
                store instanceof PipelineGetter ? (PipelineGetter<V>) store : null,
                store instanceof PipelineSetter ? (PipelineSetter<V>) store : null,
                store instanceof PrefixDeleter ? (PrefixDeleter) store : null,
                store instanceof StatsProvider ? (StatsProvider) store : null,
                store instanceof DistributedLocker ? (DistributedLocker) store : null
        );
    }

    public boolean hasPipelineGet() {
        return pipelineGetter != null;
    }

    public boolean hasPipelineSet() {
        return pipelineSetter != null;
    }

    public boolean hasPrefixDelete() {
        return prefixDeleter != null;
    }

    public boolean hasStats() {
        return statsProvider != null;
    }

    public boolean hasLocking() {
        return locker != null;
    }

    public PipelineGetter<V> pipelineGetter() {
        return pipelineGetter;
    }

    public PipelineSetter<V> pipelineSetter() {
        return pipelineSetter;
    }

    public PrefixDeleter prefixDeleter() {
        return prefixDeleter;
    }

    public StatsProvider statsProvider() {
        return statsProvider;
    }

    public DistributedLocker locker() {
        return locker;
    }

    @Override
    public String toString() {
        return "StoreCapabilities{" +
                "pipelineGet=" + hasPipelineGet() +
                ", pipelineSet=" + hasPipelineSet() +
                ", prefixDelete=" + hasPrefixDelete() +
                ", stats=" + hasStats() +
                ", locking=" + hasLocking() +
                '}';
    }
}
