package cn.bafuka.armorcache.advanced;

import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.core.CacheOperation;
import cn.bafuka.armorcache.core.CacheStats;
import cn.bafuka.armorcache.core.KeyPolicy;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import cn.bafuka.armorcache.metrics.MetricsCollector;
import cn.bafuka.armorcache.model.CacheConfig;
import cn.bafuka.armorcache.spi.DistributedLocker;
import cn.bafuka.armorcache.spi.StoreCapabilities;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 高级缓存装饰器
 * 包装任意 {@link Cache} 实现，增加防击穿回源、批量管道操作与指标统计
 *
 * <p>回源流程：</p>
 * <ol>
 *     <li>读取缓存，命中直接返回</li>
 *     <li>未命中时（加锁模式）单次尝试获取 lock:key 互斥锁，失败抛出 LOCK_ACQUIRE</li>
 *     <li>获取锁后再次读取后端（双重检查），仍未命中才调用 loader</li>
 *     <li>回写缓存，写入失败仅记录日志</li>
 *     <li>finally 中释放锁</li>
 * </ol>
 *
 * @param <V> 缓存值类型
 */
@Slf4j
public class DefaultAdvancedCache<V> implements AdvancedCache<V> {

    static final String LOCK_KEY_PREFIX = "lock:";

    private static final String BACKEND = "advanced";

    /**
     * 被包装的后端
     */
    private final Cache<V> store;

    /**
     * 构造时探测的后端能力
     */
    private final StoreCapabilities<V> capabilities;

    private final KeyPolicy keyPolicy;

    private final MetricsCollector metrics = new MetricsCollector();

    private final PipelineExecutor pipeline;

    private final Duration lockLease;

    private final boolean refreshTtlOnHit;

    public DefaultAdvancedCache(Cache<V> store, CacheConfig config) {
        this.store = store;
        this.capabilities = StoreCapabilities.probe(store);
        this.keyPolicy = new KeyPolicy(config.getPrefix(), config.getTtl());
        this.refreshTtlOnHit = config.isRefreshTtlOnHit();

        CacheConfig.AdvancedConfig advanced = config.getAdvanced() != null
                ? config.getAdvanced() : new CacheConfig.AdvancedConfig();
        this.lockLease = advanced.getLockLease();
        this.pipeline = new PipelineExecutor(advanced.getPipelineThreads(), advanced.getPipelineConcurrency());

        log.info("高级缓存装饰器已创建: store={}, capabilities={}", store.getClass().getSimpleName(), capabilities);
    }

    public StoreCapabilities<V> getCapabilities() {
        return capabilities;
    }

    // ==================== 基础操作 ====================

    @Override
    public V get(CacheContext ctx, String key) {
        String op = CacheOperation.GET.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        return withMetrics(op, 1, () -> {
            try {
                V value = store.get(ctx, key);
                metrics.recordHit(op, 1);
                return value;
            } catch (CacheException e) {
                if (e.isCacheMiss()) {
                    metrics.recordMiss(op, 1);
                }
                throw e;
            }
        });
    }

    @Override
    public void set(CacheContext ctx, String key, V value, Duration ttl) {
        String op = CacheOperation.SET.getOpName();
        keyPolicy.validateKey(op, key);

        Duration resolved = keyPolicy.resolveTtl(ttl);
        withMetrics(op, 1, () -> {
            store.set(ctx, key, value, resolved);
            return null;
        });
    }

    @Override
    public void delete(CacheContext ctx, String... keys) {
        if (keys == null || keys.length == 0) {
            return;
        }
        withMetrics(CacheOperation.DELETE.getOpName(), keys.length, () -> {
            store.delete(ctx, keys);
            return null;
        });
    }

    @Override
    public boolean exists(CacheContext ctx, String key) {
        return withMetrics(CacheOperation.EXISTS.getOpName(), 1, () -> store.exists(ctx, key));
    }

    @Override
    public void clear(CacheContext ctx) {
        withMetrics(CacheOperation.CLEAR.getOpName(), 1, () -> {
            store.clear(ctx);
            return null;
        });
    }

    @Override
    public int len(CacheContext ctx) {
        return withMetrics(CacheOperation.LEN.getOpName(), 1, () -> store.len(ctx));
    }

    @Override
    public void ping(CacheContext ctx) {
        store.ping(ctx);
    }

    // ==================== 回源 ====================

    @Override
    public V getOrSet(CacheContext ctx, String key, Duration ttl, Callable<V> loader) {
        return getOrLoad(ctx, key, ttl, loader, false);
    }

    @Override
    public V getOrSetLocked(CacheContext ctx, String key, Duration ttl, Callable<V> loader) {
        return getOrLoad(ctx, key, ttl, loader, true);
    }

    private V getOrLoad(CacheContext ctx, String key, Duration ttl, Callable<V> loader, boolean locked) {
        String op = locked ? CacheOperation.GET_OR_SET_LOCKED.getOpName() : CacheOperation.GET_OR_SET.getOpName();

        return withMetrics(op, 1, () -> {
            try {
                return get(ctx, key);
            } catch (CacheException e) {
                if (!e.isCacheMiss()) {
                    throw e;
                }
            }

            if (!locked || !capabilities.hasLocking()) {
                return loadAndSet(ctx, op, key, ttl, loader);
            }
            return loadUnderLock(ctx, op, key, ttl, loader);
        });
    }

    private V loadUnderLock(CacheContext ctx, String op, String key, Duration ttl, Callable<V> loader) {
        DistributedLocker locker = capabilities.locker();
        String lockKey = LOCK_KEY_PREFIX + key;

        if (!locker.tryLock(ctx, lockKey, lockLease)) {
            log.debug("回源锁获取失败: key={}", key);
            throw new CacheException(ErrorKind.LOCK_ACQUIRE, op, key);
        }

        try {
            // 双重检查：等锁期间其他线程可能已经回填
            try {
                V value = store.get(ctx, key);
                log.debug("双重检查命中: key={}", key);
                return value;
            } catch (CacheException e) {
                if (!e.isCacheMiss()) {
                    throw e;
                }
            }
            return loadAndSet(ctx, op, key, ttl, loader);
        } finally {
            unlockQuietly(op, lockKey);
        }
    }

    private V loadAndSet(CacheContext ctx, String op, String key, Duration ttl, Callable<V> loader) {
        V value;
        try {
            value = loader.call();
        } catch (CacheException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException(ErrorKind.LOAD, op, key, e);
        } catch (Exception e) {
            log.error("回源加载失败: key={}", key, e);
            throw new CacheException(ErrorKind.LOAD, op, key, e);
        }

        try {
            set(ctx, key, value, ttl);
        } catch (CacheException e) {
            log.warn("回源结果写入缓存失败，忽略: key={}, error={}", key, e.getMessage());
        }
        return value;
    }

    private void unlockQuietly(String op, String lockKey) {
        try {
            // 调用方上下文可能已取消，释放锁使用 background
            capabilities.locker().unlock(CacheContext.background(), lockKey);
        } catch (CacheException e) {
            metrics.recordError(op);
            log.warn("释放回源锁失败: lockKey={}, error={}", lockKey, e.getMessage());
        }
    }

    // ==================== 批量操作 ====================

    @Override
    public Map<String, V> getManyPipeline(CacheContext ctx, Iterable<String> keys) {
        String op = CacheOperation.GET_MANY_PIPELINE.getOpName();
        List<String> keyList = new ArrayList<>();
        if (keys != null) {
            keys.forEach(keyList::add);
        }

        if (capabilities.hasPipelineGet()) {
            return withMetrics(op, keyList.size(), () -> capabilities.pipelineGetter().getManyPipeline(ctx, keyList));
        }

        Map<String, V> result = Collections.synchronizedMap(new HashMap<>(keyList.size()));
        List<PipelineExecutor.PipelineTask> tasks = new ArrayList<>(keyList.size());
        for (String key : keyList) {
            tasks.add(c -> {
                try {
                    result.put(key, get(c, key));
                } catch (CacheException e) {
                    if (e.isCancellation()) {
                        throw e;
                    }
                    if (!e.isCacheMiss()) {
                        log.debug("批量读取单键失败，跳过: key={}, error={}", key, e.getMessage());
                    }
                }
            });
        }

        withMetrics(op, keyList.size(), () -> {
            pipeline.execute(ctx, op, tasks);
            return null;
        });

        synchronized (result) {
            return new HashMap<>(result);
        }
    }

    @Override
    public void setManyPipeline(CacheContext ctx, Map<String, V> items, Duration ttl) {
        String op = CacheOperation.SET_MANY_PIPELINE.getOpName();
        if (items == null || items.isEmpty()) {
            CacheContext.orBackground(ctx).checkActive(op, null);
            return;
        }

        if (capabilities.hasPipelineSet()) {
            withMetrics(op, items.size(), () -> {
                capabilities.pipelineSetter().setManyPipeline(ctx, items, ttl);
                return null;
            });
            return;
        }

        List<PipelineExecutor.PipelineTask> tasks = new ArrayList<>(items.size());
        for (Map.Entry<String, V> entry : items.entrySet()) {
            String key = entry.getKey();
            V value = entry.getValue();
            tasks.add(c -> set(c, key, value, ttl));
        }

        withMetrics(op, items.size(), () -> {
            pipeline.execute(ctx, op, tasks);
            return null;
        });
    }

    // ==================== 前缀删除 / 统计 ====================

    @Override
    public long deleteByPrefix(CacheContext ctx, String prefix) {
        String op = CacheOperation.DELETE_BY_PREFIX.getOpName();
        if (!capabilities.hasPrefixDelete()) {
            throw CacheException.unsupported(op);
        }
        return withMetrics(op, 1, () -> capabilities.prefixDeleter().deleteByPrefix(ctx, prefix));
    }

    @Override
    public CacheStats stats(CacheContext ctx) {
        CacheStats base = capabilities.hasStats()
                ? capabilities.statsProvider().stats(ctx)
                : CacheStats.builder().backend(BACKEND).refreshTtlOnHit(refreshTtlOnHit).build();

        // 命中/未命中以装饰器层的统计为准
        return base.toBuilder()
                .hits(metrics.totalHits())
                .misses(metrics.totalMisses())
                .build();
    }

    @Override
    public MetricsCollector metrics() {
        return metrics;
    }

    @Override
    public void close() {
        pipeline.close();
        store.close();
        log.info("高级缓存装饰器已关闭");
    }

    /**
     * 记录耗时、条目数与错误次数（未命中不计为错误）
     */
    private <T> T withMetrics(String op, int items, Supplier<T> fn) {
        long start = System.nanoTime();
        try {
            return fn.get();
        } catch (RuntimeException e) {
            if (!CacheException.isCacheMiss(e)) {
                metrics.recordError(op);
            }
            throw e;
        } finally {
            metrics.recordOperation(op, Duration.ofNanos(System.nanoTime() - start), items);
        }
    }
}
