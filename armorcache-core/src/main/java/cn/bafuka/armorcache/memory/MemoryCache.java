package cn.bafuka.armorcache.memory;

import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.core.CacheOperation;
import cn.bafuka.armorcache.core.CacheStats;
import cn.bafuka.armorcache.core.KeyPolicy;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import cn.bafuka.armorcache.model.CacheConfig;
import cn.bafuka.armorcache.model.EvictionPolicy;
import cn.bafuka.armorcache.spi.DistributedLocker;
import cn.bafuka.armorcache.spi.PrefixDeleter;
import cn.bafuka.armorcache.spi.StatsProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * 本地内存缓存引擎
 * 基于 {@link LruStore} 的有界 LRU 缓存，支持 TTL、惰性过期与后台定期清理
 *
 * @param <V> 缓存值类型
 */
@Slf4j
public class MemoryCache<V> implements Cache<V>, PrefixDeleter, StatsProvider, DistributedLocker {

    private static final String BACKEND = "memory";

    private static final Duration DEFAULT_LOCK_LEASE = Duration.ofSeconds(30);

    private final KeyPolicy keyPolicy;

    private final LruStore<String, CacheEntry<V>> store;

    private final boolean refreshTtlOnHit;

    private final CaffeineLeaseLocker locker = new CaffeineLeaseLocker();

    /**
     * 后台清理调度器，未启用清理时为 null
     */
    private final ScheduledExecutorService sweeper;
    private final ScheduledFuture<?> sweepTask;

    private final long startTime = System.currentTimeMillis();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    /**
     * 构建本地缓存
     *
     * @param config 缓存配置
     * @throws CacheException 淘汰策略不是 LRU 时为 INVALID_CONFIG
     */
    public MemoryCache(CacheConfig config) {
        CacheConfig.MemoryConfig memory = config.getMemory() != null
                ? config.getMemory() : new CacheConfig.MemoryConfig();

        EvictionPolicy policy = memory.getEvictionPolicy();
        if (policy != null && !policy.isSupported()) {
            throw CacheException.invalidConfig("eviction policy " + policy + " is not supported");
        }

        this.keyPolicy = new KeyPolicy(config.getPrefix(), config.getTtl());
        this.refreshTtlOnHit = config.isRefreshTtlOnHit();
        this.store = new LruStore<>(memory.getMaxEntries(), (key, entry) -> {
            evictions.increment();
            log.debug("本地缓存容量淘汰: key={}", key);
        });

        Duration interval = memory.getCleanupInterval();
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "armorcache-sweeper");
                t.setDaemon(true);
                return t;
            });
            long millis = interval.toMillis();
            this.sweepTask = sweeper.scheduleWithFixedDelay(() -> {
                try {
                    sweepExpired();
                } catch (RuntimeException e) {
                    log.error("本地缓存后台清理失败", e);
                }
            }, millis, millis, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
            this.sweepTask = null;
        }

        log.info("构建本地缓存: maxEntries={}, ttl={}, prefix={}, cleanupInterval={}",
                memory.getMaxEntries(), keyPolicy.getDefaultTtl(), keyPolicy.getPrefix(), interval);
    }

    @Override
    public V get(CacheContext ctx, String key) {
        String op = CacheOperation.GET.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        String fullKey = keyPolicy.fullKey(key);
        CacheEntry<V> entry = store.get(fullKey);
        if (entry == null) {
            misses.increment();
            log.debug("本地缓存未命中: key={}", key);
            throw CacheException.miss(op, key);
        }

        long now = System.currentTimeMillis();
        if (entry.isExpired(now)) {
            if (store.removeIf(fullKey, current -> current == entry)) {
                expirations.increment();
            }
            misses.increment();
            log.debug("本地缓存已过期: key={}", key);
            throw CacheException.miss(op, key);
        }

        if (refreshTtlOnHit) {
            entry.refresh(now);
        }
        hits.increment();
        log.debug("本地缓存命中: key={}", key);
        return entry.getValue();
    }

    @Override
    public void set(CacheContext ctx, String key, V value, Duration ttl) {
        String op = CacheOperation.SET.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        String fullKey = keyPolicy.fullKey(key);
        long ttlMillis = keyPolicy.resolveTtl(ttl).toMillis();
        store.set(fullKey, new CacheEntry<>(fullKey, value, ttlMillis, System.currentTimeMillis()));
        log.debug("本地缓存写入: key={}, ttl={}ms", key, ttlMillis);
    }

    @Override
    public void delete(CacheContext ctx, String... keys) {
        CacheContext.orBackground(ctx).checkActive(CacheOperation.DELETE.getOpName(), null);
        if (keys == null) {
            return;
        }
        for (String key : keys) {
            if (key != null) {
                store.delete(keyPolicy.fullKey(key));
            }
        }
    }

    @Override
    public boolean exists(CacheContext ctx, String key) {
        String op = CacheOperation.EXISTS.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        String fullKey = keyPolicy.fullKey(key);
        CacheEntry<V> entry = store.peek(fullKey);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(System.currentTimeMillis())) {
            if (store.removeIf(fullKey, current -> current == entry)) {
                expirations.increment();
            }
            return false;
        }
        return true;
    }

    @Override
    public void clear(CacheContext ctx) {
        CacheContext.orBackground(ctx).checkActive(CacheOperation.CLEAR.getOpName(), null);
        store.clear();
        log.info("本地缓存已清空");
    }

    @Override
    public int len(CacheContext ctx) {
        CacheContext.orBackground(ctx).checkActive(CacheOperation.LEN.getOpName(), null);
        return store.size();
    }

    @Override
    public long deleteByPrefix(CacheContext ctx, String prefix) {
        String op = CacheOperation.DELETE_BY_PREFIX.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, prefix);

        String fullPrefix = keyPolicy.fullKey(prefix == null ? "" : prefix);
        int removed = store.removeAll((key, entry) -> key.startsWith(fullPrefix));
        log.debug("本地缓存按前缀删除: prefix={}, removed={}", prefix, removed);
        return removed;
    }

    @Override
    public boolean tryLock(CacheContext ctx, String key, Duration lease) {
        String op = CacheOperation.LOCK.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        Duration resolved = lease != null && !lease.isZero() && !lease.isNegative() ? lease : DEFAULT_LOCK_LEASE;
        return locker.tryAcquire(keyPolicy.fullKey(key), resolved);
    }

    @Override
    public void unlock(CacheContext ctx, String key) {
        String op = CacheOperation.UNLOCK.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        if (!locker.release(keyPolicy.fullKey(key))) {
            throw new CacheException(ErrorKind.LOCK_NOT_HELD, op, key);
        }
    }

    @Override
    public void ping(CacheContext ctx) {
        CacheContext.orBackground(ctx).checkActive(CacheOperation.PING.getOpName(), null);
    }

    @Override
    public CacheStats stats(CacheContext ctx) {
        return CacheStats.builder()
                .backend(BACKEND)
                .items(store.size())
                .hits(hits.sum())
                .misses(misses.sum())
                .evictions(evictions.sum())
                .expirations(expirations.sum())
                .uptime(Duration.ofMillis(System.currentTimeMillis() - startTime))
                .refreshTtlOnHit(refreshTtlOnHit)
                .build();
    }

    @Override
    public void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        log.info("本地缓存已关闭: items={}", store.size());
    }

    /**
     * 清理所有已过期条目
     *
     * @return 清理数量
     */
    int sweepExpired() {
        long now = System.currentTimeMillis();
        int removed = store.removeAll((key, entry) -> entry.isExpired(now));
        if (removed > 0) {
            expirations.add(removed);
            log.debug("本地缓存后台清理: removed={}", removed);
        }
        return removed;
    }

    /**
     * 所有键（含命名空间前缀），从最近使用到最久未使用
     */
    List<String> keys() {
        return store.keys();
    }
}
