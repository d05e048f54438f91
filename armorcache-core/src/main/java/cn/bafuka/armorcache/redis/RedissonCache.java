package cn.bafuka.armorcache.redis;

import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.core.CacheOperation;
import cn.bafuka.armorcache.core.CacheStats;
import cn.bafuka.armorcache.core.KeyPolicy;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import cn.bafuka.armorcache.model.CacheConfig;
import cn.bafuka.armorcache.serializer.ValueSerializer;
import cn.bafuka.armorcache.spi.DistributedLocker;
import cn.bafuka.armorcache.spi.PipelineGetter;
import cn.bafuka.armorcache.spi.PipelineSetter;
import cn.bafuka.armorcache.spi.PrefixDeleter;
import cn.bafuka.armorcache.spi.StatsProvider;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RFuture;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.config.Config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Redis 缓存实现
 * 基于 Redisson，值以字节形式存储，由 {@link ValueSerializer} 负责编解码
 *
 * @param <V> 缓存值类型
 */
@Slf4j
public class RedissonCache<V> implements Cache<V>, PipelineGetter<V>, PipelineSetter<V>,
        PrefixDeleter, StatsProvider, DistributedLocker {

    private static final String BACKEND = "redis";

    private static final Duration DEFAULT_LOCK_LEASE = Duration.ofSeconds(30);

    /**
     * Redisson 客户端
     */
    private final RedissonClient redissonClient;

    /**
     * 客户端是否由本实例创建（决定 close 时是否关闭客户端）
     */
    private final boolean ownsClient;

    private final KeyPolicy keyPolicy;

    private final ValueSerializer<V> serializer;

    private final long startTime = System.currentTimeMillis();

    public RedissonCache(RedissonClient redissonClient, CacheConfig config, ValueSerializer<V> serializer) {
        this(redissonClient, config, serializer, false);
    }

    RedissonCache(RedissonClient redissonClient, CacheConfig config, ValueSerializer<V> serializer, boolean ownsClient) {
        this.redissonClient = redissonClient;
        this.keyPolicy = new KeyPolicy(config.getPrefix(), config.getTtl());
        this.serializer = serializer;
        this.ownsClient = ownsClient;
    }

    /**
     * 根据配置创建客户端并连接 Redis，连接失败时关闭客户端并抛出 CONNECTION
     *
     * @param config     缓存配置
     * @param serializer 值序列化器
     * @return Redis 缓存
     */
    public static <V> RedissonCache<V> create(CacheConfig config, ValueSerializer<V> serializer) {
        CacheConfig.RedisConfig redis = config.getRedis();

        Config redissonConfig = new Config();
        redissonConfig.useSingleServer()
                .setAddress(redis.getUrl())
                .setConnectionPoolSize(redis.getPoolSize())
                .setConnectionMinimumIdleSize(Math.min(redis.getMinIdle(), redis.getPoolSize()))
                .setRetryAttempts(redis.getMaxRetries())
                .setConnectTimeout((int) redis.getConnectTimeout().toMillis())
                .setTimeout((int) redis.getReadTimeout().toMillis());

        RedissonClient client;
        try {
            client = Redisson.create(redissonConfig);
        } catch (RedisException e) {
            log.error("连接 Redis 失败: url={}", redis.getUrl(), e);
            throw new CacheException(ErrorKind.CONNECTION, CacheOperation.INIT.getOpName(), null, e);
        }

        RedissonCache<V> cache = new RedissonCache<>(client, config, serializer, true);
        try {
            cache.ping(CacheContext.withTimeout(redis.getConnectTimeout()));
        } catch (CacheException e) {
            client.shutdown();
            throw e;
        }

        log.info("构建 Redis 缓存: url={}, poolSize={}, prefix={}, ttl={}",
                redis.getUrl(), redis.getPoolSize(), config.getPrefix(), config.getTtl());
        return cache;
    }

    @Override
    public V get(CacheContext ctx, String key) {
        String op = CacheOperation.GET.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        byte[] data;
        try {
            data = bucket(key).get();
        } catch (RedisException e) {
            throw connectionError(op, key, e);
        }

        if (data == null) {
            log.debug("Redis 缓存未命中: key={}", key);
            throw CacheException.miss(op, key);
        }
        return decode(op, key, data);
    }

    @Override
    public void set(CacheContext ctx, String key, V value, Duration ttl) {
        String op = CacheOperation.SET.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        byte[] data = encode(op, key, value);
        long ttlMillis = keyPolicy.resolveTtl(ttl).toMillis();
        try {
            RBucket<byte[]> bucket = bucket(key);
            if (ttlMillis > 0) {
                bucket.set(data, ttlMillis, TimeUnit.MILLISECONDS);
            } else {
                bucket.set(data);
            }
        } catch (RedisException e) {
            throw connectionError(op, key, e);
        }
        log.debug("Redis 缓存写入: key={}, ttl={}ms", key, ttlMillis);
    }

    @Override
    public void delete(CacheContext ctx, String... keys) {
        String op = CacheOperation.DELETE.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, null);
        if (keys == null || keys.length == 0) {
            return;
        }

        String[] fullKeys = new String[keys.length];
        for (int i = 0; i < keys.length; i++) {
            fullKeys[i] = keyPolicy.fullKey(keys[i]);
        }
        try {
            redissonClient.getKeys().delete(fullKeys);
        } catch (RedisException e) {
            throw connectionError(op, null, e);
        }
    }

    @Override
    public boolean exists(CacheContext ctx, String key) {
        String op = CacheOperation.EXISTS.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        try {
            return redissonClient.getKeys().countExists(keyPolicy.fullKey(key)) > 0;
        } catch (RedisException e) {
            throw connectionError(op, key, e);
        }
    }

    @Override
    public void clear(CacheContext ctx) {
        String op = CacheOperation.CLEAR.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, null);
        try {
            long removed = redissonClient.getKeys().deleteByPattern(keyPolicy.fullKey("") + "*");
            log.info("Redis 缓存已清空: removed={}", removed);
        } catch (RedisException e) {
            throw connectionError(op, null, e);
        }
    }

    @Override
    public int len(CacheContext ctx) {
        String op = CacheOperation.LEN.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, null);
        try {
            int total = 0;
            for (String ignored : redissonClient.getKeys().getKeysByPattern(keyPolicy.fullKey("") + "*")) {
                total++;
            }
            return total;
        } catch (RedisException e) {
            throw connectionError(op, null, e);
        }
    }

    @Override
    public long deleteByPrefix(CacheContext ctx, String prefix) {
        String op = CacheOperation.DELETE_BY_PREFIX.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, prefix);
        try {
            long removed = redissonClient.getKeys().deleteByPattern(keyPolicy.fullKey(prefix == null ? "" : prefix) + "*");
            log.debug("Redis 按前缀删除: prefix={}, removed={}", prefix, removed);
            return removed;
        } catch (RedisException e) {
            throw connectionError(op, prefix, e);
        }
    }

    @Override
    public Map<String, V> getManyPipeline(CacheContext ctx, Iterable<String> keys) {
        String op = CacheOperation.GET_MANY_PIPELINE.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, null);

        List<String> keyList = new ArrayList<>();
        for (String key : keys) {
            keyPolicy.validateKey(op, key);
            keyList.add(key);
        }
        if (keyList.isEmpty()) {
            return new HashMap<>();
        }

        Map<String, RFuture<byte[]>> futures = new LinkedHashMap<>();
        RBatch batch = redissonClient.createBatch();
        for (String key : keyList) {
            futures.put(key, batch.<byte[]>getBucket(keyPolicy.fullKey(key), ByteArrayCodec.INSTANCE).getAsync());
        }

        try {
            batch.execute();
        } catch (RedisException e) {
            throw connectionError(op, null, e);
        }

        Map<String, V> result = new HashMap<>(futures.size());
        for (Map.Entry<String, RFuture<byte[]>> entry : futures.entrySet()) {
            byte[] data;
            try {
                data = entry.getValue().toCompletableFuture().join();
            } catch (CompletionException e) {
                log.error("Redis 批量读取失败: key={}", entry.getKey(), e.getCause());
                throw new CacheException(ErrorKind.CONNECTION, op, entry.getKey(), e.getCause());
            }
            if (data != null) {
                result.put(entry.getKey(), decode(op, entry.getKey(), data));
            }
        }
        return result;
    }

    @Override
    public void setManyPipeline(CacheContext ctx, Map<String, V> items, Duration ttl) {
        String op = CacheOperation.SET_MANY_PIPELINE.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, null);
        if (items == null || items.isEmpty()) {
            return;
        }

        // 先完成校验与编码，任一失败都不会发出请求
        Map<String, byte[]> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : items.entrySet()) {
            keyPolicy.validateKey(op, entry.getKey());
            encoded.put(entry.getKey(), encode(op, entry.getKey(), entry.getValue()));
        }

        long ttlMillis = keyPolicy.resolveTtl(ttl).toMillis();
        RBatch batch = redissonClient.createBatch();
        for (Map.Entry<String, byte[]> entry : encoded.entrySet()) {
            RBucketAsync<byte[]> bucket = batch.getBucket(keyPolicy.fullKey(entry.getKey()), ByteArrayCodec.INSTANCE);
            if (ttlMillis > 0) {
                bucket.setAsync(entry.getValue(), ttlMillis, TimeUnit.MILLISECONDS);
            } else {
                bucket.setAsync(entry.getValue());
            }
        }

        try {
            batch.execute();
        } catch (RedisException e) {
            throw connectionError(op, null, e);
        }
    }

    @Override
    public boolean tryLock(CacheContext ctx, String key, Duration lease) {
        String op = CacheOperation.LOCK.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        Duration resolved = lease != null && !lease.isZero() && !lease.isNegative() ? lease : DEFAULT_LOCK_LEASE;
        RLock lock = redissonClient.getLock(keyPolicy.fullKey(key));
        try {
            // waitTime = 0：单次尝试，不自旋等待
            return lock.tryLock(0, resolved.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException(ErrorKind.LOCK_ACQUIRE, op, key, e);
        } catch (RedisException e) {
            throw connectionError(op, key, e);
        }
    }

    @Override
    public void unlock(CacheContext ctx, String key) {
        String op = CacheOperation.UNLOCK.getOpName();
        keyPolicy.validateKey(op, key);
        CacheContext.orBackground(ctx).checkActive(op, key);

        RLock lock = redissonClient.getLock(keyPolicy.fullKey(key));
        try {
            if (!lock.isHeldByCurrentThread()) {
                throw new CacheException(ErrorKind.LOCK_NOT_HELD, op, key);
            }
            lock.unlock();
        } catch (IllegalMonitorStateException e) {
            // 租约已过期
            throw new CacheException(ErrorKind.LOCK_NOT_HELD, op, key, e);
        } catch (RedisException e) {
            throw connectionError(op, key, e);
        }
    }

    @Override
    public void ping(CacheContext ctx) {
        String op = CacheOperation.PING.getOpName();
        CacheContext.orBackground(ctx).checkActive(op, null);
        try {
            redissonClient.getKeys().count();
        } catch (RedisException e) {
            throw connectionError(op, null, e);
        }
    }

    @Override
    public CacheStats stats(CacheContext ctx) {
        long items = 0;
        try {
            items = len(ctx);
        } catch (CacheException e) {
            log.warn("获取 Redis 条目数失败: {}", e.getMessage());
        }
        return CacheStats.builder()
                .backend(BACKEND)
                .items(items)
                .uptime(Duration.ofMillis(System.currentTimeMillis() - startTime))
                .build();
    }

    @Override
    public void close() {
        if (ownsClient) {
            redissonClient.shutdown();
            log.info("Redis 客户端已关闭");
        }
    }

    /**
     * 列出当前命名空间下的业务键（不含前缀）
     */
    public List<String> keys(String pattern) {
        List<String> keys = new ArrayList<>();
        for (String fullKey : redissonClient.getKeys().getKeysByPattern(keyPolicy.fullKey(pattern))) {
            keys.add(keyPolicy.stripPrefix(fullKey));
        }
        return keys;
    }

    private RBucket<byte[]> bucket(String key) {
        return redissonClient.getBucket(keyPolicy.fullKey(key), ByteArrayCodec.INSTANCE);
    }

    private byte[] encode(String op, String key, V value) {
        try {
            return serializer.encode(value);
        } catch (RuntimeException e) {
            throw new CacheException(ErrorKind.SERIALIZE, op, key, rootOf(e));
        }
    }

    private V decode(String op, String key, byte[] data) {
        try {
            return serializer.decode(data);
        } catch (RuntimeException e) {
            throw new CacheException(ErrorKind.DESERIALIZE, op, key, rootOf(e));
        }
    }

    /**
     * 序列化器自身抛出的 CacheException 只保留底层原因，由本层重新标注操作与键
     */
    private static Throwable rootOf(RuntimeException e) {
        if (e instanceof CacheException && e.getCause() != null) {
            return e.getCause();
        }
        return e;
    }

    private static CacheException connectionError(String op, String key, RedisException e) {
        log.error("Redis 操作失败: op={}, key={}", op, key, e);
        return new CacheException(ErrorKind.CONNECTION, op, key, e);
    }
}
