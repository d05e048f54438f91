package cn.bafuka.armorcache.advanced;

import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.model.CacheConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 后台回填器
 * 将缓存写入交给有界线程池异步执行，每次回填使用独立的超时预算，与调用方上下文无关
 *
 * @param <V> 缓存值类型
 */
@Slf4j
public class BackgroundPopulator<V> implements AutoCloseable {

    private final Cache<V> cache;

    private final ThreadPoolExecutor executor;

    /**
     * 单次回填超时
     */
    private final Duration timeout;

    private final AtomicLong failed = new AtomicLong();

    public BackgroundPopulator(Cache<V> cache, CacheConfig.PopulatorConfig config) {
        CacheConfig.PopulatorConfig cfg = config != null ? config : new CacheConfig.PopulatorConfig();
        int threads = Math.max(1, cfg.getThreads());
        this.cache = cache;
        this.timeout = cfg.getTimeout();

        AtomicInteger index = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, cfg.getQueueCapacity())),
                r -> {
                    Thread thread = new Thread(r, "armorcache-populator-" + index.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());

        log.info("后台回填器已启动: threads={}, queueCapacity={}, timeout={}",
                threads, cfg.getQueueCapacity(), timeout);
    }

    /**
     * 提交一次后台回填
     *
     * @return 是否成功入队，队列已满或已关闭时返回 false
     */
    public boolean submit(String key, V value, Duration ttl) {
        try {
            executor.execute(() -> populate(key, value, ttl));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("后台回填被拒绝: key={}, queued={}", key, executor.getQueue().size());
            return false;
        }
    }

    private void populate(String key, V value, Duration ttl) {
        try {
            cache.set(CacheContext.withTimeout(timeout), key, value, ttl);
            log.debug("后台回填完成: key={}", key);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("后台回填失败: key={}", key, e);
        }
    }

    /**
     * 失败的回填次数
     */
    public long failedCount() {
        return failed.get();
    }

    /**
     * 排队中的回填数
     */
    public int pendingCount() {
        return executor.getQueue().size();
    }

    /**
     * 停止接收新任务并等待已入队的回填完成
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis() + 1000L, TimeUnit.MILLISECONDS)) {
                log.warn("后台回填器未能在期限内排空，强制关闭");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("后台回填器已关闭: failed={}", failed.get());
    }
}
