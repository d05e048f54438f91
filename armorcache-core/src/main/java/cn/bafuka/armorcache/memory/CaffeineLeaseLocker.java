package cn.bafuka.armorcache.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 进程内租约锁表
 * 基于 Caffeine 的按条目过期，租约到期后锁自动释放，持有者崩溃不会永久占用
 *
 * <p>租约归属于获取它的线程，只有该线程能释放；租约过期后被他人重新获取时，
 * 原持有者的释放不会影响新租约。</p>
 */
@Slf4j
public class CaffeineLeaseLocker {

    /**
     * 租约
     */
    private static final class Lease {
        final long leaseNanos;

        /**
         * 持有线程 ID
         */
        final long ownerThreadId;

        Lease(long leaseNanos, long ownerThreadId) {
            this.leaseNanos = leaseNanos;
            this.ownerThreadId = ownerThreadId;
        }
    }

    /**
     * 锁表，不设容量上限，避免锁被容量淘汰
     */
    private final Cache<String, Lease> leases;

    public CaffeineLeaseLocker() {
        this.leases = Caffeine.newBuilder()
                .expireAfter(new Expiry<String, Lease>() {
                    @Override
                    public long expireAfterCreate(String key, Lease lease, long currentTime) {
                        return lease.leaseNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, Lease lease, long currentTime, long currentDuration) {
                        return lease.leaseNanos;
                    }

                    @Override
                    public long expireAfterRead(String key, Lease lease, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    /**
     * 尝试获取租约
     *
     * @param key   锁键
     * @param lease 租约时长
     * @return 是否成功
     */
    public boolean tryAcquire(String key, Duration lease) {
        long nanos = Math.max(1L, lease.toNanos());
        boolean acquired = leases.asMap().putIfAbsent(key, new Lease(nanos, Thread.currentThread().getId())) == null;
        log.debug("本地锁{}: key={}, lease={}ms", acquired ? "获取成功" : "已被占用", key, lease.toMillis());
        return acquired;
    }

    /**
     * 释放当前线程持有的租约
     *
     * @return 释放前是否由当前线程持有（租约已过期或属于其他线程视为未持有）
     */
    public boolean release(String key) {
        Lease lease = leases.getIfPresent(key);
        if (lease == null || lease.ownerThreadId != Thread.currentThread().getId()) {
            log.debug("本地锁未由当前线程持有: key={}", key);
            return false;
        }
        return leases.asMap().remove(key, lease);
    }

    public boolean isLocked(String key) {
        return leases.getIfPresent(key) != null;
    }
}
