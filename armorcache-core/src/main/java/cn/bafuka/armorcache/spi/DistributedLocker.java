package cn.bafuka.armorcache.spi;

import cn.bafuka.armorcache.core.CacheContext;

import java.time.Duration;

/**
 * 互斥锁能力
 * 锁带有租约，持有者崩溃后锁会自动过期
 */
public interface DistributedLocker {

    /**
     * 尝试加锁，单次非阻塞尝试
     *
     * @param ctx   调用上下文
     * @param key   锁键
     * @param lease 租约时长
     * @return 是否加锁成功
     */
    boolean tryLock(CacheContext ctx, String key, Duration lease);

    /**
     * 释放锁
     *
     * @throws cn.bafuka.armorcache.exception.CacheException 未持有锁时为 LOCK_NOT_HELD
     */
    void unlock(CacheContext ctx, String key);
}
