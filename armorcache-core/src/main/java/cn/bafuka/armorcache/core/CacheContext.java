package cn.bafuka.armorcache.core;

import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 调用上下文
 * 承载调用方的取消信号与截止时间，在调用链中向下传递
 *
 * <p>子上下文会继承父上下文的取消状态和截止时间；取消子上下文不影响父上下文。
 * {@link #background()} 永不取消，也不可被取消。</p>
 */
public final class CacheContext {

    private static final CacheContext BACKGROUND = new CacheContext(null, 0L);

    /**
     * 父上下文
     */
    private final CacheContext parent;

    /**
     * 截止时间（System.nanoTime 基准），0 表示无截止时间
     */
    private final long deadlineNanos;

    /**
     * 本上下文自身的结束原因
     */
    private final AtomicReference<ErrorKind> reason = new AtomicReference<>();

    private CacheContext(CacheContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    public static CacheContext background() {
        return BACKGROUND;
    }

    public static CacheContext withTimeout(Duration timeout) {
        return BACKGROUND.childWithTimeout(timeout);
    }

    /**
     * 创建可独立取消的子上下文
     */
    public CacheContext withCancel() {
        return new CacheContext(this, deadlineNanos);
    }

    /**
     * 创建带超时的子上下文，截止时间取父子两者中较早的一个
     */
    public CacheContext childWithTimeout(Duration timeout) {
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        if (deadline == 0L) {
            deadline = 1L;
        }
        if (deadlineNanos != 0L && deadlineNanos - deadline < 0) {
            deadline = deadlineNanos;
        }
        return new CacheContext(this, deadline);
    }

    /**
     * 取消当前上下文，重复调用无副作用
     */
    public void cancel() {
        if (this == BACKGROUND) {
            throw new IllegalStateException("background context cannot be cancelled");
        }
        reason.compareAndSet(null, ErrorKind.CANCELLED);
    }

    public boolean isDone() {
        return doneReason() != null;
    }

    /**
     * 获取结束原因
     *
     * @return CANCELLED / DEADLINE_EXCEEDED，未结束返回 null
     */
    public ErrorKind doneReason() {
        ErrorKind own = reason.get();
        if (own != null) {
            return own;
        }
        if (parent != null) {
            ErrorKind inherited = parent.doneReason();
            if (inherited != null) {
                return inherited;
            }
        }
        if (deadlineNanos != 0L && System.nanoTime() - deadlineNanos >= 0) {
            reason.compareAndSet(null, ErrorKind.DEADLINE_EXCEEDED);
            return reason.get();
        }
        return null;
    }

    /**
     * 剩余时间，无截止时间时返回 null
     */
    public Duration remaining() {
        if (deadlineNanos == 0L) {
            return null;
        }
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    /**
     * 检查上下文是否仍然有效
     *
     * @param operation 操作名
     * @param key       缓存键，可为 null
     * @throws CacheException 上下文已取消或超时
     */
    public void checkActive(String operation, String key) {
        ErrorKind done = doneReason();
        if (done != null) {
            throw new CacheException(done, operation, key);
        }
    }

    /**
     * 空上下文视为 background
     */
    public static CacheContext orBackground(CacheContext ctx) {
        return ctx == null ? BACKGROUND : ctx;
    }
}
