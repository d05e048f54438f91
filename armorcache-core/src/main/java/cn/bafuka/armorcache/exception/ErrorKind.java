package cn.bafuka.armorcache.exception;

/**
 * 缓存错误类型
 * 描述错误的性质，而不是具体的异常类
 */
public enum ErrorKind {

    /**
     * 键为空
     */
    KEY_EMPTY("key is empty", false),

    /**
     * 缓存未命中（预期结果，并非故障）
     */
    CACHE_MISS("cache miss", false),

    /**
     * 配置非法
     */
    INVALID_CONFIG("invalid config", false),

    /**
     * 序列化失败
     */
    SERIALIZE("serialization failed", false),

    /**
     * 反序列化失败
     */
    DESERIALIZE("deserialization failed", false),

    /**
     * 连接失败
     */
    CONNECTION("connection failed", true),

    /**
     * 获取锁失败
     */
    LOCK_ACQUIRE("lock acquisition failed", true),

    /**
     * 未持有锁
     */
    LOCK_NOT_HELD("lock not held", true),

    /**
     * 调用方已取消
     */
    CANCELLED("context canceled", false),

    /**
     * 调用方超时
     */
    DEADLINE_EXCEEDED("context deadline exceeded", false),

    /**
     * 后端不支持该能力
     */
    UNSUPPORTED("operation not supported", false),

    /**
     * 回源加载失败
     */
    LOAD("value load failed", false);

    private final String description;

    private final boolean retryable;

    ErrorKind(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
