package cn.bafuka.armorcache.memory;

/**
 * 本地缓存条目
 *
 * @param <V> 缓存值类型
 */
final class CacheEntry<V> {

    private final String key;

    private final V value;

    /**
     * 解析后的 TTL（毫秒），0 表示永不过期
     */
    private final long ttlMillis;

    /**
     * 过期时间戳（毫秒），0 表示永不过期
     */
    private volatile long expiresAt;

    CacheEntry(String key, V value, long ttlMillis, long now) {
        this.key = key;
        this.value = value;
        this.ttlMillis = ttlMillis;
        this.expiresAt = ttlMillis > 0 ? now + ttlMillis : 0L;
    }

    String getKey() {
        return key;
    }

    V getValue() {
        return value;
    }

    long getExpiresAt() {
        return expiresAt;
    }

    boolean isExpired(long now) {
        long at = expiresAt;
        return at != 0L && now > at;
    }

    /**
     * 命中时重新计算过期时间
     */
    void refresh(long now) {
        if (ttlMillis > 0) {
            expiresAt = now + ttlMillis;
        }
    }
}
