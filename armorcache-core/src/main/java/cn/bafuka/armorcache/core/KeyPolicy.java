package cn.bafuka.armorcache.core;

import cn.bafuka.armorcache.exception.CacheException;

import java.time.Duration;

/**
 * 键与 TTL 策略
 * 负责键校验、键命名空间（前缀）以及 TTL 解析
 */
public class KeyPolicy {

    /**
     * 键前缀
     */
    private final String prefix;

    /**
     * 默认 TTL，Duration.ZERO 表示永不过期
     */
    private final Duration defaultTtl;

    public KeyPolicy(String prefix, Duration defaultTtl) {
        this.prefix = prefix == null ? "" : prefix.trim();
        this.defaultTtl = defaultTtl == null || defaultTtl.isNegative() ? Duration.ZERO : defaultTtl;
    }

    /**
     * 校验键，空白键抛出 KEY_EMPTY
     */
    public void validateKey(String operation, String key) {
        if (key == null || key.trim().isEmpty()) {
            throw CacheException.keyEmpty(operation);
        }
    }

    /**
     * 拼接命名空间前缀
     */
    public String fullKey(String key) {
        if (prefix.isEmpty()) {
            return key;
        }
        return prefix + key;
    }

    /**
     * 去掉命名空间前缀
     */
    public String stripPrefix(String fullKey) {
        if (!prefix.isEmpty() && fullKey.startsWith(prefix)) {
            return fullKey.substring(prefix.length());
        }
        return fullKey;
    }

    /**
     * 解析 TTL：正数覆盖默认值，零/负数/null 使用默认值
     */
    public Duration resolveTtl(Duration ttl) {
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            return ttl;
        }
        return defaultTtl;
    }

    public String getPrefix() {
        return prefix;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
