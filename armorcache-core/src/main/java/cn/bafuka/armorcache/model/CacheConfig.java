package cn.bafuka.armorcache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 缓存配置
 * 核心只读取解析后的 TTL 与前缀等字段，不负责配置的加载
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheConfig {

    /**
     * 后端类型
     */
    @Builder.Default
    private CacheType type = CacheType.MEMORY;

    /**
     * 默认过期时间
     */
    @Builder.Default
    private Duration ttl = Duration.ofMinutes(5);

    /**
     * 键前缀（命名空间）
     */
    @Builder.Default
    private String prefix = "cache:";

    /**
     * 命中时是否刷新过期时间
     */
    @Builder.Default
    private boolean refreshTtlOnHit = false;

    /**
     * 本地内存配置
     */
    @Builder.Default
    private MemoryConfig memory = new MemoryConfig();

    /**
     * Redis 配置
     */
    @Builder.Default
    private RedisConfig redis = new RedisConfig();

    /**
     * 高级装饰器配置
     */
    @Builder.Default
    private AdvancedConfig advanced = new AdvancedConfig();

    /**
     * 后台回填配置
     */
    @Builder.Default
    private PopulatorConfig populator = new PopulatorConfig();

    /**
     * 本地内存配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryConfig {
        /**
         * 最大条目数
         */
        @Builder.Default
        private int maxEntries = 10_000;

        /**
         * 过期清理间隔，小于等于 0 时不启动后台清理
         */
        @Builder.Default
        private Duration cleanupInterval = Duration.ofMinutes(1);

        /**
         * 淘汰策略，为空时默认 LRU
         */
        @Builder.Default
        private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
    }

    /**
     * Redis 配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RedisConfig {
        /**
         * 连接地址，如 redis://127.0.0.1:6379
         */
        private String url;

        /**
         * 连接池大小
         */
        @Builder.Default
        private int poolSize = 10;

        /**
         * 最小空闲连接
         */
        @Builder.Default
        private int minIdle = 2;

        /**
         * 命令重试次数
         */
        @Builder.Default
        private int maxRetries = 3;

        /**
         * 连接超时
         */
        @Builder.Default
        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * 命令超时
         */
        @Builder.Default
        private Duration readTimeout = Duration.ofSeconds(3);
    }

    /**
     * 高级装饰器配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AdvancedConfig {
        /**
         * 批量操作的最大并发数
         */
        @Builder.Default
        private int pipelineConcurrency = 10;

        /**
         * 批量操作工作线程数
         */
        @Builder.Default
        private int pipelineThreads = 16;

        /**
         * 回源锁租约时长
         */
        @Builder.Default
        private Duration lockLease = Duration.ofSeconds(30);
    }

    /**
     * 后台回填配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PopulatorConfig {
        /**
         * 回填线程数
         */
        @Builder.Default
        private int threads = 2;

        /**
         * 等待队列容量
         */
        @Builder.Default
        private int queueCapacity = 1000;

        /**
         * 单次回填的超时预算
         */
        @Builder.Default
        private Duration timeout = Duration.ofSeconds(5);
    }
}
