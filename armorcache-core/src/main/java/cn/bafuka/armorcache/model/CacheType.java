package cn.bafuka.armorcache.model;

/**
 * 缓存后端类型
 */
public enum CacheType {

    /**
     * 进程内存
     */
    MEMORY,

    /**
     * Redis（基于 Redisson）
     */
    REDIS
}
