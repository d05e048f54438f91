package cn.bafuka.armorcache.model;

/**
 * 淘汰策略标识
 * 目前仅实现 LRU，其余标识可以被配置识别，但在构造缓存时会被拒绝
 */
public enum EvictionPolicy {

    LRU,
    LFU,
    FIFO,
    ARC,
    TINYLFU;

    public boolean isSupported() {
        return this == LRU;
    }
}
