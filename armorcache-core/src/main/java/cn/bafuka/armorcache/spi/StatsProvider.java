package cn.bafuka.armorcache.spi;

import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.core.CacheStats;

/**
 * 原生统计能力
 */
public interface StatsProvider {

    CacheStats stats(CacheContext ctx);
}
