package cn.bafuka.armorcache.spi;

import cn.bafuka.armorcache.core.CacheContext;

/**
 * 按前缀删除能力
 */
public interface PrefixDeleter {

    /**
     * @param prefix 业务前缀（不含命名空间前缀）
     * @return 删除的条目数
     */
    long deleteByPrefix(CacheContext ctx, String prefix);
}
