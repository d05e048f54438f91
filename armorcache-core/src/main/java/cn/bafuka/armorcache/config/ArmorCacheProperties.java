package cn.bafuka.armorcache.config;

import cn.bafuka.armorcache.model.CacheConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * ArmorCache 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "armorcache")
public class ArmorCacheProperties {

    /**
     * 是否启用 ArmorCache
     */
    private boolean enabled = true;

    /**
     * 缓存配置
     */
    private CacheConfig cache = new CacheConfig();
}
