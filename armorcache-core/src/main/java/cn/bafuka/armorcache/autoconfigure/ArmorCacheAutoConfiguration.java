package cn.bafuka.armorcache.autoconfigure;

import cn.bafuka.armorcache.advanced.BackgroundPopulator;
import cn.bafuka.armorcache.config.ArmorCacheProperties;
import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.factory.ArmorCaches;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ArmorCache 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ArmorCacheProperties.class)
@ConditionalOnProperty(prefix = "armorcache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ArmorCacheAutoConfiguration {

    public ArmorCacheAutoConfiguration() {
        log.info("ArmorCache auto-configuration initializing...");
    }

    /**
     * 高级缓存（后端由 armorcache.cache.type 决定）
     * 按名称判断是否已存在，应用自定义的强类型缓存 Bean 不影响默认实例
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(name = "armorCache")
    public AdvancedCache<Object> armorCache(ArmorCacheProperties properties) {
        log.info("创建 ArmorCache: type={}, prefix={}, ttl={}",
                properties.getCache().getType(), properties.getCache().getPrefix(), properties.getCache().getTtl());
        return ArmorCaches.newAdvanced(properties.getCache(), Object.class);
    }

    /**
     * 后台回填器
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(name = "armorCachePopulator")
    public BackgroundPopulator<Object> armorCachePopulator(AdvancedCache<Object> armorCache,
                                                           ArmorCacheProperties properties) {
        return new BackgroundPopulator<>(armorCache, properties.getCache().getPopulator());
    }
}
