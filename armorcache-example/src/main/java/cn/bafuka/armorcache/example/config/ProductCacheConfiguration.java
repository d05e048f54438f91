package cn.bafuka.armorcache.example.config;

import cn.bafuka.armorcache.advanced.BackgroundPopulator;
import cn.bafuka.armorcache.config.ArmorCacheProperties;
import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.example.entity.Product;
import cn.bafuka.armorcache.factory.ArmorCaches;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 商品缓存配置
 * 使用 armorcache.cache 配置构建商品专用的强类型缓存
 */
@Configuration
public class ProductCacheConfiguration {

    @Bean(destroyMethod = "close")
    public AdvancedCache<Product> productCache(ArmorCacheProperties properties) {
        return ArmorCaches.newAdvanced(properties.getCache(), Product.class);
    }

    @Bean(destroyMethod = "close")
    public BackgroundPopulator<Product> productCachePopulator(AdvancedCache<Product> productCache,
                                                             ArmorCacheProperties properties) {
        return new BackgroundPopulator<>(productCache, properties.getCache().getPopulator());
    }
}
