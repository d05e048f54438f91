package cn.bafuka.armorcache.example.service;

import cn.bafuka.armorcache.advanced.BackgroundPopulator;
import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.core.CacheKeys;
import cn.bafuka.armorcache.example.entity.Product;
import cn.bafuka.armorcache.example.repository.ProductRepository;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 商品服务
 * 演示 ArmorCache 的防击穿回源、批量读取与后台回填
 */
@Slf4j
@Service
public class ProductService {

    private static final String KEY_PREFIX = "product";

    /**
     * 单次请求的超时预算
     */
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(3);

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private AdvancedCache<Product> productCache;

    @Autowired
    private BackgroundPopulator<Product> productCachePopulator;

    /**
     * 根据ID查询商品（并发未命中时只有一个线程回源）
     *
     * @param productId 商品ID
     * @return 商品信息，不存在时为 null
     */
    public Product getProductById(Long productId) {
        CacheContext ctx = CacheContext.withTimeout(REQUEST_TIMEOUT);
        String key = productKey(productId);
        try {
            return productCache.getOrSetLocked(ctx, key, null, () -> {
                log.info("从数据库查询商品: productId={}", productId);
                return productRepository.selectById(productId);
            });
        } catch (CacheException e) {
            if (e.getKind() != ErrorKind.LOCK_ACQUIRE) {
                throw e;
            }
            return waitForLoader(ctx, key, productId);
        }
    }

    /**
     * 其他线程正在回源，退避重读缓存，多次未果后降级查库
     */
    private Product waitForLoader(CacheContext ctx, String key, Long productId) {
        log.debug("回源锁被占用，等待其他线程完成加载: productId={}", productId);

        int maxRetries = 5;
        long retryDelayMs = 100;
        for (int retry = 0; retry < maxRetries; retry++) {
            try {
                Thread.sleep(retryDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CacheException(ErrorKind.CANCELLED, "get", key, e);
            }

            try {
                return productCache.get(ctx, key);
            } catch (CacheException e) {
                if (!e.isCacheMiss()) {
                    throw e;
                }
            }
            // 指数退避，但最大不超过 500ms
            retryDelayMs = Math.min(retryDelayMs * 2, 500);
        }

        log.warn("等待超时，降级查询数据库: productId={}, retries={}", productId, maxRetries);
        return productRepository.selectById(productId);
    }

    /**
     * 批量查询商品，缓存中不存在的商品会回源并在后台回填
     *
     * @param productIds 商品ID列表
     * @return 商品ID -> 商品
     */
    public Map<Long, Product> getProducts(List<Long> productIds) {
        CacheContext ctx = CacheContext.withTimeout(REQUEST_TIMEOUT);
        List<String> keys = new ArrayList<>(productIds.size());
        for (Long id : productIds) {
            keys.add(productKey(id));
        }

        Map<String, Product> cached = productCache.getManyPipeline(ctx, keys);

        Map<Long, Product> result = new LinkedHashMap<>();
        for (Long id : productIds) {
            String key = productKey(id);
            Product product = cached.get(key);
            if (product == null && !cached.containsKey(key)) {
                product = productRepository.selectById(id);
                if (product != null) {
                    productCachePopulator.submit(key, product, null);
                }
            }
            if (product != null) {
                result.put(id, product);
            }
        }
        return result;
    }

    /**
     * 查询所有商品（不走缓存）
     */
    public List<Product> getAllProducts() {
        return productRepository.selectList();
    }

    /**
     * 创建商品
     */
    public Product createProduct(Product product) {
        productRepository.insert(product);
        log.info("商品创建成功: productId={}", product.getId());
        return product;
    }

    /**
     * 更新商品（写库后删除缓存）
     */
    public void updateProduct(Product product) {
        productRepository.updateById(product);
        productCache.delete(CacheContext.withTimeout(REQUEST_TIMEOUT), productKey(product.getId()));
        log.info("商品更新成功: productId={}", product.getId());
    }

    /**
     * 删除商品
     */
    public void deleteProduct(Long productId) {
        productRepository.deleteById(productId);
        productCache.delete(CacheContext.withTimeout(REQUEST_TIMEOUT), productKey(productId));
        log.info("商品删除成功: productId={}", productId);
    }

    /**
     * 预热：把全部商品批量写入缓存
     *
     * @return 写入条数
     */
    public int warmUp() {
        Map<String, Product> items = new LinkedHashMap<>();
        for (Product product : productRepository.selectList()) {
            items.put(productKey(product.getId()), product);
        }
        productCache.setManyPipeline(CacheContext.withTimeout(REQUEST_TIMEOUT), items, null);
        log.info("商品缓存预热完成: count={}", items.size());
        return items.size();
    }

    /**
     * 清除全部商品缓存
     *
     * @return 删除条数
     */
    public long evictAll() {
        return productCache.deleteByPrefix(CacheContext.withTimeout(REQUEST_TIMEOUT), KEY_PREFIX + ":");
    }

    private static String productKey(Long productId) {
        return CacheKeys.of(KEY_PREFIX).add(productId).build();
    }
}
