package cn.bafuka.armorcache.example.controller;

import cn.bafuka.armorcache.core.AdvancedCache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.core.CacheStats;
import cn.bafuka.armorcache.example.entity.Product;
import cn.bafuka.armorcache.example.repository.ProductRepository;
import cn.bafuka.armorcache.example.service.ProductService;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.metrics.OperationSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看 ArmorCache 的运行状态和指标
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private AdvancedCache<Product> productCache;

    @Autowired
    private ProductService productService;

    @Autowired
    private ProductRepository productRepository;

    /**
     * 缓存统计
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = productCache.stats(CacheContext.withTimeout(Duration.ofSeconds(1)));

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("stats", stats);
        result.put("hitRate", String.format("%.2f%%", stats.hitRate() * 100));
        result.put("dbQueries", productRepository.getQueryCount());
        return result;
    }

    /**
     * 各操作的指标快照
     */
    @GetMapping("/metrics")
    public Map<String, Object> getMetrics() {
        Map<String, OperationSnapshot> snapshot = productCache.metrics().snapshot();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", snapshot.size());
        result.put("operations", snapshot);
        return result;
    }

    /**
     * 重置指标
     */
    @PostMapping("/metrics/reset")
    public Map<String, Object> resetMetrics() {
        productCache.metrics().reset();
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", "指标已重置");
        return result;
    }

    /**
     * 预热全部商品
     */
    @PostMapping("/warm-up")
    public Map<String, Object> warmUp() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("count", productService.warmUp());
        return result;
    }

    /**
     * 清除全部商品缓存
     */
    @PostMapping("/evict")
    public Map<String, Object> evict() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("removed", productService.evictAll());
        return result;
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> result = new HashMap<>();
        try {
            productCache.ping(CacheContext.withTimeout(Duration.ofSeconds(1)));
            result.put("success", true);
            result.put("healthy", true);
            result.put("message", "ArmorCache 运行正常");
        } catch (CacheException e) {
            log.warn("缓存健康检查失败: {}", e.getMessage());
            result.put("success", false);
            result.put("healthy", false);
            result.put("message", e.getMessage());
        }
        return result;
    }
}
