package cn.bafuka.armorcache.example.repository;

import cn.bafuka.armorcache.example.entity.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 商品仓储
 * 内存实现，模拟数据库查询延迟并统计查询次数
 */
@Slf4j
@Repository
public class ProductRepository {

    private static final long QUERY_DELAY_MS = 50L;

    private final Map<Long, Product> table = new ConcurrentHashMap<>();

    private final AtomicLong idGenerator = new AtomicLong();

    private final AtomicLong queryCount = new AtomicLong();

    public ProductRepository() {
        insert(Product.builder().name("机械键盘").price(new BigDecimal("399.00")).stock(100).build());
        insert(Product.builder().name("无线鼠标").price(new BigDecimal("129.00")).stock(300).build());
        insert(Product.builder().name("4K 显示器").price(new BigDecimal("2499.00")).stock(20).build());
    }

    public Product selectById(Long id) {
        queryCount.incrementAndGet();
        // 模拟数据库查询延迟
        try {
            Thread.sleep(QUERY_DELAY_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return table.get(id);
    }

    public List<Product> selectList() {
        queryCount.incrementAndGet();
        return table.values().stream()
                .sorted(Comparator.comparing(Product::getId))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public Product insert(Product product) {
        product.setId(idGenerator.incrementAndGet());
        product.setCreateTime(LocalDateTime.now());
        product.setUpdateTime(LocalDateTime.now());
        table.put(product.getId(), product);
        return product;
    }

    public boolean updateById(Product product) {
        return table.computeIfPresent(product.getId(), (id, old) -> {
            product.setCreateTime(old.getCreateTime());
            return product;
        }) != null;
    }

    public boolean deleteById(Long id) {
        return table.remove(id) != null;
    }

    /**
     * 累计查询次数
     */
    public long getQueryCount() {
        return queryCount.get();
    }
}
