package cn.bafuka.armorcache.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ArmorCache 示例应用启动类
 */
@SpringBootApplication
public class ArmorCacheExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArmorCacheExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  ArmorCache Example Application Started!");
        System.out.println("  Diagnostic: http://localhost:8080/api/diagnostic/stats");
        System.out.println("========================================\n");
    }
}
