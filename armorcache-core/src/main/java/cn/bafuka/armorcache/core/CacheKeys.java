package cn.bafuka.armorcache.core;

import java.util.ArrayList;
import java.util.List;

/**
 * 业务键构造器
 * 以冒号拼接各段，空段被忽略。注意：不会自动附加缓存配置的命名空间前缀
 *
 * <pre>
 * CacheKeys.of("user").add("42").add("profile").build(); // user:42:profile
 * </pre>
 */
public final class CacheKeys {

    private final String prefix;

    private final List<String> parts = new ArrayList<>();

    private CacheKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public static CacheKeys of(String prefix) {
        return new CacheKeys(prefix);
    }

    public CacheKeys add(Object part) {
        if (part != null) {
            String s = part.toString();
            if (!s.isEmpty()) {
                parts.add(s);
            }
        }
        return this;
    }

    public CacheKeys reset() {
        parts.clear();
        return this;
    }

    public String build() {
        StringBuilder out = new StringBuilder(prefix);
        for (String part : parts) {
            if (out.length() > 0) {
                out.append(':');
            }
            out.append(part);
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return build();
    }
}
