package cn.bafuka.armorcache.core;

import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * KeyPolicy / CacheKeys 单元测试
 */
public class KeyPolicyTest {

    private final KeyPolicy policy = new KeyPolicy(" app: ", Duration.ofMinutes(5));

    @Test
    public void testFullKeyAndStrip() {
        assertEquals("app:", policy.getPrefix());
        assertEquals("app:user:1", policy.fullKey("user:1"));
        assertEquals("user:1", policy.stripPrefix("app:user:1"));
        assertEquals("other", policy.stripPrefix("other"));
    }

    @Test
    public void testEmptyPrefix() {
        KeyPolicy bare = new KeyPolicy(null, null);
        assertEquals("k", bare.fullKey("k"));
        assertEquals(Duration.ZERO, bare.getDefaultTtl());
    }

    @Test
    public void testResolveTtl() {
        assertEquals(Duration.ofSeconds(10), policy.resolveTtl(Duration.ofSeconds(10)));
        assertEquals(Duration.ofMinutes(5), policy.resolveTtl(Duration.ZERO));
        assertEquals(Duration.ofMinutes(5), policy.resolveTtl(Duration.ofSeconds(-1)));
        assertEquals(Duration.ofMinutes(5), policy.resolveTtl(null));
    }

    @Test
    public void testValidateKey() {
        policy.validateKey("get", "k");
        for (String bad : new String[]{null, "", "   "}) {
            try {
                policy.validateKey("get", bad);
                fail();
            } catch (CacheException e) {
                assertEquals(ErrorKind.KEY_EMPTY, e.getKind());
                assertEquals("get", e.getOperation());
            }
        }
    }

    @Test
    public void testCacheKeys() {
        assertEquals("user:42", CacheKeys.of("user").add("42").build());
        assertEquals("user:42:profile", CacheKeys.of("user").add(42).add("").add(null).add("profile").build());
        assertEquals("42", CacheKeys.of("").add("42").build());

        CacheKeys keys = CacheKeys.of("order").add("1");
        assertEquals("order", keys.reset().build());
    }
}
