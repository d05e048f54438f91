package cn.bafuka.armorcache.memory;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * LruStore 单元测试
 */
public class LruStoreTest {

    private List<String> evicted;

    private LruStore<String, String> store;

    @Before
    public void setUp() {
        evicted = new ArrayList<>();
        store = new LruStore<>(2, (k, v) -> evicted.add(k));
    }

    /**
     * 容量 2，依次写入 A、B、C，A 被淘汰
     */
    @Test
    public void testEvictsLeastRecentlyUsed() {
        store.set("A", "a");
        store.set("B", "b");
        store.set("C", "c");

        assertNull(store.get("A"));
        assertEquals("b", store.get("B"));
        assertEquals("c", store.get("C"));
        assertEquals(2, store.size());
        assertEquals(Arrays.asList("A"), evicted);
    }

    /**
     * 访问后写入：被访问的条目保留
     */
    @Test
    public void testGetMarksMostRecentlyUsed() {
        store.set("A", "a");
        store.set("B", "b");
        store.get("A");
        store.set("C", "c");

        assertEquals("a", store.get("A"));
        assertNull(store.get("B"));
        assertEquals(Arrays.asList("B"), evicted);
    }

    /**
     * peek 不改变访问顺序
     */
    @Test
    public void testPeekDoesNotPromote() {
        store.set("A", "a");
        store.set("B", "b");
        assertEquals("a", store.peek("A"));
        store.set("C", "c");

        assertNull(store.peek("A"));
        assertEquals(Arrays.asList("C", "B"), store.keys());
    }

    /**
     * 替换已有键不触发淘汰
     */
    @Test
    public void testReplaceDoesNotEvict() {
        store.set("A", "a");
        store.set("B", "b");
        store.set("A", "a2");

        assertEquals(2, store.size());
        assertTrue(evicted.isEmpty());
        assertEquals("a2", store.get("A"));
        assertEquals(Arrays.asList("A", "B"), store.keys());
    }

    @Test
    public void testDeleteAndClear() {
        store.set("A", "a");
        store.set("B", "b");

        assertTrue(store.delete("A"));
        assertFalse(store.delete("A"));
        assertEquals(1, store.size());

        store.clear();
        assertEquals(0, store.size());
        assertTrue(store.keys().isEmpty());
    }

    @Test
    public void testRemoveIfChecksCurrentValue() {
        store.set("A", "a");

        assertFalse(store.removeIf("A", v -> v.equals("other")));
        assertTrue(store.removeIf("A", v -> v.equals("a")));
        assertFalse(store.removeIf("missing", v -> true));
        assertEquals(0, store.size());
    }

    @Test
    public void testRemoveAll() {
        LruStore<String, Integer> numbers = new LruStore<>(10);
        for (int i = 0; i < 6; i++) {
            numbers.set("k" + i, i);
        }

        int removed = numbers.removeAll((k, v) -> v % 2 == 0);

        assertEquals(3, removed);
        assertEquals(3, numbers.size());
        assertNull(numbers.peek("k0"));
        assertEquals(Integer.valueOf(1), numbers.peek("k1"));
    }

    /**
     * 容量为 0 时不限制条目数
     */
    @Test
    public void testZeroCapacityIsUnbounded() {
        LruStore<Integer, Integer> unbounded = new LruStore<>(0);
        for (int i = 0; i < 1000; i++) {
            unbounded.set(i, i);
        }
        assertEquals(1000, unbounded.size());
    }

    @Test(expected = NullPointerException.class)
    public void testNullValueRejected() {
        store.set("A", null);
    }

    /**
     * 并发读写后条目数不超过容量
     */
    @Test
    public void testConcurrentAccessRespectsCapacity() throws InterruptedException {
        LruStore<Integer, Integer> shared = new LruStore<>(100);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            int offset = t * 1000;
            pool.execute(() -> {
                try {
                    for (int i = 0; i < 1000; i++) {
                        shared.set(offset + i, i);
                        shared.get(offset + i / 2);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(30, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(100, shared.size());
        assertEquals(100, shared.keys().size());
    }
}
