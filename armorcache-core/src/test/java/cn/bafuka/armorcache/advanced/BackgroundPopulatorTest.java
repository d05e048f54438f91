package cn.bafuka.armorcache.advanced;

import cn.bafuka.armorcache.core.Cache;
import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import cn.bafuka.armorcache.memory.MemoryCache;
import cn.bafuka.armorcache.model.CacheConfig;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * BackgroundPopulator 单元测试
 */
public class BackgroundPopulatorTest {

    private static CacheConfig.PopulatorConfig populatorConfig(int threads, int queueCapacity) {
        return CacheConfig.PopulatorConfig.builder()
                .threads(threads)
                .queueCapacity(queueCapacity)
                .timeout(Duration.ofSeconds(2))
                .build();
    }

    @Test
    public void testSubmitPopulates() {
        CacheConfig config = CacheConfig.builder()
                .memory(CacheConfig.MemoryConfig.builder().cleanupInterval(Duration.ZERO).build())
                .build();
        MemoryCache<String> cache = new MemoryCache<>(config);
        BackgroundPopulator<String> populator = new BackgroundPopulator<>(cache, populatorConfig(2, 10));

        assertTrue(populator.submit("a", "1", null));
        assertTrue(populator.submit("b", "2", null));
        populator.close();

        assertEquals("1", cache.get(CacheContext.background(), "a"));
        assertEquals("2", cache.get(CacheContext.background(), "b"));
        assertEquals(0, populator.failedCount());
        cache.close();
    }

    /**
     * 回填使用独立的超时上下文
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testUsesOwnTimeoutContext() {
        Cache<String> cache = mock(Cache.class);
        BackgroundPopulator<String> populator = new BackgroundPopulator<>(cache, populatorConfig(1, 10));

        populator.submit("k", "v", Duration.ofMinutes(1));
        populator.close();

        ArgumentCaptor<CacheContext> captor = ArgumentCaptor.forClass(CacheContext.class);
        verify(cache).set(captor.capture(), eq("k"), eq("v"), eq(Duration.ofMinutes(1)));
        assertNotNull(captor.getValue().remaining());
        assertNotSame(CacheContext.background(), captor.getValue());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFailuresCounted() {
        Cache<String> cache = mock(Cache.class);
        doThrow(new CacheException(ErrorKind.CONNECTION, "set", "k"))
                .when(cache).set(any(), anyString(), any(), any());
        BackgroundPopulator<String> populator = new BackgroundPopulator<>(cache, populatorConfig(1, 10));

        populator.submit("k", "v", null);
        populator.submit("k2", "v", null);
        populator.close();

        assertEquals(2, populator.failedCount());
    }

    /**
     * 队列已满时拒绝回填
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testRejectsWhenQueueFull() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        Cache<String> cache = mock(Cache.class);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(cache).set(any(), anyString(), any(), any());
        BackgroundPopulator<String> populator = new BackgroundPopulator<>(cache, populatorConfig(1, 1));

        assertTrue(populator.submit("running", "v", null));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(populator.submit("queued", "v", null));
        assertFalse(populator.submit("rejected", "v", null));
        assertEquals(1, populator.pendingCount());

        release.countDown();
        populator.close();
        verify(cache, never()).set(any(), eq("rejected"), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testSubmitAfterClose() {
        BackgroundPopulator<String> populator = new BackgroundPopulator<>(mock(Cache.class), populatorConfig(1, 1));
        populator.close();

        assertFalse(populator.submit("k", "v", null));
    }
}
