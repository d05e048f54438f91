package cn.bafuka.armorcache.memory;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.Assert.*;

/**
 * CaffeineLeaseLocker 单元测试
 */
public class CaffeineLeaseLockerTest {

    private CaffeineLeaseLocker locker;

    @Before
    public void setUp() {
        locker = new CaffeineLeaseLocker();
    }

    @Test
    public void testAcquireAndRelease() {
        assertTrue(locker.tryAcquire("k", Duration.ofSeconds(10)));
        assertTrue(locker.isLocked("k"));
        assertFalse(locker.tryAcquire("k", Duration.ofSeconds(10)));

        assertTrue(locker.release("k"));
        assertFalse(locker.isLocked("k"));
        assertFalse(locker.release("k"));
    }

    @Test
    public void testKeysAreIndependent() {
        assertTrue(locker.tryAcquire("a", Duration.ofSeconds(10)));
        assertTrue(locker.tryAcquire("b", Duration.ofSeconds(10)));
    }

    /**
     * 租约到期后锁自动释放
     */
    @Test
    public void testLeaseExpires() throws InterruptedException {
        assertTrue(locker.tryAcquire("k", Duration.ofMillis(50)));
        Thread.sleep(150);

        assertFalse(locker.isLocked("k"));
        assertTrue(locker.tryAcquire("k", Duration.ofSeconds(10)));
    }

    /**
     * 其他线程持有的租约不能被释放
     */
    @Test
    public void testReleaseByOtherThreadRejected() throws Exception {
        ExecutorService other = Executors.newSingleThreadExecutor();
        try {
            assertTrue(other.submit(() -> locker.tryAcquire("k", Duration.ofSeconds(10))).get());

            assertFalse(locker.release("k"));
            assertTrue(locker.isLocked("k"));

            assertTrue(other.submit(() -> locker.release("k")).get());
            assertFalse(locker.isLocked("k"));
        } finally {
            other.shutdownNow();
        }
    }

    /**
     * 过期的旧持有者释放时不会删除新持有者的租约
     */
    @Test
    public void testStaleHolderCannotReleaseNewLease() throws InterruptedException, ExecutionException {
        ExecutorService second = Executors.newSingleThreadExecutor();
        ExecutorService third = Executors.newSingleThreadExecutor();
        try {
            assertTrue(locker.tryAcquire("k", Duration.ofMillis(50)));
            Thread.sleep(150);

            assertTrue(second.submit(() -> locker.tryAcquire("k", Duration.ofSeconds(30))).get());

            assertFalse(locker.release("k"));
            assertTrue(locker.isLocked("k"));
            assertFalse(third.submit(() -> locker.tryAcquire("k", Duration.ofSeconds(30))).get());

            assertTrue(second.submit(() -> locker.release("k")).get());
            assertTrue(third.submit(() -> locker.tryAcquire("k", Duration.ofSeconds(30))).get());
        } finally {
            second.shutdownNow();
            third.shutdownNow();
        }
    }
}
