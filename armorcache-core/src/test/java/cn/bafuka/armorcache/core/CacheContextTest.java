package cn.bafuka.armorcache.core;

import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * CacheContext 单元测试
 */
public class CacheContextTest {

    @Test
    public void testBackgroundNeverDone() {
        CacheContext ctx = CacheContext.background();

        assertFalse(ctx.isDone());
        assertNull(ctx.remaining());
        ctx.checkActive("get", "k");
        assertSame(ctx, CacheContext.orBackground(null));
    }

    @Test(expected = IllegalStateException.class)
    public void testBackgroundCannotBeCancelled() {
        CacheContext.background().cancel();
    }

    @Test
    public void testCancelPropagatesToChildren() {
        CacheContext parent = CacheContext.background().withCancel();
        CacheContext child = parent.withCancel();

        parent.cancel();

        assertEquals(ErrorKind.CANCELLED, child.doneReason());
        try {
            child.checkActive("get", "k");
            fail();
        } catch (CacheException e) {
            assertEquals(ErrorKind.CANCELLED, e.getKind());
            assertEquals("k", e.getKey());
        }
    }

    @Test
    public void testCancellingChildLeavesParent() {
        CacheContext parent = CacheContext.background().withCancel();
        CacheContext child = parent.withCancel();

        child.cancel();
        child.cancel();

        assertTrue(child.isDone());
        assertFalse(parent.isDone());
    }

    @Test
    public void testDeadline() throws InterruptedException {
        CacheContext ctx = CacheContext.withTimeout(Duration.ofMillis(30));
        assertFalse(ctx.isDone());
        assertTrue(ctx.remaining().toMillis() <= 30);

        Thread.sleep(60);

        assertEquals(ErrorKind.DEADLINE_EXCEEDED, ctx.doneReason());
        assertEquals(Duration.ZERO, ctx.remaining());
    }

    /**
     * 子上下文的截止时间不会晚于父上下文
     */
    @Test
    public void testChildDeadlineCappedByParent() {
        CacheContext parent = CacheContext.withTimeout(Duration.ofMillis(50));
        CacheContext child = parent.childWithTimeout(Duration.ofMinutes(5));

        assertTrue(child.remaining().toMillis() <= 50);
    }
}
