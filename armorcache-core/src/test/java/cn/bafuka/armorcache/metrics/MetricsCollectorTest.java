package cn.bafuka.armorcache.metrics;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * MetricsCollector 单元测试
 */
public class MetricsCollectorTest {

    private MetricsCollector collector;

    @Before
    public void setUp() {
        collector = new MetricsCollector();
    }

    @Test
    public void testRecordOperation() {
        collector.recordOperation("get", Duration.ofMillis(10), 1);
        collector.recordOperation("get", Duration.ofMillis(30), 2);

        OperationSnapshot snapshot = collector.snapshot("get");
        assertNotNull(snapshot);
        assertEquals(2, snapshot.getCount());
        assertEquals(3, snapshot.getTotalItems());
        assertEquals(Duration.ofMillis(10), snapshot.getMinDuration());
        assertEquals(Duration.ofMillis(30), snapshot.getMaxDuration());
        assertEquals(Duration.ofMillis(20), snapshot.getAvgDuration());
    }

    /**
     * 零耗时同样是有效的最小值
     */
    @Test
    public void testZeroDurationKeptAsMin() {
        collector.recordOperation("get", Duration.ofMillis(5), 1);
        collector.recordOperation("get", Duration.ZERO, 1);
        collector.recordOperation("get", Duration.ofMillis(9), 1);

        OperationSnapshot snapshot = collector.snapshot("get");
        assertEquals(Duration.ZERO, snapshot.getMinDuration());
        assertEquals(Duration.ofMillis(9), snapshot.getMaxDuration());
    }

    /**
     * 空操作名或条目数不为正时忽略
     */
    @Test
    public void testIgnoresInvalidInput() {
        collector.recordOperation("", Duration.ofMillis(1), 1);
        collector.recordOperation(null, Duration.ofMillis(1), 1);
        collector.recordOperation("get", Duration.ofMillis(1), 0);
        collector.recordHit("get", 0);
        collector.recordMiss("get", -1);

        assertTrue(collector.snapshot().isEmpty());
    }

    @Test
    public void testHitsMissesAndErrors() {
        collector.recordHit("get", 3);
        collector.recordMiss("get", 1);
        collector.recordError("get");
        collector.recordError("set");

        Map<String, OperationSnapshot> snapshot = collector.snapshot();
        assertEquals(2, snapshot.size());
        assertEquals(3, snapshot.get("get").getHits());
        assertEquals(1, snapshot.get("get").getMisses());
        assertEquals(1, snapshot.get("get").getErrors());
        assertEquals(1, snapshot.get("set").getErrors());
        assertEquals(0, snapshot.get("set").getCount());

        assertEquals(3, collector.totalHits());
        assertEquals(1, collector.totalMisses());
    }

    @Test
    public void testDisabled() {
        collector.setEnabled(false);
        collector.recordOperation("get", Duration.ofMillis(1), 1);
        collector.recordHit("get", 1);
        collector.recordError("get");

        assertFalse(collector.isEnabled());
        assertTrue(collector.snapshot().isEmpty());
        assertNull(collector.snapshot("get"));

        collector.setEnabled(true);
        assertTrue(collector.snapshot().isEmpty());
    }

    @Test
    public void testReset() {
        collector.recordOperation("get", Duration.ofMillis(1), 1);
        collector.recordError("get");

        collector.reset();

        assertTrue(collector.snapshot().isEmpty());
        assertEquals(0, collector.totalHits());
    }
}
