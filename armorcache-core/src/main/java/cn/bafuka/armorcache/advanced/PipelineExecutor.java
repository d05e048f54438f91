package cn.bafuka.armorcache.advanced;

import cn.bafuka.armorcache.core.CacheContext;
import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 有界并发执行器
 * 调用线程按顺序获取信号量许可后才把任务提交到共享线程池，单次调用最多占用 concurrency 个池线程；
 * 上下文结束时停止提交，尚未提交的任务不再执行并上报取消错误。
 * 第一个错误只记录一次，并在所有已提交任务结束后抛出
 */
@Slf4j
public class PipelineExecutor implements AutoCloseable {

    private static final long GATE_POLL_MILLIS = 10L;

    /**
     * 批量任务单元
     */
    @FunctionalInterface
    public interface PipelineTask {

        void run(CacheContext ctx);
    }

    private final ExecutorService pool;

    /**
     * 单次调用的最大并发数
     */
    private final int concurrency;

    public PipelineExecutor(int threads, int concurrency) {
        int poolSize = Math.max(1, threads);
        this.concurrency = Math.max(1, concurrency);
        this.pool = new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new PipelineThreadFactory());
        log.info("批量执行器已启动: threads={}, concurrency={}", poolSize, this.concurrency);
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * 执行一批任务
     *
     * @param ctx       调用上下文
     * @param operation 操作名（用于错误标注）
     * @param tasks     任务列表
     * @throws CacheException 第一个失败任务的异常
     */
    public void execute(CacheContext ctx, String operation, List<PipelineTask> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return;
        }

        // 第一个错误出现后取消剩余任务，不影响调用方的上下文
        CacheContext child = CacheContext.orBackground(ctx).withCancel();
        Semaphore gate = new Semaphore(concurrency);
        AtomicReference<RuntimeException> firstError = new AtomicReference<>();

        List<CompletableFuture<Void>> futures = new ArrayList<>(tasks.size());
        try {
            for (PipelineTask task : tasks) {
                // 许可在提交前获取，等待中的任务不占用池线程
                if (!acquire(child, gate)) {
                    ErrorKind reason = child.doneReason();
                    fail(child, firstError, new CacheException(reason == null ? ErrorKind.CANCELLED : reason, operation, null));
                    break;
                }
                try {
                    futures.add(CompletableFuture.runAsync(() -> runGated(child, gate, task, firstError), pool));
                } catch (RejectedExecutionException e) {
                    gate.release();
                    throw e;
                }
            }
        } catch (RejectedExecutionException e) {
            child.cancel();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            throw new IllegalStateException("pipeline executor is closed", e);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        RuntimeException error = firstError.get();
        if (error != null) {
            throw error;
        }
    }

    private static void runGated(CacheContext ctx, Semaphore gate,
                                 PipelineTask task, AtomicReference<RuntimeException> firstError) {
        try {
            task.run(ctx);
        } catch (RuntimeException e) {
            fail(ctx, firstError, e);
        } finally {
            gate.release();
        }
    }

    private static boolean acquire(CacheContext ctx, Semaphore gate) {
        try {
            while (!ctx.isDone()) {
                if (gate.tryAcquire(GATE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void fail(CacheContext ctx, AtomicReference<RuntimeException> firstError, RuntimeException e) {
        if (firstError.compareAndSet(null, e)) {
            ctx.cancel();
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("批量执行器已关闭");
    }

    /**
     * 守护线程工厂
     */
    private static class PipelineThreadFactory implements ThreadFactory {

        private final AtomicInteger index = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "armorcache-pipeline-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
