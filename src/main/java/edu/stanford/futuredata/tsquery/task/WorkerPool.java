package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fixed-size pool with no queue of its own: submit blocks until a worker frees up or the
 * request's deadline passes. Tasks still running at their deadline are interrupted and dropped.
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    @FunctionalInterface
    public interface Task {
        void run(RequestContext ctx) throws Exception;
    }

    private final String name;
    private final Semaphore slots;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    public WorkerPool(String name, int maxWorkers) {
        this.name = name;
        this.slots = new Semaphore(maxWorkers);
        this.workers = Executors.newFixedThreadPool(maxWorkers, r -> {
            Thread t = new Thread(r, name + "-worker");
            t.setDaemon(true);
            return t;
        });
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs task on a worker. Returns false if no worker freed up before the deadline. An exception
     * thrown by the task goes to onError unless the request was cancelled meanwhile; an Error
     * always does, wrapped in an EXECUTION QueryException.
     */
    public boolean submit(RequestContext ctx, Task task, Consumer<Exception> onError) {
        try {
            if (!slots.tryAcquire(ctx.remainingMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Pool {} saturated, dropping request {}", name, ctx.requestID);
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Pool {} interrupted while submitting request {}", name, ctx.requestID);
            return false;
        }
        AtomicBoolean started = new AtomicBoolean(false);
        AtomicBoolean released = new AtomicBoolean(false);
        Runnable release = () -> {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        };
        Future<?> future;
        try {
            future = workers.submit(() -> {
                started.set(true);
                try {
                    ctx.checkCancelled();
                    task.run(ctx);
                } catch (Exception e) {
                    if (ctx.isCancelled()) {
                        logger.warn("Pool {} discarding cancelled request {}: {}", name, ctx.requestID, e.getMessage());
                    } else {
                        logger.warn("Pool {} request {} failed", name, ctx.requestID, e);
                        onError.accept(e);
                    }
                } catch (Error e) {
                    // Submitted futures swallow Errors.
                    logger.error("Pool {} request {} panicked", name, ctx.requestID, e);
                    onError.accept(QueryException.panic(e));
                } finally {
                    release.run();
                }
            });
        } catch (RejectedExecutionException e) {
            release.run();
            logger.warn("Pool {} shut down, dropping request {}", name, ctx.requestID);
            return false;
        }
        try {
            timer.schedule(() -> {
                if (!future.isDone()) {
                    logger.warn("Pool {} request {} timed out", name, ctx.requestID);
                    ctx.cancel();
                    future.cancel(true);
                    // A task cancelled before it started never reaches its own release.
                    if (!started.get()) {
                        release.run();
                    }
                }
            }, ctx.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Pool {} shut down, no timeout for request {}", name, ctx.requestID);
        }
        return true;
    }

    public int availableWorkers() {
        return slots.availablePermits();
    }

    public void shutdown() {
        timer.shutdownNow();
        workers.shutdownNow();
    }
}
