package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.plan.PhysicalPlan;
import edu.stanford.futuredata.tsquery.sql.Statement;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifetime of one statement on its root broker. The result future is completed once, with the
 * merged result or the first error; later completions are ignored.
 */
public class JobContext<R> {
    private static final Logger logger = LoggerFactory.getLogger(JobContext.class);

    public final Statement statement;
    private final CompletableFuture<R> result = new CompletableFuture<>();
    private volatile String rootTaskID = null;
    private volatile PhysicalPlan plan = null;
    private volatile Runnable onCancel = () -> {};
    // Intermediates still to accept. The future turns true once all have, false if the job ends first.
    private final AtomicInteger pendingIntermediates = new AtomicInteger(0);
    private final CompletableFuture<Boolean> intermediatesAccepted = new CompletableFuture<>();

    public JobContext(Statement statement) {
        this.statement = statement;
    }

    public void bind(String rootTaskID, PhysicalPlan plan, Runnable onCancel) {
        this.rootTaskID = rootTaskID;
        this.plan = plan;
        this.onCancel = onCancel;
        this.pendingIntermediates.set(plan.getIntermediates().size());
        if (plan.getIntermediates().isEmpty()) {
            intermediatesAccepted.complete(true);
        }
        result.whenComplete((r, e) -> intermediatesAccepted.complete(false));
    }

    public String getRootTaskID() {
        return rootTaskID;
    }

    public PhysicalPlan getPlan() {
        return plan;
    }

    public CompletableFuture<R> result() {
        return result;
    }

    public boolean emit(R value) {
        return result.complete(value);
    }

    public boolean fail(QueryException e) {
        return result.completeExceptionally(e);
    }

    public boolean isDone() {
        return result.isDone();
    }

    /** Aborts the job: the caller sees a CANCELLED error and child contexts stop merging. */
    public void cancel() {
        QueryException e = QueryException.cancelled(rootTaskID == null ? "unplanned" : rootTaskID);
        if (fail(e)) {
            logger.info("Job {} cancelled", rootTaskID);
            onCancel.run();
        }
    }

    void intermediateAccepted() {
        if (pendingIntermediates.decrementAndGet() == 0) {
            intermediatesAccepted.complete(true);
        }
    }

    public CompletableFuture<Boolean> intermediatesAccepted() {
        return intermediatesAccepted;
    }

    public boolean awaitIntermediates(long timeoutMillis) throws InterruptedException {
        try {
            return intermediatesAccepted.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            return false;
        }
    }

    // Blocks for the result. Interrupting the caller cancels the job.
    public R await() throws QueryException {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw QueryException.cancelled(rootTaskID);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw QueryException.cancelled(rootTaskID);
        }
    }

    static QueryException unwrap(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof QueryException) {
            return (QueryException) t;
        }
        return QueryException.remote(String.valueOf(t.getMessage()));
    }
}
