package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.utilities.QueryException;

import java.util.concurrent.atomic.AtomicBoolean;

public class RequestContext {

    public final String requestID;
    private final long deadlineMillis;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RequestContext(String requestID, long timeoutMillis) {
        this.requestID = requestID;
        this.deadlineMillis = System.currentTimeMillis() + timeoutMillis;
    }

    public long remainingMillis() {
        return Math.max(0, deadlineMillis - System.currentTimeMillis());
    }

    public boolean isExpired() {
        return System.currentTimeMillis() >= deadlineMillis;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || isExpired();
    }

    /** Throws if the request was cancelled or ran past its deadline. */
    public void checkCancelled() throws QueryException {
        if (cancelled.get()) {
            throw QueryException.cancelled(requestID);
        }
        if (isExpired()) {
            throw QueryException.timeout(requestID);
        }
    }
}
