package edu.stanford.futuredata.tsquery.utilities;

/** Tunables shared by brokers and storage nodes. */
public final class QueryConfig {

    public final long timeoutMillis;
    public final int maxWorkers;
    public final long initialBackoffMillis;
    public final long maxBackoffMillis;
    public final long streamRefreshMillis;

    public QueryConfig(long timeoutMillis, int maxWorkers, long initialBackoffMillis, long maxBackoffMillis,
                       long streamRefreshMillis) {
        if (timeoutMillis <= 0 || maxWorkers <= 0 || initialBackoffMillis <= 0
                || maxBackoffMillis < initialBackoffMillis || streamRefreshMillis <= 0) {
            throw new IllegalArgumentException("Invalid query config");
        }
        this.timeoutMillis = timeoutMillis;
        this.maxWorkers = maxWorkers;
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
        this.streamRefreshMillis = streamRefreshMillis;
    }

    public static QueryConfig defaults() {
        return new QueryConfig(30_000L, 64, 100L, 5_000L, 1_000L);
    }

    public QueryConfig withTimeoutMillis(long timeoutMillis) {
        return new QueryConfig(timeoutMillis, maxWorkers, initialBackoffMillis, maxBackoffMillis, streamRefreshMillis);
    }

    public QueryConfig withMaxWorkers(int maxWorkers) {
        return new QueryConfig(timeoutMillis, maxWorkers, initialBackoffMillis, maxBackoffMillis, streamRefreshMillis);
    }

    public QueryConfig withBackoff(long initialBackoffMillis, long maxBackoffMillis) {
        return new QueryConfig(timeoutMillis, maxWorkers, initialBackoffMillis, maxBackoffMillis, streamRefreshMillis);
    }

    public QueryConfig withStreamRefreshMillis(long streamRefreshMillis) {
        return new QueryConfig(timeoutMillis, maxWorkers, initialBackoffMillis, maxBackoffMillis, streamRefreshMillis);
    }

    @Override
    public String toString() {
        return String.format("QueryConfig{timeout=%dms, maxWorkers=%d, backoff=%d..%dms, streamRefresh=%dms}",
                timeoutMillis, maxWorkers, initialBackoffMillis, maxBackoffMillis, streamRefreshMillis);
    }
}
