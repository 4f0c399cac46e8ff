package edu.stanford.futuredata.tsquery.sql;

import edu.stanford.futuredata.tsquery.sql.expr.Expr;

import java.util.List;
import java.util.Objects;

/** A data query: {@code select ... from metric where <tag filter> group by <tags>}. */
public final class Query implements Statement {

    public static final String DEFAULT_NAMESPACE = "default-ns";

    public final String namespace;
    public final String metricName;
    public final List<SelectItem> selectItems;
    // Tag filter, may be null.
    public final Expr condition;
    public final List<String> groupBy;
    public final long startTime;
    public final long endTime;
    // Down-sampling interval in millis, 0 keeps raw timestamps.
    public final long interval;
    // Max number of series returned, 0 for unlimited.
    public final int limit;

    public Query(String namespace, String metricName, List<SelectItem> selectItems, Expr condition,
                 List<String> groupBy, long startTime, long endTime, long interval, int limit) {
        this.namespace = namespace == null || namespace.isEmpty() ? DEFAULT_NAMESPACE : namespace;
        this.metricName = Objects.requireNonNull(metricName);
        this.selectItems = List.copyOf(selectItems);
        this.condition = condition;
        this.groupBy = List.copyOf(groupBy);
        this.startTime = startTime;
        this.endTime = endTime;
        this.interval = interval;
        this.limit = limit;
    }

    /** {@code select <fields> from <metric>} over all time, no filter, no grouping. */
    public static Query of(String metricName, SelectItem... selectItems) {
        return new Query(null, metricName, List.of(selectItems), null, List.of(), 0L, Long.MAX_VALUE, 0L, 0);
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    public Query withCondition(Expr condition) {
        return new Query(namespace, metricName, selectItems, condition, groupBy, startTime, endTime, interval, limit);
    }

    public Query withGroupBy(List<String> groupBy) {
        return new Query(namespace, metricName, selectItems, condition, groupBy, startTime, endTime, interval, limit);
    }

    public Query withTimeRange(long startTime, long endTime, long interval) {
        return new Query(namespace, metricName, selectItems, condition, groupBy, startTime, endTime, interval, limit);
    }

    public Query withLimit(int limit) {
        return new Query(namespace, metricName, selectItems, condition, groupBy, startTime, endTime, interval, limit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("select ").append(selectItems).append(" from ").append(metricName);
        if (condition != null) {
            sb.append(" where ").append(condition);
        }
        if (hasGroupBy()) {
            sb.append(" group by ").append(String.join(",", groupBy));
        }
        return sb.toString();
    }
}
