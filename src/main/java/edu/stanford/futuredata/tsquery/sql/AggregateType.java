package edu.stanford.futuredata.tsquery.sql;

public enum AggregateType {
    SUM,
    MIN,
    MAX,
    COUNT,
    LAST;

    /** Combines two values of the same timestamp; {@code existing} is the older one. */
    public double combine(double existing, double incoming) {
        switch (this) {
            case SUM:
            case COUNT:
                return existing + incoming;
            case MIN:
                return Math.min(existing, incoming);
            case MAX:
                return Math.max(existing, incoming);
            case LAST:
                return incoming;
            default:
                throw new IllegalStateException("Unknown aggregate " + this);
        }
    }
}
