package edu.stanford.futuredata.tsquery.series;

import edu.stanford.futuredata.tsquery.sql.AggregateType;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/** Points of one selected field, keyed by (down-sampled) timestamp. */
public final class FieldValues implements Serializable {

    public final AggregateType aggregate;
    public final TreeMap<Long, Double> points = new TreeMap<>();

    public FieldValues(AggregateType aggregate) {
        this.aggregate = aggregate;
    }

    /** Adds a raw point read from storage; under COUNT every raw point counts one. */
    public void addRaw(long timestamp, double value) {
        combine(timestamp, aggregate == AggregateType.COUNT ? 1.0 : value);
    }

    /** Adds an already aggregated point. */
    public void combine(long timestamp, double value) {
        points.merge(timestamp, value, aggregate::combine);
    }

    public void merge(FieldValues other) {
        if (other.aggregate != aggregate) {
            throw new IllegalArgumentException("Cannot merge " + other.aggregate + " into " + aggregate);
        }
        for (Map.Entry<Long, Double> e : other.points.entrySet()) {
            combine(e.getKey(), e.getValue());
        }
    }

    public FieldValues copy() {
        FieldValues copy = new FieldValues(aggregate);
        copy.points.putAll(points);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValues)) return false;
        FieldValues that = (FieldValues) o;
        return aggregate == that.aggregate && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return 31 * aggregate.hashCode() + points.hashCode();
    }

    @Override
    public String toString() {
        return aggregate + points.toString();
    }
}
