package edu.stanford.futuredata.tsquery.series;

import com.fasterxml.jackson.annotation.JsonIgnore;
import edu.stanford.futuredata.tsquery.sql.AggregateType;

import java.io.Serializable;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** One result series: its group-by tags and the values of every selected field. */
public final class TimeSeries implements Serializable {

    public final TreeMap<String, String> tags;
    public final TreeMap<String, FieldValues> fields = new TreeMap<>();

    public TimeSeries(SortedMap<String, String> tags) {
        this.tags = new TreeMap<>(tags);
    }

    /** {@code k1=v1,k2=v2} over the sorted tags; empty when the query has no grouping. */
    @JsonIgnore
    public String getGroupKey() {
        return tags.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(","));
    }

    public FieldValues field(String name, AggregateType aggregate) {
        return fields.computeIfAbsent(name, k -> new FieldValues(aggregate));
    }

    /** Combines {@code other}, which must carry the same group tags, into this series. */
    public void merge(TimeSeries other) {
        if (!tags.equals(other.tags)) {
            throw new IllegalArgumentException("Cannot merge series " + other.getGroupKey() + " into " + getGroupKey());
        }
        for (Map.Entry<String, FieldValues> e : other.fields.entrySet()) {
            FieldValues mine = fields.get(e.getKey());
            if (mine == null) {
                fields.put(e.getKey(), e.getValue().copy());
            } else {
                mine.merge(e.getValue());
            }
        }
    }

    public TimeSeries copy() {
        TimeSeries copy = new TimeSeries(tags);
        fields.forEach((k, v) -> copy.fields.put(k, v.copy()));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries)) return false;
        TimeSeries that = (TimeSeries) o;
        return tags.equals(that.tags) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return 31 * tags.hashCode() + fields.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries{" + tags + " " + fields + "}";
    }
}
