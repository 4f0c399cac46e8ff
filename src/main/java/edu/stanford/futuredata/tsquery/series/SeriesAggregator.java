package edu.stanford.futuredata.tsquery.series;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hash-merges series by group key. Not thread-safe; callers that share one aggregator
 * synchronize on it.
 */
public class SeriesAggregator {

    private final TreeMap<String, TimeSeries> groups = new TreeMap<>();

    public static long bucket(long timestamp, long interval) {
        return interval <= 0 ? timestamp : timestamp - Math.floorMod(timestamp, interval);
    }

    public void add(TimeSeries series) {
        TimeSeries existing = groups.get(series.getGroupKey());
        if (existing == null) {
            groups.put(series.getGroupKey(), series.copy());
        } else {
            existing.merge(series);
        }
    }

    public void addAll(Iterable<TimeSeries> series) {
        for (TimeSeries s : series) {
            add(s);
        }
    }

    public int size() {
        return groups.size();
    }

    /** Series in group key order, at most {@code limit} of them when limit is positive. */
    public List<TimeSeries> result(int limit) {
        List<TimeSeries> result = new ArrayList<>();
        for (TimeSeries s : groups.values()) {
            if (limit > 0 && result.size() >= limit) {
                break;
            }
            result.add(s);
        }
        return result;
    }

    /** Splits the groups into {@code n} partitions by group key hash. */
    public List<List<TimeSeries>> partition(int n) {
        List<List<TimeSeries>> partitions = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            partitions.add(new ArrayList<>());
        }
        for (Map.Entry<String, TimeSeries> e : groups.entrySet()) {
            partitions.get(Math.floorMod(e.getKey().hashCode(), n)).add(e.getValue());
        }
        return partitions;
    }
}
