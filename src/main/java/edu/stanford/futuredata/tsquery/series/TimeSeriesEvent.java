package edu.stanford.futuredata.tsquery.series;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

/** Result of a data query: series ordered by group key. */
public final class TimeSeriesEvent implements Serializable {

    public final List<TimeSeries> series;

    public TimeSeriesEvent(List<TimeSeries> series) {
        this.series = List.copyOf(series);
    }

    public static TimeSeriesEvent empty() {
        return new TimeSeriesEvent(List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return series.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TimeSeriesEvent && series.equals(((TimeSeriesEvent) o).series);
    }

    @Override
    public int hashCode() {
        return series.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeriesEvent" + series;
    }
}
