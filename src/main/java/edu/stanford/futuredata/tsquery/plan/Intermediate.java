package edu.stanford.futuredata.tsquery.plan;

import java.io.Serializable;
import java.util.Objects;

// A broker that merges one partition of the grouped results of every leaf.
public final class Intermediate implements Serializable {

    public final String parent;
    public final String indicator;
    // Number of leaves streaming into this intermediate.
    public final int numOfTask;

    public Intermediate(String parent, String indicator, int numOfTask) {
        this.parent = Objects.requireNonNull(parent);
        this.indicator = Objects.requireNonNull(indicator);
        this.numOfTask = numOfTask;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Intermediate)) return false;
        Intermediate that = (Intermediate) o;
        return numOfTask == that.numOfTask && parent.equals(that.parent) && indicator.equals(that.indicator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, indicator, numOfTask);
    }

    @Override
    public String toString() {
        return "Intermediate{" + indicator + ", parent=" + parent + ", numOfTask=" + numOfTask + "}";
    }
}
