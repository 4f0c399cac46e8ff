package edu.stanford.futuredata.tsquery.plan;

import java.io.Serializable;
import java.util.Objects;

public final class Root implements Serializable {

    public final String indicator;
    // Number of direct children the root receives results from.
    public final int numOfTask;

    public Root(String indicator, int numOfTask) {
        this.indicator = Objects.requireNonNull(indicator);
        this.numOfTask = numOfTask;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Root)) return false;
        Root root = (Root) o;
        return numOfTask == root.numOfTask && indicator.equals(root.indicator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indicator, numOfTask);
    }

    @Override
    public String toString() {
        return "Root{" + indicator + ", numOfTask=" + numOfTask + "}";
    }
}
