package edu.stanford.futuredata.tsquery.plan;

import edu.stanford.futuredata.tsquery.models.Node;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

public final class Leaf implements Serializable {

    public final String parent;
    public final String indicator;
    public final List<Node> receivers;
    public final List<Integer> shardIDs;

    public Leaf(String parent, String indicator, List<Node> receivers, List<Integer> shardIDs) {
        this.parent = Objects.requireNonNull(parent);
        this.indicator = Objects.requireNonNull(indicator);
        this.receivers = List.copyOf(receivers);
        this.shardIDs = List.copyOf(shardIDs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Leaf)) return false;
        Leaf leaf = (Leaf) o;
        return parent.equals(leaf.parent) && indicator.equals(leaf.indicator)
                && receivers.equals(leaf.receivers) && shardIDs.equals(leaf.shardIDs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, indicator, receivers, shardIDs);
    }

    @Override
    public String toString() {
        return "Leaf{" + indicator + ", parent=" + parent + ", receivers=" + receivers + ", shards=" + shardIDs + "}";
    }
}
