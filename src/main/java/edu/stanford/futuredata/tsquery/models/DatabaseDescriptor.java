package edu.stanford.futuredata.tsquery.models;

import java.util.*;

/** A database and its active shard assignment: storage node indicator to the shard ids it owns. */
public final class DatabaseDescriptor {

    public final String name;
    private final Map<String, List<Integer>> shardAssignment;

    public DatabaseDescriptor(String name, Map<String, List<Integer>> shardAssignment) {
        this.name = Objects.requireNonNull(name);
        Map<String, List<Integer>> copy = new TreeMap<>();
        shardAssignment.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.shardAssignment = Collections.unmodifiableMap(copy);
    }

    /** Sorted by storage node indicator. */
    public Map<String, List<Integer>> getShardAssignment() {
        return shardAssignment;
    }

    public Set<Integer> activeShards() {
        Set<Integer> shards = new TreeSet<>();
        shardAssignment.values().forEach(shards::addAll);
        return shards;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatabaseDescriptor)) return false;
        DatabaseDescriptor that = (DatabaseDescriptor) o;
        return name.equals(that.name) && shardAssignment.equals(that.shardAssignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, shardAssignment);
    }

    @Override
    public String toString() {
        return "Database{" + name + " " + shardAssignment + "}";
    }
}
