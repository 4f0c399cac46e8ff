package edu.stanford.futuredata.tsquery.plan;

import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.QueryException;

import java.io.Serializable;
import java.util.*;

/**
 * Immutable execution tree Root -> [Intermediate] -> Leaf. Children name their parent by
 * indicator only.
 */
public final class PhysicalPlan implements Serializable {

    private final String database;
    private final Root root;
    private final List<Intermediate> intermediates;
    private final List<Leaf> leaves;

    private PhysicalPlan(String database, Root root, List<Intermediate> intermediates, List<Leaf> leaves) {
        this.database = database;
        this.root = root;
        this.intermediates = List.copyOf(intermediates);
        this.leaves = List.copyOf(leaves);
    }

    public static Builder newBuilder(String database, Root root) {
        return new Builder(database, root);
    }

    public String getDatabase() {
        return database;
    }

    public Root getRoot() {
        return root;
    }

    public List<Intermediate> getIntermediates() {
        return intermediates;
    }

    public List<Leaf> getLeaves() {
        return leaves;
    }

    public boolean hasIntermediates() {
        return !intermediates.isEmpty();
    }

    public Optional<Leaf> getLeaf(String indicator) {
        return leaves.stream().filter(l -> l.indicator.equals(indicator)).findFirst();
    }

    public Optional<Intermediate> getIntermediate(String indicator) {
        return intermediates.stream().filter(i -> i.indicator.equals(indicator)).findFirst();
    }

    // Checks the structural invariants of the tree against the database's active shard set.
    public void validate(Set<Integer> activeShards) throws QueryException {
        Set<String> parents = new HashSet<>();
        parents.add(root.indicator);
        intermediates.forEach(i -> parents.add(i.indicator));
        int expectedRootChildren = intermediates.isEmpty() ? leaves.size() : intermediates.size();
        if (root.numOfTask != expectedRootChildren) {
            throw QueryException.inconsistentShards("root expects " + root.numOfTask + " children, plan has "
                    + expectedRootChildren);
        }
        Set<Integer> seen = new HashSet<>();
        for (Leaf leaf : leaves) {
            if (!parents.contains(leaf.parent)) {
                throw QueryException.inconsistentShards("leaf " + leaf.indicator + " has unknown parent " + leaf.parent);
            }
            if (leaf.receivers.isEmpty()) {
                throw QueryException.inconsistentShards("leaf " + leaf.indicator + " has no receivers");
            }
            for (Integer shardID : leaf.shardIDs) {
                if (!seen.add(shardID)) {
                    throw QueryException.inconsistentShards("shard " + shardID + " assigned twice");
                }
            }
        }
        if (!seen.equals(activeShards)) {
            throw QueryException.inconsistentShards("plan shards " + seen + " != active shards " + activeShards);
        }
    }

    /**
     * Task id a leaf addresses its responses to on {@code receiver}: the root task itself, or the
     * intermediate task registered for it on that receiver.
     */
    public String receiverTaskID(String rootTaskID, String receiver) {
        return hasIntermediates() ? intermediateTaskID(rootTaskID, receiver) : rootTaskID;
    }

    public static String intermediateTaskID(String rootTaskID, String intermediate) {
        return rootTaskID + "@" + intermediate;
    }

    public List<Node> targets() {
        List<Node> targets = new ArrayList<>();
        intermediates.forEach(i -> targets.add(Node.parse(i.indicator)));
        leaves.forEach(l -> targets.add(Node.parse(l.indicator)));
        return targets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhysicalPlan)) return false;
        PhysicalPlan that = (PhysicalPlan) o;
        return database.equals(that.database) && root.equals(that.root)
                && intermediates.equals(that.intermediates) && leaves.equals(that.leaves);
    }

    @Override
    public int hashCode() {
        return Objects.hash(database, root, intermediates, leaves);
    }

    @Override
    public String toString() {
        return "PhysicalPlan{" + database + " " + root + ", intermediates=" + intermediates + ", leaves=" + leaves + "}";
    }

    public static final class Builder {
        private final String database;
        private final Root root;
        private final List<Intermediate> intermediates = new ArrayList<>();
        private final List<Leaf> leaves = new ArrayList<>();

        private Builder(String database, Root root) {
            this.database = Objects.requireNonNull(database);
            this.root = Objects.requireNonNull(root);
        }

        public Builder addIntermediate(Intermediate intermediate) {
            intermediates.add(intermediate);
            return this;
        }

        public Builder addLeaf(Leaf leaf) {
            leaves.add(leaf);
            return this;
        }

        public PhysicalPlan build() {
            return new PhysicalPlan(database, root, intermediates, leaves);
        }
    }
}
