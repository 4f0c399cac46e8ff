package edu.stanford.futuredata.tsquery.plan;

import edu.stanford.futuredata.tsquery.models.DatabaseDescriptor;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiles a statement against the current cluster view into a {@link PhysicalPlan}. Pure: the
 * same inputs always produce the same plan.
 */
public class PhysicalPlanner {
    private static final Logger logger = LoggerFactory.getLogger(PhysicalPlanner.class);

    private final Node self;

    public PhysicalPlanner(Node self) {
        this.self = self;
    }

    // Plan for statements whose leaves report straight to the root.
    public PhysicalPlan plan(DatabaseDescriptor database) throws QueryException {
        return plan(database, List.of(self), false);
    }

    public PhysicalPlan plan(DatabaseDescriptor database, List<Node> liveBrokers, boolean grouped)
            throws QueryException {
        Map<String, List<Integer>> assignment = new TreeMap<>();
        database.getShardAssignment().forEach((storage, shards) -> {
            if (!shards.isEmpty()) {
                assignment.put(storage, shards);
            }
        });
        if (assignment.isEmpty()) {
            throw QueryException.noAvailableStorageNode();
        }
        int numStorage = assignment.size();
        PhysicalPlan plan;
        if (!grouped || numStorage == 1) {
            // One leaf already sees every series when there is a single storage node.
            PhysicalPlan.Builder builder = PhysicalPlan.newBuilder(database.name, new Root(self.indicator(), numStorage));
            assignment.forEach((storage, shards) ->
                    builder.addLeaf(new Leaf(self.indicator(), storage, List.of(self), shards)));
            plan = builder.build();
        } else {
            List<Node> receivers = chooseIntermediates(liveBrokers, numStorage);
            PhysicalPlan.Builder builder = PhysicalPlan.newBuilder(database.name,
                    new Root(self.indicator(), receivers.size()));
            for (Node receiver : receivers) {
                builder.addIntermediate(new Intermediate(self.indicator(), receiver.indicator(), numStorage));
            }
            assignment.forEach((storage, shards) ->
                    builder.addLeaf(new Leaf(self.indicator(), storage, receivers, shards)));
            plan = builder.build();
        }
        plan.validate(database.activeShards());
        logger.debug("Broker {} planned {}", self, plan);
        return plan;
    }

    /** The first min(S, max(1, B-1)) brokers other than self by indicator; self only when alone. */
    List<Node> chooseIntermediates(List<Node> liveBrokers, int numStorage) {
        Set<Node> brokers = new TreeSet<>(liveBrokers);
        brokers.add(self);
        int numIntermediates = Math.min(numStorage, Math.max(1, brokers.size() - 1));
        List<Node> chosen = brokers.stream().filter(b -> !b.equals(self))
                .limit(numIntermediates).collect(Collectors.toList());
        if (chosen.size() < numIntermediates) {
            chosen.add(self);
        }
        return chosen;
    }
}
