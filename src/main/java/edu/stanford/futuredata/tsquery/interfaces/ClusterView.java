package edu.stanford.futuredata.tsquery.interfaces;

import edu.stanford.futuredata.tsquery.models.DatabaseDescriptor;
import edu.stanford.futuredata.tsquery.models.Node;

import java.util.List;
import java.util.Optional;

public interface ClusterView {
    /*
     What a broker knows about the cluster.
     Implementations may cache; callers treat results as snapshots.
     */

    List<DatabaseDescriptor> databases();
    Optional<DatabaseDescriptor> database(String name);
    // Live brokers including the caller.
    List<Node> liveBrokers();
    // Storage nodes owning at least one shard of any database.
    List<Node> storageNodes();
}
