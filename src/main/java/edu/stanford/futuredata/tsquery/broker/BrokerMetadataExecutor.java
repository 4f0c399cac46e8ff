package edu.stanford.futuredata.tsquery.broker;

import edu.stanford.futuredata.tsquery.RequestType;
import edu.stanford.futuredata.tsquery.interfaces.ClusterView;
import edu.stanford.futuredata.tsquery.models.DatabaseDescriptor;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlan;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlanner;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.MetadataType;
import edu.stanford.futuredata.tsquery.task.JobContext;
import edu.stanford.futuredata.tsquery.task.MetadataResultMerger;
import edu.stanford.futuredata.tsquery.utilities.QueryException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs SHOW statements. Databases come from the cluster view; everything else fans out to the
 * storage nodes of the database and is merged into one sorted list.
 */
public class BrokerMetadataExecutor {

    private final ClusterView cluster;
    private final PhysicalPlanner planner;
    private final JobDispatcher dispatcher;

    BrokerMetadataExecutor(ClusterView cluster, PhysicalPlanner planner, JobDispatcher dispatcher) {
        this.cluster = cluster;
        this.planner = planner;
        this.dispatcher = dispatcher;
    }

    public JobContext<List<String>> execute(String database, Metadata metadata) {
        JobContext<List<String>> job = new JobContext<>(metadata);
        if (metadata.type == MetadataType.DATABASE) {
            job.emit(cluster.databases().stream().map(d -> d.name).sorted()
                    .limit(metadata.limit).collect(Collectors.toList()));
            return job;
        }
        PhysicalPlan plan;
        try {
            DatabaseDescriptor descriptor = cluster.database(database)
                    .orElseThrow(() -> QueryException.databaseNotFound(database));
            plan = planner.plan(descriptor);
        } catch (QueryException e) {
            job.fail(e);
            return job;
        }
        dispatcher.dispatch(job, plan, RequestType.Metadata, metadata, new MetadataResultMerger(job, metadata));
        return job;
    }
}
