package edu.stanford.futuredata.tsquery.broker;

import edu.stanford.futuredata.tsquery.RequestType;
import edu.stanford.futuredata.tsquery.interfaces.ClusterView;
import edu.stanford.futuredata.tsquery.models.DatabaseDescriptor;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlan;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlanner;
import edu.stanford.futuredata.tsquery.series.TimeSeriesEvent;
import edu.stanford.futuredata.tsquery.sql.Query;
import edu.stanford.futuredata.tsquery.task.JobContext;
import edu.stanford.futuredata.tsquery.task.RootResultMerger;
import edu.stanford.futuredata.tsquery.utilities.QueryException;

/** Runs data queries from this broker as root. */
public class BrokerQueryExecutor {

    private final ClusterView cluster;
    private final PhysicalPlanner planner;
    private final JobDispatcher dispatcher;

    BrokerQueryExecutor(ClusterView cluster, PhysicalPlanner planner, JobDispatcher dispatcher) {
        this.cluster = cluster;
        this.planner = planner;
        this.dispatcher = dispatcher;
    }

    public JobContext<TimeSeriesEvent> execute(String database, Query query) {
        JobContext<TimeSeriesEvent> job = new JobContext<>(query);
        PhysicalPlan plan;
        try {
            DatabaseDescriptor descriptor = cluster.database(database)
                    .orElseThrow(() -> QueryException.databaseNotFound(database));
            plan = planner.plan(descriptor, cluster.liveBrokers(), query.hasGroupBy());
        } catch (QueryException e) {
            job.fail(e);
            return job;
        }
        dispatcher.dispatch(job, plan, RequestType.Data, query, new RootResultMerger(job, query.limit));
        return job;
    }
}
