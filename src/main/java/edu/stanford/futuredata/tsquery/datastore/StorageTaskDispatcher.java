package edu.stanford.futuredata.tsquery.datastore;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.interfaces.Engine;
import edu.stanford.futuredata.tsquery.interfaces.TSDBDatabase;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.plan.Leaf;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlan;
import edu.stanford.futuredata.tsquery.rpc.ServerStream;
import edu.stanford.futuredata.tsquery.rpc.TaskDispatcher;
import edu.stanford.futuredata.tsquery.series.SeriesAggregator;
import edu.stanford.futuredata.tsquery.series.TimeSeries;
import edu.stanford.futuredata.tsquery.series.TimeSeriesEvent;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.Query;
import edu.stanford.futuredata.tsquery.task.RequestContext;
import edu.stanford.futuredata.tsquery.task.TaskManager;
import edu.stanford.futuredata.tsquery.task.WorkerPool;
import edu.stanford.futuredata.tsquery.utilities.ErrorKind;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs leaf tasks on the worker pool and streams each result to every receiver named by the
 * plan: one completed response per receiver, holding the receiver's share of the groups.
 */
class StorageTaskDispatcher implements TaskDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(StorageTaskDispatcher.class);

    private final String self;
    private final Engine engine;
    private final TaskManager taskManager;
    private final WorkerPool workerPool;
    private final QueryConfig config;

    StorageTaskDispatcher(String self, Engine engine, TaskManager taskManager, WorkerPool workerPool,
                          QueryConfig config) {
        this.self = self;
        this.engine = engine;
        this.taskManager = taskManager;
        this.workerPool = workerPool;
        this.config = config;
    }

    @Override
    public void dispatch(ServerStream from, TaskRequest request) {
        PhysicalPlan plan;
        Leaf leaf;
        try {
            plan = Utilities.byteStringToObject(request.getPhysicalPlan(), PhysicalPlan.class);
            leaf = plan.getLeaf(self).orElseThrow(() -> QueryException.malformedRequest("no leaf " + self + " in plan"));
        } catch (QueryException e) {
            logger.warn("DataStore {} rejecting request {} from {}: {}", self, request.getRequestID(), from.getPeer(),
                    e.getMessage());
            try {
                from.send(TaskResponse.newBuilder().setTaskID(request.getParentTaskID()).setCompleted(true)
                        .setErrMsg(e.getMessage()).setSendNode(self).build());
            } catch (QueryException sendError) {
                logger.warn("DataStore {} could not reply to {}: {}", self, from.getPeer(), sendError.getMessage());
            }
            return;
        }
        RequestContext ctx = new RequestContext(request.getRequestID(), config.timeoutMillis);
        boolean accepted = workerPool.submit(ctx, c -> execute(c, request, plan, leaf),
                e -> respondError(request, plan, leaf, toQueryException(e)));
        if (!accepted) {
            logger.warn("DataStore {} dropped request {} from {}", self, request.getRequestID(), from.getPeer());
        }
    }

    private void execute(RequestContext ctx, TaskRequest request, PhysicalPlan plan, Leaf leaf) throws QueryException {
        TSDBDatabase database = engine.getDatabase(plan.getDatabase())
                .orElseThrow(() -> QueryException.databaseNotFound(plan.getDatabase()));
        List<ByteString> payloads = new ArrayList<>();
        switch (request.getType()) {
            case Metadata: {
                Metadata metadata = Utilities.byteStringToObject(request.getPayload(), Metadata.class);
                List<String> values = new StorageMetadataExecutor(database, metadata, leaf.shardIDs, ctx).execute();
                ByteString payload = Utilities.objectToByteString(new ArrayList<>(values));
                leaf.receivers.forEach(r -> payloads.add(payload));
                break;
            }
            case Data: {
                Query query = Utilities.byteStringToObject(request.getPayload(), Query.class);
                SeriesAggregator aggregator = new StorageQueryExecutor(database, query, leaf.shardIDs, ctx).execute();
                for (List<TimeSeries> partition : aggregator.partition(leaf.receivers.size())) {
                    payloads.add(Utilities.objectToByteString(new TimeSeriesEvent(partition)));
                }
                break;
            }
            default:
                throw QueryException.malformedRequest("unknown request type " + request.getType());
        }
        for (int i = 0; i < leaf.receivers.size(); i++) {
            ctx.checkCancelled();
            Node receiver = leaf.receivers.get(i);
            taskManager.sendResponse(receiver.indicator(), TaskResponse.newBuilder()
                    .setTaskID(plan.receiverTaskID(request.getParentTaskID(), receiver.indicator()))
                    .setCompleted(true)
                    .setPayload(payloads.get(i))
                    .setSendNode(self)
                    .build());
        }
    }

    private void respondError(TaskRequest request, PhysicalPlan plan, Leaf leaf, QueryException error) {
        for (Node receiver : leaf.receivers) {
            try {
                taskManager.sendResponse(receiver.indicator(), TaskResponse.newBuilder()
                        .setTaskID(plan.receiverTaskID(request.getParentTaskID(), receiver.indicator()))
                        .setCompleted(true)
                        .setErrMsg(error.getMessage())
                        .setSendNode(self)
                        .build());
            } catch (QueryException e) {
                logger.warn("DataStore {} could not report error to {}: {}", self, receiver, e.getMessage());
            }
        }
    }

    private static QueryException toQueryException(Exception e) {
        if (e instanceof QueryException) {
            return (QueryException) e;
        }
        return new QueryException(ErrorKind.EXECUTION, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }
}
