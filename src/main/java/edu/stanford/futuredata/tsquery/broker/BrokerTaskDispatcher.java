package edu.stanford.futuredata.tsquery.broker;

import edu.stanford.futuredata.tsquery.RequestType;
import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.plan.Intermediate;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlan;
import edu.stanford.futuredata.tsquery.rpc.ServerStream;
import edu.stanford.futuredata.tsquery.rpc.TaskDispatcher;
import edu.stanford.futuredata.tsquery.task.IntermediateResultMerger;
import edu.stanford.futuredata.tsquery.task.TaskContext;
import edu.stanford.futuredata.tsquery.task.TaskManager;
import edu.stanford.futuredata.tsquery.task.TaskType;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Handles requests a root sends to this broker as an intermediate: registers the intermediate
 * task, arms its timeout and tells the root it accepted.
 */
class BrokerTaskDispatcher implements TaskDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(BrokerTaskDispatcher.class);

    private final TaskManager taskManager;
    private final ScheduledExecutorService timer;
    private final QueryConfig config;

    BrokerTaskDispatcher(TaskManager taskManager, ScheduledExecutorService timer, QueryConfig config) {
        this.taskManager = taskManager;
        this.timer = timer;
        this.config = config;
    }

    @Override
    public void dispatch(ServerStream from, TaskRequest request) {
        String self = taskManager.getIndicator();
        if (request.getType() == RequestType.Cancel) {
            String taskID = PhysicalPlan.intermediateTaskID(request.getParentTaskID(), self);
            logger.info("Broker {} cancelling intermediate task {} for {}", self, taskID, request.getParentNode());
            taskManager.fail(taskID, QueryException.cancelled(taskID));
            return;
        }
        Intermediate intermediate;
        try {
            if (request.getType() != RequestType.Data) {
                throw QueryException.malformedRequest("broker only runs data tasks, got " + request.getType());
            }
            PhysicalPlan plan = Utilities.byteStringToObject(request.getPhysicalPlan(), PhysicalPlan.class);
            intermediate = plan.getIntermediate(self).orElseThrow(
                    () -> QueryException.malformedRequest("no intermediate " + self + " in plan"));
        } catch (QueryException e) {
            logger.warn("Broker {} rejecting request {} from {}: {}", self, request.getRequestID(), from.getPeer(),
                    e.getMessage());
            reply(from, TaskResponse.newBuilder().setTaskID(request.getParentTaskID()).setCompleted(true)
                    .setErrMsg(e.getMessage()).setSendNode(self).build());
            return;
        }

        String taskID = PhysicalPlan.intermediateTaskID(request.getParentTaskID(), self);
        IntermediateResultMerger merger = new IntermediateResultMerger(taskManager, request.getParentNode(),
                request.getParentTaskID());
        TaskContext ctx = new TaskContext(taskID, TaskType.INTERMEDIATE, request.getParentNode(),
                request.getParentTaskID(), intermediate.numOfTask, merger);
        if (!taskManager.submit(ctx)) {
            return;
        }
        try {
            merger.setTimeout(timer.schedule(() -> taskManager.fail(taskID, QueryException.timeout(taskID)),
                    config.timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            taskManager.fail(taskID, QueryException.transport("broker " + self + " shut down", e));
            return;
        }
        logger.debug("Broker {} accepted intermediate task {}", self, taskID);
        reply(from, TaskResponse.newBuilder().setTaskID(request.getParentTaskID()).setCompleted(false)
                .setSendNode(self).build());
    }

    private void reply(ServerStream to, TaskResponse response) {
        try {
            to.send(response);
        } catch (QueryException e) {
            logger.warn("Broker {} could not reply to {}: {}", taskManager.getIndicator(), to.getPeer(), e.getMessage());
        }
    }
}
