package edu.stanford.futuredata.tsquery.broker;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.tsquery.RequestType;
import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.plan.Intermediate;
import edu.stanford.futuredata.tsquery.plan.Leaf;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlan;
import edu.stanford.futuredata.tsquery.sql.Statement;
import edu.stanford.futuredata.tsquery.task.*;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registers the root task of a planned job and sends its requests: intermediates first, then,
 * once every intermediate accepted, the leaves. Never blocks on remote nodes.
 */
class JobDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(JobDispatcher.class);

    private final TaskManager taskManager;
    private final ScheduledExecutorService timer;
    private final QueryConfig config;

    JobDispatcher(TaskManager taskManager, ScheduledExecutorService timer, QueryConfig config) {
        this.taskManager = taskManager;
        this.timer = timer;
        this.config = config;
    }

    <R> void dispatch(JobContext<R> job, PhysicalPlan plan, RequestType type, Statement statement,
                      ResultMerger merger) {
        String self = taskManager.getIndicator();
        String taskID = taskManager.allocTaskID();
        job.bind(taskID, plan, () -> cancelTasks(taskID, plan));
        taskManager.submit(new TaskContext(taskID, TaskType.ROOT, self, "", plan.getRoot().numOfTask, merger));
        try {
            ScheduledFuture<?> timeout = timer.schedule(
                    () -> taskManager.fail(taskID, QueryException.timeout(taskID)),
                    config.timeoutMillis, TimeUnit.MILLISECONDS);
            job.result().whenComplete((r, e) -> timeout.cancel(false));
        } catch (RejectedExecutionException e) {
            taskManager.fail(taskID, QueryException.transport("broker " + self + " shut down", e));
            return;
        }

        ByteString serializedPlan = Utilities.objectToByteString(plan);
        ByteString serializedStatement = Utilities.objectToByteString(statement);
        TaskRequest request = TaskRequest.newBuilder()
                .setRequestID(taskID)
                .setParentTaskID(taskID)
                .setParentNode(self)
                .setType(type)
                .setPhysicalPlan(serializedPlan)
                .setPayload(serializedStatement)
                .build();
        try {
            for (Intermediate intermediate : plan.getIntermediates()) {
                send(job, intermediate.indicator, request);
            }
        } catch (QueryException e) {
            taskManager.fail(taskID, e);
            return;
        }
        // Leaves go out on the thread that delivers the last accept, or right here without intermediates.
        job.intermediatesAccepted().thenAccept(accepted -> {
            if (accepted) {
                sendLeaves(job, plan, request);
            }
        });
    }

    private void sendLeaves(JobContext<?> job, PhysicalPlan plan, TaskRequest request) {
        String taskID = request.getParentTaskID();
        try {
            for (Leaf leaf : plan.getLeaves()) {
                send(job, leaf.indicator, request);
            }
            logger.debug("Broker {} dispatched task {} to {}", taskManager.getIndicator(), taskID, plan.targets());
        } catch (QueryException e) {
            taskManager.fail(taskID, e);
        }
    }

    /*
     * Fails the root and every intermediate context of the job. Intermediates on this broker are
     * failed directly, the others are told over their task stream.
     */
    private void cancelTasks(String taskID, PhysicalPlan plan) {
        String self = taskManager.getIndicator();
        taskManager.fail(taskID, QueryException.cancelled(taskID));
        for (Intermediate intermediate : plan.getIntermediates()) {
            if (intermediate.indicator.equals(self)) {
                String childID = PhysicalPlan.intermediateTaskID(taskID, self);
                taskManager.fail(childID, QueryException.cancelled(childID));
                continue;
            }
            TaskRequest cancel = TaskRequest.newBuilder()
                    .setRequestID(taskID)
                    .setParentTaskID(taskID)
                    .setParentNode(self)
                    .setType(RequestType.Cancel)
                    .build();
            try {
                taskManager.sendRequest(intermediate.indicator, cancel);
            } catch (QueryException e) {
                logger.warn("Broker {} could not cancel task {} on {}: {}", self, taskID, intermediate.indicator,
                        e.getMessage());
            }
        }
    }

    private void send(JobContext<?> job, String target, TaskRequest request) throws QueryException {
        if (job.isDone()) {
            throw QueryException.cancelled(request.getParentTaskID());
        }
        taskManager.sendRequest(target, request);
    }
}
