package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.rpc.ServerStream;
import edu.stanford.futuredata.tsquery.rpc.TaskClient;
import edu.stanford.futuredata.tsquery.rpc.TaskClientFactory;
import edu.stanford.futuredata.tsquery.rpc.TaskServerFactory;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class TaskManager {
    private static final Logger logger = LoggerFactory.getLogger(TaskManager.class);

    private final String indicator;
    // Null on storage nodes, which never open outbound streams.
    private final TaskClientFactory clientFactory;
    private final TaskServerFactory serverFactory;
    private final ConcurrentHashMap<String, TaskContext> tasks = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong(0);

    public TaskManager(String indicator, TaskClientFactory clientFactory, TaskServerFactory serverFactory) {
        this.indicator = indicator;
        this.clientFactory = clientFactory;
        this.serverFactory = serverFactory;
    }

    public String allocTaskID() {
        return indicator + "-" + seq.incrementAndGet();
    }

    /** Tracks ctx. A second submit under the same id is ignored and returns false. */
    public boolean submit(TaskContext ctx) {
        TaskContext prev = tasks.putIfAbsent(ctx.taskID, ctx);
        if (prev != null) {
            logger.warn("Node {} ignoring duplicate task {}", indicator, ctx.taskID);
            return false;
        }
        return true;
    }

    public Optional<TaskContext> get(String taskID) {
        return Optional.ofNullable(tasks.get(taskID));
    }

    public void complete(String taskID) {
        tasks.remove(taskID);
    }

    public void fail(String taskID, QueryException e) {
        TaskContext ctx = tasks.get(taskID);
        if (ctx == null) {
            return;
        }
        if (ctx.fail(e)) {
            logger.warn("Node {} task {} failed: {}", indicator, taskID, e.getMessage());
        }
        complete(taskID);
    }

    /** Routes a response read from an outbound stream to its task; unknown tasks are dropped. */
    public void receive(TaskResponse response) {
        TaskContext ctx = tasks.get(response.getTaskID());
        if (ctx == null) {
            logger.debug("Node {} dropping response for unknown task {} from {}", indicator, response.getTaskID(),
                    response.getSendNode());
            return;
        }
        if (ctx.receiveResult(response)) {
            complete(ctx.taskID);
        }
    }

    public void sendRequest(String target, TaskRequest request) throws QueryException {
        if (clientFactory == null) {
            throw QueryException.noSendStream(target);
        }
        Optional<TaskClient> client = clientFactory.getTaskClient(target);
        if (client.isEmpty()) {
            throw QueryException.noSendStream(target);
        }
        client.get().send(request);
    }

    public void sendResponse(String parent, TaskResponse response) throws QueryException {
        Optional<ServerStream> stream = serverFactory.getStream(parent);
        if (stream.isEmpty()) {
            throw QueryException.noSendStream(parent);
        }
        stream.get().send(response);
    }

    public int size() {
        return tasks.size();
    }

    public String getIndicator() {
        return indicator;
    }
}
