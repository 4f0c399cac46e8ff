package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.Backoff;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public class TaskClientFactory {
    private static final Logger logger = LoggerFactory.getLogger(TaskClientFactory.class);

    private final String self;
    private final ClientConnFactory connFactory;
    private final QueryConfig config;
    private final Map<String, TaskClient> clients = new ConcurrentHashMap<>();
    private final ScheduledExecutorService reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "task-client-reconnect");
        t.setDaemon(true);
        return t;
    });
    private volatile TaskReceiver receiver;

    public TaskClientFactory(String self, ClientConnFactory connFactory, QueryConfig config) {
        this.self = self;
        this.connFactory = connFactory;
        this.config = config;
    }

    public void setTaskReceiver(TaskReceiver receiver) {
        this.receiver = receiver;
    }

    // Opens a stream to target unless one is already open or reconnecting.
    public void createTaskClient(Node target) {
        if (receiver == null) {
            throw new IllegalStateException("Task receiver not set");
        }
        TaskClient client = clients.computeIfAbsent(target.indicator(), k -> {
            logger.info("Creating task client {} -> {}", self, target);
            return new TaskClient(self, target, connFactory, receiver, reconnectExecutor,
                    new Backoff(config.initialBackoffMillis, config.maxBackoffMillis));
        });
        client.start();
    }

    public Optional<TaskClient> getTaskClient(String indicator) {
        return Optional.ofNullable(clients.get(indicator));
    }

    public void closeTaskClient(String indicator) {
        TaskClient client = clients.remove(indicator);
        if (client != null) {
            logger.info("Closing task client {} -> {}", self, indicator);
            client.close();
        }
    }

    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>();
        clients.values().forEach(c -> nodes.add(c.getTarget()));
        Collections.sort(nodes);
        return nodes;
    }

    public void close() {
        for (String indicator : new ArrayList<>(clients.keySet())) {
            closeTaskClient(indicator);
        }
        reconnectExecutor.shutdownNow();
    }
}
