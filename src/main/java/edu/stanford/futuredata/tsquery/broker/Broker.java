package edu.stanford.futuredata.tsquery.broker;

import edu.stanford.futuredata.tsquery.interfaces.ClusterView;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.plan.PhysicalPlanner;
import edu.stanford.futuredata.tsquery.rpc.*;
import edu.stanford.futuredata.tsquery.series.TimeSeriesEvent;
import edu.stanford.futuredata.tsquery.sql.Metadata;
import edu.stanford.futuredata.tsquery.sql.Query;
import edu.stanford.futuredata.tsquery.sql.Statement;
import edu.stanford.futuredata.tsquery.task.JobContext;
import edu.stanford.futuredata.tsquery.task.ResponseRouter;
import edu.stanford.futuredata.tsquery.task.TaskManager;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public class Broker {

    private static final Logger logger = LoggerFactory.getLogger(Broker.class);

    private final Node self;
    private final ClusterView cluster;
    private final QueryConfig config;
    // Set when this broker owns its ZooKeeper session.
    private final BrokerCurator zkCurator;
    private final Server server;

    private final ClientConnFactory connFactory;
    private final TaskClientFactory clientFactory;
    private final TaskServerFactory serverFactory = new TaskServerFactory();
    private final TaskManager taskManager;
    // Root and intermediate task timeouts.
    private final ScheduledExecutorService timer;

    private final BrokerQueryExecutor queryExecutor;
    private final BrokerMetadataExecutor metadataExecutor;

    private final StreamUpdateDaemon streamUpdateDaemon;
    public volatile boolean runStreamUpdateDaemon = true;

    private boolean serving = false;

    /*
     * CONSTRUCTOR/TEARDOWN
     */

    public Broker(String host, int port, String zkHost, int zkPort, QueryConfig config) {
        this(new Node(host, port), new BrokerCurator(zkHost, zkPort), config, ServerBuilder.forPort(port),
                new GrpcClientConnFactory());
    }

    public Broker(Node self, ClusterView cluster, QueryConfig config, ServerBuilder<?> serverBuilder,
                  ClientConnFactory connFactory) {
        this.self = self;
        this.cluster = cluster;
        this.config = config;
        this.zkCurator = cluster instanceof BrokerCurator ? (BrokerCurator) cluster : null;
        this.connFactory = connFactory;
        this.clientFactory = new TaskClientFactory(self.indicator(), connFactory, config);
        this.taskManager = new TaskManager(self.indicator(), clientFactory, serverFactory);
        this.clientFactory.setTaskReceiver(new ResponseRouter(taskManager));
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "broker-timer-" + self.port);
            t.setDaemon(true);
            return t;
        });
        JobDispatcher jobDispatcher = new JobDispatcher(taskManager, timer, config);
        PhysicalPlanner planner = new PhysicalPlanner(self);
        this.queryExecutor = new BrokerQueryExecutor(cluster, planner, jobDispatcher);
        this.metadataExecutor = new BrokerMetadataExecutor(cluster, planner, jobDispatcher);
        TaskHandler handler = new TaskHandler(self.indicator(), serverFactory,
                new BrokerTaskDispatcher(taskManager, timer, config));
        this.server = serverBuilder
                .addService(ServerInterceptors.intercept(handler, RpcContexts.logicNodeInterceptor()))
                .build();
        this.streamUpdateDaemon = new StreamUpdateDaemon();
    }

    /** Start serving requests. */
    public boolean startServing() {
        assert(!serving);
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("Broker {} startup failed: {}", self, e.getMessage());
            return false;
        }
        serving = true;
        if (zkCurator != null) {
            zkCurator.registerBroker(self);
        }
        streamUpdateDaemon.start();
        logger.info("Broker {} serving with {}", self, config);
        return true;
    }

    public void shutdown() {
        runStreamUpdateDaemon = false;
        streamUpdateDaemon.interrupt();
        try {
            if (streamUpdateDaemon.isAlive()) {
                streamUpdateDaemon.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        clientFactory.close();
        connFactory.close();
        server.shutdownNow();
        timer.shutdownNow();
        if (zkCurator != null) {
            zkCurator.close();
        }
        logger.info("Broker {} shut down", self);
    }

    /*
     * PUBLIC FUNCTIONS
     */

    public JobContext<TimeSeriesEvent> dataQuery(String database, Query query) {
        return queryExecutor.execute(database, query);
    }

    public JobContext<List<String>> metadataQuery(String database, Metadata metadata) {
        return metadataExecutor.execute(database, metadata);
    }

    public JobContext<?> handle(String database, Statement statement) {
        if (statement instanceof Query) {
            return dataQuery(database, (Query) statement);
        } else if (statement instanceof Metadata) {
            return metadataQuery(database, (Metadata) statement);
        }
        JobContext<Object> job = new JobContext<>(statement);
        job.fail(QueryException.unsupportedStatement(String.valueOf(statement)));
        return job;
    }

    /** Opens task streams to every storage node and broker in the cluster view and closes the rest. */
    public void refreshStreams() {
        Set<Node> targets = new TreeSet<>(cluster.storageNodes());
        targets.addAll(cluster.liveBrokers());
        targets.add(self);
        for (Node target : targets) {
            clientFactory.createTaskClient(target);
        }
        for (Node open : clientFactory.nodes()) {
            if (!targets.contains(open)) {
                clientFactory.closeTaskClient(open.indicator());
            }
        }
    }

    public Node getSelf() {
        return self;
    }

    public TaskManager getTaskManager() {
        return taskManager;
    }

    public TaskClientFactory getClientFactory() {
        return clientFactory;
    }

    public TaskServerFactory getServerFactory() {
        return serverFactory;
    }

    private class StreamUpdateDaemon extends Thread {

        StreamUpdateDaemon() {
            super("stream-update-" + self.port);
            setDaemon(true);
        }

        @Override
        public void run() {
            while (runStreamUpdateDaemon) {
                try {
                    Thread.sleep(config.streamRefreshMillis);
                } catch (InterruptedException e) {
                    break;
                }
                try {
                    refreshStreams();
                } catch (RuntimeException e) {
                    logger.error("Broker {} stream refresh failed", self, e);
                }
            }
        }

        @Override
        public synchronized void start() {
            refreshStreams();
            super.start();
        }
    }
}
