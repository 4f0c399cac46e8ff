package edu.stanford.futuredata.tsquery.datastore;

import edu.stanford.futuredata.tsquery.interfaces.Engine;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.rpc.RpcContexts;
import edu.stanford.futuredata.tsquery.rpc.TaskHandler;
import edu.stanford.futuredata.tsquery.rpc.TaskServerFactory;
import edu.stanford.futuredata.tsquery.task.TaskManager;
import edu.stanford.futuredata.tsquery.task.WorkerPool;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/** A storage node: serves leaf tasks over its shards to whichever brokers stream to it. */
public class DataStore {
    private static final Logger logger = LoggerFactory.getLogger(DataStore.class);

    private final Node self;
    private final Server server;
    private final TaskServerFactory serverFactory = new TaskServerFactory();
    private final TaskManager taskManager;
    private final WorkerPool workerPool;

    private boolean serving = false;

    public DataStore(String dsHost, int dsPort, Engine engine, QueryConfig config) {
        this(new Node(dsHost, dsPort), engine, config, ServerBuilder.forPort(dsPort));
    }

    public DataStore(Node self, Engine engine, QueryConfig config, ServerBuilder<?> serverBuilder) {
        this.self = self;
        this.taskManager = new TaskManager(self.indicator(), null, serverFactory);
        this.workerPool = new WorkerPool("datastore-" + self.port, config.maxWorkers);
        StorageTaskDispatcher dispatcher = new StorageTaskDispatcher(self.indicator(), engine, taskManager,
                workerPool, config);
        TaskHandler handler = new TaskHandler(self.indicator(), serverFactory, dispatcher);
        this.server = serverBuilder
                .addService(ServerInterceptors.intercept(handler, RpcContexts.logicNodeInterceptor()))
                .build();
    }

    /** Start serving requests. */
    public boolean startServing() {
        assert(!serving);
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("DataStore {} startup failed: {}", self, e.getMessage());
            return false;
        }
        serving = true;
        logger.info("DataStore {} serving", self);
        return true;
    }

    public void shutDown() {
        server.shutdownNow();
        workerPool.shutdown();
        serving = false;
        logger.info("DataStore {} shut down", self);
    }

    public Node getSelf() {
        return self;
    }

    public TaskServerFactory getServerFactory() {
        return serverFactory;
    }
}
