package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.TaskServiceGrpc;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.Backoff;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.ManagedChannel;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound task stream to one peer. Responses are handed to the {@link TaskReceiver}; a failed
 * stream is re-created after a jittered backoff until the client is closed.
 */
public class TaskClient {
    private static final Logger logger = LoggerFactory.getLogger(TaskClient.class);

    private final String self;
    private final Node target;
    private final ClientConnFactory connFactory;
    private final TaskReceiver receiver;
    private final ScheduledExecutorService reconnectExecutor;
    private final Backoff backoff;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // Current request stream, null while reconnecting.
    private StreamObserver<TaskRequest> requestStream = null;
    // Bumped per stream so callbacks of a replaced stream are ignored.
    private long generation = 0;
    private int reconnects = 0;

    TaskClient(String self, Node target, ClientConnFactory connFactory, TaskReceiver receiver,
               ScheduledExecutorService reconnectExecutor, Backoff backoff) {
        this.self = self;
        this.target = target;
        this.connFactory = connFactory;
        this.receiver = receiver;
        this.reconnectExecutor = reconnectExecutor;
        this.backoff = backoff;
    }

    public Node getTarget() {
        return target;
    }

    void start() {
        if (running.compareAndSet(false, true)) {
            connect();
        }
    }

    private synchronized void connect() {
        if (!running.get()) {
            return;
        }
        ManagedChannel channel;
        try {
            channel = connFactory.getClientConn(target);
        } catch (QueryException e) {
            logger.warn("Task client {} -> {} cannot get connection: {}", self, target, e.getMessage());
            scheduleReconnect(generation);
            return;
        }
        long streamGeneration = ++generation;
        TaskServiceGrpc.TaskServiceStub stub = TaskServiceGrpc.newStub(channel)
                .withInterceptors(RpcContexts.attachLogicNode(self));
        requestStream = stub.handle(new StreamObserver<>() {
            @Override
            public void onNext(TaskResponse response) {
                backoff.reset();
                receiver.receive(response);
            }

            @Override
            public void onError(Throwable t) {
                logger.warn("Task stream {} -> {} failed: {}", self, target, t.getMessage());
                streamFailed(streamGeneration);
            }

            @Override
            public void onCompleted() {
                logger.info("Task stream {} -> {} closed by peer", self, target);
                streamFailed(streamGeneration);
            }
        });
        logger.info("Task stream {} -> {} established", self, target);
    }

    private synchronized void streamFailed(long streamGeneration) {
        if (streamGeneration != generation) {
            return;
        }
        requestStream = null;
        scheduleReconnect(streamGeneration);
    }

    private void scheduleReconnect(long failedGeneration) {
        if (!running.get()) {
            return;
        }
        long delay = backoff.nextDelayMillis();
        try {
            reconnectExecutor.schedule(() -> {
                synchronized (this) {
                    if (failedGeneration != generation || requestStream != null) {
                        return;
                    }
                    reconnects++;
                }
                connect();
            }, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Task client {} -> {} not reconnecting, executor shut down", self, target);
        }
    }

    public synchronized boolean isReady() {
        return requestStream != null;
    }

    public synchronized int getReconnects() {
        return reconnects;
    }

    public synchronized void send(TaskRequest request) throws QueryException {
        if (requestStream == null) {
            throw QueryException.noSendStream(target.indicator());
        }
        try {
            requestStream.onNext(request);
        } catch (RuntimeException e) {
            throw QueryException.taskSend(target.indicator(), e);
        }
    }

    // Drops the current stream as if the transport had failed.
    synchronized void resetStream(Throwable cause) {
        if (requestStream != null) {
            requestStream.onError(cause);
        }
    }

    public void close() {
        running.set(false);
        synchronized (this) {
            if (requestStream != null) {
                try {
                    requestStream.onCompleted();
                } catch (RuntimeException e) {
                    logger.debug("Task stream {} -> {} already closed: {}", self, target, e.getMessage());
                }
                requestStream = null;
            }
        }
    }
}
