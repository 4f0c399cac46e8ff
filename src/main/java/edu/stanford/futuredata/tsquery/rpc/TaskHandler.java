package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.TaskServiceGrpc;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of the task stream. Registers each inbound stream under the caller's
 * {@code logicNode} and hands every request to the node's dispatcher.
 */
public class TaskHandler extends TaskServiceGrpc.TaskServiceImplBase {
    private static final Logger logger = LoggerFactory.getLogger(TaskHandler.class);

    private final String self;
    private final TaskServerFactory serverFactory;
    private final TaskDispatcher dispatcher;

    public TaskHandler(String self, TaskServerFactory serverFactory, TaskDispatcher dispatcher) {
        this.self = self;
        this.serverFactory = serverFactory;
        this.dispatcher = dispatcher;
    }

    @Override
    public StreamObserver<TaskRequest> handle(StreamObserver<TaskResponse> responseObserver) {
        String peer = RpcContexts.LOGIC_NODE.get();
        if (peer == null || peer.isEmpty()) {
            logger.warn("Node {} rejecting task stream without logicNode", self);
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("missing logicNode").asRuntimeException());
            return new StreamObserver<>() {
                @Override
                public void onNext(TaskRequest request) {
                    logger.debug("Node {} dropping request {} on rejected stream", self, request.getRequestID());
                }

                @Override
                public void onError(Throwable t) {
                    logger.debug("Rejected stream failed: {}", t.getMessage());
                }

                @Override
                public void onCompleted() {
                    logger.debug("Rejected stream completed");
                }
            };
        }
        ServerStream stream = new ServerStream(peer, responseObserver);
        long epoch = serverFactory.register(peer, stream);
        return new StreamObserver<>() {
            @Override
            public void onNext(TaskRequest request) {
                try {
                    dispatcher.dispatch(stream, request);
                } catch (RuntimeException e) {
                    logger.error("Node {} failed dispatching request {} from {}", self, request.getRequestID(), peer, e);
                }
            }

            @Override
            public void onError(Throwable t) {
                logger.warn("Node {} lost task stream from {}: {}", self, peer, t.getMessage());
                serverFactory.deregister(epoch, peer);
                stream.close(false);
            }

            @Override
            public void onCompleted() {
                serverFactory.deregister(epoch, peer);
                stream.close(true);
            }
        };
    }
}
