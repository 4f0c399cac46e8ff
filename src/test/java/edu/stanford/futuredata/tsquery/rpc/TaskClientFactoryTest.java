package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskRequest;
import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.TaskServiceGrpc;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.QueryConfig;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class TaskClientFactoryTest {

    private static final Node server = new Node("1.1.1.1", 9000);
    private static final String client = "1.1.1.2:8000";
    private static final QueryConfig config = QueryConfig.defaults().withBackoff(10, 50);

    private TaskServerFactory serverFactory;
    private Server grpcServer;
    private GrpcClientConnFactory connFactory;
    private TaskClientFactory clientFactory;
    private final BlockingQueue<TaskResponse> received = new LinkedBlockingQueue<>();

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            assertTrue(System.currentTimeMillis() < deadline, "condition not met in time");
            Thread.sleep(10);
        }
    }

    @BeforeEach
    public void startServer() throws IOException {
        serverFactory = new TaskServerFactory();
        // Echoes each request back as a completed response for its parent task.
        TaskHandler handler = new TaskHandler(server.indicator(), serverFactory, (from, request) -> {
            try {
                from.send(TaskResponse.newBuilder().setTaskID(request.getParentTaskID()).setCompleted(true)
                        .setSendNode(server.indicator()).build());
            } catch (QueryException e) {
                fail(e);
            }
        });
        grpcServer = InProcessServerBuilder.forName(server.indicator()).directExecutor()
                .addService(ServerInterceptors.intercept(handler, RpcContexts.logicNodeInterceptor()))
                .build().start();
        connFactory = new GrpcClientConnFactory(n -> InProcessChannelBuilder.forName(n.indicator()).build());
        clientFactory = new TaskClientFactory(client, connFactory, config);
        clientFactory.setTaskReceiver(received::add);
    }

    @AfterEach
    public void stopServer() {
        clientFactory.close();
        connFactory.close();
        grpcServer.shutdownNow();
    }

    @Test
    public void testRequestResponse() throws Exception {
        clientFactory.createTaskClient(server);
        clientFactory.createTaskClient(server);
        assertEquals(1, clientFactory.nodes().size());
        TaskClient taskClient = clientFactory.getTaskClient(server.indicator()).orElseThrow();
        waitFor(() -> serverFactory.getStream(client).isPresent());

        taskClient.send(TaskRequest.newBuilder().setRequestID("r-1").setParentTaskID("t-1").build());
        TaskResponse response = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(response);
        assertEquals("t-1", response.getTaskID());
        assertEquals(server.indicator(), response.getSendNode());
    }

    @Test
    public void testReconnectsAfterStreamFailure() throws Exception {
        clientFactory.createTaskClient(server);
        TaskClient taskClient = clientFactory.getTaskClient(server.indicator()).orElseThrow();
        waitFor(() -> serverFactory.getStream(client).isPresent());
        ServerStream before = serverFactory.getStream(client).orElseThrow();

        taskClient.resetStream(Status.UNAVAILABLE.asRuntimeException());
        waitFor(() -> taskClient.getReconnects() >= 1 && taskClient.isReady());
        waitFor(() -> serverFactory.getStream(client).map(s -> s != before).orElse(false));

        taskClient.send(TaskRequest.newBuilder().setRequestID("r-2").setParentTaskID("t-2").build());
        TaskResponse response = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(response);
        assertEquals("t-2", response.getTaskID());
    }

    @Test
    public void testClosedClientHasNoSendStream() throws Exception {
        clientFactory.createTaskClient(server);
        TaskClient taskClient = clientFactory.getTaskClient(server.indicator()).orElseThrow();
        clientFactory.closeTaskClient(server.indicator());
        assertTrue(clientFactory.getTaskClient(server.indicator()).isEmpty());
        assertFalse(taskClient.isReady());
        QueryException e = assertThrows(QueryException.class,
                () -> taskClient.send(TaskRequest.getDefaultInstance()));
        assertTrue(e.getMessage().startsWith(QueryException.NO_SEND_STREAM));
        waitFor(() -> serverFactory.getStream(client).isEmpty());
    }

    @Test
    public void testStreamWithoutLogicNodeIsRejected() throws Exception {
        ManagedChannel channel = InProcessChannelBuilder.forName(server.indicator()).build();
        CountDownLatch closed = new CountDownLatch(1);
        AtomicReference<Throwable> error = new AtomicReference<>();
        try {
            TaskServiceGrpc.newStub(channel).handle(new StreamObserver<>() {
                @Override
                public void onNext(TaskResponse response) {}

                @Override
                public void onError(Throwable t) {
                    error.set(t);
                    closed.countDown();
                }

                @Override
                public void onCompleted() {
                    closed.countDown();
                }
            });
            assertTrue(closed.await(5, TimeUnit.SECONDS));
            assertEquals(Status.Code.INVALID_ARGUMENT, Status.fromThrowable(error.get()).getCode());
            assertTrue(serverFactory.nodes().isEmpty());
        } finally {
            channel.shutdownNow();
        }
    }
}
