package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class TaskServerFactoryTest {

    @SuppressWarnings("unchecked")
    private static ServerStream stream(String peer) {
        return new ServerStream(peer, mock(StreamObserver.class));
    }

    @Test
    public void testStaleDeregisterKeepsNewerStream() {
        TaskServerFactory factory = new TaskServerFactory();
        ServerStream first = stream("1.1.1.1:9000");
        ServerStream second = stream("1.1.1.1:9000");
        long oldEpoch = factory.register("1.1.1.1:9000", first);
        long newEpoch = factory.register("1.1.1.1:9000", second);
        assertTrue(newEpoch > oldEpoch);
        assertSame(second, factory.getStream("1.1.1.1:9000").orElseThrow());

        // The old stream's teardown arrives after its replacement registered.
        assertFalse(factory.deregister(oldEpoch, "1.1.1.1:9000"));
        assertSame(second, factory.getStream("1.1.1.1:9000").orElseThrow());

        assertTrue(factory.deregister(newEpoch, "1.1.1.1:9000"));
        assertTrue(factory.getStream("1.1.1.1:9000").isEmpty());
        assertFalse(factory.deregister(newEpoch, "1.1.1.1:9000"));
    }

    @Test
    public void testNodesSortedAndParsable() {
        TaskServerFactory factory = new TaskServerFactory();
        factory.register("1.1.1.2:9000", stream("1.1.1.2:9000"));
        factory.register("1.1.1.1:9000", stream("1.1.1.1:9000"));
        factory.register("not-a-node", stream("not-a-node"));
        assertEquals(List.of(new Node("1.1.1.1", 9000), new Node("1.1.1.2", 9000)), factory.nodes());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testClosedStreamRejectsSend() {
        StreamObserver<TaskResponse> observer = mock(StreamObserver.class);
        ServerStream s = new ServerStream("1.1.1.1:9000", observer);
        s.close(true);
        s.close(true);
        verify(observer, times(1)).onCompleted();
        assertThrows(QueryException.class, () -> s.send(TaskResponse.getDefaultInstance()));
    }
}
