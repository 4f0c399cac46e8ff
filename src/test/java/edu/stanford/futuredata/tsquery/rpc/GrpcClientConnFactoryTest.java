package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.ErrorKind;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.ManagedChannel;
import io.grpc.inprocess.InProcessChannelBuilder;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class GrpcClientConnFactoryTest {

    @Test
    public void testChannelReusedPerTarget() throws QueryException {
        AtomicInteger dials = new AtomicInteger(0);
        GrpcClientConnFactory factory = new GrpcClientConnFactory(n -> {
            dials.incrementAndGet();
            return InProcessChannelBuilder.forName(n.indicator()).build();
        });
        ManagedChannel a1 = factory.getClientConn(new Node("1.1.1.1", 9000));
        ManagedChannel a2 = factory.getClientConn(new Node("1.1.1.1", 9000));
        ManagedChannel b = factory.getClientConn(new Node("1.1.1.2", 9000));
        assertSame(a1, a2);
        assertNotSame(a1, b);
        assertEquals(2, dials.get());
        assertEquals(2, factory.size());

        factory.close();
        assertTrue(a1.isShutdown());
        assertTrue(b.isShutdown());
        assertEquals(0, factory.size());
        QueryException e = assertThrows(QueryException.class, () -> factory.getClientConn(new Node("1.1.1.1", 9000)));
        assertEquals(ErrorKind.TRANSPORT, e.getKind());
        assertEquals(2, dials.get());
    }
}
