package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

// One channel per target indicator, reused by every stream to that target.
public class GrpcClientConnFactory implements ClientConnFactory {
    private static final Logger logger = LoggerFactory.getLogger(GrpcClientConnFactory.class);

    private final Function<Node, ManagedChannel> dialer;
    private final Map<String, ManagedChannel> conns = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed = false;

    public GrpcClientConnFactory() {
        this(target -> ManagedChannelBuilder.forAddress(target.host, target.port).usePlaintext().build());
    }

    public GrpcClientConnFactory(Function<Node, ManagedChannel> dialer) {
        this.dialer = dialer;
    }

    @Override
    public ManagedChannel getClientConn(Node target) throws QueryException {
        String indicator = target.indicator();
        lock.readLock().lock();
        try {
            checkOpen();
            ManagedChannel channel = conns.get(indicator);
            if (channel != null) {
                return channel;
            }
        } finally {
            lock.readLock().unlock();
        }
        lock.writeLock().lock();
        try {
            checkOpen();
            ManagedChannel channel = conns.get(indicator);
            if (channel == null) {
                channel = dialer.apply(target);
                conns.put(indicator, channel);
                logger.info("Dialed {}", indicator);
            }
            return channel;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void checkOpen() throws QueryException {
        if (closed) {
            throw QueryException.transport("client connection factory closed", null);
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            closed = true;
            for (ManagedChannel c : conns.values()) {
                c.shutdownNow();
            }
            conns.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return conns.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
