package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.models.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public class TaskServerFactory {
    private static final Logger logger = LoggerFactory.getLogger(TaskServerFactory.class);

    private final Map<String, Registration> streams = new ConcurrentHashMap<>();
    private final AtomicLong epochs = new AtomicLong(0);

    private static final class Registration {
        final long epoch;
        final ServerStream stream;

        Registration(long epoch, ServerStream stream) {
            this.epoch = epoch;
            this.stream = stream;
        }
    }

    // Registers the stream, replacing any previous one for the peer, and returns its epoch.
    public long register(String indicator, ServerStream stream) {
        long epoch = epochs.incrementAndGet();
        streams.put(indicator, new Registration(epoch, stream));
        logger.info("Registered stream from {} epoch {}", indicator, epoch);
        return epoch;
    }

    /** Removes the peer's stream only if it is still the one registered under {@code epoch}. */
    public boolean deregister(long epoch, String indicator) {
        AtomicBoolean removed = new AtomicBoolean(false);
        streams.computeIfPresent(indicator, (k, r) -> {
            if (r.epoch == epoch) {
                removed.set(true);
                return null;
            }
            return r;
        });
        if (removed.get()) {
            logger.info("Deregistered stream from {} epoch {}", indicator, epoch);
        } else {
            logger.debug("Ignored stale deregister from {} epoch {}", indicator, epoch);
        }
        return removed.get();
    }

    public Optional<ServerStream> getStream(String indicator) {
        Registration r = streams.get(indicator);
        return r == null ? Optional.empty() : Optional.of(r.stream);
    }

    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>();
        for (String indicator : streams.keySet()) {
            try {
                nodes.add(Node.parse(indicator));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping unparsable peer indicator {}", indicator);
            }
        }
        Collections.sort(nodes);
        return nodes;
    }
}
