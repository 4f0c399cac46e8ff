package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.models.Node;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.ManagedChannel;

public interface ClientConnFactory {
    // Cached channel to target, dialed on first use. Fails once the factory is closed.
    ManagedChannel getClientConn(Node target) throws QueryException;
    // Shut down every channel.
    void close();
}
