package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import io.grpc.stub.StreamObserver;

public class ServerStream {

    private final String peer;
    private final StreamObserver<TaskResponse> responseObserver;
    private boolean closed = false;

    public ServerStream(String peer, StreamObserver<TaskResponse> responseObserver) {
        this.peer = peer;
        this.responseObserver = responseObserver;
    }

    public String getPeer() {
        return peer;
    }

    public synchronized void send(TaskResponse response) throws QueryException {
        if (closed) {
            throw QueryException.noSendStream(peer);
        }
        try {
            responseObserver.onNext(response);
        } catch (RuntimeException e) {
            throw QueryException.taskSend(peer, e);
        }
    }

    /** Marks the stream unusable; completes the call unless the peer already failed it. */
    public synchronized void close(boolean complete) {
        if (closed) {
            return;
        }
        closed = true;
        if (complete) {
            responseObserver.onCompleted();
        }
    }
}
