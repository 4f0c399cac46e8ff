package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskRequest;

public interface TaskDispatcher {
    /*
     Routes a request read from an inbound task stream.
     Must not block the stream's read loop longer than the request's own deadline.
     */

    void dispatch(ServerStream from, TaskRequest request);
}
