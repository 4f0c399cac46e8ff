package edu.stanford.futuredata.tsquery.rpc;

import edu.stanford.futuredata.tsquery.TaskResponse;

public interface TaskReceiver {
    void receive(TaskResponse response);
}
