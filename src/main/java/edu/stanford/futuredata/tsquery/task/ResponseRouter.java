package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.rpc.TaskReceiver;

public class ResponseRouter implements TaskReceiver {

    private final TaskManager taskManager;

    public ResponseRouter(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public void receive(TaskResponse response) {
        taskManager.receive(response);
    }
}
