package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.series.SeriesAggregator;
import edu.stanford.futuredata.tsquery.series.TimeSeriesEvent;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;

public class IntermediateResultMerger implements ResultMerger {
    private static final Logger logger = LoggerFactory.getLogger(IntermediateResultMerger.class);

    private final TaskManager taskManager;
    private final String parentNode;
    private final String parentTaskID;
    private final SeriesAggregator aggregator = new SeriesAggregator();
    private boolean done = false;
    private Future<?> timeout = null;

    public IntermediateResultMerger(TaskManager taskManager, String parentNode, String parentTaskID) {
        this.taskManager = taskManager;
        this.parentNode = parentNode;
        this.parentTaskID = parentTaskID;
    }

    public synchronized void setTimeout(Future<?> timeout) {
        if (done) {
            timeout.cancel(false);
        } else {
            this.timeout = timeout;
        }
    }

    @Override
    public void merge(TaskResponse response) throws QueryException {
        if (response.getPayload().isEmpty()) {
            return;
        }
        TimeSeriesEvent event = Utilities.byteStringToObject(response.getPayload(), TimeSeriesEvent.class);
        synchronized (this) {
            if (!done) {
                aggregator.addAll(event.series);
            }
        }
    }

    @Override
    public void complete(QueryException error) {
        TaskResponse.Builder response = TaskResponse.newBuilder()
                .setTaskID(parentTaskID)
                .setCompleted(true)
                .setSendNode(taskManager.getIndicator());
        synchronized (this) {
            done = true;
            if (timeout != null) {
                timeout.cancel(false);
            }
            if (error != null) {
                response.setErrMsg(error.getMessage());
            } else {
                response.setPayload(Utilities.objectToByteString(new TimeSeriesEvent(aggregator.result(0))));
            }
        }
        try {
            taskManager.sendResponse(parentNode, response.build());
        } catch (QueryException e) {
            logger.warn("Intermediate {} could not forward task {} to {}: {}", taskManager.getIndicator(),
                    parentTaskID, parentNode, e.getMessage());
        }
    }
}
