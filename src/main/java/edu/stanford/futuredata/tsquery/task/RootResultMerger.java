package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.series.SeriesAggregator;
import edu.stanford.futuredata.tsquery.series.TimeSeriesEvent;
import edu.stanford.futuredata.tsquery.utilities.QueryException;
import edu.stanford.futuredata.tsquery.utilities.Utilities;

public class RootResultMerger implements ResultMerger {

    private final JobContext<TimeSeriesEvent> job;
    private final int limit;
    private final SeriesAggregator aggregator = new SeriesAggregator();
    private boolean done = false;

    public RootResultMerger(JobContext<TimeSeriesEvent> job, int limit) {
        this.job = job;
        this.limit = limit;
    }

    @Override
    public void merge(TaskResponse response) throws QueryException {
        if (response.getPayload().isEmpty()) {
            if (!response.getCompleted()) {
                // Intermediate accepted its task.
                job.intermediateAccepted();
            }
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
        TimeSeriesEvent event;
        synchronized (this) {
            done = true;
            if (error != null) {
                job.fail(error);
                return;
            }
            event = new TimeSeriesEvent(aggregator.result(limit));
        }
        job.emit(event);
    }
}
