package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.utilities.QueryException;

public interface ResultMerger {
    /*
     Combines the partial results of one task.
     Implementations synchronize their own state: responses of a task may arrive on several streams at once.
     */

    // Fold one successful response into the partial result.
    void merge(TaskResponse response) throws QueryException;
    // Called exactly once when the task turns terminal; error is null on success.
    void complete(QueryException error);
}
