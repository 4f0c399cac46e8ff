package edu.stanford.futuredata.tsquery.task;

import edu.stanford.futuredata.tsquery.TaskResponse;
import edu.stanford.futuredata.tsquery.utilities.QueryException;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-task state on a root or intermediate node: Pending, then Merging, then Completed or
 * Errored. The terminal transition happens once.
 */
public class TaskContext {

    public final String taskID;
    public final TaskType taskType;
    public final String parentNode;
    public final String parentTaskID;

    private final ResultMerger merger;
    private final AtomicInteger expectResults;
    private final AtomicReference<QueryException> error = new AtomicReference<>();
    private final AtomicBoolean terminal = new AtomicBoolean(false);

    public TaskContext(String taskID, TaskType taskType, String parentNode, String parentTaskID,
                       int expectResults, ResultMerger merger) {
        this.taskID = taskID;
        this.taskType = taskType;
        this.parentNode = parentNode;
        this.parentTaskID = parentTaskID;
        this.expectResults = new AtomicInteger(expectResults);
        this.merger = merger;
    }

    /** Returns true if this response moved the task to a terminal state. */
    public boolean receiveResult(TaskResponse response) {
        if (terminal.get()) {
            return false;
        }
        if (!response.getErrMsg().isEmpty()) {
            return fail(QueryException.remote(response.getErrMsg()));
        }
        try {
            merger.merge(response);
        } catch (QueryException e) {
            return fail(e);
        }
        if (response.getCompleted() && expectResults.decrementAndGet() == 0) {
            return finish(null);
        }
        return false;
    }

    public boolean fail(QueryException e) {
        error.compareAndSet(null, e);
        expectResults.set(0);
        return finish(error.get());
    }

    private boolean finish(QueryException err) {
        if (!terminal.compareAndSet(false, true)) {
            return false;
        }
        merger.complete(err);
        return true;
    }

    public boolean isCompleted() {
        return expectResults.get() <= 0;
    }

    public boolean isTerminal() {
        return terminal.get();
    }

    public Optional<QueryException> getError() {
        return Optional.ofNullable(error.get());
    }

    @Override
    public String toString() {
        return "TaskContext{" + taskID + " " + taskType + " expect=" + expectResults.get() + "}";
    }
}
