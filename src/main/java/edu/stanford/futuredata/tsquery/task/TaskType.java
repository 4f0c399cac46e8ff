package edu.stanford.futuredata.tsquery.task;

public enum TaskType {
    ROOT,
    INTERMEDIATE
}
