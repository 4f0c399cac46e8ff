package edu.stanford.futuredata.tsquery.utilities;

public enum ErrorKind {
    PLANNING,
    TRANSPORT,
    EXECUTION,
    PROTOCOL,
    CANCELLED
}
