package edu.stanford.futuredata.tsquery.utilities;

/**
 * Failure of a distributed query. The message is what travels in {@code TaskResponse.errMsg}
 * and what the caller finally sees.
 */
public class QueryException extends Exception {

    public static final String NO_AVAILABLE_STORAGE_NODE = "no available storage node for server";
    public static final String NO_SEND_STREAM = "no send stream";
    public static final String TASK_SEND = "send task request error";

    private final ErrorKind kind;

    public QueryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static QueryException noAvailableStorageNode() {
        return new QueryException(ErrorKind.PLANNING, NO_AVAILABLE_STORAGE_NODE);
    }

    public static QueryException unsupportedStatement(String detail) {
        return new QueryException(ErrorKind.PLANNING, "unsupported statement: " + detail);
    }

    public static QueryException inconsistentShards(String detail) {
        return new QueryException(ErrorKind.PLANNING, "inconsistent shard assignment: " + detail);
    }

    public static QueryException databaseNotFound(String database) {
        return new QueryException(ErrorKind.PLANNING, "database not found: " + database);
    }

    public static QueryException noSendStream(String target) {
        return new QueryException(ErrorKind.TRANSPORT, NO_SEND_STREAM + " to " + target);
    }

    public static QueryException taskSend(String target, Throwable cause) {
        return new QueryException(ErrorKind.TRANSPORT, TASK_SEND + " to " + target, cause);
    }

    public static QueryException transport(String message, Throwable cause) {
        return new QueryException(ErrorKind.TRANSPORT, message, cause);
    }

    public static QueryException timeout(String taskID) {
        return new QueryException(ErrorKind.EXECUTION, "task " + taskID + " timed out");
    }

    public static QueryException shardNotFound(int shardID) {
        return new QueryException(ErrorKind.EXECUTION, "shard not found: " + shardID);
    }

    public static QueryException indexRead(Throwable cause) {
        return new QueryException(ErrorKind.EXECUTION, "index read error: " + cause.getMessage(), cause);
    }

    public static QueryException tagKeyNotFound(String tagKey) {
        return new QueryException(ErrorKind.EXECUTION, "tag key not found: " + tagKey);
    }

    public static QueryException panic(Throwable cause) {
        return new QueryException(ErrorKind.EXECUTION, "task panicked: " + cause, cause);
    }

    public static QueryException remote(String errMsg) {
        return new QueryException(ErrorKind.EXECUTION, errMsg);
    }

    public static QueryException malformedRequest(String detail) {
        return new QueryException(ErrorKind.PROTOCOL, "malformed request: " + detail);
    }

    public static QueryException unknownMetadataType(Object type) {
        return new QueryException(ErrorKind.PROTOCOL, "unknown metadata type: " + type);
    }

    public static QueryException cancelled(String taskID) {
        return new QueryException(ErrorKind.CANCELLED, "task " + taskID + " cancelled");
    }
}
