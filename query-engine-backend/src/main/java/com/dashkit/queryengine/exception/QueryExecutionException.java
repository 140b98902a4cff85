package com.dashkit.queryengine.exception;

/**
 * Backend rejected or failed a query. The backend's own message is carried in the message
 * text and the original exception is kept as the cause.
 */
public class QueryExecutionException extends QueryEngineException {
    public static final String TIMEOUT_CODE = "QUERY_TIMEOUT";

    public QueryExecutionException(String message) {
        super("EXECUTION_ERROR", message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super("EXECUTION_ERROR", message, cause);
    }

    private QueryExecutionException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static QueryExecutionException timeout(long timeoutMs, Throwable cause) {
        return new QueryExecutionException(TIMEOUT_CODE, "Query timed out after " + timeoutMs + "ms", cause);
    }

    public boolean isTimeout() {
        return TIMEOUT_CODE.equals(getCode());
    }
}
