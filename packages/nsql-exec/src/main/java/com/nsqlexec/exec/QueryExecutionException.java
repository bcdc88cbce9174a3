package com.nsqlexec.exec;

/**
 * Raised while parsing or evaluating a single program. Never escapes
 * {@link HybridExecutor#execute}; it is converted to a failed {@link ExecutionOutcome} there.
 */
public class QueryExecutionException extends Exception {

    private final FailureKind kind;

    public QueryExecutionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryExecutionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() { return kind; }

    public static QueryExecutionException parse(String message) {
        return new QueryExecutionException(FailureKind.PARSE_ERROR, message);
    }

    public static QueryExecutionException execution(String message) {
        return new QueryExecutionException(FailureKind.EXECUTION_ERROR, message);
    }

    public static QueryExecutionException oracle(String message, Throwable cause) {
        return new QueryExecutionException(FailureKind.ORACLE_ERROR, message, cause);
    }
}
