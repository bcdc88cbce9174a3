package com.nsqlexec.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of executing one normalized program: either an answer (an ordered sequence of scalar
 * values, possibly empty) or a failure of a given kind. Immutable.
 */
public class ExecutionOutcome {

    private final List<Object> values;
    private final FailureKind failureKind;
    private final String message;

    private ExecutionOutcome(List<Object> values, FailureKind failureKind, String message) {
        this.values = values;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static ExecutionOutcome answer(List<?> values) {
        return new ExecutionOutcome(Collections.unmodifiableList(new ArrayList<Object>(values)), null, null);
    }

    public static ExecutionOutcome failure(FailureKind kind, String message) {
        return new ExecutionOutcome(Collections.emptyList(), Objects.requireNonNull(kind), message);
    }

    public boolean isAnswer() { return failureKind == null; }
    public boolean isFailure() { return failureKind != null; }

    /** Answer values; empty for a failure. */
    public List<Object> getValues() { return values; }

    /** Failure kind, or null for an answer. */
    public FailureKind getFailureKind() { return failureKind; }

    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionOutcome)) return false;
        ExecutionOutcome that = (ExecutionOutcome) o;
        return values.equals(that.values)
                && failureKind == that.failureKind
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, failureKind, message);
    }

    @Override
    public String toString() {
        return isAnswer() ? "Answer" + values : "Failure(" + failureKind + ": " + message + ")";
    }
}
