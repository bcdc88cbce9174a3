package com.nsqlexec.vote;

import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.exec.SqlValues;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Canonical, order-insensitive form of an execution outcome used to compare answers in a vote.
 * Failures map to {@link #ERROR}; answers without non-null values map to {@link #EMPTY}.
 */
public final class VotingKey implements Comparable<VotingKey> {

    public enum Kind { ERROR, EMPTY, ANSWER }

    public static final VotingKey ERROR = new VotingKey(Kind.ERROR, Collections.emptySortedSet());
    public static final VotingKey EMPTY = new VotingKey(Kind.EMPTY, Collections.emptySortedSet());

    private final Kind kind;
    private final SortedSet<String> values;

    private VotingKey(Kind kind, SortedSet<String> values) {
        this.kind = kind;
        this.values = values;
    }

    public static VotingKey of(ExecutionOutcome outcome) {
        if (outcome == null || outcome.isFailure()) {
            return ERROR;
        }
        return ofValues(outcome.getValues());
    }

    public static VotingKey ofValues(Collection<?> answer) {
        SortedSet<String> canonical = new TreeSet<>();
        for (Object value : answer) {
            if (value != null) {
                canonical.add(canonical(value));
            }
        }
        if (canonical.isEmpty()) {
            return EMPTY;
        }
        return new VotingKey(Kind.ANSWER, Collections.unmodifiableSortedSet(canonical));
    }

    /** Numbers compare by value ({@code 2}, {@code 2.0}, {@code "2"}); text by its trimmed form. */
    static String canonical(Object value) {
        BigDecimal number = SqlValues.toNumber(value);
        if (number != null) {
            return SqlValues.render(number);
        }
        return value.toString().trim();
    }

    public Kind getKind() { return kind; }
    public SortedSet<String> getValues() { return values; }
    public boolean isError() { return kind == Kind.ERROR; }
    public boolean isEmpty() { return kind == Kind.EMPTY; }

    @Override
    public int compareTo(VotingKey other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VotingKey)) return false;
        VotingKey that = (VotingKey) o;
        return kind == that.kind && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return kind == Kind.ANSWER ? values.toString() : "<" + kind.name().toLowerCase(Locale.ROOT) + ">";
    }
}
