package com.nsqlexec.exec;

import com.nsqlexec.table.TableStore;

import java.util.HashMap;
import java.util.Map;

/**
 * Outcomes of the programs executed against one table, keyed by normalized program text. The
 * computation runs at most once per distinct text. Scoped to a single table and a single worker;
 * not thread-safe.
 */
public class ExecutionCache {

    /** Produces the outcome of a normalized program. */
    public interface Computation {
        ExecutionOutcome compute(String normalizedText);
    }

    private final TableStore table;
    private final Map<String, ExecutionOutcome> outcomes = new HashMap<>();
    private int hits;
    private int misses;

    public ExecutionCache(TableStore table) {
        this.table = table;
    }

    /**
     * @throws IllegalArgumentException if {@code table} is not the table this cache was made for
     */
    public ExecutionOutcome getOrCompute(String normalizedText, TableStore table, Computation computation) {
        if (table != this.table) {
            throw new IllegalArgumentException("Execution cache is scoped to table '" + this.table.getTitle()
                    + "', got '" + (table == null ? null : table.getTitle()) + "'");
        }
        ExecutionOutcome cached = outcomes.get(normalizedText);
        if (cached != null) {
            hits++;
            return cached;
        }

        misses++;
        ExecutionOutcome outcome;
        try {
            outcome = computation.compute(normalizedText);
        } catch (RuntimeException e) {
            outcome = ExecutionOutcome.failure(FailureKind.EXECUTION_ERROR, e.toString());
        }
        if (outcome == null) {
            outcome = ExecutionOutcome.failure(FailureKind.EXECUTION_ERROR, "no outcome produced");
        }
        outcomes.put(normalizedText, outcome);
        return outcome;
    }

    public TableStore getTable() { return table; }
    public int size() { return outcomes.size(); }
    public int getHits() { return hits; }
    public int getMisses() { return misses; }
}
