package com.nsqlexec;

import com.nsqlexec.exec.ExecutionCache;
import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.table.TableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionCacheTest {

    private TableStore table;
    private ExecutionCache cache;
    private List<String> computed;

    @BeforeEach
    void setUp() {
        table = TableStore.of("t", List.of("a"), List.of(List.of("1")));
        cache = new ExecutionCache(table);
        computed = new ArrayList<>();
    }

    private ExecutionOutcome compute(String text) {
        computed.add(text);
        return ExecutionOutcome.answer(List.of(text.length()));
    }

    @Test
    void testComputesOncePerDistinctText() {
        for (int i = 0; i < 5; i++) {
            cache.getOrCompute("SELECT 1", table, this::compute);
            cache.getOrCompute("SELECT 2", table, this::compute);
        }
        assertEquals(List.of("SELECT 1", "SELECT 2"), computed);
        assertEquals(2, cache.size());
        assertEquals(2, cache.getMisses());
        assertEquals(8, cache.getHits());
    }

    @Test
    void testRepeatedRequestsReturnTheSameOutcome() {
        ExecutionOutcome first = cache.getOrCompute("SELECT 1", table, this::compute);
        ExecutionOutcome second = cache.getOrCompute("SELECT 1", table, text -> {
            throw new AssertionError("must not recompute");
        });
        assertSame(first, second);
    }

    @Test
    void testFailuresAreCachedToo() {
        ExecutionOutcome failed = cache.getOrCompute("SELECT x", table, text -> {
            computed.add(text);
            throw new IllegalStateException("boom");
        });
        assertEquals(FailureKind.EXECUTION_ERROR, failed.getFailureKind());
        assertSame(failed, cache.getOrCompute("SELECT x", table, this::compute));
        assertEquals(1, computed.size());
    }

    @Test
    void testMissingOutcomeBecomesFailure() {
        ExecutionOutcome outcome = cache.getOrCompute("SELECT 1", table, text -> null);
        assertTrue(outcome.isFailure());
    }

    @Test
    void testCacheIsScopedToItsTable() {
        TableStore other = TableStore.of("t", List.of("a"), List.of(List.of("1")));
        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompute("SELECT 1", other, this::compute));
        assertTrue(computed.isEmpty());
    }
}
