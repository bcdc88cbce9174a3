package com.nsqlexec;

import com.nsqlexec.data.Example;
import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.exec.HybridExecutor;
import com.nsqlexec.llm.OracleException;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.program.QueryNormalizer;
import com.nsqlexec.runner.ExampleProcessor;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.ProgramExecution;
import com.nsqlexec.runner.WorkerContext;
import com.nsqlexec.table.TableStore;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.VotePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExampleProcessorTest {

    private TableStore table;
    private CountingExecutor executor;
    private WorkerContext context;
    private ExampleProcessor processor;

    @BeforeEach
    void setUp() {
        table = TableStore.of("Medal Table", List.of("Nation", "Gold"), List.of(
                List.of("Spain", "13"),
                List.of("France", "8")));
        executor = new CountingExecutor();
        context = new WorkerContext(0, new QueryNormalizer(), executor, new ConsensusAggregator(),
                VotePolicy.simple());
        processor = new ExampleProcessor();
    }

    private Example example(String... programs) {
        List<CandidateProgram> candidates = new ArrayList<>();
        for (int i = 0; i < programs.length; i++) {
            candidates.add(new CandidateProgram(programs[i], -0.1 * i, i));
        }
        return new Example("7", "nu-7", "Which nation won the most gold medals?", List.of("Spain"), table,
                candidates);
    }

    @Test
    void testFailingCandidateIsIsolated() {
        ExampleResult result = processor.process(example(
                "SELECT nation FROM w ORDER BY gold DESC LIMIT 1",
                "EXPLODE",
                "SELECT `Nation` FROM w WHERE `Gold` > 10"), context);

        assertFalse(result.isFailed());
        assertEquals(List.of("Spain"), result.getConsensus().getAnswer());
        assertEquals(2, result.getConsensus().getSupportingPrograms().size());
        assertEquals(1, result.getConsensus().getFailedPrograms().size());
        assertEquals(1, result.getConsensus().getFailedPrograms().get(0).getProgram().getRank());

        ExecutionOutcome failed = result.getExecutions().get(1).getOutcome();
        assertEquals(FailureKind.EXECUTION_ERROR, failed.getFailureKind());
    }

    @Test
    void testCandidatesNormalizingToTheSameTextExecuteOnce() {
        ExampleResult result = processor.process(example(
                "SELECT nation FROM w WHERE gold > 10",
                "SELECT `Nation` FROM `Medal Table` WHERE `Gold` > 10"), context);

        assertEquals(1, executor.calls.size());
        List<ProgramExecution> executions = result.getExecutions();
        assertEquals(executions.get(0).getNormalizedText(), executions.get(1).getNormalizedText());
        assertSame(executions.get(0).getOutcome(), executions.get(1).getOutcome());
        assertEquals(List.of("Spain"), result.getConsensus().getAnswer());
    }

    @Test
    void testExampleWithoutUsableProgramGetsPlaceholder() {
        ExampleResult result = processor.process(example("<dummy program>"), context);
        assertTrue(result.getConsensus().isPlaceholder());
        assertEquals(List.of(VotePolicy.DEFAULT_PLACEHOLDER), result.getConsensus().getAnswer());
        assertEquals("7", result.getEid());
        assertEquals(List.of("Spain"), result.getGoldAnswer());
    }

    /** Counts executions; the program text EXPLODE throws instead of returning an outcome. */
    private static class CountingExecutor extends HybridExecutor {
        final List<String> calls = new ArrayList<>();

        CountingExecutor() {
            super((question, table, hintColumns) -> {
                throw new OracleException("no oracle in this test");
            });
        }

        @Override
        public ExecutionOutcome execute(String normalizedText, TableStore table, String question) {
            calls.add(normalizedText);
            if (normalizedText.equals("EXPLODE")) {
                throw new IllegalStateException("executor crashed");
            }
            return super.execute(normalizedText, table, question);
        }
    }
}
