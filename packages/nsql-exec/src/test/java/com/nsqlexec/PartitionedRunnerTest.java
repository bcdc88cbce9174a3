package com.nsqlexec;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.nsqlexec.data.CheckpointWriter;
import com.nsqlexec.data.Example;
import com.nsqlexec.data.ResultWriter;
import com.nsqlexec.eval.DefaultAnswerEvaluator;
import com.nsqlexec.exec.HybridExecutor;
import com.nsqlexec.llm.OracleException;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.program.QueryNormalizer;
import com.nsqlexec.runner.ExampleProcessor;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.PartitionedRunner;
import com.nsqlexec.runner.RunSummary;
import com.nsqlexec.runner.RunnerException;
import com.nsqlexec.runner.WorkerContext;
import com.nsqlexec.runner.WorkerContextFactory;
import com.nsqlexec.table.TableStore;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.VotePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class PartitionedRunnerTest {

    @TempDir
    Path tempDir;

    private List<Example> examples;
    private Set<Integer> createdContexts;
    private WorkerContextFactory contextFactory;

    @BeforeEach
    void setUp() {
        TableStore table = TableStore.of("Medal Table", List.of("Nation", "Gold"), List.of(
                List.of("Spain", "13"),
                List.of("France", "8")));
        List<CandidateProgram> programs = List.of(
                new CandidateProgram("SELECT nation FROM w WHERE gold > 10", -0.1, 0),
                new CandidateProgram("SELECT nation FROM w ORDER BY gold DESC LIMIT 1", -0.2, 1));

        examples = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            List<Object> gold = List.of(i == 1 ? "France" : "Spain");
            examples.add(new Example(String.valueOf(i), "nu-" + i, "which nation won the most gold?", gold,
                    table, programs));
        }

        createdContexts = ConcurrentHashMap.newKeySet();
        contextFactory = workerId -> {
            createdContexts.add(workerId);
            HybridExecutor executor = new HybridExecutor((question, t, hints) -> {
                throw new OracleException("no oracle in this test");
            });
            return new WorkerContext(workerId, new QueryNormalizer(), executor, new ConsensusAggregator(),
                    VotePolicy.simple());
        };
    }

    /** Throws for eid 3. */
    private static ExampleProcessor crashingOnThree() {
        return new ExampleProcessor() {
            @Override
            public ExampleResult process(Example example, WorkerContext context) {
                if (example.getEid().equals("3")) {
                    throw new IllegalStateException("table exploded");
                }
                return super.process(example, context);
            }
        };
    }

    @Test
    void testResultsAreMergedInDatasetOrder() throws RunnerException {
        PartitionedRunner runner = new PartitionedRunner(2, contextFactory, new ExampleProcessor(),
                new DefaultAnswerEvaluator(), null);
        RunSummary summary = runner.run(examples);

        List<String> eids = new ArrayList<>();
        for (ExampleResult result : summary.getResults()) {
            eids.add(result.getEid());
            assertEquals(List.of("Spain"), result.getConsensus().getAnswer());
        }
        assertEquals(List.of("0", "1", "2", "3", "4"), eids);
        assertEquals(Set.of(0, 1), createdContexts);
        assertEquals(4, summary.getCorrect());
        assertEquals(5, summary.getTotal());
        assertEquals(0, summary.getScore("1"));
    }

    @Test
    void testFailingExampleBecomesSentinel() throws RunnerException {
        PartitionedRunner runner = new PartitionedRunner(3, contextFactory, crashingOnThree(),
                new DefaultAnswerEvaluator(), null);
        RunSummary summary = runner.run(examples);

        assertEquals(5, summary.getTotal());
        assertEquals(1, summary.getFailedExamples());
        ExampleResult sentinel = summary.getResults().get(3);
        assertTrue(sentinel.isFailed());
        assertTrue(sentinel.getError().contains("table exploded"));
        assertEquals(List.of(VotePolicy.DEFAULT_PLACEHOLDER), sentinel.getConsensus().getAnswer());
        assertEquals(3, summary.getCorrect());
    }

    @Test
    void testStackOverflowStaysWithItsExample() throws RunnerException {
        ExampleProcessor overflowing = new ExampleProcessor() {
            @Override
            public ExampleResult process(Example example, WorkerContext context) {
                if (example.getEid().equals("3")) {
                    throw new StackOverflowError("nested too deeply");
                }
                return super.process(example, context);
            }
        };
        PartitionedRunner runner = new PartitionedRunner(2, contextFactory, overflowing,
                new DefaultAnswerEvaluator(), null);
        RunSummary summary = runner.run(examples);

        assertEquals(5, summary.getTotal());
        assertEquals(1, summary.getFailedExamples());
        ExampleResult sentinel = summary.getResults().get(3);
        assertTrue(sentinel.isFailed());
        assertTrue(sentinel.getError().contains("StackOverflowError"));
        assertEquals(List.of("Spain"), summary.getResults().get(4).getConsensus().getAnswer());
    }

    @Test
    void testInternalErrorStopsRun() {
        ExampleProcessor broken = new ExampleProcessor() {
            @Override
            public ExampleResult process(Example example, WorkerContext context) {
                throw new InternalError("corrupted state");
            }
        };
        PartitionedRunner runner = new PartitionedRunner(2, contextFactory, broken,
                new DefaultAnswerEvaluator(), null);
        RunnerException e = assertThrows(RunnerException.class, () -> runner.run(examples));
        assertTrue(e.getCause() instanceof InternalError);
    }

    @Test
    void testEveryWorkerWritesCheckpoint() throws RunnerException {
        CheckpointWriter checkpoints = new CheckpointWriter(tempDir, "run");
        PartitionedRunner runner = new PartitionedRunner(3, contextFactory, new ExampleProcessor(),
                new DefaultAnswerEvaluator(), checkpoints);
        runner.run(examples);

        for (int w = 0; w < 3; w++) {
            assertTrue(Files.exists(checkpoints.fileFor(w)), "missing checkpoint of worker " + w);
        }
    }

    @Test
    void testEmptyInput() throws RunnerException {
        PartitionedRunner runner = new PartitionedRunner(4, contextFactory, new ExampleProcessor(),
                new DefaultAnswerEvaluator(), null);
        RunSummary summary = runner.run(Collections.emptyList());
        assertEquals(0, summary.getTotal());
        assertEquals(0.0, summary.getAccuracy());
    }

    @Test
    void testNonPositiveWorkerCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionedRunner(0, contextFactory,
                new ExampleProcessor(), new DefaultAnswerEvaluator(), null));
    }

    @Test
    void testResultFile() throws RunnerException, IOException {
        PartitionedRunner runner = new PartitionedRunner(2, contextFactory, crashingOnThree(),
                new DefaultAnswerEvaluator(), null);
        RunSummary summary = runner.run(examples);

        Path output = tempDir.resolve("out").resolve("result.json");
        new ResultWriter().write(output, summary);

        JsonObject root = JsonParser.parseString(Files.readString(output)).getAsJsonObject();
        assertEquals(5, root.size());
        JsonObject first = root.getAsJsonObject("0");
        assertEquals("Spain", first.getAsJsonArray("consensus_answer").get(0).getAsString());
        assertEquals(2, first.getAsJsonArray("supporting_program_ids").size());
        assertEquals(1, first.get("correct").getAsInt());
        assertEquals(0, root.getAsJsonObject("1").get("correct").getAsInt());
        assertTrue(root.getAsJsonObject("3").has("error"));
    }
}
