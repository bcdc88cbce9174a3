package com.nsqlexec;

import com.nsqlexec.data.CheckpointReader;
import com.nsqlexec.data.CheckpointWriter;
import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.ProgramExecution;
import com.nsqlexec.vote.CandidateOutcome;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.VotePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointRoundTripTest {

    private static final String PREFIX = "run";

    @TempDir
    Path tempDir;

    private CheckpointWriter writer;
    private ConsensusAggregator aggregator;

    @BeforeEach
    void setUp() {
        writer = new CheckpointWriter(tempDir, PREFIX);
        aggregator = new ConsensusAggregator();
    }

    private ExampleResult example(String eid) {
        List<ProgramExecution> executions = new ArrayList<>();
        executions.add(new ProgramExecution(new CandidateProgram("SELECT a", 0.0, 0), "SELECT a",
                ExecutionOutcome.answer(List.of("Spain"))));
        executions.add(new ProgramExecution(new CandidateProgram("SELECT b", -5.0, 1), "SELECT b",
                ExecutionOutcome.answer(List.of("France"))));
        executions.add(new ProgramExecution(new CandidateProgram("SELECT c", -5.0, 2), "SELECT c",
                ExecutionOutcome.answer(List.of("France"))));
        executions.add(new ProgramExecution(new CandidateProgram("SELEC d", Double.NaN, 3), "SELEC d",
                ExecutionOutcome.failure(FailureKind.PARSE_ERROR, "bad syntax")));

        List<CandidateOutcome> candidates = new ArrayList<>();
        for (ProgramExecution execution : executions) {
            candidates.add(execution.toCandidateOutcome());
        }
        return ExampleResult.completed(eid, "who won?", List.of("Spain"), executions,
                aggregator.aggregate(candidates, VotePolicy.simple()));
    }

    @Test
    void testCheckpointFileName() {
        assertEquals(tempDir.resolve("run_tmp_3.json"), writer.fileFor(3));
    }

    @Test
    void testStoredOutcomesAreVotedAgainOnRead() throws IOException {
        ExampleResult original = example("0");
        assertEquals(List.of("France"), original.getConsensus().getAnswer());
        writer.write(0, List.of(original));

        List<ExampleResult> simple = new CheckpointReader(aggregator, VotePolicy.simple()).readAll(tempDir, PREFIX);
        assertEquals(1, simple.size());
        assertEquals(List.of("France"), simple.get(0).getConsensus().getAnswer());
        assertEquals(4, simple.get(0).getExecutions().size());

        List<ExampleResult> prob = new CheckpointReader(aggregator, VotePolicy.prob()).readAll(tempDir, PREFIX);
        assertEquals(List.of("Spain"), prob.get(0).getConsensus().getAnswer());
    }

    @Test
    void testExecutionDetailsSurvive() throws IOException {
        writer.write(0, List.of(example("0")));

        ExampleResult read = new CheckpointReader(aggregator, VotePolicy.simple()).readAll(tempDir, PREFIX).get(0);
        assertEquals("who won?", read.getQuestion());
        assertEquals(List.of("Spain"), read.getGoldAnswer());
        ProgramExecution failed = read.getExecutions().get(3);
        assertEquals("SELEC d", failed.getProgram().getText());
        assertEquals(3, failed.getProgram().getRank());
        assertTrue(Double.isNaN(failed.getProgram().getScore()));
        assertEquals(FailureKind.PARSE_ERROR, failed.getOutcome().getFailureKind());
        assertEquals("bad syntax", failed.getOutcome().getMessage());
        assertEquals(1, read.getConsensus().getFailedPrograms().size());
    }

    @Test
    void testSentinelsAndOrderingAcrossWorkers() throws IOException {
        writer.write(0, List.of(example("0"), example("10")));
        writer.write(1, List.of(example("1"),
                ExampleResult.failed("9", "q", List.of("x"), "boom", VotePolicy.DEFAULT_PLACEHOLDER)));
        Files.writeString(tempDir.resolve("other_tmp_0.json"), "{}");

        CheckpointReader reader = new CheckpointReader(aggregator, VotePolicy.simple().withAnswerPlaceholder("N/A"));
        assertEquals(2, reader.findCheckpoints(tempDir, PREFIX).size());

        List<ExampleResult> results = reader.readAll(tempDir, PREFIX);
        List<String> eids = new ArrayList<>();
        for (ExampleResult result : results) {
            eids.add(result.getEid());
        }
        assertEquals(List.of("0", "1", "9", "10"), eids);

        ExampleResult sentinel = results.get(2);
        assertTrue(sentinel.isFailed());
        assertEquals("boom", sentinel.getError());
        assertEquals(List.of("N/A"), sentinel.getConsensus().getAnswer());
    }

    @Test
    void testMalformedCheckpointIsRejected() throws IOException {
        Path file = tempDir.resolve("run_tmp_0.json");
        Files.writeString(file, "{\"0\": {\"question\": \"q\", \"programs\": [{\"rank\": 0}]}}");
        assertThrows(IOException.class, () -> new CheckpointReader(aggregator, VotePolicy.simple()).read(file));
    }
}
