package com.nsqlexec.data;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.ProgramExecution;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.ConsensusResult;
import com.nsqlexec.vote.VotePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads per-worker checkpoints back and votes again on the stored outcomes, so a run can be
 * re-scored under another vote policy without executing any program.
 */
public class CheckpointReader {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointReader.class);

    private final ConsensusAggregator aggregator;
    private final VotePolicy policy;

    public CheckpointReader(ConsensusAggregator aggregator, VotePolicy policy) {
        this.aggregator = aggregator;
        this.policy = policy;
    }

    /**
     * Checkpoint files of the given prefix in {@code dir}, ordered by worker id.
     */
    public List<Path> findCheckpoints(Path dir, String prefix) throws IOException {
        Pattern name = Pattern.compile(Pattern.quote(prefix + CheckpointWriter.TMP_MARKER) + "(\\d+)\\.json");
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> name.matcher(p.getFileName().toString()).matches())
                    .sorted(Comparator.comparingInt(p -> workerId(name, p)))
                    .collect(Collectors.toList());
        }
    }

    private static int workerId(Pattern name, Path file) {
        Matcher matcher = name.matcher(file.getFileName().toString());
        return matcher.matches() ? Integer.parseInt(matcher.group(1)) : Integer.MAX_VALUE;
    }

    /**
     * All results stored under {@code dir}, ordered by eid.
     */
    public List<ExampleResult> readAll(Path dir, String prefix) throws IOException {
        List<ExampleResult> results = new ArrayList<>();
        for (Path file : findCheckpoints(dir, prefix)) {
            List<ExampleResult> read = read(file);
            logger.info("Read {} results from {}", read.size(), file);
            results.addAll(read);
        }
        results.sort(Comparator.comparing(ExampleResult::getEid, CheckpointReader::compareEids));
        return results;
    }

    public List<ExampleResult> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IOException("Checkpoint " + file + " must hold a JSON object keyed by eid");
            }
            List<ExampleResult> results = new ArrayList<>();
            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
                results.add(toResult(entry.getKey(), entry.getValue().getAsJsonObject()));
            }
            return results;
        } catch (RuntimeException e) {
            throw new IOException("Malformed checkpoint " + file + ": " + e.getMessage(), e);
        }
    }

    ExampleResult toResult(String eid, JsonObject json) {
        String question = JsonValues.getString(json, "question");
        List<Object> gold = JsonValues.toList(json.get("gold_answer"));
        if (json.has("failed") && json.get("failed").getAsBoolean()) {
            return ExampleResult.failed(eid, question, gold, JsonValues.getString(json, "error"),
                    policy.getAnswerPlaceholder());
        }

        List<ProgramExecution> executions = new ArrayList<>();
        JsonElement programs = json.get("programs");
        if (programs != null && programs.isJsonArray()) {
            for (JsonElement element : programs.getAsJsonArray()) {
                JsonObject entry = element.getAsJsonObject();
                CandidateProgram program = new CandidateProgram(JsonValues.getString(entry, "program"),
                        entry.get("score").getAsDouble(), entry.get("rank").getAsInt());
                executions.add(new ProgramExecution(program, JsonValues.getString(entry, "normalized"),
                        toOutcome(entry.getAsJsonObject("outcome"))));
            }
        }
        ExampleResult result = ExampleResult.completed(eid, question, gold, executions,
                ConsensusResult.placeholder(policy.getAnswerPlaceholder()));
        return result.withConsensus(aggregator.aggregate(result.candidateOutcomes(), policy));
    }

    static ExecutionOutcome toOutcome(JsonObject json) {
        if (CheckpointWriter.STATUS_ANSWER.equals(JsonValues.getString(json, "status"))) {
            return ExecutionOutcome.answer(JsonValues.toList(json.get("values")));
        }
        return ExecutionOutcome.failure(FailureKind.valueOf(JsonValues.getString(json, "kind")),
                JsonValues.getString(json, "message"));
    }

    /** Numeric eids in numeric order, others after them in string order. */
    static int compareEids(String a, String b) {
        boolean numericA = a.matches("\\d+");
        boolean numericB = b.matches("\\d+");
        if (numericA && numericB) {
            int cmp = Integer.compare(a.length(), b.length());
            return cmp != 0 ? cmp : a.compareTo(b);
        }
        if (numericA != numericB) {
            return numericA ? -1 : 1;
        }
        return a.compareTo(b);
    }
}
