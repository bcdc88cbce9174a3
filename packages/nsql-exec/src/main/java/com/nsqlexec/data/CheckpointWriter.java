package com.nsqlexec.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.ProgramExecution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the results of one worker to {@code <saveDir>/<prefix>_tmp_<workerId>.json}, keyed by
 * eid, with every executed program and its outcome. Safe for concurrent use by several workers
 * since each writes its own file.
 */
public class CheckpointWriter {

    static final String TMP_MARKER = "_tmp_";

    static final String STATUS_ANSWER = "answer";
    static final String STATUS_FAILURE = "failure";

    private final Path saveDir;
    private final String prefix;
    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .serializeNulls()
            .create();

    public CheckpointWriter(Path saveDir, String prefix) {
        this.saveDir = saveDir;
        this.prefix = prefix;
    }

    public Path fileFor(int workerId) {
        return saveDir.resolve(prefix + TMP_MARKER + workerId + ".json");
    }

    public Path write(int workerId, List<ExampleResult> results) throws IOException {
        JsonObject root = new JsonObject();
        for (ExampleResult result : results) {
            root.add(result.getEid(), toJson(result));
        }
        Files.createDirectories(saveDir);
        Path file = fileFor(workerId);
        Files.writeString(file, gson.toJson(root), StandardCharsets.UTF_8);
        return file;
    }

    static JsonObject toJson(ExampleResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("question", result.getQuestion());
        json.add("gold_answer", JsonValues.toJson(result.getGoldAnswer()));
        json.addProperty("failed", result.isFailed());
        if (result.isFailed()) {
            json.addProperty("error", result.getError());
        }
        json.add("consensus_answer", JsonValues.toJson(result.getConsensus().getAnswer()));

        JsonArray programs = new JsonArray();
        for (ProgramExecution execution : result.getExecutions()) {
            CandidateProgram program = execution.getProgram();
            JsonObject entry = new JsonObject();
            entry.addProperty("rank", program.getRank());
            entry.addProperty("program", program.getText());
            entry.addProperty("normalized", execution.getNormalizedText());
            entry.addProperty("score", program.getScore());
            entry.add("outcome", toJson(execution.getOutcome()));
            programs.add(entry);
        }
        json.add("programs", programs);
        return json;
    }

    static JsonObject toJson(ExecutionOutcome outcome) {
        JsonObject json = new JsonObject();
        if (outcome.isAnswer()) {
            json.addProperty("status", STATUS_ANSWER);
            json.add("values", JsonValues.toJson(outcome.getValues()));
        } else {
            json.addProperty("status", STATUS_FAILURE);
            json.addProperty("kind", outcome.getFailureKind().name());
            json.addProperty("message", outcome.getMessage());
        }
        return json;
    }
}
