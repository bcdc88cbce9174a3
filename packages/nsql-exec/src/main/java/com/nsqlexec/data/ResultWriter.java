package com.nsqlexec.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.RunSummary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the final output of a run: eid to question, gold answer, consensus answer, the ranks of
 * the programs that support it and the correctness score.
 */
public class ResultWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public void write(Path file, RunSummary summary) throws IOException {
        JsonObject root = new JsonObject();
        for (ExampleResult result : summary.getResults()) {
            JsonObject json = new JsonObject();
            json.addProperty("question", result.getQuestion());
            json.add("gold_answer", JsonValues.toJson(result.getGoldAnswer()));
            json.add("consensus_answer", JsonValues.toJson(result.getConsensus().getAnswer()));
            JsonArray support = new JsonArray();
            for (CandidateProgram program : result.getConsensus().getSupportingPrograms()) {
                support.add(program.getRank());
            }
            json.add("supporting_program_ids", support);
            json.addProperty("correct", summary.getScore(result.getEid()));
            if (result.isFailed()) {
                json.addProperty("error", result.getError());
            }
            root.add(result.getEid(), json);
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, gson.toJson(root), StandardCharsets.UTF_8);
    }
}
