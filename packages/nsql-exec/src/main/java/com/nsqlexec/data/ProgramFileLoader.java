package com.nsqlexec.data;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nsqlexec.program.CandidateProgram;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads generated programs: {@code {eid: {generations: [[program, score], ...]}}}. A generation
 * may also be {@code [program, question, score]}; the score is always the last element.
 */
public class ProgramFileLoader {

    /** Stands in for the programs of an example nothing was generated for. */
    public static final String DUMMY_PROGRAM = "<dummy program>";

    public Map<String, List<CandidateProgram>> load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IOException("Program file " + file + " must hold a JSON object keyed by eid");
            }
            Map<String, List<CandidateProgram>> programs = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
                programs.put(entry.getKey(), parseGenerations(entry.getValue()));
            }
            return programs;
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Malformed program file " + file + ": " + e.getMessage(), e);
        }
    }

    static List<CandidateProgram> parseGenerations(JsonElement entry) {
        JsonElement generations = entry.isJsonObject() ? entry.getAsJsonObject().get("generations") : null;
        if (generations == null || !generations.isJsonArray() || generations.getAsJsonArray().isEmpty()) {
            return Collections.singletonList(new CandidateProgram(DUMMY_PROGRAM, 0.0, 0));
        }
        List<CandidateProgram> programs = new ArrayList<>();
        int rank = 0;
        for (JsonElement generation : generations.getAsJsonArray()) {
            programs.add(parseGeneration(generation, rank++));
        }
        return programs;
    }

    private static CandidateProgram parseGeneration(JsonElement generation, int rank) {
        if (!generation.isJsonArray()) {
            return new CandidateProgram(generation.isJsonNull() ? "" : generation.getAsString(), 0.0, rank);
        }
        JsonArray parts = generation.getAsJsonArray();
        String text = parts.isEmpty() || parts.get(0).isJsonNull() ? "" : parts.get(0).getAsString();
        double score = parts.size() < 2 ? 0.0 : parseScore(parts.get(parts.size() - 1));
        return new CandidateProgram(text, score, rank);
    }

    private static double parseScore(JsonElement element) {
        if (element.isJsonNull()) {
            return Double.NaN;
        }
        try {
            return element.getAsDouble();
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
