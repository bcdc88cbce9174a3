package com.nsqlexec.data;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.table.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads a dataset split and joins it with the generated programs.
 *
 * <p>The dataset is a JSON array of
 * {@code {id, question, answer_text, table: {page_title, header, rows}}}. The eid of an example
 * is its index in the array. Examples without an entry in the program map are skipped.
 */
public class DatasetLoader {

    private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);

    public List<Example> load(Path dataset, Map<String, List<CandidateProgram>> programs) throws IOException {
        JsonArray items;
        try (Reader reader = Files.newBufferedReader(dataset, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonArray()) {
                throw new IOException("Dataset " + dataset + " must hold a JSON array of examples");
            }
            items = root.getAsJsonArray();
        } catch (JsonParseException e) {
            throw new IOException("Malformed dataset " + dataset + ": " + e.getMessage(), e);
        }

        List<Example> examples = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            String eid = String.valueOf(i);
            List<CandidateProgram> candidates = programs.get(eid);
            if (candidates == null) {
                continue;
            }
            try {
                examples.add(toExample(eid, items.get(i).getAsJsonObject(), candidates));
            } catch (IllegalStateException | ClassCastException e) {
                throw new IOException("Malformed example " + eid + " in " + dataset + ": " + e.getMessage(), e);
            }
        }
        logger.info("Loaded {} of {} examples from {}", examples.size(), items.size(), dataset);
        return examples;
    }

    static Example toExample(String eid, JsonObject item, List<CandidateProgram> programs) {
        JsonObject tableJson = item.has("table") && item.get("table").isJsonObject()
                ? item.getAsJsonObject("table")
                : new JsonObject();
        List<List<Object>> rows = new ArrayList<>();
        JsonElement rowsJson = tableJson.get("rows");
        if (rowsJson != null && rowsJson.isJsonArray()) {
            for (JsonElement row : rowsJson.getAsJsonArray()) {
                rows.add(JsonValues.toList(row));
            }
        }
        TableStore table = TableStore.of(JsonValues.getString(tableJson, "page_title"),
                JsonValues.toStrings(tableJson.get("header")), rows);

        String question = JsonValues.getString(item, "question");
        return new Example(eid, JsonValues.getString(item, "id"), question == null ? "" : question,
                item.has("answer_text") ? JsonValues.toList(item.get("answer_text")) : Collections.emptyList(),
                table, programs);
    }
}
