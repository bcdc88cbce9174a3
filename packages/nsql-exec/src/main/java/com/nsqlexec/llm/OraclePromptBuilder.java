package com.nsqlexec.llm;

import com.nsqlexec.program.ast.NeuralLeaf;
import com.nsqlexec.table.TableStore;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the prompts sent to the LLM when it acts as the answer oracle.
 */
public class OraclePromptBuilder {

    private static final String SYSTEM_PROMPT_RESOURCE = "/prompts/oracle-system-prompt.txt";

    private String systemPrompt;

    public OraclePromptBuilder() {
        loadSystemPrompt();
    }

    private void loadSystemPrompt() {
        try (InputStream is = getClass().getResourceAsStream(SYSTEM_PROMPT_RESOURCE)) {
            if (is != null) {
                this.systemPrompt = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))
                        .lines()
                        .collect(Collectors.joining("\n"));
            } else {
                this.systemPrompt = getDefaultSystemPrompt();
            }
        } catch (IOException e) {
            this.systemPrompt = getDefaultSystemPrompt();
        }
    }

    private String getDefaultSystemPrompt() {
        return """
            You answer questions about a single table.
            Use only the information in the table. Do not explain your reasoning.
            """;
    }

    public String buildSystemPrompt() {
        return systemPrompt;
    }

    /**
     * Build the user prompt: the table (restricted to the hint columns by the caller), the
     * question, and the expected answer format.
     */
    public String buildUserPrompt(String question, TableStore table, boolean perRow) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("## Table: ").append(table.getTitle()).append("\n");
        prompt.append(formatTable(table)).append("\n");

        prompt.append("## Question\n");
        prompt.append(NeuralLeaf.stripMarker(question)).append("\n\n");

        prompt.append("## Answer Format\n");
        if (perRow) {
            prompt.append("Answer the question for every row of the table, one line per row, as\n");
            prompt.append("<row_id>: <answer>\n");
            prompt.append("Give exactly ").append(table.getRowCount()).append(" lines, for row_id 1 to ")
                    .append(table.getRowCount()).append(".\n");
        } else {
            prompt.append("Respond with ONLY the answer. If there are several answers, separate them with |.\n");
        }
        return prompt.toString();
    }

    static String formatTable(TableStore table) {
        StringBuilder sb = new StringBuilder();
        sb.append("row_id");
        for (String column : table.getColumns()) {
            sb.append(" | ").append(column);
        }
        sb.append("\n");
        List<List<Object>> rows = table.getRows();
        for (int r = 0; r < rows.size(); r++) {
            sb.append(r + 1);
            for (Object cell : rows.get(r)) {
                sb.append(" | ").append(cell == null ? "" : cell.toString().replace("\n", " "));
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
