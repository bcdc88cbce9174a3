package com.nsqlexec.llm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses oracle answers out of LLM responses.
 */
public class OracleResponseParser {

    // longer row ids are never in range
    private static final Pattern ROW_LINE = Pattern.compile("^\\s*(?:row(?:_id)?\\s*)?(\\d{1,9})\\s*[:.)\\-]\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ANSWER_PREFIX = Pattern.compile("^\\s*(?:final\\s+)?answer\\s*:\\s*",
            Pattern.CASE_INSENSITIVE);

    /**
     * Parse one answer per row from {@code <row_id>: <answer>} lines.
     *
     * @throws OracleException if any of the rows 1..rowCount is missing
     */
    public List<Object> parseRowAnswers(String response, int rowCount) throws OracleException {
        if (response == null || response.trim().isEmpty()) {
            throw new OracleException("Empty response");
        }
        Map<Integer, String> answers = new HashMap<>();
        for (String line : stripFences(response).split("\\R")) {
            Matcher matcher = ROW_LINE.matcher(line);
            if (matcher.matches()) {
                int row = Integer.parseInt(matcher.group(1));
                if (row >= 1 && row <= rowCount && !answers.containsKey(row)) {
                    answers.put(row, matcher.group(2).trim());
                }
            }
        }
        if (answers.size() != rowCount) {
            throw new OracleException("Expected answers for " + rowCount + " rows but found " + answers.size());
        }
        List<Object> values = new ArrayList<>(rowCount);
        for (int row = 1; row <= rowCount; row++) {
            values.add(emptyToNull(answers.get(row)));
        }
        return values;
    }

    /**
     * Parse a single answer; several values may be separated by {@code |}.
     */
    public List<Object> parseAnswer(String response) throws OracleException {
        if (response == null || response.trim().isEmpty()) {
            throw new OracleException("Empty response");
        }
        String answer = null;
        for (String line : stripFences(response).split("\\R")) {
            if (!line.trim().isEmpty()) {
                answer = line;
                break;
            }
        }
        if (answer == null) {
            throw new OracleException("No answer in response: " + response.trim());
        }
        answer = ANSWER_PREFIX.matcher(answer).replaceFirst("");

        List<Object> values = new ArrayList<>();
        for (String part : answer.split("\\|")) {
            String value = part.trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static String stripFences(String response) {
        StringBuilder sb = new StringBuilder();
        for (String line : response.split("\\R")) {
            if (!line.trim().startsWith("```")) {
                sb.append(line).append("\n");
            }
        }
        return sb.toString();
    }

    private static String emptyToNull(String value) {
        if (value == null || value.isEmpty() || value.equalsIgnoreCase("none") || value.equalsIgnoreCase("null")) {
            return null;
        }
        return value;
    }
}
