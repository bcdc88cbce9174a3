package com.nsqlexec.llm;

import com.nsqlexec.program.ast.NeuralLeaf;
import com.nsqlexec.table.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * {@link AnswerOracle} backed by a chat-completion LLM. {@code map@} questions are asked once for
 * the whole table and answered row by row; other questions get a single answer.
 */
public class LlmAnswerOracle implements AnswerOracle {

    private static final Logger logger = LoggerFactory.getLogger(LlmAnswerOracle.class);

    private final ChatClient client;
    private final OraclePromptBuilder promptBuilder;
    private final OracleResponseParser responseParser;

    public LlmAnswerOracle(ChatClient client) {
        this(client, new OraclePromptBuilder(), new OracleResponseParser());
    }

    public LlmAnswerOracle(ChatClient client, OraclePromptBuilder promptBuilder, OracleResponseParser responseParser) {
        this.client = client;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
    }

    @Override
    public List<Object> answer(String question, TableStore table, List<String> hintColumns) throws OracleException {
        boolean perRow = NeuralLeaf.kindOf(question) == NeuralLeaf.Kind.MAP;
        TableStore context = relevantPart(table, hintColumns);

        String response;
        try {
            response = client.chat(promptBuilder.buildSystemPrompt(),
                    promptBuilder.buildUserPrompt(question, context, perRow));
        } catch (IOException e) {
            throw new OracleException("Oracle request failed: " + e.getMessage(), e);
        } catch (ChatClient.ApiException e) {
            throw new OracleException(e.getMessage(), e);
        }
        logger.debug("Oracle answered '{}' with: {}", question, response);

        return perRow
                ? responseParser.parseRowAnswers(response, table.getRowCount())
                : responseParser.parseAnswer(response);
    }

    private static TableStore relevantPart(TableStore table, List<String> hintColumns) {
        if (hintColumns == null || hintColumns.isEmpty()) {
            return table;
        }
        TableStore projected = table.project(hintColumns);
        return projected.getColumnCount() == 0 ? table : projected;
    }
}
