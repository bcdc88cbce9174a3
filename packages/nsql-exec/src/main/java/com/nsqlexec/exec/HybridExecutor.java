package com.nsqlexec.exec;

import com.nsqlexec.llm.AnswerOracle;
import com.nsqlexec.program.ProgramParser;
import com.nsqlexec.program.ast.ProgramNode;
import com.nsqlexec.table.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes normalized hybrid programs against a table. {@link #execute} never throws: parse,
 * evaluation and oracle errors all come back as a failed {@link ExecutionOutcome}.
 */
public class HybridExecutor {

    private static final Logger logger = LoggerFactory.getLogger(HybridExecutor.class);

    private final ProgramParser parser;
    private final AnswerOracle oracle;

    public HybridExecutor(AnswerOracle oracle) {
        this(new ProgramParser(), oracle);
    }

    public HybridExecutor(ProgramParser parser, AnswerOracle oracle) {
        this.parser = parser;
        this.oracle = oracle;
    }

    public ExecutionOutcome execute(String normalizedText, TableStore table) {
        return execute(normalizedText, table, null);
    }

    /**
     * @param question the example's question, answered directly by the oracle when the program
     *                 is a whole-query fallback; may be null
     */
    public ExecutionOutcome execute(String normalizedText, TableStore table, String question) {
        try {
            ProgramNode program = parser.parse(normalizedText);
            Relation result = program.accept(new PlanEvaluator(table, oracle, question));
            return ExecutionOutcome.answer(result.flatten());
        } catch (QueryExecutionException e) {
            logger.debug("{} for program: {} ({})", e.getKind(), normalizedText, e.getMessage());
            return ExecutionOutcome.failure(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Unexpected error executing program: {}", normalizedText, e);
            return ExecutionOutcome.failure(FailureKind.EXECUTION_ERROR, e.toString());
        } catch (StackOverflowError e) {
            logger.debug("Program nested too deeply: {}", abbreviate(normalizedText));
            return ExecutionOutcome.failure(FailureKind.EXECUTION_ERROR, "program nested too deeply");
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
