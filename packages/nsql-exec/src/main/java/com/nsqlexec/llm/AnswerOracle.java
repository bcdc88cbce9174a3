package com.nsqlexec.llm;

import com.nsqlexec.table.TableStore;

import java.util.List;

/**
 * Answers a natural-language sub-question against a table.
 */
public interface AnswerOracle {

    /**
     * @param question    the question; a {@code map@} prefix asks for one value per table row,
     *                    anything else asks for a single answer (possibly several values)
     * @param table       the example's table
     * @param hintColumns columns relevant to the question; empty means the whole table
     * @return the answer values, one per row for {@code map@} questions
     * @throws OracleException if no usable answer could be obtained
     */
    List<Object> answer(String question, TableStore table, List<String> hintColumns) throws OracleException;
}
