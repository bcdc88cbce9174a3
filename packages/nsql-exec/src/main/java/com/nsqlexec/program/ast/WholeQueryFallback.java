package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

import java.util.Collections;
import java.util.List;

/**
 * Program consisting of a single {@code QA("ans@...")} call: relational evaluation is skipped and
 * the question is answered by the oracle directly against the table.
 */
public class WholeQueryFallback extends ProgramNode {

    private final String question;
    private final List<String> hintColumns;

    public WholeQueryFallback(String question, List<String> hintColumns) {
        this.question = question;
        this.hintColumns = Collections.unmodifiableList(hintColumns);
    }

    /** Question of the QA call without its {@code ans@} marker. */
    public String getQuestion() { return question; }
    public List<String> getHintColumns() { return hintColumns; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitWholeQueryFallback(this);
    }
}
