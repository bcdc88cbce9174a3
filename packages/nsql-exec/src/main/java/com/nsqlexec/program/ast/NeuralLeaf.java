package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A {@code QA(...)} sub-expression, delegated to the answer oracle.
 */
public class NeuralLeaf extends ProgramNode {

    public enum Kind {
        /** {@code map@}: one value per table row, materialized as a column. */
        MAP,
        /** {@code ans@}: a single value (or list) bound for the whole query. */
        ANSWER
    }

    private final String placeholder;
    private final Kind kind;
    private final String question;
    private final List<String> hintColumns;

    public NeuralLeaf(String placeholder, String question, List<String> hintColumns) {
        this.placeholder = placeholder;
        this.question = question;
        this.kind = kindOf(question);
        this.hintColumns = Collections.unmodifiableList(hintColumns);
    }

    public static Kind kindOf(String question) {
        return question.trim().toLowerCase(Locale.ROOT).startsWith("map@") ? Kind.MAP : Kind.ANSWER;
    }

    /** Column or binding name the leaf is referenced by in the relational query. */
    public String getPlaceholder() { return placeholder; }
    public Kind getKind() { return kind; }

    /** Question as written, including its {@code map@}/{@code ans@} marker. */
    public String getQuestion() { return question; }

    /** Question without the marker. */
    public String getQuestionText() {
        return stripMarker(question);
    }

    public static String stripMarker(String question) {
        String trimmed = question.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("map@") || lower.startsWith("ans@")) {
            return trimmed.substring(4).trim();
        }
        return trimmed;
    }

    public List<String> getHintColumns() { return hintColumns; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitNeuralLeaf(this);
    }

    @Override
    public String toString() {
        return placeholder + "=QA(" + question + "; " + hintColumns + ")";
    }
}
