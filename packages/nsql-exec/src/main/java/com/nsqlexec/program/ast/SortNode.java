package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;
import org.apache.calcite.sql.SqlNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Stable sort of its input. Ordinal and alias references were already replaced by the
 * select-list expressions they denote.
 */
public class SortNode extends ProgramNode {

    private final ProgramNode input;
    private final List<SortKey> keys;
    private final Map<String, SqlNode> aliases;

    public SortNode(ProgramNode input, List<SortKey> keys, Map<String, SqlNode> aliases) {
        this.input = input;
        this.keys = Collections.unmodifiableList(keys);
        this.aliases = aliases;
    }

    public ProgramNode getInput() { return input; }
    public List<SortKey> getKeys() { return keys; }
    public Map<String, SqlNode> getAliases() { return aliases; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitSort(this);
    }

    public static class SortKey {
        private final SqlNode expression;
        private final boolean descending;
        private final boolean nullsFirst;

        public SortKey(SqlNode expression, boolean descending, boolean nullsFirst) {
            this.expression = expression;
            this.descending = descending;
            this.nullsFirst = nullsFirst;
        }

        public SqlNode getExpression() { return expression; }
        public boolean isDescending() { return descending; }
        public boolean isNullsFirst() { return nullsFirst; }
    }
}
