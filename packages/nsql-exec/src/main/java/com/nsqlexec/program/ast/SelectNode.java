package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

/**
 * Final row selection of a query: DISTINCT, then OFFSET and LIMIT.
 */
public class SelectNode extends ProgramNode {

    private final ProgramNode input;
    private final boolean distinct;
    private final Integer offset;
    private final Integer limit;

    public SelectNode(ProgramNode input, boolean distinct, Integer offset, Integer limit) {
        this.input = input;
        this.distinct = distinct;
        this.offset = offset;
        this.limit = limit;
    }

    public ProgramNode getInput() { return input; }
    public boolean isDistinct() { return distinct; }

    /** Rows to skip, or null. */
    public Integer getOffset() { return offset; }

    /** Maximum number of rows, or null for no limit. */
    public Integer getLimit() { return limit; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitSelect(this);
    }
}
