package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

import java.util.Collections;
import java.util.List;

/**
 * A relational query whose natural-language sub-expressions were lifted out as
 * {@link NeuralLeaf}s. Leaves are answered first and referenced from the query by placeholder.
 */
public class HybridQuery extends ProgramNode {

    private final List<NeuralLeaf> leaves;
    private final ProgramNode query;

    public HybridQuery(List<NeuralLeaf> leaves, ProgramNode query) {
        this.leaves = Collections.unmodifiableList(leaves);
        this.query = query;
    }

    public List<NeuralLeaf> getLeaves() { return leaves; }
    public ProgramNode getQuery() { return query; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitHybridQuery(this);
    }
}
