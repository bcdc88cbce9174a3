package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

/**
 * Node of a parsed hybrid program. The set of variants is closed; consumers dispatch with a
 * {@link ProgramVisitor}.
 */
public abstract class ProgramNode {

    ProgramNode() {
    }

    public abstract <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException;
}
