package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;
import org.apache.calcite.sql.SqlNode;

import java.util.Map;

public class FilterNode extends ProgramNode {

    private final ProgramNode input;
    private final SqlNode condition;
    private final Map<String, SqlNode> aliases;

    public FilterNode(ProgramNode input, SqlNode condition, Map<String, SqlNode> aliases) {
        this.input = input;
        this.condition = condition;
        this.aliases = aliases;
    }

    public ProgramNode getInput() { return input; }
    public SqlNode getCondition() { return condition; }

    /** Select-list aliases (lower case) visible to the condition. */
    public Map<String, SqlNode> getAliases() { return aliases; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitFilter(this);
    }
}
