package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;
import org.apache.calcite.sql.SqlNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the select list. A {@code *} item expands to the input's table columns.
 */
public class ProjectNode extends ProgramNode {

    private final ProgramNode input;
    private final List<SqlNode> expressions;
    private final List<String> names;
    private final Map<String, SqlNode> aliases;

    public ProjectNode(ProgramNode input, List<SqlNode> expressions, List<String> names, Map<String, SqlNode> aliases) {
        this.input = input;
        this.expressions = Collections.unmodifiableList(expressions);
        this.names = Collections.unmodifiableList(names);
        this.aliases = aliases;
    }

    public ProgramNode getInput() { return input; }
    public List<SqlNode> getExpressions() { return expressions; }
    public List<String> getNames() { return names; }
    public Map<String, SqlNode> getAliases() { return aliases; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitProject(this);
    }
}
