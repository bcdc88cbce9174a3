package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;
import org.apache.calcite.sql.SqlNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Groups its input by the key expressions (a single group when there are none) and keeps the
 * groups satisfying the optional HAVING condition.
 */
public class AggregateNode extends ProgramNode {

    private final ProgramNode input;
    private final List<SqlNode> groupKeys;
    private final SqlNode having;
    private final Map<String, SqlNode> aliases;

    public AggregateNode(ProgramNode input, List<SqlNode> groupKeys, SqlNode having, Map<String, SqlNode> aliases) {
        this.input = input;
        this.groupKeys = Collections.unmodifiableList(groupKeys);
        this.having = having;
        this.aliases = aliases;
    }

    public ProgramNode getInput() { return input; }
    public List<SqlNode> getGroupKeys() { return groupKeys; }
    public SqlNode getHaving() { return having; }
    public Map<String, SqlNode> getAliases() { return aliases; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitAggregate(this);
    }
}
