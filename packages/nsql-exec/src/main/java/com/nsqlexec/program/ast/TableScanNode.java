package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

public class TableScanNode extends ProgramNode {

    private final String tableName;

    /**
     * @param tableName referenced table, or null for a query without FROM
     */
    public TableScanNode(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() { return tableName; }

    @Override
    public <R> R accept(ProgramVisitor<R> visitor) throws QueryExecutionException {
        return visitor.visitTableScan(this);
    }
}
