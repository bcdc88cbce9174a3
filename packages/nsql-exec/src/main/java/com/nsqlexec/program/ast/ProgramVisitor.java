package com.nsqlexec.program.ast;

import com.nsqlexec.exec.QueryExecutionException;

public interface ProgramVisitor<R> {

    R visitHybridQuery(HybridQuery node) throws QueryExecutionException;

    R visitWholeQueryFallback(WholeQueryFallback node) throws QueryExecutionException;

    R visitNeuralLeaf(NeuralLeaf node) throws QueryExecutionException;

    R visitTableScan(TableScanNode node) throws QueryExecutionException;

    R visitFilter(FilterNode node) throws QueryExecutionException;

    R visitAggregate(AggregateNode node) throws QueryExecutionException;

    R visitSort(SortNode node) throws QueryExecutionException;

    R visitProject(ProjectNode node) throws QueryExecutionException;

    R visitSelect(SelectNode node) throws QueryExecutionException;
}
