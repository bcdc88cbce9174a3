package com.nsqlexec.exec;

import com.nsqlexec.llm.AnswerOracle;
import com.nsqlexec.llm.OracleException;
import com.nsqlexec.program.PlanBuilder;
import com.nsqlexec.program.ProgramParser;
import com.nsqlexec.program.SqlNodes;
import com.nsqlexec.program.ast.AggregateNode;
import com.nsqlexec.program.ast.FilterNode;
import com.nsqlexec.program.ast.HybridQuery;
import com.nsqlexec.program.ast.NeuralLeaf;
import com.nsqlexec.program.ast.ProgramNode;
import com.nsqlexec.program.ast.ProgramVisitor;
import com.nsqlexec.program.ast.ProjectNode;
import com.nsqlexec.program.ast.SelectNode;
import com.nsqlexec.program.ast.SortNode;
import com.nsqlexec.program.ast.TableScanNode;
import com.nsqlexec.program.ast.WholeQueryFallback;
import com.nsqlexec.table.TableStore;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates one parsed program against one table. Neural leaves are answered first: {@code map@}
 * answers become extra columns of the scanned relation, {@code ans@} answers become scalar
 * bindings. Instances are single-use.
 */
public class PlanEvaluator implements ProgramVisitor<Relation>, ExpressionEvaluator.SubqueryRunner {

    private static final String FALLBACK_COLUMN = "answer";

    private final TableStore table;
    private final AnswerOracle oracle;
    private final String exampleQuestion;
    private final Map<String, Object> bindings = new HashMap<>();
    private final ExpressionEvaluator expressions;
    private final PlanBuilder planBuilder = new PlanBuilder();
    private final Map<SqlNode, ProgramNode> subqueryPlans = new IdentityHashMap<>();
    private Relation source;

    /**
     * @param exampleQuestion the example's natural-language question, used by the whole-query
     *                        fallback; may be null
     */
    public PlanEvaluator(TableStore table, AnswerOracle oracle, String exampleQuestion) {
        this.table = table;
        this.oracle = oracle;
        this.exampleQuestion = exampleQuestion;
        this.source = Relation.of(table);
        this.expressions = new ExpressionEvaluator(bindings, this);
    }

    @Override
    public Relation visitHybridQuery(HybridQuery node) throws QueryExecutionException {
        for (NeuralLeaf leaf : node.getLeaves()) {
            leaf.accept(this);
        }
        return node.getQuery().accept(this);
    }

    @Override
    public Relation visitWholeQueryFallback(WholeQueryFallback node) throws QueryExecutionException {
        String question = exampleQuestion != null && !exampleQuestion.trim().isEmpty()
                ? exampleQuestion
                : node.getQuestion();
        List<Object> values = ask(question, node.getHintColumns());
        List<Relation.Tuple> tuples = new ArrayList<>(values.size());
        for (Object value : values) {
            tuples.add(new Relation.Tuple(Collections.singletonList(value)));
        }
        return new Relation(Collections.singletonList(FALLBACK_COLUMN), tuples, false);
    }

    @Override
    public Relation visitNeuralLeaf(NeuralLeaf node) throws QueryExecutionException {
        List<Object> values = ask(node.getQuestion(), node.getHintColumns());
        if (node.getKind() == NeuralLeaf.Kind.MAP) {
            if (values.size() != source.size()) {
                throw new QueryExecutionException(FailureKind.ORACLE_ERROR, "oracle returned " + values.size()
                        + " values for " + source.size() + " rows: " + node.getQuestion());
            }
            source = source.withColumn(node.getPlaceholder(), values);
        } else if (values.isEmpty()) {
            bindings.put(node.getPlaceholder(), null);
        } else if (values.size() == 1) {
            bindings.put(node.getPlaceholder(), values.get(0));
        } else {
            bindings.put(node.getPlaceholder(), values);
        }
        return source;
    }

    private List<Object> ask(String question, List<String> hintColumns) throws QueryExecutionException {
        try {
            List<Object> values = oracle.answer(question, table, hintColumns);
            if (values == null) {
                throw new QueryExecutionException(FailureKind.ORACLE_ERROR, "oracle returned no answer: " + question);
            }
            return values;
        } catch (OracleException e) {
            throw QueryExecutionException.oracle(e.getMessage(), e);
        }
    }

    @Override
    public Relation visitTableScan(TableScanNode node) throws QueryExecutionException {
        if (node.getTableName() == null) {
            return Relation.singleRow();
        }
        if (!table.isReferencedBy(node.getTableName())) {
            throw QueryExecutionException.execution("no such table: " + node.getTableName());
        }
        return source;
    }

    @Override
    public Relation visitFilter(FilterNode node) throws QueryExecutionException {
        Relation input = node.getInput().accept(this);
        List<Relation.Tuple> kept = new ArrayList<>();
        for (Relation.Tuple tuple : input.getTuples()) {
            if (SqlValues.isTrue(expressions.evaluate(node.getCondition(), input, tuple, node.getAliases()))) {
                kept.add(tuple);
            }
        }
        return new Relation(input.getColumns(), kept, input.isGrouped());
    }

    @Override
    public Relation visitAggregate(AggregateNode node) throws QueryExecutionException {
        Relation input = node.getInput().accept(this);
        Map<List<String>, List<Relation.Tuple>> groups = new LinkedHashMap<>();
        if (node.getGroupKeys().isEmpty()) {
            // aggregates without GROUP BY yield one row even for empty input
            groups.put(Collections.emptyList(), new ArrayList<>(input.getTuples()));
        } else {
            for (Relation.Tuple tuple : input.getTuples()) {
                List<Object> key = expressions.evaluateAll(node.getGroupKeys(), input, tuple, node.getAliases());
                groups.computeIfAbsent(groupKey(key), k -> new ArrayList<>()).add(tuple);
            }
        }

        List<Relation.Tuple> grouped = new ArrayList<>();
        for (List<Relation.Tuple> members : groups.values()) {
            List<Object> first = members.isEmpty()
                    ? Collections.nCopies(input.getColumns().size(), null)
                    : members.get(0).getValues();
            Relation.Tuple tuple = new Relation.Tuple(first, members);
            if (node.getHaving() == null
                    || SqlValues.isTrue(expressions.evaluate(node.getHaving(), input, tuple, node.getAliases()))) {
                grouped.add(tuple);
            }
        }
        return new Relation(input.getColumns(), grouped, true);
    }

    private static List<String> groupKey(List<Object> values) {
        List<String> key = new ArrayList<>(values.size());
        for (Object value : values) {
            BigDecimal number = SqlValues.toNumber(value);
            key.add(SqlValues.render(number != null ? number : value));
        }
        return key;
    }

    @Override
    public Relation visitSort(SortNode node) throws QueryExecutionException {
        Relation input = node.getInput().accept(this);
        List<SortNode.SortKey> keys = node.getKeys();
        List<Object[]> rows = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            Relation.Tuple tuple = input.getTuples().get(i);
            Object[] row = new Object[keys.size() + 1];
            for (int k = 0; k < keys.size(); k++) {
                row[k] = expressions.evaluate(keys.get(k).getExpression(), input, tuple, node.getAliases());
            }
            row[keys.size()] = tuple;
            rows.add(row);
        }

        // List.sort is stable, so equal keys keep their input order
        rows.sort((a, b) -> {
            for (int k = 0; k < keys.size(); k++) {
                int cmp = compareSortValues(a[k], b[k], keys.get(k));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        });

        List<Relation.Tuple> sorted = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            sorted.add((Relation.Tuple) row[keys.size()]);
        }
        return new Relation(input.getColumns(), sorted, input.isGrouped());
    }

    private static int compareSortValues(Object a, Object b, SortNode.SortKey key) {
        if (a == null || b == null) {
            if (a == b) {
                return 0;
            }
            return (a == null) == key.isNullsFirst() ? -1 : 1;
        }
        int cmp = SqlValues.compare(a, b);
        return key.isDescending() ? -cmp : cmp;
    }

    @Override
    public Relation visitProject(ProjectNode node) throws QueryExecutionException {
        Relation input = node.getInput().accept(this);
        List<SqlNode> items = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < node.getExpressions().size(); i++) {
            SqlNode expression = node.getExpressions().get(i);
            if (expression instanceof SqlIdentifier && ((SqlIdentifier) expression).isStar()) {
                for (String column : input.getColumns()) {
                    if (!column.startsWith(ProgramParser.PLACEHOLDER_PREFIX)) {
                        items.add(new SqlIdentifier(column, expression.getParserPosition()));
                        names.add(column);
                    }
                }
            } else {
                items.add(expression);
                names.add(node.getNames().get(i));
            }
        }

        List<Relation.Tuple> tuples = input.getTuples();
        if (!input.isGrouped() && !referencesColumns(items) && tuples.size() > 1) {
            // nothing varies per row, so every row would be the same
            tuples = tuples.subList(0, 1);
        }

        List<Relation.Tuple> projected = new ArrayList<>(tuples.size());
        for (Relation.Tuple tuple : tuples) {
            List<Object> values = new ArrayList<>(items.size());
            for (SqlNode item : items) {
                values.add(SqlValues.toOutput(expressions.evaluate(item, input, tuple, node.getAliases())));
            }
            projected.add(new Relation.Tuple(values));
        }
        return new Relation(names, projected, false);
    }

    private boolean referencesColumns(List<SqlNode> items) {
        Set<String> scalars = new HashSet<>(bindings.keySet());
        for (SqlNode item : items) {
            if (SqlNodes.referencesColumn(item, scalars)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Relation visitSelect(SelectNode node) throws QueryExecutionException {
        Relation input = node.getInput().accept(this);
        List<Relation.Tuple> tuples = input.getTuples();
        if (node.isDistinct()) {
            Set<List<String>> seen = new HashSet<>();
            List<Relation.Tuple> distinct = new ArrayList<>();
            for (Relation.Tuple tuple : tuples) {
                if (seen.add(groupKey(tuple.getValues()))) {
                    distinct.add(tuple);
                }
            }
            tuples = distinct;
        }
        int from = node.getOffset() == null ? 0 : Math.min(node.getOffset(), tuples.size());
        int to = tuples.size();
        if (node.getLimit() != null) {
            to = (int) Math.min(to, (long) from + node.getLimit());
        }
        return new Relation(input.getColumns(), tuples.subList(from, to), false);
    }

    @Override
    public Relation run(SqlNode query) throws QueryExecutionException {
        ProgramNode plan = subqueryPlans.get(query);
        if (plan == null) {
            plan = planBuilder.build(query);
            subqueryPlans.put(query, plan);
        }
        return plan.accept(this);
    }
}
