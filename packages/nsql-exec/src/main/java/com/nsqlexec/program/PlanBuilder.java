package com.nsqlexec.program;

import com.nsqlexec.exec.QueryExecutionException;
import com.nsqlexec.program.ast.AggregateNode;
import com.nsqlexec.program.ast.FilterNode;
import com.nsqlexec.program.ast.ProgramNode;
import com.nsqlexec.program.ast.ProjectNode;
import com.nsqlexec.program.ast.SelectNode;
import com.nsqlexec.program.ast.SortNode;
import com.nsqlexec.program.ast.TableScanNode;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts a parsed single-table query into a plan:
 * scan, filter, aggregate, sort, project, then distinct/offset/limit.
 */
public class PlanBuilder {

    private static final BigDecimal MAX_ROWS = BigDecimal.valueOf(Integer.MAX_VALUE);

    public ProgramNode build(SqlNode query) throws QueryExecutionException {
        SqlNode body = query;
        SqlNodeList orderList = null;
        SqlNode offset = null;
        SqlNode fetch = null;

        if (query instanceof SqlOrderBy) {
            SqlOrderBy orderBy = (SqlOrderBy) query;
            body = orderBy.query;
            orderList = orderBy.orderList;
            offset = orderBy.offset;
            fetch = orderBy.fetch;
        }
        if (!(body instanceof SqlSelect)) {
            throw QueryExecutionException.parse("unsupported query: " + body.getKind());
        }

        SqlSelect select = (SqlSelect) body;
        if (orderList == null || orderList.size() == 0) {
            orderList = select.getOrderList();
        }
        if (offset == null) {
            offset = select.getOffset();
        }
        if (fetch == null) {
            fetch = select.getFetch();
        }

        List<SqlNode> expressions = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Map<String, SqlNode> aliases = new HashMap<>();
        for (SqlNode item : select.getSelectList()) {
            if (SqlNodes.contains(item, SqlKind.OVER)) {
                throw QueryExecutionException.parse("window functions are not supported");
            }
            if (item.getKind() == SqlKind.AS) {
                SqlCall as = (SqlCall) item;
                SqlNode expression = as.operand(0);
                String alias = SqlNodes.simpleName((SqlIdentifier) as.operand(1));
                expressions.add(expression);
                names.add(alias);
                aliases.put(alias.toLowerCase(Locale.ROOT), expression);
            } else {
                expressions.add(item);
                names.add(displayName(item));
            }
        }
        aliases = Collections.unmodifiableMap(aliases);

        ProgramNode plan = new TableScanNode(tableName(select.getFrom()));

        if (select.getWhere() != null) {
            if (SqlNodes.containsAggregate(select.getWhere())) {
                throw QueryExecutionException.parse("aggregate functions are not allowed in WHERE");
            }
            plan = new FilterNode(plan, select.getWhere(), aliases);
        }

        List<SqlNode> groupKeys = new ArrayList<>();
        if (select.getGroup() != null) {
            for (SqlNode key : select.getGroup()) {
                groupKeys.add(resolveOrdinal(key, expressions, "GROUP BY"));
            }
        }
        boolean aggregate = !groupKeys.isEmpty()
                || select.getHaving() != null
                || SqlNodes.containsAggregate(select.getSelectList())
                || SqlNodes.containsAggregate(orderList);
        if (aggregate) {
            plan = new AggregateNode(plan, groupKeys, select.getHaving(), aliases);
        }

        List<SortNode.SortKey> sortKeys = sortKeys(orderList, expressions);
        if (!sortKeys.isEmpty()) {
            plan = new SortNode(plan, sortKeys, aliases);
        }

        plan = new ProjectNode(plan, expressions, names, aliases);
        return new SelectNode(plan, select.isDistinct(), rowCount(offset, "OFFSET"), rowCount(fetch, "LIMIT"));
    }

    private static String tableName(SqlNode from) throws QueryExecutionException {
        if (from == null) {
            return null;
        }
        if (from instanceof SqlIdentifier) {
            return SqlNodes.simpleName((SqlIdentifier) from);
        }
        if (from.getKind() == SqlKind.AS) {
            SqlNode source = ((SqlCall) from).operand(0);
            if (source instanceof SqlIdentifier) {
                return SqlNodes.simpleName((SqlIdentifier) source);
            }
        }
        throw QueryExecutionException.parse("unsupported FROM clause: " + from.getKind());
    }

    private static List<SortNode.SortKey> sortKeys(SqlNodeList orderList, List<SqlNode> expressions)
            throws QueryExecutionException {
        List<SortNode.SortKey> keys = new ArrayList<>();
        if (orderList == null) {
            return keys;
        }
        for (SqlNode item : orderList) {
            SqlNode expression = item;
            Boolean nullsFirst = null;
            boolean descending = false;
            if (expression.getKind() == SqlKind.NULLS_FIRST || expression.getKind() == SqlKind.NULLS_LAST) {
                nullsFirst = expression.getKind() == SqlKind.NULLS_FIRST;
                expression = ((SqlCall) expression).operand(0);
            }
            if (expression.getKind() == SqlKind.DESCENDING) {
                descending = true;
                expression = ((SqlCall) expression).operand(0);
            }
            expression = resolveOrdinal(expression, expressions, "ORDER BY");
            // NULL sorts as the smallest value unless stated otherwise
            boolean first = nullsFirst != null ? nullsFirst : !descending;
            keys.add(new SortNode.SortKey(expression, descending, first));
        }
        return keys;
    }

    /** {@code ORDER BY 2} and {@code GROUP BY 1} refer to select-list positions. */
    private static SqlNode resolveOrdinal(SqlNode key, List<SqlNode> expressions, String clause)
            throws QueryExecutionException {
        if (!(key instanceof SqlNumericLiteral)) {
            return key;
        }
        SqlNumericLiteral literal = (SqlNumericLiteral) key;
        if (!literal.isExact()) {
            return key;
        }
        BigDecimal position = literal.bigDecimalValue();
        if (position.compareTo(BigDecimal.ONE) < 0 || position.compareTo(BigDecimal.valueOf(expressions.size())) > 0) {
            throw QueryExecutionException.parse(clause + " position " + position + " is out of range");
        }
        int ordinal = position.intValue();
        SqlNode expression = expressions.get(ordinal - 1);
        if (expression instanceof SqlIdentifier && ((SqlIdentifier) expression).isStar()) {
            throw QueryExecutionException.parse(clause + " position " + ordinal + " refers to *");
        }
        return expression;
    }

    private static Integer rowCount(SqlNode node, String clause) throws QueryExecutionException {
        if (node == null) {
            return null;
        }
        if (node instanceof SqlNumericLiteral) {
            BigDecimal value = ((SqlNumericLiteral) node).bigDecimalValue();
            if (value != null && value.signum() >= 0 && value.stripTrailingZeros().scale() <= 0) {
                // larger than any table
                return value.min(MAX_ROWS).intValue();
            }
        }
        throw QueryExecutionException.parse(clause + " must be a non-negative integer literal");
    }

    private static String displayName(SqlNode item) {
        if (item instanceof SqlIdentifier) {
            return SqlNodes.simpleName((SqlIdentifier) item);
        }
        if (item instanceof SqlBasicCall) {
            return SqlNodes.operatorName((SqlCall) item).toLowerCase(Locale.ROOT);
        }
        return item.toString();
    }
}
