package com.nsqlexec.exec;

import com.nsqlexec.program.SqlNodes;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlSelectKeyword;
import org.apache.calcite.sql.fun.SqlBetweenOperator;
import org.apache.calcite.sql.fun.SqlCase;
import org.apache.calcite.sql.fun.SqlLikeOperator;
import org.apache.calcite.sql.type.SqlTypeName;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates Calcite expression trees against one tuple of a {@link Relation}.
 *
 * <p>Identifiers resolve to a column of the relation, then to a scalar binding (answers of
 * {@code ans@} leaves), then to a select-list alias. Aggregate calls are evaluated over the
 * members of a grouped tuple.
 */
public class ExpressionEvaluator {

    /** Runs an uncorrelated subquery. */
    public interface SubqueryRunner {
        Relation run(SqlNode query) throws QueryExecutionException;
    }

    private final Map<String, Object> bindings;
    private final SubqueryRunner subqueries;

    public ExpressionEvaluator(Map<String, Object> bindings, SubqueryRunner subqueries) {
        this.bindings = bindings;
        this.subqueries = subqueries;
    }

    public Object evaluate(SqlNode node, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        if (node == null) {
            return null;
        }
        if (node instanceof SqlLiteral) {
            return literal((SqlLiteral) node);
        }
        if (node instanceof SqlIdentifier) {
            return identifier((SqlIdentifier) node, relation, tuple, aliases);
        }
        if (SqlNodes.isQuery(node)) {
            return scalarSubquery(node);
        }
        if (node instanceof SqlCase) {
            return caseExpression((SqlCase) node, relation, tuple, aliases);
        }
        if (!(node instanceof SqlCall)) {
            throw QueryExecutionException.execution("unsupported expression: " + node.getKind());
        }

        SqlCall call = (SqlCall) node;
        if (SqlNodes.isAggregate(call)) {
            return aggregate(call, relation, tuple, aliases);
        }

        switch (call.getKind()) {
            case AND:
                return and(call, relation, tuple, aliases);
            case OR:
                return or(call, relation, tuple, aliases);
            case NOT: {
                Object value = evaluate(call.operand(0), relation, tuple, aliases);
                return value == null ? null : !SqlValues.isTrue(value);
            }
            case EQUALS:
            case NOT_EQUALS:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
                return comparison(call.getKind(),
                        evaluate(call.operand(0), relation, tuple, aliases),
                        evaluate(call.operand(1), relation, tuple, aliases));
            case IS_NULL:
                return evaluate(call.operand(0), relation, tuple, aliases) == null;
            case IS_NOT_NULL:
                return evaluate(call.operand(0), relation, tuple, aliases) != null;
            case IS_TRUE:
                return SqlValues.isTrue(evaluate(call.operand(0), relation, tuple, aliases));
            case IS_FALSE: {
                Object value = evaluate(call.operand(0), relation, tuple, aliases);
                return value != null && !SqlValues.isTrue(value);
            }
            case BETWEEN:
                return between(call, relation, tuple, aliases);
            case LIKE:
                return like(call, relation, tuple, aliases);
            case IN:
                return in(call, false, relation, tuple, aliases);
            case NOT_IN:
                return in(call, true, relation, tuple, aliases);
            case EXISTS:
                return subqueries.run(call.operand(0)).size() > 0;
            case PLUS:
            case MINUS:
            case TIMES:
            case DIVIDE:
            case MOD:
                return arithmetic(call, relation, tuple, aliases);
            case MINUS_PREFIX: {
                BigDecimal value = SqlValues.numericOperand(evaluate(call.operand(0), relation, tuple, aliases), "-");
                return value == null ? null : value.negate();
            }
            case PLUS_PREFIX:
                return SqlValues.numericOperand(evaluate(call.operand(0), relation, tuple, aliases), "+");
            case CAST:
                return cast(call, relation, tuple, aliases);
            case AS:
                return evaluate(call.operand(0), relation, tuple, aliases);
            default:
                return function(call, relation, tuple, aliases);
        }
    }

    private Object literal(SqlLiteral literal) {
        SqlTypeName type = literal.getTypeName();
        if (type == SqlTypeName.NULL) {
            return null;
        }
        if (type == SqlTypeName.BOOLEAN) {
            return literal.booleanValue();
        }
        if (literal instanceof SqlNumericLiteral) {
            return ((SqlNumericLiteral) literal).bigDecimalValue();
        }
        return literal.getValueAs(String.class);
    }

    private Object identifier(SqlIdentifier identifier, Relation relation, Relation.Tuple tuple,
                              Map<String, SqlNode> aliases) throws QueryExecutionException {
        String name = SqlNodes.simpleName(identifier);
        int index = relation.indexOf(name);
        if (index >= 0) {
            return tuple.get(index);
        }
        if (bindings.containsKey(name)) {
            return bindings.get(name);
        }
        String key = name.toLowerCase(Locale.ROOT);
        if (aliases.containsKey(key)) {
            Map<String, SqlNode> rest = new HashMap<>(aliases);
            rest.remove(key);
            return evaluate(aliases.get(key), relation, tuple, rest);
        }
        throw QueryExecutionException.execution("no such column: " + name);
    }

    private Object scalarSubquery(SqlNode query) throws QueryExecutionException {
        Relation result = subqueries.run(query);
        if (result.size() == 0 || result.getColumns().isEmpty()) {
            return null;
        }
        return result.getTuples().get(0).get(0);
    }

    private Object caseExpression(SqlCase node, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        SqlNodeList whens = node.getWhenOperands();
        SqlNodeList thens = node.getThenOperands();
        Object subject = node.getValueOperand() == null ? null : evaluate(node.getValueOperand(), relation, tuple, aliases);
        for (int i = 0; i < whens.size(); i++) {
            Object when = evaluate(whens.get(i), relation, tuple, aliases);
            boolean matched = node.getValueOperand() == null
                    ? SqlValues.isTrue(when)
                    : Boolean.TRUE.equals(SqlValues.equal(subject, when));
            if (matched) {
                return evaluate(thens.get(i), relation, tuple, aliases);
            }
        }
        return evaluate(node.getElseOperand(), relation, tuple, aliases);
    }

    private Object and(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        boolean unknown = false;
        for (SqlNode operand : call.getOperandList()) {
            Object value = evaluate(operand, relation, tuple, aliases);
            if (value == null) {
                unknown = true;
            } else if (!SqlValues.isTrue(value)) {
                return false;
            }
        }
        return unknown ? null : Boolean.TRUE;
    }

    private Object or(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        boolean unknown = false;
        for (SqlNode operand : call.getOperandList()) {
            Object value = evaluate(operand, relation, tuple, aliases);
            if (value == null) {
                unknown = true;
            } else if (SqlValues.isTrue(value)) {
                return true;
            }
        }
        return unknown ? null : Boolean.FALSE;
    }

    private static Boolean comparison(SqlKind kind, Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        int cmp = SqlValues.compare(left, right);
        switch (kind) {
            case EQUALS:
                return cmp == 0;
            case NOT_EQUALS:
                return cmp != 0;
            case LESS_THAN:
                return cmp < 0;
            case LESS_THAN_OR_EQUAL:
                return cmp <= 0;
            case GREATER_THAN:
                return cmp > 0;
            default:
                return cmp >= 0;
        }
    }

    private Object between(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        Object value = evaluate(call.operand(SqlBetweenOperator.VALUE_OPERAND), relation, tuple, aliases);
        Object lower = evaluate(call.operand(SqlBetweenOperator.LOWER_OPERAND), relation, tuple, aliases);
        Object upper = evaluate(call.operand(SqlBetweenOperator.UPPER_OPERAND), relation, tuple, aliases);
        if (value == null || lower == null || upper == null) {
            return null;
        }
        boolean inside = SqlValues.compare(value, lower) >= 0 && SqlValues.compare(value, upper) <= 0;
        boolean negated = call.getOperator() instanceof SqlBetweenOperator
                && ((SqlBetweenOperator) call.getOperator()).isNegated();
        return negated != inside;
    }

    private Object like(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        Object value = evaluate(call.operand(0), relation, tuple, aliases);
        Object pattern = evaluate(call.operand(1), relation, tuple, aliases);
        if (value == null || pattern == null) {
            return null;
        }
        boolean matches = SqlValues.like(SqlValues.render(value), SqlValues.render(pattern));
        boolean negated = call.getOperator() instanceof SqlLikeOperator
                && ((SqlLikeOperator) call.getOperator()).isNegated();
        return negated != matches;
    }

    private Object in(SqlCall call, boolean negated, Relation relation, Relation.Tuple tuple,
                      Map<String, SqlNode> aliases) throws QueryExecutionException {
        Object value = evaluate(call.operand(0), relation, tuple, aliases);
        List<Object> candidates = new ArrayList<>();
        SqlNode right = call.operand(1);
        if (SqlNodes.isQuery(right)) {
            Relation result = subqueries.run(right);
            if (result.getColumns().isEmpty()) {
                throw QueryExecutionException.execution("IN subquery returns no columns");
            }
            for (Relation.Tuple row : result.getTuples()) {
                candidates.add(row.get(0));
            }
        } else if (right instanceof SqlNodeList) {
            for (SqlNode item : (SqlNodeList) right) {
                addFlattened(candidates, evaluate(item, relation, tuple, aliases));
            }
        } else {
            addFlattened(candidates, evaluate(right, relation, tuple, aliases));
        }

        if (value == null) {
            return null;
        }
        boolean sawNull = false;
        for (Object candidate : candidates) {
            if (candidate == null) {
                sawNull = true;
            } else if (SqlValues.compare(value, candidate) == 0) {
                return !negated;
            }
        }
        return sawNull ? null : negated;
    }

    private static void addFlattened(List<Object> target, Object value) {
        // an ans@ leaf may bind a list of answers
        if (value instanceof Collection) {
            target.addAll((Collection<?>) value);
        } else {
            target.add(value);
        }
    }

    private Object arithmetic(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        String operator = call.getOperator().getName();
        BigDecimal left = SqlValues.numericOperand(evaluate(call.operand(0), relation, tuple, aliases), operator);
        BigDecimal right = SqlValues.numericOperand(evaluate(call.operand(1), relation, tuple, aliases), operator);
        if (left == null || right == null) {
            return null;
        }
        switch (call.getKind()) {
            case PLUS:
                return left.add(right);
            case MINUS:
                return left.subtract(right);
            case TIMES:
                return left.multiply(right);
            case DIVIDE:
                return SqlValues.divide(left, right);
            default:
                return right.signum() == 0 ? null : left.remainder(right);
        }
    }

    private Object cast(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        Object value = evaluate(call.operand(0), relation, tuple, aliases);
        SqlNode target = call.operand(1);
        if (!(target instanceof SqlDataTypeSpec)) {
            throw QueryExecutionException.execution("unsupported cast target: " + target);
        }
        return SqlValues.cast(value, ((SqlDataTypeSpec) target).getTypeName().getSimple());
    }

    private Object function(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        String name = SqlNodes.operatorName(call);
        List<Object> args = new ArrayList<>();
        for (SqlNode operand : call.getOperandList()) {
            // TRIM carries its flag and trim character as literal operands
            if (operand instanceof SqlLiteral && ((SqlLiteral) operand).getTypeName() == SqlTypeName.SYMBOL) {
                continue;
            }
            args.add(evaluate(operand, relation, tuple, aliases));
        }

        switch (name) {
            case "||":
                return args.get(0) == null || args.get(1) == null
                        ? null : SqlValues.render(args.get(0)) + SqlValues.render(args.get(1));
            case "ABS": {
                BigDecimal value = SqlValues.numericOperand(arg(args, 0, name), name);
                return value == null ? null : value.abs();
            }
            case "LOWER":
                return args.get(0) == null ? null : SqlValues.render(args.get(0)).toLowerCase(Locale.ROOT);
            case "UPPER":
                return args.get(0) == null ? null : SqlValues.render(args.get(0)).toUpperCase(Locale.ROOT);
            case "LENGTH":
            case "CHAR_LENGTH":
            case "CHARACTER_LENGTH":
                return args.get(0) == null ? null : BigDecimal.valueOf(SqlValues.render(args.get(0)).length());
            case "ROUND":
                return round(args, name);
            case "COALESCE":
            case "IFNULL":
                for (Object arg : args) {
                    if (arg != null) {
                        return arg;
                    }
                }
                return null;
            case "SUBSTR":
            case "SUBSTRING":
                return substring(args, name);
            case "TRIM":
                return args.isEmpty() || args.get(args.size() - 1) == null
                        ? null : SqlValues.render(args.get(args.size() - 1)).trim();
            case "MIN":
            case "MAX":
                return scalarExtreme(args, name.equals("MAX"));
            case "NOT LIKE":
                return args.get(0) == null || args.get(1) == null
                        ? null : !SqlValues.like(SqlValues.render(args.get(0)), SqlValues.render(args.get(1)));
            default:
                throw QueryExecutionException.execution("unsupported function: " + name);
        }
    }

    private static Object arg(List<Object> args, int index, String function) throws QueryExecutionException {
        if (index >= args.size()) {
            throw QueryExecutionException.execution("wrong number of arguments to " + function);
        }
        return args.get(index);
    }

    private static Object round(List<Object> args, String name) throws QueryExecutionException {
        BigDecimal value = SqlValues.numericOperand(arg(args, 0, name), name);
        if (value == null) {
            return null;
        }
        int digits = 0;
        if (args.size() > 1) {
            BigDecimal places = SqlValues.numericOperand(args.get(1), name);
            digits = places == null ? 0 : places.intValue();
        }
        return value.setScale(Math.max(digits, 0), RoundingMode.HALF_UP);
    }

    private static Object substring(List<Object> args, String name) throws QueryExecutionException {
        Object value = arg(args, 0, name);
        BigDecimal start = SqlValues.numericOperand(arg(args, 1, name), name);
        if (value == null || start == null) {
            return null;
        }
        String text = SqlValues.render(value);
        // 1-based, as in SQL
        int from = Math.max(start.intValue() - 1, 0);
        int to = text.length();
        if (args.size() > 2) {
            BigDecimal length = SqlValues.numericOperand(args.get(2), name);
            if (length == null) {
                return null;
            }
            to = Math.min(text.length(), start.intValue() - 1 + length.intValue());
        }
        if (from >= to) {
            return "";
        }
        return text.substring(from, to);
    }

    private static Object scalarExtreme(List<Object> args, boolean max) {
        Object best = null;
        for (Object arg : args) {
            if (arg == null) {
                return null;
            }
            if (best == null || (max ? SqlValues.compare(arg, best) > 0 : SqlValues.compare(arg, best) < 0)) {
                best = arg;
            }
        }
        return best;
    }

    private Object aggregate(SqlCall call, Relation relation, Relation.Tuple tuple, Map<String, SqlNode> aliases)
            throws QueryExecutionException {
        String name = SqlNodes.operatorName(call);
        List<Relation.Tuple> members = tuple.getMembers();
        if (members == null) {
            throw QueryExecutionException.execution("misuse of aggregate function " + name + "()");
        }

        SqlNode argument = call.operandCount() == 0 ? null : call.operand(0);
        if (name.equals("COUNT") && (argument == null
                || (argument instanceof SqlIdentifier && ((SqlIdentifier) argument).isStar()))) {
            return BigDecimal.valueOf(members.size());
        }

        List<Object> values = new ArrayList<>();
        for (Relation.Tuple member : members) {
            // members are plain rows, so nested aggregates fail as misuse
            Object value = evaluate(argument, relation, member, aliases);
            if (value != null) {
                values.add(value);
            }
        }
        if (isDistinct(call)) {
            values = distinctValues(values);
        }

        switch (name) {
            case "COUNT":
                return BigDecimal.valueOf(values.size());
            case "SUM":
            case "TOTAL": {
                if (values.isEmpty()) {
                    return name.equals("TOTAL") ? BigDecimal.ZERO : null;
                }
                return sum(values, name);
            }
            case "AVG":
                if (values.isEmpty()) {
                    return null;
                }
                return sum(values, name).divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL64);
            case "MIN":
            case "MAX": {
                Object best = null;
                for (Object value : values) {
                    int cmp = best == null ? 0 : SqlValues.compare(value, best);
                    if (best == null || (name.equals("MAX") ? cmp > 0 : cmp < 0)) {
                        best = value;
                    }
                }
                return best;
            }
            default:
                throw QueryExecutionException.execution("unsupported aggregate: " + name);
        }
    }

    private static BigDecimal sum(List<Object> values, String name) throws QueryExecutionException {
        BigDecimal total = BigDecimal.ZERO;
        for (Object value : values) {
            total = total.add(SqlValues.numericOperand(value, name));
        }
        return total;
    }

    private static boolean isDistinct(SqlCall call) {
        SqlLiteral quantifier = call.getFunctionQuantifier();
        return quantifier != null && quantifier.getValue() == SqlSelectKeyword.DISTINCT;
    }

    private static List<Object> distinctValues(List<Object> values) {
        Set<String> seen = new HashSet<>();
        List<Object> distinct = new ArrayList<>();
        for (Object value : values) {
            BigDecimal number = SqlValues.toNumber(value);
            String key = number != null ? SqlValues.render(number) : SqlValues.render(value);
            if (seen.add(key)) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    /** Evaluates an expression list of the form used by GROUP BY keys. */
    public List<Object> evaluateAll(List<SqlNode> nodes, Relation relation, Relation.Tuple tuple,
                                    Map<String, SqlNode> aliases) throws QueryExecutionException {
        if (nodes.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> values = new ArrayList<>(nodes.size());
        for (SqlNode node : nodes) {
            values.add(evaluate(node, relation, tuple, aliases));
        }
        return values;
    }
}
