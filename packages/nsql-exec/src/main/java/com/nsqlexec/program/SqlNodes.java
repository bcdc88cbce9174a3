package com.nsqlexec.program;

import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Helpers for inspecting Calcite parse trees. Traversals never descend into subqueries.
 */
public final class SqlNodes {

    private static final Set<String> AGGREGATES = new HashSet<>(Arrays.asList("COUNT", "SUM", "AVG", "MIN", "MAX", "TOTAL"));

    private SqlNodes() {
    }

    /** Upper-case name of the call's operator or function. */
    public static String operatorName(SqlCall call) {
        return call.getOperator().getName().toUpperCase(Locale.ROOT);
    }

    /** Last component of a possibly qualified identifier ({@code w.col} gives {@code col}). */
    public static String simpleName(SqlIdentifier identifier) {
        if (identifier.isStar()) {
            return "*";
        }
        return identifier.names.get(identifier.names.size() - 1);
    }

    public static boolean isQuery(SqlNode node) {
        return node != null && (node.getKind() == SqlKind.SELECT || node.getKind() == SqlKind.ORDER_BY
                || node.getKind() == SqlKind.UNION || node.getKind() == SqlKind.INTERSECT
                || node.getKind() == SqlKind.EXCEPT);
    }

    /**
     * Whether the call is an aggregate. {@code MIN}/{@code MAX} with several arguments are the
     * scalar variants.
     */
    public static boolean isAggregate(SqlCall call) {
        String name = operatorName(call);
        if (!AGGREGATES.contains(name)) {
            return false;
        }
        if (name.equals("MIN") || name.equals("MAX")) {
            return call.operandCount() == 1;
        }
        return true;
    }

    public static boolean containsAggregate(SqlNode node) {
        if (node == null || isQuery(node)) {
            return false;
        }
        if (node instanceof SqlNodeList) {
            for (SqlNode item : (SqlNodeList) node) {
                if (containsAggregate(item)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof SqlCall) {
            SqlCall call = (SqlCall) node;
            if (isAggregate(call)) {
                return true;
            }
            for (SqlNode operand : call.getOperandList()) {
                if (containsAggregate(operand)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether the expression reads a column of its input row. Identifiers naming a scalar
     * binding do not count.
     */
    public static boolean referencesColumn(SqlNode node, Set<String> scalarNames) {
        if (node == null || isQuery(node)) {
            return false;
        }
        if (node instanceof SqlIdentifier) {
            SqlIdentifier identifier = (SqlIdentifier) node;
            return identifier.isStar() || !scalarNames.contains(simpleName(identifier));
        }
        if (node instanceof SqlNodeList) {
            for (SqlNode item : (SqlNodeList) node) {
                if (referencesColumn(item, scalarNames)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof SqlCall) {
            SqlCall call = (SqlCall) node;
            if (call.getKind() == SqlKind.AS) {
                // the second operand is the alias name
                return referencesColumn(call.operand(0), scalarNames);
            }
            for (SqlNode operand : call.getOperandList()) {
                if (referencesColumn(operand, scalarNames)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean contains(SqlNode node, SqlKind kind) {
        if (node == null) {
            return false;
        }
        if (node.getKind() == kind) {
            return true;
        }
        if (node instanceof SqlNodeList) {
            for (SqlNode item : (SqlNodeList) node) {
                if (contains(item, kind)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof SqlCall && !isQuery(node)) {
            for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                if (contains(operand, kind)) {
                    return true;
                }
            }
        }
        return false;
    }
}
