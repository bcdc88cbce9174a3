package com.nsqlexec.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory table of one example: title, ordered unique column names and rows.
 * Cells are kept as they arrive (usually strings); typing happens during evaluation.
 */
public class TableStore {

    /** Conventional table name generated programs use instead of the title. */
    public static final String DEFAULT_ALIAS = "w";

    private final String title;
    private final List<String> columns;
    private final List<List<Object>> rows;
    private final Map<String, Integer> exactIndex;

    private TableStore(String title, List<String> columns, List<List<Object>> rows) {
        this.title = title;
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
        this.exactIndex = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            exactIndex.put(columns.get(i), i);
        }
    }

    /**
     * Build a table from a raw header and rows. Blank headers become {@code col_<n>}, repeated
     * headers get a {@code _2}, {@code _3} ... suffix, and short or long rows are padded with
     * nulls or truncated to the header width.
     */
    public static TableStore of(String title, List<String> header, List<? extends List<?>> rows) {
        List<String> columns = uniqueColumns(header);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            List<Object> cells = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                cells.add(row != null && i < row.size() ? row.get(i) : null);
            }
            copied.add(Collections.unmodifiableList(cells));
        }
        return new TableStore(title == null ? "" : title, columns, copied);
    }

    private static List<String> uniqueColumns(List<String> header) {
        List<String> columns = new ArrayList<>(header.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (name == null || name.trim().isEmpty()) {
                name = "col_" + i;
            }
            name = name.trim();
            String unique = name;
            int suffix = 2;
            while (!seen.add(unique.toLowerCase(Locale.ROOT))) {
                unique = name + "_" + suffix++;
            }
            columns.add(unique);
        }
        return columns;
    }

    public String getTitle() { return title; }
    public List<String> getColumns() { return columns; }
    public List<List<Object>> getRows() { return rows; }
    public int getRowCount() { return rows.size(); }
    public int getColumnCount() { return columns.size(); }

    public Object getCell(int row, int column) {
        return rows.get(row).get(column);
    }

    public List<Object> getColumnValues(int column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Exact index of a column, or -1.
     */
    public int indexOf(String name) {
        Integer index = exactIndex.get(name);
        return index == null ? -1 : index;
    }

    /**
     * Index of the column a (possibly sloppy) name refers to: exact match first, then
     * case-insensitive, then canonical. Returns -1 when nothing matches.
     */
    public int resolveColumn(String name) {
        if (name == null) {
            return -1;
        }
        int exact = indexOf(name);
        if (exact >= 0) {
            return exact;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        String canonical = FuzzyMatcher.canonical(name);
        for (int i = 0; i < columns.size(); i++) {
            if (FuzzyMatcher.canonical(columns.get(i)).equals(canonical)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Whether a table reference in a program denotes this table.
     */
    public boolean isReferencedBy(String tableName) {
        if (tableName == null) {
            return false;
        }
        return DEFAULT_ALIAS.equalsIgnoreCase(tableName.trim())
                || title.equals(tableName)
                || FuzzyMatcher.canonicalEquals(title, tableName);
    }

    /**
     * Copy restricted to the given columns (in the given order). Unknown names are skipped.
     */
    public TableStore project(List<String> columnNames) {
        List<Integer> indexes = new ArrayList<>();
        List<String> header = new ArrayList<>();
        for (String name : columnNames) {
            int index = resolveColumn(name);
            if (index >= 0 && !indexes.contains(index)) {
                indexes.add(index);
                header.add(columns.get(index));
            }
        }
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> cells = new ArrayList<>(indexes.size());
            for (int index : indexes) {
                cells.add(row.get(index));
            }
            projected.add(cells);
        }
        return of(title, header, projected);
    }

    @Override
    public String toString() {
        return "TableStore{title='" + title + "', columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
