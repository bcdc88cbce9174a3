package com.nsqlexec.exec;

import com.nsqlexec.table.FuzzyMatcher;
import com.nsqlexec.table.TableStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Intermediate result of relational evaluation. A grouped relation carries, for every tuple, the
 * tuples of the group it stands for, so aggregates can be computed over them.
 */
public class Relation {

    private final List<String> columns;
    private final List<Tuple> tuples;
    private final boolean grouped;

    public Relation(List<String> columns, List<Tuple> tuples, boolean grouped) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.tuples = Collections.unmodifiableList(new ArrayList<>(tuples));
        this.grouped = grouped;
    }

    public static Relation of(TableStore table) {
        List<Tuple> tuples = new ArrayList<>(table.getRowCount());
        for (List<Object> row : table.getRows()) {
            tuples.add(new Tuple(row));
        }
        return new Relation(table.getColumns(), tuples, false);
    }

    /** A relation without columns and with a single tuple, used when a query has no FROM clause. */
    public static Relation singleRow() {
        return new Relation(Collections.emptyList(), List.of(new Tuple(Collections.emptyList())), false);
    }

    public List<String> getColumns() { return columns; }
    public List<Tuple> getTuples() { return tuples; }
    public boolean isGrouped() { return grouped; }
    public int size() { return tuples.size(); }

    /**
     * Index of a column by exact, then case-insensitive, then canonical name; -1 if absent.
     */
    public int indexOf(String name) {
        int index = columns.indexOf(name);
        if (index >= 0) {
            return index;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        for (int i = 0; i < columns.size(); i++) {
            if (FuzzyMatcher.canonicalEquals(columns.get(i), name)) {
                return i;
            }
        }
        return -1;
    }

    /** Copy with an extra column appended; {@code values} must have one entry per tuple. */
    public Relation withColumn(String name, List<?> values) {
        if (values.size() != tuples.size()) {
            throw new IllegalArgumentException("Expected " + tuples.size() + " values for column " + name
                    + " but got " + values.size());
        }
        List<String> newColumns = new ArrayList<>(columns);
        newColumns.add(name);
        List<Tuple> newTuples = new ArrayList<>(tuples.size());
        for (int i = 0; i < tuples.size(); i++) {
            List<Object> row = new ArrayList<>(tuples.get(i).getValues());
            row.add(values.get(i));
            newTuples.add(new Tuple(row));
        }
        return new Relation(newColumns, newTuples, false);
    }

    /** All values in row-major order. A multi-valued cell contributes each of its values. */
    public List<Object> flatten() {
        List<Object> values = new ArrayList<>();
        for (Tuple tuple : tuples) {
            for (Object value : tuple.getValues()) {
                if (value instanceof Collection) {
                    values.addAll((Collection<?>) value);
                } else {
                    values.add(value);
                }
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return "Relation" + columns + " x " + tuples.size() + (grouped ? " (grouped)" : "");
    }

    /**
     * One row. Members are the rows of the group this tuple represents, or null when the
     * relation is not grouped.
     */
    public static class Tuple {
        private final List<Object> values;
        private final List<Tuple> members;

        public Tuple(List<Object> values) {
            this(values, null);
        }

        public Tuple(List<Object> values, List<Tuple> members) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
            this.members = members == null ? null : Collections.unmodifiableList(new ArrayList<>(members));
        }

        public List<Object> getValues() { return values; }
        public List<Tuple> getMembers() { return members; }

        public Object get(int index) {
            return values.get(index);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
