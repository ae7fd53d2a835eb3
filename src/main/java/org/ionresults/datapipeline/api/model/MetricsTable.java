package org.ionresults.datapipeline.api.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-ion metrics table, indexed by {@code formula_i}.
 * <p>
 * Columns are the metric names shared by every row. Row iteration follows insertion order.
 * The table is consumed read-only by the materialization stage.
 */
public final class MetricsTable {

    private final List<String> columns;
    private final Map<Integer, MetricsRow> rows;

    private MetricsTable(List<String> columns, Map<Integer, MetricsRow> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean containsIon(int formulaIndex) {
        return rows.containsKey(formulaIndex);
    }

    public MetricsRow get(int formulaIndex) {
        return rows.get(formulaIndex);
    }

    public Set<Integer> formulaIndices() {
        return rows.keySet();
    }

    public Collection<MetricsRow> rows() {
        return rows.values();
    }

    /**
     * Collects rows and checks that each one carries exactly the table's columns.
     */
    public static final class Builder {
        private final List<String> columns;
        private final Map<Integer, MetricsRow> rows = new LinkedHashMap<>();

        private Builder(List<String> columns) {
            Set<String> unique = new LinkedHashSet<>(columns);
            if (unique.size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate metric columns: " + columns);
            }
            this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        }

        public Builder addRow(int formulaIndex, String formula, String adduct, Map<String, Object> values) {
            return addRow(new MetricsRow(formulaIndex, formula, adduct, values));
        }

        public Builder addRow(MetricsRow row) {
            if (!row.values().keySet().equals(new LinkedHashSet<>(columns))) {
                throw new IllegalArgumentException(String.format(
                    "Row formula_i=%d has columns %s, table expects %s",
                    row.formulaIndex(), row.values().keySet(), columns));
            }
            if (rows.putIfAbsent(row.formulaIndex(), row) != null) {
                throw new IllegalArgumentException("Duplicate row for formula_i=" + row.formulaIndex());
            }
            return this;
        }

        public MetricsTable build() {
            return new MetricsTable(columns, Collections.unmodifiableMap(new LinkedHashMap<>(rows)));
        }
    }
}
