package org.ionresults.datapipeline.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quality metrics of one ion as produced by the scoring stage.
 * <p>
 * Metric values keep whatever numeric representation the scoring stage used
 * (boxed primitives, {@link java.math.BigDecimal}, atomics, primitive arrays, lists).
 * They are converted to portable values only when rows are built.
 *
 * @param formulaIndex identifier of the ion ({@code formula_i})
 * @param formula      sum formula, e.g. {@code H2O}
 * @param adduct       adduct, e.g. {@code +H}
 * @param values       metric name to raw value, in table column order
 */
public record MetricsRow(int formulaIndex, String formula, String adduct, Map<String, Object> values) {

    public MetricsRow {
        if (formula == null || adduct == null) {
            throw new IllegalArgumentException("formula and adduct are required for formula_i=" + formulaIndex);
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean hasMetric(String name) {
        return values.containsKey(name);
    }

    /**
     * Raw value of a metric, may be {@code null} if the scoring stage left it empty.
     */
    public Object metric(String name) {
        return values.get(name);
    }
}
