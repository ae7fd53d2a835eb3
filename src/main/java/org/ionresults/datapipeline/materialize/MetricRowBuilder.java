package org.ionresults.datapipeline.materialize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.ionresults.datapipeline.api.MaterializationException;
import org.ionresults.datapipeline.api.NonPortableValueException;
import org.ionresults.datapipeline.api.UpstreamDataException;
import org.ionresults.datapipeline.api.model.IonImageIds;
import org.ionresults.datapipeline.api.model.MetricsRow;
import org.ionresults.datapipeline.api.model.MetricsTable;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.utils.MetricField;
import org.ionresults.datapipeline.utils.MetricsJsonEncoder;
import org.ionresults.datapipeline.utils.NumericNormalizer;

/**
 * Fuses the metrics table with the posted image ids into one {@link ResultRecord} per ion.
 * <p>
 * {@code msm} and {@code fdr} become dedicated columns. {@code metrics_json} holds the declared
 * metrics in declared order; a declared {@code msm} therefore appears both as column and
 * inside the bundle. The declared order is fixed per builder, so repeated builds over the
 * same input produce identical JSON text.
 */
public class MetricRowBuilder {

    public static final String MSM = "msm";
    public static final String FDR = "fdr";

    private final List<String> declaredMetrics;
    private final int isotopeSlots;
    private final NumericNormalizer normalizer;

    /**
     * @param declaredMetrics metric names of the JSON bundle, in bundle order
     * @param isotopeSlots    number of isotope peak slots per ion
     * @param normalizer      numeric conversion applied to every stored value
     */
    public MetricRowBuilder(List<String> declaredMetrics, int isotopeSlots, NumericNormalizer normalizer) {
        if (isotopeSlots < 1) {
            throw new IllegalArgumentException("isotopeSlots must be >= 1, got " + isotopeSlots);
        }
        if (declaredMetrics.stream().distinct().count() != declaredMetrics.size()) {
            throw new IllegalArgumentException("Declared metrics contain duplicates: " + declaredMetrics);
        }
        this.declaredMetrics = List.copyOf(declaredMetrics);
        this.isotopeSlots = isotopeSlots;
        this.normalizer = normalizer;
    }

    public List<String> getDeclaredMetrics() {
        return declaredMetrics;
    }

    /**
     * Builds the result rows of one job.
     * <p>
     * Ions of the table without image ids get an all-null id list.
     *
     * @param table     metrics per ion
     * @param imageRefs posted image ids per {@code formula_i}
     * @param jobId     job identifier written into every row
     * @return one record per table row, in table order
     * @throws UpstreamDataException     if a column is missing, ids reference an unknown ion
     *                                   or an id list has the wrong length
     * @throws NonPortableValueException if a metric value cannot be normalized
     */
    public List<ResultRecord> buildRows(MetricsTable table,
                                        Map<Integer, IonImageIds> imageRefs,
                                        long jobId) throws MaterializationException {
        checkColumns(table);
        checkImageRefs(table, imageRefs);

        IonImageIds noImages = IonImageIds.allAbsent(isotopeSlots);
        List<ResultRecord> records = new ArrayList<>(table.size());
        for (MetricsRow row : table.rows()) {
            IonImageIds ids = imageRefs.getOrDefault(row.formulaIndex(), noImages);
            records.add(buildRecord(row, ids, jobId));
        }
        return Collections.unmodifiableList(records);
    }

    private ResultRecord buildRecord(MetricsRow row, IonImageIds ids, long jobId) throws NonPortableValueException {
        Double msm;
        Double fdr;
        List<MetricField> fields = new ArrayList<>(declaredMetrics.size());
        try {
            msm = normalizer.normalizeScalar(MSM, row.metric(MSM));
            fdr = normalizer.normalizeScalar(FDR, row.metric(FDR));
            for (String metric : declaredMetrics) {
                fields.add(new MetricField(metric, normalizer.normalize(row.metric(metric))));
            }
        } catch (NonPortableValueException e) {
            throw new NonPortableValueException(
                "formula_i=" + row.formulaIndex() + " (" + row.formula() + row.adduct() + "): " + e.getMessage(), e);
        }
        return new ResultRecord(jobId, row.formulaIndex(), row.formula(), row.adduct(),
            msm, fdr, MetricsJsonEncoder.encode(fields), ids);
    }

    private void checkColumns(MetricsTable table) throws UpstreamDataException {
        List<String> missing = new ArrayList<>();
        for (String required : List.of(MSM, FDR)) {
            if (!table.hasColumn(required)) missing.add(required);
        }
        for (String metric : declaredMetrics) {
            if (!table.hasColumn(metric) && !missing.contains(metric)) missing.add(metric);
        }
        if (!missing.isEmpty()) {
            throw new UpstreamDataException("Metrics table lacks columns " + missing + ", has " + table.getColumns());
        }
    }

    private void checkImageRefs(MetricsTable table, Map<Integer, IonImageIds> imageRefs) throws UpstreamDataException {
        for (Map.Entry<Integer, IonImageIds> entry : imageRefs.entrySet()) {
            if (!table.containsIon(entry.getKey())) {
                throw new UpstreamDataException(
                    "Image ids posted for formula_i=" + entry.getKey() + " which is not in the metrics table");
            }
            if (entry.getValue().size() != isotopeSlots) {
                throw new UpstreamDataException(String.format(
                    "formula_i=%d has %d image ids, expected %d isotope slots",
                    entry.getKey(), entry.getValue().size(), isotopeSlots));
            }
        }
    }
}
