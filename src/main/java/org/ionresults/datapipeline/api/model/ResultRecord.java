package org.ionresults.datapipeline.api.model;

/**
 * The persisted annotation row of one ion.
 * <p>
 * Column order of {@link #toRowTuple()} is the wire contract of the result table:
 * {@code (job_id, formula_i, formula, adduct, msm, fdr, metrics_json, image_ids)}.
 *
 * @param jobId        job the row belongs to
 * @param formulaIndex ion identifier ({@code formula_i})
 * @param formula      sum formula
 * @param adduct       adduct
 * @param msm          ranking score, {@code null} if it was not finite and the policy maps it to null
 * @param fdr          false discovery rate, same nullability as {@code msm}
 * @param metricsJson  JSON object of the declared metrics in declared order
 * @param imageIds     image references aligned with the ion's peak slots
 */
public record ResultRecord(long jobId,
                           int formulaIndex,
                           String formula,
                           String adduct,
                           Double msm,
                           Double fdr,
                           String metricsJson,
                           IonImageIds imageIds) {

    /**
     * Converts the record into the positional tuple expected by the result table insert.
     * The image references become a {@code String[]} with nulls kept in place.
     */
    public Object[] toRowTuple() {
        return new Object[] {jobId, formulaIndex, formula, adduct, msm, fdr, metricsJson, imageIds.toArray()};
    }
}
