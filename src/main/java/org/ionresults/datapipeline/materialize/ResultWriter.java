package org.ionresults.datapipeline.materialize;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.ionresults.datapipeline.api.StoreUnavailableException;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.api.resources.IResultDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes result rows with a single batched insert.
 */
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    /**
     * Insert template of the annotation table. Placeholder order matches {@link ResultRecord#toRowTuple()}.
     */
    public static final String METRICS_INSERT =
        "INSERT INTO iso_image_metrics (job_id, formula_i, sf, adduct, msm, fdr, stats, iso_image_ids) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private final String statement;

    public ResultWriter() {
        this(METRICS_INSERT);
    }

    public ResultWriter(String statement) {
        this.statement = statement;
    }

    /**
     * Inserts all records in one call. An empty record list issues no call.
     *
     * @param records  rows to insert
     * @param database insert capability
     * @throws StoreUnavailableException if the insert failed; nothing is retried
     */
    public void write(List<ResultRecord> records, IResultDatabase database) throws StoreUnavailableException {
        if (records.isEmpty()) {
            log.debug("No result rows to write");
            return;
        }
        List<Object[]> rows = new ArrayList<>(records.size());
        for (ResultRecord record : records) {
            rows.add(record.toRowTuple());
        }
        try {
            database.insert(statement, rows);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to insert " + rows.size() + " result rows: " + e.getMessage(), e);
        }
        log.debug("Inserted {} result rows", rows.size());
    }
}
