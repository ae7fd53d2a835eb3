package org.ionresults.datapipeline.resources.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.ionresults.datapipeline.api.model.IonImageIds;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.materialize.ResultWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

@Tag("integration")
class H2ResultDatabaseTest {

    @TempDir
    Path tempDir;

    private H2ResultDatabase database;

    @BeforeEach
    void setUp() {
        database = new H2ResultDatabase("test-db", config("jdbc:h2:mem:results-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1"));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static Config config(String jdbcUrl) {
        return ConfigFactory.empty()
            .withValue("jdbcUrl", ConfigValueFactory.fromAnyRef(jdbcUrl))
            .withValue("maxPoolSize", ConfigValueFactory.fromAnyRef(2));
    }

    private static ResultRecord record(long jobId, int formulaIndex, Double msm, IonImageIds ids) {
        return new ResultRecord(jobId, formulaIndex, "H2O", "+H", msm, 0.5, "{\"msm\":" + msm + "}", ids);
    }

    private static List<Object[]> tuples(ResultRecord... records) {
        List<Object[]> rows = new ArrayList<>();
        for (ResultRecord record : records) {
            rows.add(record.toRowTuple());
        }
        return rows;
    }

    @Test
    void insertedRowsReadBackWithNullsInPlace() throws Exception {
        database.insert(ResultWriter.METRICS_INSERT, tuples(
            record(3, 14, null, IonImageIds.allAbsent(4)),
            record(3, 13, 0.729, IonImageIds.of("iso_image_1", null, "iso_image_3", null))));

        List<ResultRecord> rows = database.findByJob(3);

        assertThat(rows).hasSize(2);
        ResultRecord first = rows.get(0);
        assertThat(first.formulaIndex()).isEqualTo(13);
        assertThat(first.msm()).isEqualTo(0.729);
        assertThat(first.fdr()).isEqualTo(0.5);
        assertThat(first.metricsJson()).isEqualTo("{\"msm\":0.729}");
        assertThat(first.imageIds().imageIds()).containsExactly("iso_image_1", null, "iso_image_3", null);
        assertThat(rows.get(1).msm()).isNull();
        assertThat(rows.get(1).imageIds().imageIds()).containsOnlyNulls().hasSize(4);
    }

    @Test
    void failedBatchLeavesNoRows() throws Exception {
        List<Object[]> rows = tuples(
            record(4, 1, 0.1, IonImageIds.allAbsent(2)),
            record(4, 1, 0.2, IonImageIds.allAbsent(2)));

        assertThatThrownBy(() -> database.insert(ResultWriter.METRICS_INSERT, rows)).isInstanceOf(SQLException.class);

        assertThat(database.findByJob(4)).isEmpty();
        assertThat(database.getMetrics().get("insert_errors")).isEqualTo(1L);
    }

    @Test
    void jobsAreIsolated() throws Exception {
        database.insert(ResultWriter.METRICS_INSERT, tuples(record(1, 1, 0.1, IonImageIds.allAbsent(1))));
        database.insert(ResultWriter.METRICS_INSERT, tuples(record(2, 1, 0.2, IonImageIds.allAbsent(1))));

        assertThat(database.findByJob(1)).extracting(ResultRecord::msm).containsExactly(0.1);
        assertThat(database.getMetrics().get("rows_inserted")).isEqualTo(2L);
        assertThat(database.getMetrics().get("batches_inserted")).isEqualTo(2L);
    }

    @Test
    void fileDatabaseSurvivesReopen() throws Exception {
        String url = "jdbc:h2:file:" + tempDir.resolve("results").toAbsolutePath();
        H2ResultDatabase fileDb = new H2ResultDatabase("file-db", config(url));
        fileDb.insert(ResultWriter.METRICS_INSERT, tuples(record(9, 1, 0.3, IonImageIds.of("a"))));
        fileDb.close();

        H2ResultDatabase reopened = new H2ResultDatabase("file-db", config(url));
        try {
            assertThat(reopened.findByJob(9)).singleElement()
                .satisfies(r -> assertThat(r.imageIds().imageIds()).containsExactly("a"));
        } finally {
            reopened.close();
        }
    }

    @Test
    void requiresJdbcUrl() {
        assertThatThrownBy(() -> new H2ResultDatabase("bad", ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeIsIdempotent() {
        assertThat(database.getResourceName()).isEqualTo("test-db");
        database.close();
        database.close();

        assertThat(database.getMetrics()).doesNotContainKey("h2_pool_active_connections");
    }
}
