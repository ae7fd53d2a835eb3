package org.ionresults.datapipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import org.ionresults.datapipeline.api.model.IonIsotopeImages;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.api.model.SparseIntensityMatrix;
import org.ionresults.datapipeline.api.model.SpatialMask;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

@Tag("integration")
class MaterializationRuntimeTest {

    @TempDir
    Path tempDir;

    private Config config() {
        return ConfigFactory.empty()
            .withValue("imageStore.rootDirectory", ConfigValueFactory.fromAnyRef(tempDir.toAbsolutePath().toString()))
            .withValue("database.jdbcUrl",
                ConfigValueFactory.fromAnyRef("jdbc:h2:mem:runtime-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1"))
            .withValue("parallel.parallelism", ConfigValueFactory.fromAnyRef(2))
            .withValue("parallel.partitions", ConfigValueFactory.fromAnyRef(2))
            .withFallback(ConfigFactory.defaultReference())
            .resolve();
    }

    @Test
    void storesImagesAndRowsEndToEnd() throws Exception {
        SpatialMask mask = SpatialMask.of(new int[][] {{1, 1}, {1, 0}});
        SparseIntensityMatrix image = SparseIntensityMatrix.fromDense(new double[][] {{0, 4}, {2, 0}});

        try (MaterializationRuntime runtime = new MaterializationRuntime(config())) {
            List<ResultRecord> written = runtime.materialize(3, "ds-1", MetricsFixtures.waterTable(),
                List.of(IonIsotopeImages.of(13, image, null, image, null)), mask);

            List<ResultRecord> stored = runtime.getDatabase().findByJob(3);

            assertThat(stored).hasSize(1).isEqualTo(written);
            ResultRecord record = stored.get(0);
            assertThat(record.metricsJson()).isEqualTo(MetricsFixtures.waterJson());
            assertThat(record.msm()).isEqualTo(MetricsFixtures.MSM);
            assertThat(record.imageIds().imageIds().get(1)).isNull();
            assertThat(record.imageIds().imageIds().get(3)).isNull();
            for (String id : List.of(record.imageIds().imageIds().get(0), record.imageIds().imageIds().get(2))) {
                assertThat(runtime.getImageStore().readImage("ds-1", id)).isNotEmpty();
            }
            assertThat(runtime.getImageStore().getMetrics().get("images_written")).isEqualTo(2L);
        }
    }

    @Test
    void buildsFromConfigFile() throws Exception {
        File configFile = tempDir.resolve("ion-results.conf").toFile();
        Path imageRoot = tempDir.resolve("images");
        Files.writeString(configFile.toPath(), """
            imageStore.rootDirectory = "%s"
            database.jdbcUrl = "jdbc:h2:mem:from-file-%s;DB_CLOSE_DELAY=-1"
            parallel.parallelism = 1
            materialization.isotopeSlots = 2
            """.formatted(imageRoot.toAbsolutePath().toString().replace("\\", "/"), UUID.randomUUID()));
        SpatialMask mask = SpatialMask.full(1, 2);

        try (MaterializationRuntime runtime = MaterializationRuntime.fromConfigFile(configFile)) {
            assertThat(runtime.getMaterializer().getSettings().isotopeSlots()).isEqualTo(2);

            List<ResultRecord> written = runtime.materialize(8, "ds-2", MetricsFixtures.waterTable(),
                List.of(IonIsotopeImages.of(13, null, SparseIntensityMatrix.fromDense(new double[][] {{1, 2}}))), mask);

            assertThat(written.get(0).imageIds().imageIds().get(0)).isNull();
            assertThat(imageRoot.resolve("ds-2").resolve(written.get(0).imageIds().imageIds().get(1) + ".png")).exists();
            assertThat(runtime.getDatabase().findByJob(8)).isEqualTo(written);
        }
    }
}
