package org.ionresults.datapipeline.materialize;

import java.util.List;

import org.ionresults.datapipeline.utils.NonFinitePolicy;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Job-level settings of the materialization stage.
 *
 * @param metrics           metric names of {@code metrics_json}, in output order
 * @param isotopeSlots      isotope peak slots per ion
 * @param nonFinitePolicy   handling of NaN and infinities
 * @param imageStoreKind    backend selector passed to the image store
 * @param partitions        number of ion partitions for image posting
 * @param parallelism       posting threads including the caller
 * @param partitionAttempts attempts per partition before the stage fails
 */
public record MaterializationSettings(List<String> metrics,
                                      int isotopeSlots,
                                      NonFinitePolicy nonFinitePolicy,
                                      String imageStoreKind,
                                      int partitions,
                                      int parallelism,
                                      int partitionAttempts) {

    public static final List<String> DEFAULT_METRICS = List.of(
        "chaos", "spatial", "spectral", "msm", "total_iso_ints", "min_iso_ints", "max_iso_ints");

    public MaterializationSettings {
        metrics = List.copyOf(metrics);
        if (isotopeSlots < 1) {
            throw new IllegalArgumentException("isotopeSlots must be >= 1, got " + isotopeSlots);
        }
        if (partitions < 1 || parallelism < 1 || partitionAttempts < 1) {
            throw new IllegalArgumentException(String.format(
                "partitions, parallelism and partitionAttempts must be >= 1, got %d, %d, %d",
                partitions, parallelism, partitionAttempts));
        }
    }

    /**
     * Reads the {@code materialization} and {@code parallel} sections of the application config.
     * Missing keys fall back to the defaults of {@code reference.conf}.
     *
     * @param config root application config
     * @return the settings
     */
    public static MaterializationSettings fromConfig(Config config) {
        Config m = config.hasPath("materialization") ? config.getConfig("materialization") : ConfigFactory.empty();
        Config p = config.hasPath("parallel") ? config.getConfig("parallel") : ConfigFactory.empty();

        List<String> metrics = m.hasPath("metrics") ? m.getStringList("metrics") : DEFAULT_METRICS;
        int isotopeSlots = m.hasPath("isotopeSlots") ? m.getInt("isotopeSlots") : 4;
        NonFinitePolicy policy = m.hasPath("nonFinitePolicy")
            ? NonFinitePolicy.fromConfig(m.getString("nonFinitePolicy"))
            : NonFinitePolicy.NULL;
        String storeKind = m.hasPath("imageStoreKind") ? m.getString("imageStoreKind") : "fs";

        int parallelism = p.hasPath("parallelism") ? p.getInt("parallelism") : Runtime.getRuntime().availableProcessors();
        int partitions = p.hasPath("partitions") ? p.getInt("partitions") : parallelism;
        int attempts = p.hasPath("partitionAttempts") ? p.getInt("partitionAttempts") : 1;

        return new MaterializationSettings(metrics, isotopeSlots, policy, storeKind, partitions, parallelism, attempts);
    }
}
