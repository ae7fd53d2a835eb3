package org.ionresults.datapipeline;

import java.io.File;
import java.util.List;

import org.ionresults.config.ConfigLoader;
import org.ionresults.datapipeline.api.MaterializationException;
import org.ionresults.datapipeline.api.model.IonIsotopeImages;
import org.ionresults.datapipeline.api.model.MetricsTable;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.api.model.SpatialMask;
import org.ionresults.datapipeline.materialize.MaterializationSettings;
import org.ionresults.datapipeline.materialize.ResultMaterializer;
import org.ionresults.datapipeline.parallel.PartitionWorkerPool;
import org.ionresults.datapipeline.resources.database.H2ResultDatabase;
import org.ionresults.datapipeline.resources.storage.FileSystemImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Wires the materialization stage to its configured resources.
 * <p>
 * Reads the {@code imageStore}, {@code database}, {@code materialization} and {@code parallel}
 * sections, creates the filesystem image store, the H2 result database and the worker pool,
 * and owns them until {@link #close()}.
 */
public class MaterializationRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaterializationRuntime.class);

    private final FileSystemImageStore imageStore;
    private final H2ResultDatabase database;
    private final PartitionWorkerPool pool;
    private final ResultMaterializer materializer;

    public MaterializationRuntime(Config config) {
        MaterializationSettings settings = MaterializationSettings.fromConfig(config);
        this.imageStore = new FileSystemImageStore("image-store", config.getConfig("imageStore"));
        this.database = new H2ResultDatabase("result-db", config.getConfig("database"));
        this.pool = new PartitionWorkerPool(settings.parallelism(), settings.partitionAttempts());
        this.materializer = new ResultMaterializer(settings, pool);
        log.info("Materialization runtime ready: parallelism={}, partitions={}, isotopeSlots={}, nonFinitePolicy={}",
            settings.parallelism(), settings.partitions(), settings.isotopeSlots(), settings.nonFinitePolicy());
    }

    /**
     * Creates the runtime from a configuration file layered over the classpath defaults.
     *
     * @param configFile file to load, {@code null} to search the default locations
     * @see ConfigLoader#load(File)
     */
    public static MaterializationRuntime fromConfigFile(File configFile) {
        return new MaterializationRuntime(ConfigLoader.load(configFile).config());
    }

    public FileSystemImageStore getImageStore() {
        return imageStore;
    }

    public H2ResultDatabase getDatabase() {
        return database;
    }

    public ResultMaterializer getMaterializer() {
        return materializer;
    }

    /**
     * Stores images and result rows of one job with the configured resources.
     *
     * @see ResultMaterializer#store
     */
    public List<ResultRecord> materialize(long jobId,
                                          String datasetId,
                                          MetricsTable metricsTable,
                                          List<IonIsotopeImages> ionImages,
                                          SpatialMask mask) throws MaterializationException {
        return materializer.store(jobId, datasetId, metricsTable, ionImages, mask, imageStore, database);
    }

    @Override
    public void close() {
        pool.shutdown();
        database.close();
    }
}
