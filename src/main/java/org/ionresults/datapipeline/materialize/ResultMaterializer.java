package org.ionresults.datapipeline.materialize;

import java.util.List;
import java.util.Map;

import org.ionresults.datapipeline.api.MaterializationException;
import org.ionresults.datapipeline.api.model.IonImageIds;
import org.ionresults.datapipeline.api.model.IonIsotopeImages;
import org.ionresults.datapipeline.api.model.MetricsTable;
import org.ionresults.datapipeline.api.model.ResultRecord;
import org.ionresults.datapipeline.api.model.SpatialMask;
import org.ionresults.datapipeline.api.resources.IImageStoreProvider;
import org.ionresults.datapipeline.api.resources.IResultDatabase;
import org.ionresults.datapipeline.parallel.PartitionWorkerPool;
import org.ionresults.datapipeline.utils.NumericNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the search results of one job: isotope images first, metric rows second.
 * <p>
 * Image posting runs partitioned on the pool; row building, normalization and the insert
 * run on the calling thread once all partitions have been gathered. Any failure aborts the
 * job before the insert, so no row references an image of a failed partition. Images that
 * were posted before the failure stay in the image store unreferenced.
 */
public class ResultMaterializer {

    private static final Logger log = LoggerFactory.getLogger(ResultMaterializer.class);

    private final MaterializationSettings settings;
    private final ImagePoster imagePoster;
    private final MetricRowBuilder rowBuilder;
    private final ResultWriter resultWriter;

    public ResultMaterializer(MaterializationSettings settings, PartitionWorkerPool pool) {
        this(settings,
            new ImagePoster(pool, settings.partitions()),
            new MetricRowBuilder(settings.metrics(), settings.isotopeSlots(),
                new NumericNormalizer(settings.nonFinitePolicy())),
            new ResultWriter());
    }

    ResultMaterializer(MaterializationSettings settings,
                       ImagePoster imagePoster,
                       MetricRowBuilder rowBuilder,
                       ResultWriter resultWriter) {
        this.settings = settings;
        this.imagePoster = imagePoster;
        this.rowBuilder = rowBuilder;
        this.resultWriter = resultWriter;
    }

    public MaterializationSettings getSettings() {
        return settings;
    }

    /**
     * Posts all isotope images, then builds and inserts one row per ion of the metrics table.
     *
     * @param jobId         job identifier of the rows
     * @param datasetId     dataset the images belong to
     * @param metricsTable  metrics per ion
     * @param ionImages     isotope images per ion
     * @param mask          dataset sampling mask
     * @param storeProvider per-partition image store handles
     * @param database      result database
     * @return the written records
     * @throws MaterializationException if any stage failed; no rows were written in that case
     */
    public List<ResultRecord> store(long jobId,
                                    String datasetId,
                                    MetricsTable metricsTable,
                                    List<IonIsotopeImages> ionImages,
                                    SpatialMask mask,
                                    IImageStoreProvider storeProvider,
                                    IResultDatabase database) throws MaterializationException {
        log.info("Storing search results of job {}: {} ions, {} image sets", jobId, metricsTable.size(), ionImages.size());
        long start = System.nanoTime();

        Map<Integer, IonImageIds> imageIds = imagePoster.postImages(
            ionImages, mask, storeProvider, settings.imageStoreKind(), datasetId);
        log.info("Posted isotope images for {} ions of job {}", imageIds.size(), jobId);

        List<ResultRecord> records = storeIonMetrics(jobId, metricsTable, imageIds, database);

        log.info("Stored {} result rows of job {} in {} ms", records.size(), jobId, (System.nanoTime() - start) / 1_000_000);
        return records;
    }

    /**
     * Builds and inserts the rows for already posted images.
     *
     * @param jobId        job identifier of the rows
     * @param metricsTable metrics per ion
     * @param imageIds     posted image ids per {@code formula_i}
     * @param database     result database
     * @return the written records
     * @throws MaterializationException if rows cannot be built or inserted
     */
    public List<ResultRecord> storeIonMetrics(long jobId,
                                              MetricsTable metricsTable,
                                              Map<Integer, IonImageIds> imageIds,
                                              IResultDatabase database) throws MaterializationException {
        List<ResultRecord> records = rowBuilder.buildRows(metricsTable, imageIds, jobId);
        resultWriter.write(records, database);
        return records;
    }
}
