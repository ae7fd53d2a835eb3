package org.ionresults.datapipeline.materialize;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.ionresults.datapipeline.api.MaterializationException;
import org.ionresults.datapipeline.api.StoreUnavailableException;
import org.ionresults.datapipeline.api.UpstreamDataException;
import org.ionresults.datapipeline.api.model.DenseIonImage;
import org.ionresults.datapipeline.api.model.IonImageIds;
import org.ionresults.datapipeline.api.model.IonIsotopeImages;
import org.ionresults.datapipeline.api.model.SparseIntensityMatrix;
import org.ionresults.datapipeline.api.model.SpatialMask;
import org.ionresults.datapipeline.api.resources.IImageStore;
import org.ionresults.datapipeline.api.resources.IImageStoreProvider;
import org.ionresults.datapipeline.parallel.IonPartitions;
import org.ionresults.datapipeline.parallel.PartitionFailedException;
import org.ionresults.datapipeline.parallel.PartitionWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts the isotope images of all ions to the image store and collects the returned ids.
 * <p>
 * Ions are split into partitions that run on a {@link PartitionWorkerPool}. Each partition
 * opens its own image store handle and keeps its results in a partition-local map; nothing
 * is shared between partitions until the pool's barrier, after which the maps are merged.
 * <p>
 * Per ion and slot:
 * <ul>
 *   <li>present slot: densified against the mask, exactly one {@code postImage} call, id recorded</li>
 *   <li>absent slot: no store call, {@code null} recorded</li>
 * </ul>
 * Store failures are not caught or retried here. They fail the partition; whether the partition
 * is rerun is decided by the pool's attempt setting, and a rerun posts all its images again.
 * Only store I/O failures are rerun. Bad upstream data fails the same way on every attempt.
 */
public class ImagePoster {

    private static final Logger log = LoggerFactory.getLogger(ImagePoster.class);

    private final PartitionWorkerPool pool;
    private final int partitionCount;
    private final AtomicLong imagesPosted = new AtomicLong();

    /**
     * @param pool           pool executing the partitions
     * @param partitionCount number of partitions the ions are split into, must be &gt;= 1
     */
    public ImagePoster(PartitionWorkerPool pool, int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be >= 1, got " + partitionCount);
        }
        this.pool = pool;
        this.partitionCount = partitionCount;
    }

    /**
     * Total number of store calls that returned an id, over the lifetime of this poster.
     * Includes posts of partitions that failed later.
     */
    public long getImagesPosted() {
        return imagesPosted.get();
    }

    /**
     * Posts all present isotope images.
     *
     * @param ions          ions with their peak slots, {@code formula_i} must be unique
     * @param mask          dataset sampling mask
     * @param storeProvider source of per-partition image store handles
     * @param storeKind     image store backend selector passed through to the store
     * @param datasetId     dataset the images belong to
     * @return {@code formula_i} to image ids, one entry per ion, ids aligned with the slots
     * @throws UpstreamDataException      if ions repeat or an image does not match the mask
     * @throws StoreUnavailableException  if an image store call failed
     */
    public Map<Integer, IonImageIds> postImages(List<IonIsotopeImages> ions,
                                                SpatialMask mask,
                                                IImageStoreProvider storeProvider,
                                                String storeKind,
                                                String datasetId) throws MaterializationException {
        checkUniqueIons(ions);
        SparseImageReconstructor reconstructor = new SparseImageReconstructor(mask);
        List<List<IonIsotopeImages>> partitions = IonPartitions.partition(ions, partitionCount);

        @SuppressWarnings("unchecked")
        Map<Integer, IonImageIds>[] partitionResults = new Map[partitions.size()];

        log.debug("Posting isotope images of {} ions in {} partitions (store kind '{}', dataset '{}')",
            ions.size(), partitions.size(), storeKind, datasetId);

        try {
            pool.dispatch(partitions.size(), partition -> {
                IImageStore store = storeProvider.openHandle();
                partitionResults[partition] = postPartition(
                    partitions.get(partition), reconstructor, store, storeKind, datasetId);
                log.debug("Partition {} posted images for {} ions", partition, partitions.get(partition).size());
            }, ImagePoster::isTransient);
        } catch (PartitionFailedException e) {
            throw translate(e);
        }

        // Gather: every partition completed, results are visible after the pool's barrier
        Map<Integer, IonImageIds> merged = new LinkedHashMap<>();
        for (Map<Integer, IonImageIds> result : partitionResults) {
            merged.putAll(result);
        }
        return merged;
    }

    private Map<Integer, IonImageIds> postPartition(List<IonIsotopeImages> ions,
                                                    SparseImageReconstructor reconstructor,
                                                    IImageStore store,
                                                    String storeKind,
                                                    String datasetId) throws MaterializationException, IOException {
        Map<Integer, IonImageIds> result = new HashMap<>();
        for (IonIsotopeImages ion : ions) {
            List<String> ids = new ArrayList<>(ion.slotCount());
            for (SparseIntensityMatrix slot : ion.slots()) {
                if (!SparseImageReconstructor.isPresent(slot)) {
                    ids.add(null);
                    continue;
                }
                DenseIonImage image = reconstructor.densify(ion.formulaIndex(), slot);
                String id = store.postImage(storeKind, datasetId, image);
                if (id == null) {
                    throw new IOException("Image store returned no id for formula_i=" + ion.formulaIndex());
                }
                imagesPosted.incrementAndGet();
                ids.add(id);
            }
            result.put(ion.formulaIndex(), new IonImageIds(ids));
        }
        return result;
    }

    static boolean isTransient(Throwable failure) {
        return failure instanceof IOException || failure instanceof StoreUnavailableException;
    }

    private static void checkUniqueIons(List<IonIsotopeImages> ions) throws UpstreamDataException {
        Set<Integer> seen = new HashSet<>();
        for (IonIsotopeImages ion : ions) {
            if (!seen.add(ion.formulaIndex())) {
                throw new UpstreamDataException("Isotope images listed twice for formula_i=" + ion.formulaIndex());
            }
        }
    }

    private static MaterializationException translate(PartitionFailedException e) {
        Throwable cause = e.getCause();
        if (cause instanceof MaterializationException me) {
            return me;
        }
        if (cause instanceof IOException) {
            return new StoreUnavailableException(
                "Image store failed in partition " + e.getPartition() + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new MaterializationException("Image posting failed in partition " + e.getPartition(), e);
    }
}
