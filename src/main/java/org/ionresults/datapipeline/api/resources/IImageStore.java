package org.ionresults.datapipeline.api.resources;

import java.io.IOException;

import org.ionresults.datapipeline.api.model.DenseIonImage;

/**
 * Capability for persisting isotope images outside the result database.
 * <p>
 * Posting is at-least-once: a retried partition posts the same image again and receives a
 * new id. Implementations must tolerate duplicates; callers never deduplicate.
 * <p>
 * <strong>Thread Safety:</strong> A handle is used by a single worker thread. Implementations
 * that hand out one shared instance from {@link IImageStoreProvider#openHandle()} must be
 * thread-safe themselves.
 */
public interface IImageStore {

    /**
     * Persists one dense image.
     *
     * @param storeKind storage backend selector, e.g. {@code "fs"}
     * @param datasetId dataset the image belongs to
     * @param image     densified image
     * @return the opaque image id, never {@code null}
     * @throws IOException if the image could not be stored
     */
    String postImage(String storeKind, String datasetId, DenseIonImage image) throws IOException;
}
