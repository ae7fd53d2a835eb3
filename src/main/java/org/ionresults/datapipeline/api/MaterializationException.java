package org.ionresults.datapipeline.api;

/**
 * Base class of all failures of the result materialization stage.
 * <p>
 * A materialization either writes the complete result set of a job or fails with one of
 * the subclasses below. Nothing in this stage retries; the caller decides whether the
 * whole stage is rerun.
 * <ul>
 *   <li>{@link UpstreamDataException}: the scoring output is inconsistent</li>
 *   <li>{@link StoreUnavailableException}: an image store or database call failed</li>
 *   <li>{@link NonPortableValueException}: a metric value cannot be written as plain JSON</li>
 * </ul>
 */
public class MaterializationException extends Exception {

    public MaterializationException(String message) {
        super(message);
    }

    public MaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
