package org.ionresults.datapipeline.api;

/**
 * Thrown when the metrics table and the posted image references do not describe the same
 * set of ions, or when the table lacks a declared metric column.
 * <p>
 * Raised instead of silently dropping rows so that a partial result set is never written.
 */
public class UpstreamDataException extends MaterializationException {

    public UpstreamDataException(String message) {
        super(message);
    }
}
