package org.ionresults.datapipeline.api;

/**
 * Thrown when the image store or the result database rejects a call.
 * <p>
 * The underlying {@link java.io.IOException} or {@link java.sql.SQLException} is kept as cause.
 */
public class StoreUnavailableException extends MaterializationException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
