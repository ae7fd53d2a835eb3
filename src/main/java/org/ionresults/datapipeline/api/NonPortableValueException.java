package org.ionresults.datapipeline.api;

/**
 * Thrown when a metric value has no plain JSON representation: an unsupported type,
 * or a NaN/Infinity while the non-finite policy is {@code REJECT}.
 */
public class NonPortableValueException extends MaterializationException {

    public NonPortableValueException(String message) {
        super(message);
    }

    public NonPortableValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
