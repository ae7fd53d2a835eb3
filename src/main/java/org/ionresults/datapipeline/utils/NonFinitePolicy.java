package org.ionresults.datapipeline.utils;

/**
 * What the normalizer does with NaN and infinite numbers.
 */
public enum NonFinitePolicy {
    /** Written as JSON {@code null} and SQL {@code NULL}. */
    NULL,
    /** Fails the materialization with a {@link org.ionresults.datapipeline.api.NonPortableValueException}. */
    REJECT;

    /**
     * Parses a configuration value, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static NonFinitePolicy fromConfig(String value) {
        for (NonFinitePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown non-finite policy '" + value + "', expected NULL or REJECT");
    }
}
