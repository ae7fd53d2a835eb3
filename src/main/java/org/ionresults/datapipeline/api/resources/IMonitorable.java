package org.ionresults.datapipeline.api.resources;

import java.util.Map;

/**
 * Exposes operational counters of a resource.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the resource's metrics. Reading must not block writers.
     */
    Map<String, Number> getMetrics();
}
