package org.ionresults.datapipeline.utils;

/**
 * One named entry of the ordered metrics bundle.
 *
 * @param name  metric name
 * @param value normalized value
 */
public record MetricField(String name, PlainValue value) {
}
