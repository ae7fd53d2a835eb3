package org.ionresults.datapipeline.utils;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.stream.JsonWriter;

/**
 * Writes the ordered metrics bundle as a compact JSON object.
 * <p>
 * Keys are emitted exactly in list order; the encoder never goes through a map, so the order
 * of {@code metrics_json} is the declared metric order for every row. Integral values print
 * without a fraction, reals with {@link Double#toString(double)} precision.
 */
public final class MetricsJsonEncoder {

    private MetricsJsonEncoder() {
        // Utility class
    }

    /**
     * Encodes the fields as a JSON object.
     *
     * @param fields ordered metric fields, names must be unique
     * @return compact JSON text
     * @throws IllegalArgumentException if a name occurs twice
     */
    public static String encode(List<MetricField> fields) {
        Set<String> seen = new HashSet<>();
        StringWriter out = new StringWriter();
        try (JsonWriter writer = new JsonWriter(out)) {
            writer.beginObject();
            for (MetricField field : fields) {
                if (!seen.add(field.name())) {
                    throw new IllegalArgumentException("Duplicate metric name in bundle: " + field.name());
                }
                writer.name(field.name());
                writeValue(writer, field.value());
            }
            writer.endObject();
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static void writeValue(JsonWriter writer, PlainValue value) throws IOException {
        if (value instanceof PlainValue.Real real) {
            writer.value(real.value());
        } else if (value instanceof PlainValue.Integral integral) {
            writer.value(integral.value());
        } else if (value instanceof PlainValue.Sequence sequence) {
            writer.beginArray();
            for (PlainValue element : sequence.elements()) {
                writeValue(writer, element);
            }
            writer.endArray();
        } else {
            writer.nullValue();
        }
    }
}
