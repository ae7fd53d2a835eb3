package org.ionresults.datapipeline.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A metric value reduced to a JSON-portable shape.
 * <p>
 * Every value written to {@code metrics_json} or to the {@code msm}/{@code fdr} columns
 * passes through this type, so no library specific numeric wrapper reaches a serializer.
 */
public sealed interface PlainValue
        permits PlainValue.Real, PlainValue.Integral, PlainValue.Sequence, PlainValue.Null {

    /**
     * Converts back to plain Java objects: {@link Double}, {@link Long}, {@link List} or {@code null}.
     */
    Object toJava();

    /**
     * A finite double.
     */
    record Real(double value) implements PlainValue {
        public Real {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Real values must be finite, got " + value);
            }
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    /**
     * A 64-bit integer.
     */
    record Integral(long value) implements PlainValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    /**
     * An ordered sequence, e.g. per-peak intensities.
     */
    record Sequence(List<PlainValue> elements) implements PlainValue {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(elements.size());
            for (PlainValue element : elements) {
                out.add(element.toJava());
            }
            return Collections.unmodifiableList(out);
        }
    }

    /**
     * JSON {@code null}: an empty metric or a non-finite number under {@link NonFinitePolicy#NULL}.
     */
    enum Null implements PlainValue {
        INSTANCE;

        @Override
        public Object toJava() {
            return null;
        }
    }
}
