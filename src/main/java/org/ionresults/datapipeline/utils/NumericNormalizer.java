package org.ionresults.datapipeline.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

import org.ionresults.datapipeline.api.NonPortableValueException;

/**
 * Converts raw metric values into {@link PlainValue}s.
 * <p>
 * Supported inputs:
 * <ul>
 *   <li>floating point: {@link Double}, {@link Float} (widened exactly), {@link DoubleAdder},
 *       {@link DoubleAccumulator}</li>
 *   <li>integral: {@link Long}, {@link Integer}, {@link Short}, {@link Byte}, atomics and adders,
 *       {@link BigInteger} and integral {@link BigDecimal} within 64 bits</li>
 *   <li>{@link BigDecimal} with a fraction, and integers beyond 64 bits: converted to the nearest
 *       double, accepted only if that double is exactly the value (as {@code new BigDecimal(0.9)})
 *       or the value is the double's shortest decimal form (as {@code new BigDecimal("0.9")}).
 *       Anything else would change the number and is rejected.</li>
 *   <li>sequences: primitive arrays, object arrays and collections, converted element-wise
 *       (nested sequences allowed)</li>
 *   <li>{@code null}, mapped to {@link PlainValue.Null}</li>
 * </ul>
 * Anything else is rejected with {@link NonPortableValueException}. NaN and infinities are
 * handled according to the configured {@link NonFinitePolicy}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from the immutable policy.
 */
public final class NumericNormalizer {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final NonFinitePolicy nonFinitePolicy;

    public NumericNormalizer(NonFinitePolicy nonFinitePolicy) {
        this.nonFinitePolicy = nonFinitePolicy;
    }

    public NonFinitePolicy getNonFinitePolicy() {
        return nonFinitePolicy;
    }

    /**
     * Normalizes a scalar or sequence metric value.
     *
     * @param value raw value from the metrics table
     * @return the portable value
     * @throws NonPortableValueException if the value has no portable representation
     */
    public PlainValue normalize(Object value) throws NonPortableValueException {
        if (value == null) {
            return PlainValue.Null.INSTANCE;
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof double[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (double v : arr) out.add(real(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof float[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (float v : arr) out.add(real(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof long[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (long v : arr) out.add(new PlainValue.Integral(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof int[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (int v : arr) out.add(new PlainValue.Integral(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof short[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (short v : arr) out.add(new PlainValue.Integral(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof byte[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (byte v : arr) out.add(new PlainValue.Integral(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof Object[] arr) {
            List<PlainValue> out = new ArrayList<>(arr.length);
            for (Object v : arr) out.add(normalize(v));
            return new PlainValue.Sequence(out);
        }
        if (value instanceof Collection<?> collection) {
            List<PlainValue> out = new ArrayList<>(collection.size());
            for (Object v : collection) out.add(normalize(v));
            return new PlainValue.Sequence(out);
        }
        throw new NonPortableValueException("Unsupported metric value type " + value.getClass().getName());
    }

    /**
     * Normalizes a value destined for a scalar column such as {@code msm} or {@code fdr}.
     *
     * @param column column name, used in error messages
     * @param value  raw value
     * @return the value as double, or {@code null} for empty and (policy permitting) non-finite values
     * @throws NonPortableValueException if the value is a sequence or otherwise not portable
     */
    public Double normalizeScalar(String column, Object value) throws NonPortableValueException {
        PlainValue plain = normalize(value);
        if (plain instanceof PlainValue.Real real) {
            return real.value();
        }
        if (plain instanceof PlainValue.Integral integral) {
            return (double) integral.value();
        }
        if (plain == PlainValue.Null.INSTANCE) {
            return null;
        }
        throw new NonPortableValueException("Column '" + column + "' requires a scalar, got a sequence");
    }

    private PlainValue normalizeNumber(Number number) throws NonPortableValueException {
        if (number instanceof Double || number instanceof Float
                || number instanceof DoubleAdder || number instanceof DoubleAccumulator) {
            return real(number.doubleValue());
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte || number instanceof AtomicLong || number instanceof AtomicInteger
                || number instanceof LongAdder || number instanceof LongAccumulator) {
            return new PlainValue.Integral(number.longValue());
        }
        if (number instanceof BigInteger big) {
            return integral(big);
        }
        if (number instanceof BigDecimal decimal) {
            return normalizeDecimal(decimal);
        }
        throw new NonPortableValueException("Unsupported numeric type " + number.getClass().getName());
    }

    private PlainValue normalizeDecimal(BigDecimal decimal) throws NonPortableValueException {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return integral(stripped.toBigIntegerExact());
        }
        double d = decimal.doubleValue();
        if (Double.isFinite(d)
                && (new BigDecimal(d).compareTo(decimal) == 0 || BigDecimal.valueOf(d).compareTo(decimal) == 0)) {
            return new PlainValue.Real(d);
        }
        throw new NonPortableValueException(
            "Decimal " + decimal.toPlainString() + " cannot be represented as a double without loss");
    }

    /**
     * Integers within 64 bits stay integral; larger ones become reals when a double holds them exactly.
     */
    private static PlainValue integral(BigInteger big) throws NonPortableValueException {
        if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
            return new PlainValue.Integral(big.longValue());
        }
        double d = big.doubleValue();
        if (Double.isFinite(d) && new BigDecimal(d).toBigIntegerExact().equals(big)) {
            return new PlainValue.Real(d);
        }
        throw new NonPortableValueException("Integer " + big + " exceeds 64 bits and has no exact double value");
    }

    private PlainValue real(double value) throws NonPortableValueException {
        if (Double.isFinite(value)) {
            return new PlainValue.Real(value);
        }
        if (nonFinitePolicy == NonFinitePolicy.REJECT) {
            throw new NonPortableValueException("Non-finite metric value " + value);
        }
        return PlainValue.Null.INSTANCE;
    }
}
