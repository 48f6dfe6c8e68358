/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collector;

/**
 * The catalog of statistical reducers that a {@link Measure measure} may apply to the values collected for one pivot
 * cell or total. Every reducer is a pure function from a list of numbers to a number, and every reducer yields
 * {@code 0} for an empty list, so that no {@code NaN} reaches a rendered table.
 *
 * <p>Statistical reducers are population statistics: {@link #VARIANCE} is the mean of squared deviations from the
 * mean, and {@link #STDDEV} is its square root.
 */
public enum Reducer {
    /** The number of values. */
    COUNT("count") {
        @Override
        double apply(double[] values) {
            return values.length;
        }
    },
    /** The arithmetic sum. */
    SUM("sum") {
        @Override
        double apply(double[] values) {
            double sum = 0d;
            for (double value : values)
                sum += value;
            return sum;
        }
    },
    /** The arithmetic mean. */
    AVG("avg") {
        @Override
        double apply(double[] values) {
            return SUM.apply(values) / values.length;
        }
    },
    /** The least value. */
    MIN("min") {
        @Override
        double apply(double[] values) {
            double min = values[0];
            for (int i = 1; i < values.length; i++)
                min = Math.min(min, values[i]);
            return min;
        }
    },
    /** The greatest value. */
    MAX("max") {
        @Override
        double apply(double[] values) {
            double max = values[0];
            for (int i = 1; i < values.length; i++)
                max = Math.max(max, values[i]);
            return max;
        }
    },
    /**
     * The middle value once sorted, or the mean of the two middle values if there is an even number of values. This is
     * the continuous 50th percentile.
     */
    MEDIAN("median") {
        @Override
        double apply(double[] values) {
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            double exactIndex = 0.5 * (sorted.length - 1);
            int floor = (int) exactIndex;
            double floorVal = sorted[floor];
            if (exactIndex == floor)
                return floorVal;
            double ceilVal = sorted[floor + 1];
            return floorVal + (ceilVal - floorVal) * (exactIndex - floor);
        }
    },
    /**
     * The most frequent value. Among values tied for the highest frequency, the one encountered first wins. Other
     * implementations of a "mode" reducer may break ties differently.
     */
    MODE("mode") {
        @Override
        double apply(double[] values) {
            Map<Double, Integer> frequencies = new LinkedHashMap<>();
            for (double value : values)
                frequencies.merge(value, 1, Integer::sum);
            double mode = values[0];
            int highest = 0;
            for (Map.Entry<Double, Integer> entry : frequencies.entrySet())
                if (entry.getValue() > highest) {
                    highest = entry.getValue();
                    mode = entry.getKey();
                }
            return mode;
        }
    },
    /** The population standard deviation. */
    STDDEV("stddev") {
        @Override
        double apply(double[] values) {
            return Math.sqrt(VARIANCE.apply(values));
        }
    },
    /** The population variance. */
    VARIANCE("variance") {
        @Override
        double apply(double[] values) {
            double mean = AVG.apply(values);
            double sumOfSquares = 0d;
            for (double value : values) {
                double deviation = value - mean;
                sumOfSquares += deviation * deviation;
            }
            return sumOfSquares / values.length;
        }
    },
    /** The number of distinct values. */
    COUNT_DISTINCT("countDistinct") {
        @Override
        double apply(double[] values) {
            Set<Double> distinct = new HashSet<>();
            for (double value : values)
                distinct.add(value);
            return distinct.size();
        }
    };

    private static final Logger LOGGER = LoggerFactory.getLogger(Reducer.class);

    private static final Map<String, Reducer> BY_ID = new HashMap<>();
    static {
        for (Reducer reducer : values())
            BY_ID.put(reducer.id.toLowerCase(Locale.ROOT), reducer);
        BY_ID.put("average", AVG);
        BY_ID.put("mean", AVG);
        BY_ID.put("std", STDDEV);
        BY_ID.put("countunique", COUNT_DISTINCT);
        BY_ID.put("distinct", COUNT_DISTINCT);
    }

    private final String id;

    Reducer(String id) {
        this.id = id;
    }

    /**
     * Applies this reducer to a non-empty array, which it must not modify.
     */
    abstract double apply(double[] values);

    /**
     * Returns the identifier of this reducer, as used in configurations and {@link Measure#name() measure names}.
     *
     * @return the identifier of this reducer
     */
    public String id() {
        return id;
    }

    /**
     * Reduces the given values to a single number. Returns {@code 0} if there are no values.
     *
     * @param values the values
     * @return the reduced value
     */
    public double reduce(double[] values) {
        if (values.length == 0)
            return 0d;
        return apply(values);
    }

    /**
     * Reduces the given numbers to a single number. Returns {@code 0} if there are no numbers. {@code null} elements
     * are read as {@code 0}.
     *
     * @param values the numbers
     * @return the reduced value
     */
    public double reduce(Collection<? extends Number> values) {
        double[] arr = new double[values.size()];
        int i = 0;
        for (Number value : values)
            arr[i++] = value == null ? 0d : value.doubleValue();
        return reduce(arr);
    }

    /**
     * Returns a {@code Collector} that reduces its input numbers with this reducer.
     *
     * @return a {@code Collector} that reduces its input numbers with this reducer
     */
    public Collector<Number, ?, Double> collector() {
        return Collector.of(
            () -> new Bucket(),
            (bucket, value) -> bucket.add(value == null ? 0d : value.doubleValue()),
            (a, b) -> {
                a.addAll(b);
                return a;
            },
            bucket -> reduce(bucket.toArray())
        );
    }

    /**
     * Returns {@code true} if this reducer yields a value in the same unit as its input values. For example, the sum
     * of amounts of money is an amount of money, while their count, distinct count, or variance is not.
     *
     * @return {@code true} if this reducer preserves the unit of its input values
     */
    public boolean preservesUnit() {
        return this != COUNT && this != COUNT_DISTINCT && this != VARIANCE;
    }

    /**
     * Returns the reducer with the given identifier, matched case-insensitively. Also accepts the aliases
     * {@code average} and {@code mean} for {@link #AVG}, {@code std} for {@link #STDDEV}, and {@code countUnique} and
     * {@code distinct} for {@link #COUNT_DISTINCT}. If there is no such reducer, returns {@link #COUNT}, and logs a
     * warning.
     *
     * @param id the reducer identifier
     * @return the reducer with the given identifier, or {@link #COUNT}
     */
    public static Reducer of(String id) {
        Reducer reducer = id == null ? null : BY_ID.get(id.trim().toLowerCase(Locale.ROOT));
        if (reducer != null)
            return reducer;
        LOGGER.warn("Unknown reducer '{}'; counting instead", id);
        return COUNT;
    }

    /**
     * Returns the identifier of this reducer
     *
     * @return the identifier of this reducer
     */
    @Override
    public String toString() {
        return id;
    }
}
