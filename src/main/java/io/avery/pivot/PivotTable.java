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

/**
 * The aggregation engine. Cross-tabulates records by a row field and a column field, and reduces the configured
 * measures for every cell of the resulting matrix, for every row and column, and over all records.
 *
 * <p>Aggregation happens in two phases. The first phase makes a single pass over the records, resolving each record's
 * row key and column key, and appending the value of each measure's field to the bucket for that
 * (row key, column key, measure). The second phase reduces the bucket of every (row key, column key) pair in the
 * cartesian product of the discovered keys, so the matrix is dense: a pair with no records is reduced from an empty
 * bucket, yielding the reducer's empty default.
 *
 * <p>Totals are always re-reduced from the union of the underlying buckets, never combined from reduced cell values.
 * The average of per-cell averages is not the overall average.
 *
 * <p>The engine is stateless. Every call builds and returns an independent {@link PivotResult}.
 */
public class PivotTable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PivotTable.class);

    private PivotTable() {} // Prevent instantiation

    /**
     * Aggregates the given records as configured.
     *
     * @param records the records
     * @param config the pivot configuration
     * @return the pivot result
     */
    public static PivotResult aggregate(Iterable<Record> records, PivotConfiguration config) {
        Objects.requireNonNull(records);
        Objects.requireNonNull(config);

        Field<?> rowField = config.rowField();
        Field<?> colField = config.colField();
        Measure[] measures = config.measures().toArray(new Measure[0]);
        List<Map<String, Integer>> ordinals = new ArrayList<>(measures.length);
        for (int i = 0; i < measures.length; i++)
            ordinals.add(new HashMap<>());

        // Phase 1: Collect raw values into buckets
        Map<String, Map<String, Bucket[]>> bucketsByRow = new HashMap<>();
        Set<String> colKeySet = new HashSet<>();
        int recordCount = 0;
        for (Record record : records) {
            recordCount++;
            String rowKey = Fields.asCategory(rowField.resolve(record));
            String colKey = Fields.asCategory(colField.resolve(record));
            colKeySet.add(colKey);
            Bucket[] buckets = bucketsByRow
                .computeIfAbsent(rowKey, k -> new HashMap<>())
                .computeIfAbsent(colKey, k -> newBuckets(measures.length));
            for (int i = 0; i < measures.length; i++)
                buckets[i].add(measureValue(measures[i], record, ordinals.get(i)));
        }

        List<String> rowKeys = new ArrayList<>(bucketsByRow.keySet());
        List<String> colKeys = new ArrayList<>(colKeySet);
        Collections.sort(rowKeys);
        Collections.sort(colKeys);

        // Phase 2: Reduce every cell of the cartesian product, then every total
        ValueReducer reducer = new ValueReducer(config);
        int width = reducer.width();
        double[][][] cells = new double[rowKeys.size()][colKeys.size()][];
        double[][] rowTotals = new double[rowKeys.size()][];
        double[][] colTotals = new double[colKeys.size()][];
        Bucket[][] colUnions = new Bucket[colKeys.size()][];
        Bucket[] grandUnion = newBuckets(measures.length);
        Bucket[] empty = newBuckets(measures.length);

        for (int j = 0; j < colKeys.size(); j++)
            colUnions[j] = newBuckets(measures.length);

        for (int i = 0; i < rowKeys.size(); i++) {
            Map<String, Bucket[]> bucketsByCol = bucketsByRow.get(rowKeys.get(i));
            Bucket[] rowUnion = newBuckets(measures.length);
            for (int j = 0; j < colKeys.size(); j++) {
                Bucket[] buckets = bucketsByCol.getOrDefault(colKeys.get(j), empty);
                cells[i][j] = reducer.reduce(buckets);
                addAll(rowUnion, buckets);
                addAll(colUnions[j], buckets);
            }
            rowTotals[i] = reducer.reduce(rowUnion);
            addAll(grandUnion, rowUnion);
        }
        for (int j = 0; j < colKeys.size(); j++)
            colTotals[j] = reducer.reduce(colUnions[j]);
        double[] grandTotal = reducer.reduce(grandUnion);

        if (LOGGER.isDebugEnabled())
            LOGGER.debug("Aggregated {} records into {} rows x {} columns x {} values (rows={}, columns={})",
                         recordCount, rowKeys.size(), colKeys.size(), width, rowField, colField);

        return new PivotResult(config, rowKeys, colKeys, cells, rowTotals, colTotals, grandTotal, recordCount);
    }

    private static double measureValue(Measure measure, Record record, Map<String, Integer> ordinals) {
        Object value = measure.field().resolve(record);
        if (measure.reducer() != Reducer.COUNT_DISTINCT
            || measure.field().kind().isNumeric()
            || value instanceof Number)
            return Fields.toNumber(value);
        // Distinct categories map to distinct ordinals, stable within this run
        return ordinals.computeIfAbsent(Fields.asCategory(value), k -> ordinals.size());
    }

    private static Bucket[] newBuckets(int size) {
        Bucket[] buckets = new Bucket[size];
        for (int i = 0; i < size; i++)
            buckets[i] = new Bucket();
        return buckets;
    }

    private static void addAll(Bucket[] into, Bucket[] from) {
        for (int i = 0; i < into.length; i++)
            into[i].addAll(from[i]);
    }

    /**
     * Reduces one set of measure buckets to the values of a cell or total: the reduced measures, followed by the
     * formulas evaluated over them.
     */
    private static class ValueReducer {
        final List<Measure> measures;
        final List<Formula> formulas;
        final Map<String, Integer> indexByMeasureName = new HashMap<>();

        ValueReducer(PivotConfiguration config) {
            this.measures = config.measures();
            this.formulas = config.formulas();
            for (int i = 0; i < measures.size(); i++)
                indexByMeasureName.put(measures.get(i).name().toLowerCase(Locale.ROOT), i);
        }

        int width() {
            return measures.size() + formulas.size();
        }

        double[] reduce(Bucket[] buckets) {
            double[] values = new double[width()];
            for (int i = 0; i < measures.size(); i++)
                values[i] = measures.get(i).reducer().reduce(buckets[i].toArray());
            for (int i = 0; i < formulas.size(); i++)
                values[measures.size() + i] = formulas.get(i).evaluate(name -> values[indexByMeasureName.get(name)]);
            return values;
        }
    }
}
