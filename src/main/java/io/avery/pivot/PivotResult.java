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

import java.util.*;

/**
 * The result of a pivot: a dense matrix of values indexed by row key, column key, and value name, along with totals per
 * row, per column, and over all records.
 *
 * <p>Row keys and column keys are distinct, and sorted in {@code String} natural order. Every combination of row key,
 * column key, and value has an entry. The values are the configured {@link Measure measures}, in order, followed by the
 * configured {@link Formula formulas}, in order.
 *
 * <p>Lookups are by raw key and value name. Value names are matched exactly, or failing that, case-insensitively.
 * Looking up a key or name that is not in the result throws {@link NoSuchElementException}.
 */
public class PivotResult {
    private final PivotConfiguration config;
    private final List<String> rowKeys;
    private final List<String> colKeys;
    private final List<PivotValue> values;
    private final Map<String, Integer> rowIndexByKey;
    private final Map<String, Integer> colIndexByKey;
    private final Map<String, Integer> valueIndexByName;
    private final double[][][] cells;
    private final double[][] rowTotals;
    private final double[][] colTotals;
    private final double[] grandTotal;
    private final int recordCount;

    PivotResult(PivotConfiguration config, List<String> rowKeys, List<String> colKeys, double[][][] cells,
                double[][] rowTotals, double[][] colTotals, double[] grandTotal, int recordCount) {
        this.config = config;
        this.rowKeys = List.copyOf(rowKeys);
        this.colKeys = List.copyOf(colKeys);
        this.values = List.copyOf(config.values());
        this.rowIndexByKey = indexOf(this.rowKeys);
        this.colIndexByKey = indexOf(this.colKeys);
        this.valueIndexByName = new HashMap<>();
        for (int i = 0; i < values.size(); i++)
            valueIndexByName.put(values.get(i).name(), i);
        for (int i = 0; i < values.size(); i++)
            valueIndexByName.putIfAbsent(values.get(i).name().toLowerCase(Locale.ROOT), i);
        this.cells = cells;
        this.rowTotals = rowTotals;
        this.colTotals = colTotals;
        this.grandTotal = grandTotal;
        this.recordCount = recordCount;
    }

    private static Map<String, Integer> indexOf(List<String> keys) {
        Map<String, Integer> indexByKey = new HashMap<>();
        for (int i = 0; i < keys.size(); i++)
            indexByKey.put(keys.get(i), i);
        return indexByKey;
    }

    public PivotConfiguration configuration() {
        return config;
    }

    /**
     * Returns the sorted distinct row keys.
     *
     * @return the sorted distinct row keys
     */
    public List<String> rowKeys() {
        return rowKeys;
    }

    /**
     * Returns the sorted distinct column keys.
     *
     * @return the sorted distinct column keys
     */
    public List<String> colKeys() {
        return colKeys;
    }

    /**
     * Returns the measures followed by the formulas.
     *
     * @return the measures followed by the formulas
     */
    public List<PivotValue> values() {
        return values;
    }

    /**
     * Returns the number of records that were aggregated, including those grouped under sentinel keys.
     *
     * @return the number of records that were aggregated
     */
    public int recordCount() {
        return recordCount;
    }

    /**
     * Returns {@code true} if no records were aggregated.
     *
     * @return {@code true} if no records were aggregated
     */
    public boolean isEmpty() {
        return recordCount == 0;
    }

    /**
     * Returns the named value for the cell at the given row key and column key.
     *
     * @param rowKey the row key
     * @param colKey the column key
     * @param valueName the name of the measure or formula
     * @return the value
     * @throws NoSuchElementException if the row key, column key, or value name is not in this result
     */
    public double cell(String rowKey, String colKey, String valueName) {
        return cells[rowIndex(rowKey)][colIndex(colKey)][valueIndex(valueName)];
    }

    /**
     * Returns the given value for the cell at the given row key and column key.
     *
     * @param rowKey the row key
     * @param colKey the column key
     * @param value the measure or formula
     * @return the value
     * @throws NoSuchElementException if the row key, column key, or value is not in this result
     */
    public double cell(String rowKey, String colKey, PivotValue value) {
        return cell(rowKey, colKey, value.name());
    }

    /**
     * Returns the named value over all records in the given row.
     *
     * @param rowKey the row key
     * @param valueName the name of the measure or formula
     * @return the value
     * @throws NoSuchElementException if the row key or value name is not in this result
     */
    public double rowTotal(String rowKey, String valueName) {
        return rowTotals[rowIndex(rowKey)][valueIndex(valueName)];
    }

    public double rowTotal(String rowKey, PivotValue value) {
        return rowTotal(rowKey, value.name());
    }

    /**
     * Returns the named value over all records in the given column.
     *
     * @param colKey the column key
     * @param valueName the name of the measure or formula
     * @return the value
     * @throws NoSuchElementException if the column key or value name is not in this result
     */
    public double colTotal(String colKey, String valueName) {
        return colTotals[colIndex(colKey)][valueIndex(valueName)];
    }

    public double colTotal(String colKey, PivotValue value) {
        return colTotal(colKey, value.name());
    }

    /**
     * Returns the named value over all records.
     *
     * @param valueName the name of the measure or formula
     * @return the value
     * @throws NoSuchElementException if the value name is not in this result
     */
    public double grandTotal(String valueName) {
        return grandTotal[valueIndex(valueName)];
    }

    public double grandTotal(PivotValue value) {
        return grandTotal(value.name());
    }

    private int rowIndex(String rowKey) {
        Integer index = rowIndexByKey.get(rowKey);
        if (index == null)
            throw new NoSuchElementException("No row '" + rowKey + "' in pivot result");
        return index;
    }

    private int colIndex(String colKey) {
        Integer index = colIndexByKey.get(colKey);
        if (index == null)
            throw new NoSuchElementException("No column '" + colKey + "' in pivot result");
        return index;
    }

    private int valueIndex(String valueName) {
        Integer index = valueIndexByName.get(valueName);
        if (index == null)
            index = valueIndexByName.get(valueName.toLowerCase(Locale.ROOT));
        if (index == null)
            throw new NoSuchElementException("No value '" + valueName + "' in pivot result");
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PivotResult))
            return false;
        PivotResult other = (PivotResult) o;
        return recordCount == other.recordCount
            && rowKeys.equals(other.rowKeys)
            && colKeys.equals(other.colKeys)
            && values.equals(other.values)
            && Arrays.deepEquals(cells, other.cells)
            && Arrays.deepEquals(rowTotals, other.rowTotals)
            && Arrays.deepEquals(colTotals, other.colTotals)
            && Arrays.equals(grandTotal, other.grandTotal);
    }

    @Override
    public int hashCode() {
        int hash = Objects.hash(recordCount, rowKeys, colKeys, values);
        hash = 31 * hash + Arrays.deepHashCode(cells);
        return 31 * hash + Arrays.hashCode(grandTotal);
    }

    @Override
    public String toString() {
        return "PivotResult{rows=" + rowKeys + ", columns=" + colKeys + ", values=" + values
            + ", recordCount=" + recordCount + '}';
    }
}
