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
import java.util.function.Consumer;
import java.util.stream.Collector;
import java.util.stream.Stream;

/**
 * An ordered collection of {@link Record records} with a common {@link Header header}. Record-sets offer compact
 * storage for such records, and allow for records to be accessed repeatedly, for instance to pivot the same leads
 * under several configurations.
 */
public class RecordSet implements Iterable<Record> {
    private static final RecordSet EMPTY = new RecordSet(new Header(List.of()), new Object[0][]);

    private final Header header;
    private final Object[][] records;

    RecordSet(Header header, Object[][] records) {
        this.header = header;
        this.records = records;
    }

    /**
     * Returns an empty record-set, with an empty header.
     *
     * @return an empty record-set
     */
    public static RecordSet empty() {
        return EMPTY;
    }

    /**
     * Creates a record-set from the given attribute maps. The header is the union of all attribute names, in order of
     * first appearance. An attribute that some map does not carry is {@code null} on that map's record.
     *
     * @param rows the attribute maps, one per record
     * @return a new record-set
     */
    public static RecordSet of(List<? extends Map<String, ?>> rows) {
        Map<String, String> nameByKey = new LinkedHashMap<>();
        for (Map<String, ?> row : rows)
            for (String name : row.keySet())
                nameByKey.putIfAbsent(Header.normalize(name), name);
        Header header = new Header(new ArrayList<>(nameByKey.values()));
        Object[][] records = new Object[rows.size()][];
        for (int i = 0; i < records.length; i++) {
            Object[] values = new Object[header.size()];
            rows.get(i).forEach((name, value) -> {
                int index = header.indexOf(name);
                if (values[index] == null)
                    values[index] = value;
            });
            records[i] = values;
        }
        return new RecordSet(header, records);
    }

    /**
     * Creates a record-set from tabular rows, as read from a spreadsheet. The first row holds the attribute names, and
     * each following row holds one record's values. Rows shorter than the header are padded with empty strings, and
     * values beyond the header width are ignored. If there are no rows, the record-set is {@link #empty()}.
     *
     * @param rows the header row followed by the value rows
     * @return a new record-set
     */
    public static RecordSet fromRows(List<? extends List<?>> rows) {
        if (rows.isEmpty())
            return EMPTY;
        List<String> names = new ArrayList<>();
        for (Object name : rows.get(0))
            names.add(name == null ? "" : String.valueOf(name).trim());
        Header header = new Header(names);
        int width = names.size();
        Object[][] records = new Object[rows.size() - 1][];
        for (int i = 1; i < rows.size(); i++) {
            List<?> row = rows.get(i);
            Object[] values = new Object[width];
            for (int j = 0; j < width; j++) {
                Object value = j < row.size() ? row.get(j) : null;
                values[j] = value == null ? "" : value;
            }
            records[i - 1] = values;
        }
        return new RecordSet(header, records);
    }

    /**
     * Returns the header shared by all records in this record-set.
     *
     * @return the header shared by all records at this record-set
     */
    public Header header() {
        return header;
    }

    /**
     * Returns a sequential {@code Stream} with this record-set as its source.
     *
     * @return a sequential {@code Stream} over the records in this record-set
     */
    public Stream<Record> stream() {
        return Arrays.stream(records).map(values -> new Record(header, values));
    }

    @Override
    public Iterator<Record> iterator() {
        return stream().iterator();
    }

    /**
     * Returns the number of records in this record-set.
     *
     * @return the number of records in this record-set
     */
    public int size() {
        return records.length;
    }

    /**
     * Returns {@code true} if this record-set contains no records.
     *
     * @return {@code true} if this record-set contains no records
     */
    public boolean isEmpty() {
        return records.length == 0;
    }

    /**
     * Pivots the records in this record-set, as configured by the given configurator consumer.
     *
     * @param config a consumer that configures the pivot
     * @return the pivot result
     * @see PivotTable#aggregate
     */
    public PivotResult pivot(Consumer<PivotAPI> config) {
        return PivotTable.aggregate(this, PivotConfiguration.of(config));
    }

    /**
     * Returns a {@code Collector} that accumulates the input elements into a new {@code RecordSet}, mapping each input
     * element to a record as configured by the given configurator consumer.
     *
     * @param config a consumer that configures the record attributes
     * @return a {@code Collector} which collects all the input elements into a {@code RecordSet}, in encounter order
     * @param <T> the type of the input elements
     */
    public static <T> Collector<T, ?, RecordSet> collector(Consumer<IntoAPI<T>> config) {
        return new IntoAPI<T>().collector(config);
    }

    /**
     * Returns {@code true} if and only if the given object is a record-set with a header equal to this set's header,
     * and the object contains records equal to this set's records, in the same order as this set.
     *
     * @param o the object to be compared for equality with this record-set
     * @return {@code true} if the given object is equal to this record-set
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecordSet))
            return false;
        RecordSet other = (RecordSet) o;
        return header.equals(other.header) && Arrays.deepEquals(records, other.records);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + Arrays.deepHashCode(records);
    }

    /**
     * Returns a tabular string representation of this record-set: the header names on the first line, then one line
     * per record, each line in brackets. For example:
     *
     * <pre>{@code
     * RecordSet[
     *     [status, source, ltv],
     *     [Hot, Web, 12000],
     *     [Cold, Ad, 500]
     * ]
     * }</pre>
     *
     * @return a string representation of this record-set.
     */
    @Override
    public String toString() {
        StringJoiner rows = new StringJoiner(",\n\t", "RecordSet[\n\t", "\n]");
        rows.add("[" + String.join(", ", header.names) + "]");
        for (Object[] values : records) {
            StringJoiner row = new StringJoiner(", ", "[", "]");
            for (Object value : values)
                row.add(String.valueOf(value));
            rows.add(row.toString());
        }
        return rows.toString();
    }
}
