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
 * A shallowly immutable carrier for the attribute values of one lead, determined by the record {@link Header header}.
 * Values are stored in ordered correspondence with the header names, but are primarily accessed by attribute name.
 *
 * <p>Records are open-ended: the set of attributes is fixed at instance-creation time rather than class-declaration
 * time, so records read from differently-shaped sources can be pivoted alike. Attribute lookups never fail; an
 * attribute the record does not carry simply reads as {@code null}.
 *
 * <p>Records have a natural definition of {@code equals()}, {@code hashCode()}, and {@code toString()}, based on the
 * record header and values.
 */
public class Record {
    final Header header;
    final Object[] values;

    Record(Header header, Object[] values) {
        this.header = header;
        this.values = values;
    }

    /**
     * Creates a record holding the given attributes, in the iteration order of the map.
     *
     * @param attributes the attribute values, by attribute name
     * @return a new record
     */
    public static Record of(Map<String, ?> attributes) {
        List<String> names = new ArrayList<>(attributes.size());
        Object[] values = new Object[attributes.size()];
        int i = 0;
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            names.add(Objects.requireNonNull(entry.getKey()));
            values[i++] = entry.getValue();
        }
        return new Record(new Header(names), values);
    }

    /**
     * Returns the record {@link Header header}. The header {@link Header#names() names} are in ordered correspondence
     * with the record {@link #values() values}.
     *
     * @return the record header
     */
    public Header header() {
        return header;
    }

    /**
     * Returns an unmodifiable view of the record values. The values are in ordered correspondence with the record
     * {@link #header() header} names.
     *
     * @return the record values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    /**
     * Returns the value of the given attribute in this record, or {@code null} if this record's header does not
     * contain the attribute.
     *
     * @param name the attribute name, matched as by {@link Header#normalize}
     * @return the value of the given attribute, or {@code null}
     */
    public Object get(String name) {
        int index = header.indexOf(name);
        return index == -1 ? null : values[index];
    }

    /**
     * Returns the first meaningful value among the given attributes, trying each name in order. A value is meaningful
     * if it is not {@code null}, and not a blank string. If no attribute holds a meaningful value, returns
     * {@code null}.
     *
     * @param names the attribute names, in order of preference
     * @return the first meaningful value, or {@code null}
     */
    public Object first(List<String> names) {
        for (String name : names) {
            Object value = get(name);
            if (value == null)
                continue;
            if (value instanceof String && ((String) value).isBlank())
                continue;
            return value;
        }
        return null;
    }

    /**
     * Returns {@code true} if and only if the given object is a record with a header and values equal to this record's
     * header and values, respectively.
     *
     * @param o the object to be compared for equality with this record
     * @return {@code true} if the given object is equal to this record
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record))
            return false;
        Record other = (Record) o;
        if (!header.equals(other.header))
            return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    /**
     * Returns a string representation of this record. The string representation consists of a list of name-value
     * associations, in the same order as the header names, enclosed in the braces of {@code "Record{}"}. Adjacent
     * associations are separated by the characters {@code ", "} (comma and space).
     *
     * @return a string representation of this record
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Record{");
        String delimiter = "";
        for (int i = 0; i < values.length; i++) {
            sb.append(delimiter).append(header.names[i]).append('=').append(values[i]);
            delimiter = ", ";
        }
        return sb.append('}').toString();
    }
}
