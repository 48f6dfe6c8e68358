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

import java.util.Objects;
import java.util.function.Function;

/**
 * A selectable field of a lead, used to group records into pivot rows and columns, or to supply the values that a
 * {@link Measure measure} aggregates. A field resolves a value from a {@link Record record}, either directly from a
 * stored attribute, or derived from one (such as the month of the creation timestamp).
 *
 * <p>Fields use default object {@code equals()} and {@code hashCode()}. That is, two fields are only equal if they are
 * the same object. The standard fields are the constants of {@link Fields}.
 *
 * @param <T> the value type of the field
 */
public final class Field<T> {
    /**
     * The kind of value a field resolves to. The kind decides how values are keyed and formatted.
     */
    public enum Kind {
        /** Free text, such as a status or a source. */
        CATEGORICAL,
        /** A plain number, such as a visit count. */
        NUMERIC,
        /** An amount of money. */
        CURRENCY,
        /** A label derived from the creation timestamp. */
        DATE,
        /** The constant {@code 1}, for counting records. */
        CONSTANT,
        /** An attribute outside the catalog, read as stored. */
        ATTRIBUTE;

        /**
         * Returns {@code true} if fields of this kind resolve to numbers.
         *
         * @return {@code true} if fields of this kind resolve to numbers
         */
        public boolean isNumeric() {
            return this == NUMERIC || this == CURRENCY || this == CONSTANT;
        }
    }

    private final String id;
    private final String label;
    private final Kind kind;
    private final Function<? super Record, ? extends T> resolver;

    /**
     * Creates a new field. The resolver must not throw for any record; a record lacking the relevant attributes should
     * resolve to a safe default.
     *
     * @param id the field identifier, used in configurations and measure names
     * @param label the display label
     * @param kind the kind of value the field resolves to
     * @param resolver a function that resolves the field value from a record
     */
    public Field(String id, String label, Kind kind, Function<? super Record, ? extends T> resolver) {
        this.id = Objects.requireNonNull(id);
        this.label = Objects.requireNonNull(label);
        this.kind = Objects.requireNonNull(kind);
        this.resolver = Objects.requireNonNull(resolver);
    }

    /**
     * Returns the value of this field for the given record.
     *
     * @param record the record
     * @return the value of this field for the given record
     */
    public T resolve(Record record) {
        return resolver.apply(record);
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the field identifier
     *
     * @return the field identifier
     */
    @Override
    public String toString() {
        return id;
    }
}
