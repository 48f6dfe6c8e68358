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

/**
 * A pairing of a {@link Field field} with the {@link Reducer reducer} applied to that field's values in every pivot
 * cell and total. A measure is named after both, such as {@code sum(ltv)}; the name identifies the measure in results
 * and in {@link Formula formulas}.
 *
 * <p>Measures are equal if they have the same name and the same percentage flag.
 */
public final class Measure implements PivotValue {
    private final Field<?> field;
    private final Reducer reducer;
    private final boolean percent;

    /**
     * Creates a new measure.
     *
     * @param field the field whose values are reduced
     * @param reducer the reducer
     */
    public Measure(Field<?> field, Reducer reducer) {
        this(field, reducer, false);
    }

    private Measure(Field<?> field, Reducer reducer, boolean percent) {
        this.field = Objects.requireNonNull(field);
        this.reducer = Objects.requireNonNull(reducer);
        this.percent = percent;
    }

    /**
     * Creates a new measure from a field identifier and a reducer identifier, falling back as described by
     * {@link Fields#of} and {@link Reducer#of}.
     *
     * @param fieldId the field identifier
     * @param reducerId the reducer identifier
     * @return a new measure
     */
    public static Measure of(String fieldId, String reducerId) {
        return new Measure(Fields.of(fieldId), Reducer.of(reducerId));
    }

    /**
     * Returns a copy of this measure that is displayed as a percentage.
     *
     * @return a copy of this measure that is displayed as a percentage
     */
    public Measure asPercent() {
        return new Measure(field, reducer, true);
    }

    public Field<?> field() {
        return field;
    }

    public Reducer reducer() {
        return reducer;
    }

    @Override
    public String name() {
        return reducer.id() + "(" + field.id() + ")";
    }

    @Override
    public boolean isPercent() {
        return percent;
    }

    /**
     * Returns {@code true} if the field holds amounts of money, and the reducer {@link Reducer#preservesUnit()
     * preserves} that unit.
     *
     * @return {@code true} if this measure is an amount of money
     */
    @Override
    public boolean isCurrency() {
        return field.kind() == Field.Kind.CURRENCY && reducer.preservesUnit();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Measure))
            return false;
        Measure other = (Measure) o;
        return percent == other.percent && name().equals(other.name());
    }

    @Override
    public int hashCode() {
        return 31 * name().hashCode() + Boolean.hashCode(percent);
    }

    @Override
    public String toString() {
        return percent ? name() + " %" : name();
    }
}
