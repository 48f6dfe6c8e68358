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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An immutable pivot configuration: the row field, the column field, the measures and formulas computed per cell, and
 * the display options. Configurations are built with a {@link PivotAPI configurator}.
 */
public final class PivotConfiguration {
    private final Field<?> rowField;
    private final Field<?> colField;
    private final List<Measure> measures;
    private final List<Formula> formulas;
    private final int decimalPlaces;
    private final boolean showTotals;

    PivotConfiguration(Field<?> rowField, Field<?> colField, List<Measure> measures, List<Formula> formulas,
                       int decimalPlaces, boolean showTotals) {
        this.rowField = rowField;
        this.colField = colField;
        this.measures = measures;
        this.formulas = formulas;
        this.decimalPlaces = decimalPlaces;
        this.showTotals = showTotals;
    }

    /**
     * Returns a configuration as configured by the given configurator consumer.
     *
     * @param config a consumer that configures the pivot
     * @return a new configuration
     */
    public static PivotConfiguration of(Consumer<PivotAPI> config) {
        Objects.requireNonNull(config);
        return new PivotAPI().accept(config);
    }

    /**
     * Returns the default configuration: leads counted by status and source.
     *
     * @return the default configuration
     */
    public static PivotConfiguration defaults() {
        return of(pivot -> {});
    }

    public Field<?> rowField() {
        return rowField;
    }

    public Field<?> colField() {
        return colField;
    }

    public List<Measure> measures() {
        return measures;
    }

    public List<Formula> formulas() {
        return formulas;
    }

    /**
     * Returns the measures followed by the formulas.
     *
     * @return the measures followed by the formulas
     */
    public List<PivotValue> values() {
        List<PivotValue> values = new ArrayList<>(measures.size() + formulas.size());
        values.addAll(measures);
        values.addAll(formulas);
        return values;
    }

    public int decimalPlaces() {
        return decimalPlaces;
    }

    public boolean showTotals() {
        return showTotals;
    }

    @Override
    public String toString() {
        return "PivotConfiguration{rows=" + rowField + ", columns=" + colField + ", values=" + values()
            + ", decimalPlaces=" + decimalPlaces + ", showTotals=" + showTotals + '}';
    }
}
