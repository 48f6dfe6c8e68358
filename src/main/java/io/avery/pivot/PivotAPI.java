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
import java.util.function.Consumer;

/**
 * A configurator used to define a pivot over lead {@link Record records}.
 *
 * <p>A pivot groups records by one row field and one column field. Defining the row (or column) field again replaces
 * the earlier definition; only a single field is ever in effect per axis. Each distinct value of the row field becomes
 * a row of the result, each distinct value of the column field becomes a column, and each cell holds the configured
 * measures (and formulas) over the records that fall into it.
 *
 * <p>Measures are kept in order of definition. A measure may be redefined (same name, such as a percentage variant of
 * {@code sum(ltv)}), in which case its definition is replaced, but its original position is retained. The same holds
 * for formulas, by formula name. If no measure is defined, the pivot counts records.
 *
 * <p>The configurator degrades rather than fails: a formula that cannot be parsed, or that references a measure that
 * is not defined, is dropped with a warning, so that the remaining configuration stays usable.
 *
 * @see PivotConfiguration#of
 * @see RecordSet#pivot
 */
public class PivotAPI {
    private static final Logger LOGGER = LoggerFactory.getLogger(PivotAPI.class);

    /** The widest supported number of decimal places. */
    public static final int MAX_DECIMAL_PLACES = 10;

    private Field<?> rowField = Fields.STATUS;
    private Field<?> colField = Fields.SOURCE;
    private final Map<String, Integer> measureIndexByName = new HashMap<>();
    private final List<Measure> measures = new ArrayList<>();
    private final Map<String, Integer> formulaIndexByName = new HashMap<>();
    private final List<FormulaDefinition> formulas = new ArrayList<>();
    private int decimalPlaces = 2;
    private boolean showTotals = true;

    PivotAPI() {} // Prevent default public constructor

    /**
     * Defines the field whose distinct values become the rows.
     *
     * @param field the row field
     * @return this configurator
     */
    public PivotAPI rows(Field<?> field) {
        this.rowField = Objects.requireNonNull(field);
        return this;
    }

    /**
     * Defines the field whose distinct values become the rows, by identifier, as by {@link Fields#of}.
     *
     * @param fieldId the row field identifier
     * @return this configurator
     */
    public PivotAPI rows(String fieldId) {
        return rows(Fields.of(fieldId));
    }

    /**
     * Defines the field whose distinct values become the columns.
     *
     * @param field the column field
     * @return this configurator
     */
    public PivotAPI columns(Field<?> field) {
        this.colField = Objects.requireNonNull(field);
        return this;
    }

    /**
     * Defines the field whose distinct values become the columns, by identifier, as by {@link Fields#of}.
     *
     * @param fieldId the column field identifier
     * @return this configurator
     */
    public PivotAPI columns(String fieldId) {
        return columns(Fields.of(fieldId));
    }

    /**
     * Defines (or redefines) the given measure.
     *
     * @param measure the measure
     * @return this configurator
     */
    public PivotAPI measure(Measure measure) {
        Objects.requireNonNull(measure);
        String key = measure.name().toLowerCase(Locale.ROOT);
        int index = measureIndexByName.computeIfAbsent(key, k -> measures.size());
        if (index == measures.size())
            measures.add(measure);
        else
            measures.set(index, measure);
        return this;
    }

    /**
     * Defines (or redefines) a measure that applies the given reducer to the given field.
     *
     * @param field the field
     * @param reducer the reducer
     * @return this configurator
     */
    public PivotAPI measure(Field<?> field, Reducer reducer) {
        return measure(new Measure(field, reducer));
    }

    /**
     * Defines (or redefines) a measure by field and reducer identifiers, as by {@link Measure#of}.
     *
     * @param fieldId the field identifier
     * @param reducerId the reducer identifier
     * @return this configurator
     */
    public PivotAPI measure(String fieldId, String reducerId) {
        return measure(Measure.of(fieldId, reducerId));
    }

    /**
     * Defines (or redefines) a formula over the measures. See {@link Formula} for the expression language.
     *
     * @param name the formula name
     * @param expression the expression
     * @return this configurator
     */
    public PivotAPI formula(String name, String expression) {
        return formulaHelper(name, expression, false);
    }

    /**
     * Defines (or redefines) a formula over the measures, displayed as a percentage.
     *
     * @param name the formula name
     * @param expression the expression
     * @return this configurator
     */
    public PivotAPI percentFormula(String name, String expression) {
        return formulaHelper(name, expression, true);
    }

    private PivotAPI formulaHelper(String name, String expression, boolean percent) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(expression);
        int index = formulaIndexByName.computeIfAbsent(name, k -> formulas.size());
        FormulaDefinition def = new FormulaDefinition(name, expression, percent);
        if (index == formulas.size())
            formulas.add(def);
        else
            formulas.set(index, def);
        return this;
    }

    /**
     * Defines the number of decimal places for display. Values outside {@code [0, 10]} are clamped into that range.
     *
     * @param decimalPlaces the number of decimal places
     * @return this configurator
     */
    public PivotAPI decimalPlaces(int decimalPlaces) {
        this.decimalPlaces = Math.max(0, Math.min(MAX_DECIMAL_PLACES, decimalPlaces));
        return this;
    }

    /**
     * Defines whether rendered tables include the totals row and column. Totals are always computed.
     *
     * @param showTotals whether to show totals
     * @return this configurator
     */
    public PivotAPI showTotals(boolean showTotals) {
        this.showTotals = showTotals;
        return this;
    }

    PivotConfiguration accept(Consumer<PivotAPI> config) {
        config.accept(this);

        List<Measure> finalMeasures = measures.isEmpty()
            ? List.of(new Measure(Fields.COUNT, Reducer.COUNT))
            : List.copyOf(measures);
        Set<String> measureNames = new HashSet<>();
        for (Measure measure : finalMeasures)
            measureNames.add(measure.name().toLowerCase(Locale.ROOT));

        List<Formula> finalFormulas = new ArrayList<>();
        for (FormulaDefinition def : formulas) {
            Formula formula = def.compile(measureNames);
            if (formula != null)
                finalFormulas.add(formula);
        }

        return new PivotConfiguration(rowField, colField, finalMeasures, List.copyOf(finalFormulas),
                                      decimalPlaces, showTotals);
    }

    private static class FormulaDefinition {
        final String name;
        final String expression;
        final boolean percent;

        FormulaDefinition(String name, String expression, boolean percent) {
            this.name = name;
            this.expression = expression;
            this.percent = percent;
        }

        Formula compile(Set<String> measureNames) {
            if (measureNames.contains(name.toLowerCase(Locale.ROOT))) {
                LOGGER.warn("Dropping formula '{}': its name is taken by a measure", name);
                return null;
            }
            Formula formula;
            try {
                formula = Formula.parse(name, expression);
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Dropping formula '{}': {}", name, e.getMessage());
                return null;
            }
            for (String reference : formula.references())
                if (!measureNames.contains(reference)) {
                    LOGGER.warn("Dropping formula '{}': no measure named '{}'", name, reference);
                    return null;
                }
            return percent ? formula.asPercent() : formula;
        }
    }
}
