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

/**
 * Classes to cross-tabulate lead records into pivot tables: one field's distinct values become the rows, another's
 * become the columns, and every cell holds measures reduced over the leads matching both. For example:
 *
 * <pre>{@code
 *     RecordSet leads = SheetValues.parse(payload);
 *
 *     PivotResult result = leads.pivot(pivot -> pivot
 *         .rows(Fields.STATUS)
 *         .columns(Fields.CREATED_AT_MONTH_YEAR)
 *         .measure(Fields.LTV, Reducer.SUM)
 *         .measure(Fields.COUNT, Reducer.COUNT)
 *         .formula("avg ltv", "sum(ltv) / count(count)")
 *         .decimalPlaces(1)
 *     );
 *
 *     String table = PivotTableRenderer.render(result, new ValueFormatter(FormatOptions.of(result.configuration())));
 * }</pre>
 *
 * <p>Here we read leads from a spreadsheet payload, pivot them by status and month of creation, computing the total
 * lifetime value and the number of leads for each combination, along with their ratio, and render the result as text.
 *
 * <h2><a id="Records">Records and Headers</a></h2>
 *
 * <p>A {@code Record} is a shallowly-immutable carrier for the attribute values of one lead. Records are not typed by
 * class: each holds a {@code Header} of attribute names and values in correspondence with those names, so leads read
 * from differently-shaped sources can be pivoted alike. Attribute names are matched leniently, ignoring case and
 * punctuation. A {@code RecordSet} is an ordered collection of records sharing one header. Typed objects can be
 * collected into a record-set with {@code RecordSet.collector()}.
 *
 * <h2><a id="Fields">Fields and Measures</a></h2>
 *
 * <p>A {@code Field} reads one value from a record, never failing: absent categories read as {@code "N/A"}, unreadable
 * dates as {@code "Unknown"}, and unreadable numbers as {@code 0}. {@code Fields} catalogs the standard lead fields. A
 * {@code Measure} pairs a field with a {@code Reducer}, such as {@code sum(ltv)}; a {@code Formula} combines measures
 * arithmetically.
 *
 * <h2><a id="Configurators">Configurators</a></h2>
 *
 * <p>Pivots are defined through a configurator, {@code PivotAPI}, passed to a consumer. Entries may be redefined, in
 * which case the later definition replaces the earlier one, but keeps its position. Configuration problems degrade:
 * unknown fields pass through, unknown reducers count, and broken formulas are dropped, each with a logged warning.
 *
 * <h2><a id="Totals">Totals</a></h2>
 *
 * <p>Row, column, and grand totals are reduced from the raw values behind the cells, not from the reduced cell values,
 * so non-additive reducers such as {@code avg} and {@code median} total correctly.
 */
package io.avery.pivot;
