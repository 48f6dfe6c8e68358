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

import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PivotTableTest {
    private static final RecordSet LEADS = rows(new Object[][]{
        { "status", "source", "v" },
        { "Hot", "Web", 10 },
        { "Hot", "Web", 20 },
        { "Cold", "Ad", 5 },
    });

    @Test
    void testExample() {
        PivotResult result = LEADS.pivot(pivot -> pivot
            .rows("status")
            .columns("source")
            .measure("v", "sum")
            .measure("v", "avg")
        );

        assertEquals(List.of("Cold", "Hot"), result.rowKeys());
        assertEquals(List.of("Ad", "Web"), result.colKeys());
        assertEquals(30d, result.cell("Hot", "Web", "sum(v)"));
        assertEquals(15d, result.cell("Hot", "Web", "avg(v)"));
        assertEquals(5d, result.cell("Cold", "Ad", "sum(v)"));
        assertEquals(5d, result.cell("Cold", "Ad", "avg(v)"));
        assertEquals(0d, result.cell("Hot", "Ad", "sum(v)"));
        assertEquals(0d, result.cell("Hot", "Ad", "avg(v)"));
        assertEquals(0d, result.cell("Cold", "Web", "sum(v)"));
        assertEquals(0d, result.cell("Cold", "Web", "avg(v)"));
        assertEquals(30d, result.rowTotal("Hot", "sum(v)"));
        assertEquals(15d, result.rowTotal("Hot", "avg(v)"));
        assertEquals(35d, result.grandTotal("sum(v)"));
        assertEquals(35d / 3, result.grandTotal("avg(v)"), 1e-9);
    }

    @Test
    void testDefaults() {
        PivotResult result = LEADS.pivot(pivot -> {});

        PivotConfiguration config = result.configuration();
        assertSame(Fields.STATUS, config.rowField());
        assertSame(Fields.SOURCE, config.colField());
        assertEquals(List.of(new Measure(Fields.COUNT, Reducer.COUNT)), config.measures());
        assertEquals(2, config.decimalPlaces());
        assertTrue(config.showTotals());
        assertEquals(2d, result.cell("Hot", "Web", "count(count)"));
        assertEquals(3d, result.grandTotal("count(count)"));
    }

    @Test
    void testDensity() {
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "center" },
            { "Hot", "Web", "North" },
            { "Warm", "Ad", "South" },
            { "Cold", "Referral", "North" },
            { "Hot", "Walk-in", "East" },
        });
        PivotResult result = leads.pivot(pivot -> pivot
            .measure(Fields.COUNT, Reducer.COUNT)
            .measure("center", "countDistinct")
        );

        assertEquals(3, result.rowKeys().size());
        assertEquals(4, result.colKeys().size());
        int cells = 0;
        for (String rowKey : result.rowKeys())
            for (String colKey : result.colKeys())
                for (PivotValue value : result.values()) {
                    result.cell(rowKey, colKey, value);
                    cells++;
                }
        assertEquals(3 * 4 * 2, cells);
    }

    @Test
    void testCountConservationIncludesSentinels() {
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "createdAt" },
            { "Hot", "Web", "2024-03-14" },
            { "", "Web", "not a date" },
            { null, "", "" },
            { "Cold", null, "14/03/2024" },
        });
        PivotResult result = leads.pivot(pivot -> pivot
            .rows(Fields.STATUS)
            .columns(Fields.CREATED_AT_MONTH_YEAR)
        );

        assertEquals(4d, result.grandTotal("count(count)"));
        assertEquals(4, result.recordCount());
        assertEquals(List.of("Cold", "Hot", Fields.NOT_AVAILABLE), result.rowKeys());
        assertEquals(List.of("Mar '24", Fields.UNKNOWN), result.colKeys());
        assertEquals(2d, result.rowTotal(Fields.NOT_AVAILABLE, "count(count)"));
        assertEquals(2d, result.colTotal(Fields.UNKNOWN, "count(count)"));
    }

    @Test
    void testAdditiveTotals() {
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "ltv" },
            { "Hot", "Web", "₹1,25,000" },
            { "Hot", "Ad", "5000" },
            { "Cold", "Web", 750.5 },
            { "Warm", "Referral", "" },
            { "Cold", "Ad", "1,000" },
        });
        PivotResult result = leads.pivot(pivot -> pivot
            .measure(Fields.LTV, Reducer.SUM)
            .measure(Fields.COUNT, Reducer.COUNT)
        );

        for (PivotValue value : result.values()) {
            double sum = 0;
            for (String rowKey : result.rowKeys())
                for (String colKey : result.colKeys())
                    sum += result.cell(rowKey, colKey, value);
            assertEquals(sum, result.grandTotal(value), 1e-9);
        }
        assertEquals(131750.5, result.grandTotal("sum(ltv)"), 1e-9);
    }

    @Test
    void testNonAdditiveTotals() {
        // Mean of the two cell means is (1 + 100) / 2; the true mean is (1 + 1 + 1 + 100) / 4
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "visits" },
            { "Hot", "Web", 1 },
            { "Hot", "Web", 1 },
            { "Hot", "Web", 1 },
            { "Hot", "Ad", 100 },
        });
        PivotResult result = leads.pivot(pivot -> pivot
            .measure(Fields.VISITS, Reducer.AVG)
            .measure(Fields.VISITS, Reducer.MEDIAN)
        );

        assertEquals(100d, result.cell("Hot", "Ad", "avg(visits)"));
        assertEquals(1d, result.cell("Hot", "Web", "avg(visits)"));
        assertEquals(103d / 4, result.rowTotal("Hot", "avg(visits)"), 1e-9);
        assertEquals(103d / 4, result.grandTotal("avg(visits)"), 1e-9);
        assertEquals(1d, result.grandTotal("median(visits)"));
    }

    @Test
    void testDeterminism() {
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "ltv", "visits" },
            { "Hot", "Web", 1200, 3 },
            { "Cold", "Ad", 400, 1 },
            { "Hot", "Ad", 900, 3 },
            { "Warm", "Web", 50, 2 },
            { "Cold", "Web", 400, 1 },
        });
        PivotConfiguration config = PivotConfiguration.of(pivot -> {
            for (Reducer reducer : Reducer.values())
                pivot.measure(Fields.VISITS, reducer);
            pivot.measure(Fields.STATUS, Reducer.COUNT_DISTINCT);
            pivot.formula("ratio", "sum(visits) / count(visits)");
        });

        PivotResult first = PivotTable.aggregate(leads, config);
        PivotResult second = PivotTable.aggregate(leads, config);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void testEmptyAndMissingRowValuesShareSentinel() {
        List<Map<String, Object>> maps = new ArrayList<>();
        Map<String, Object> blank = new LinkedHashMap<>();
        blank.put("status", "   ");
        blank.put("source", "Web");
        Map<String, Object> nul = new LinkedHashMap<>();
        nul.put("status", null);
        nul.put("source", "Web");
        Map<String, Object> missing = new LinkedHashMap<>();
        missing.put("source", "Web");
        maps.add(blank);
        maps.add(nul);
        maps.add(missing);

        PivotResult result = RecordSet.of(maps).pivot(pivot -> {});

        assertEquals(List.of(Fields.NOT_AVAILABLE), result.rowKeys());
        assertEquals(3d, result.cell(Fields.NOT_AVAILABLE, "Web", "count(count)"));
    }

    @Test
    void testSameRowAndColumnField() {
        PivotResult result = LEADS.pivot(pivot -> pivot
            .rows(Fields.STATUS)
            .columns(Fields.STATUS)
        );

        assertEquals(List.of("Cold", "Hot"), result.rowKeys());
        assertEquals(List.of("Cold", "Hot"), result.colKeys());
        assertEquals(1d, result.cell("Cold", "Cold", "count(count)"));
        assertEquals(2d, result.cell("Hot", "Hot", "count(count)"));
        assertEquals(0d, result.cell("Hot", "Cold", "count(count)"));
        assertEquals(0d, result.cell("Cold", "Hot", "count(count)"));
    }

    @Test
    void testEmptyInput() {
        PivotResult result = RecordSet.empty().pivot(pivot -> pivot
            .measure(Fields.LTV, Reducer.AVG)
            .measure(Fields.LTV, Reducer.MIN)
        );

        assertTrue(result.isEmpty());
        assertEquals(List.of(), result.rowKeys());
        assertEquals(List.of(), result.colKeys());
        assertEquals(0d, result.grandTotal("avg(ltv)"));
        assertEquals(0d, result.grandTotal("min(ltv)"));
    }

    @Test
    void testUnknownReducerAndField() {
        PivotResult result = LEADS.pivot(pivot -> pivot
            .rows("tier")
            .measure("v", "geometricMean")
        );

        assertEquals(List.of(Fields.NOT_AVAILABLE), result.rowKeys());
        assertEquals(3d, result.grandTotal("count(v)"));
    }

    @Test
    void testCountDistinctOfCategories() {
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "associate" },
            { "Hot", "Web", "Priya" },
            { "Hot", "Web", "Priya" },
            { "Hot", "Ad", "Rahul" },
            { "Cold", "Web", "Rahul" },
            { "Cold", "Web", "" },
        });
        PivotResult result = leads.pivot(pivot -> pivot.measure(Fields.ASSOCIATE, Reducer.COUNT_DISTINCT));

        assertEquals(1d, result.cell("Hot", "Web", "countDistinct(associate)"));
        assertEquals(2d, result.rowTotal("Hot", "countDistinct(associate)"));
        assertEquals(3d, result.colTotal("Web", "countDistinct(associate)"));
        assertEquals(3d, result.grandTotal("countDistinct(associate)"));
    }

    @Test
    void testFormulaPerCellAndTotal() {
        PivotResult result = LEADS.pivot(pivot -> pivot
            .measure("v", "sum")
            .measure(Fields.COUNT, Reducer.COUNT)
            .formula("mean", "sum(v) / count(count)")
            .percentFormula("share", "100 * count(count) / 3")
            .formula("broken", "sum(v) +")
            .formula("dangling", "max(v) * 2")
        );

        assertEquals(List.of("sum(v)", "count(count)", "mean", "share"),
                     result.values().stream().map(PivotValue::name).collect(Collectors.toList()));
        assertEquals(15d, result.cell("Hot", "Web", "mean"));
        assertEquals(0d, result.cell("Hot", "Ad", "mean"));
        assertEquals(35d / 3, result.grandTotal("mean"), 1e-9);
        assertEquals(100d, result.grandTotal("share"), 1e-9);
        assertTrue(result.values().get(3).isPercent());
    }

    @Test
    void testMeasureRedefinitionKeepsPosition() {
        PivotConfiguration config = PivotConfiguration.of(pivot -> pivot
            .measure(Fields.LTV, Reducer.SUM)
            .measure(Fields.COUNT, Reducer.COUNT)
            .measure(new Measure(Fields.LTV, Reducer.SUM).asPercent())
            .decimalPlaces(42)
        );

        assertEquals(2, config.measures().size());
        assertTrue(config.measures().get(0).isPercent());
        assertEquals(PivotAPI.MAX_DECIMAL_PLACES, config.decimalPlaces());
    }

    @Test
    void testUnknownLookupThrows() {
        PivotResult result = LEADS.pivot(pivot -> {});

        assertThrows(NoSuchElementException.class, () -> result.cell("Warm", "Web", "count(count)"));
        assertThrows(NoSuchElementException.class, () -> result.colTotal("Email", "count(count)"));
        assertThrows(NoSuchElementException.class, () -> result.grandTotal("sum(ltv)"));
    }

    @Test
    void testAttributeMeasuresKeepMagnitude() {
        RecordSet leads = rows(new Object[][]{
            { "status", "source", "v" },
            { "Hot", "Web", 12345678.5 },
            { "Hot", "Web", 0.0001 },
            { "Cold", "Ad", "2.5E-4" },
        });
        PivotResult result = leads.pivot(pivot -> pivot
            .measure("v", "sum")
            .measure("v", "min")
            .measure("v", "max")
        );

        assertEquals(12345678.5001, result.cell("Hot", "Web", "sum(v)"), 1e-6);
        assertEquals(1e-4, result.cell("Hot", "Web", "min(v)"));
        assertEquals(12345678.5, result.cell("Hot", "Web", "max(v)"));
        assertEquals(2.5e-4, result.cell("Cold", "Ad", "sum(v)"));
        assertEquals(12345678.50035, result.grandTotal("sum(v)"), 1e-6);
    }

    @Test
    void testLargeNumericKeysStayDistinct() {
        RecordSet leads = rows(new Object[][]{
            { "v", "source" },
            { 1e19, "Web" },
            { 2e19, "Web" },
            { 2e19, "Ad" },
            { 3.0, "Ad" },
        });
        PivotResult result = leads.pivot(pivot -> pivot.rows("v"));

        assertEquals(List.of("10000000000000000000", "20000000000000000000", "3"), result.rowKeys());
        assertEquals(1d, result.cell("10000000000000000000", "Web", "count(count)"));
        assertEquals(2d, result.rowTotal("20000000000000000000", "count(count)"));
        assertEquals(1d, result.rowTotal("3", "count(count)"));
    }

    private static RecordSet rows(Object[][] table) {
        List<List<Object>> rows = new ArrayList<>();
        for (Object[] row : table)
            rows.add(Arrays.asList(row));
        return RecordSet.fromRows(rows);
    }
}
