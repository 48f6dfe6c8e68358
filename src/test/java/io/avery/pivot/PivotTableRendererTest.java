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

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class PivotTableRendererTest {
    private static final RecordSet LEADS = RecordSet.fromRows(List.of(
        List.of("status", "source", "v"),
        List.of("Hot", "Web", 10),
        List.of("Hot", "Web", 20),
        List.of("Cold", "Ad", 5)
    ));

    @Test
    void testRenderWithTotals() {
        PivotResult result = LEADS.pivot(pivot -> pivot.decimalPlaces(0));

        String table = PivotTableRenderer.render(result, new ValueFormatter(FormatOptions.of(result.configuration())));

        String expected = String.join("\n",
            "Status  Value         Ad  Web  Total",
            "------  ------------  --  ---  -----",
            "Cold    count(count)  1   0    1",
            "Hot     count(count)  0   2    2",
            "Total   count(count)  1   2    3"
        );
        assertEquals(expected, table);
    }

    @Test
    void testRenderWithoutTotals() {
        PivotResult result = LEADS.pivot(pivot -> pivot
            .measure("v", "sum")
            .measure("v", "avg")
            .decimalPlaces(1)
            .showTotals(false)
        );

        String table = PivotTableRenderer.render(result, new ValueFormatter(FormatOptions.of(result.configuration())));

        String expected = String.join("\n",
            "Status  Value   Ad   Web",
            "------  ------  ---  ----",
            "Cold    sum(v)  5.0  0.0",
            "        avg(v)  5.0  0.0",
            "Hot     sum(v)  0.0  30.0",
            "        avg(v)  0.0  15.0"
        );
        assertEquals(expected, table);
        assertFalse(table.contains("Total"));
    }
}
