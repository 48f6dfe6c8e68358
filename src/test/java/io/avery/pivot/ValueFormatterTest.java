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

import java.text.ParseException;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ValueFormatterTest {
    private static final Measure SUM_LTV = new Measure(Fields.LTV, Reducer.SUM);
    private static final Measure COUNT_LTV = new Measure(Fields.LTV, Reducer.COUNT);
    private static final Measure AVG_VISITS = new Measure(Fields.VISITS, Reducer.AVG);
    private static final ValueFormatter RUPEES = new ValueFormatter(FormatOptions.defaults().withCurrencySymbol("₹"));
    private static final ValueFormatter DOLLARS = new ValueFormatter(
        FormatOptions.defaults().withLocale(Locale.US).withCurrencySymbol("$")
    );

    @Test
    void testIndianUnits() {
        assertEquals("₹1.23Cr", RUPEES.format(12345678, SUM_LTV));
        assertEquals("₹1.25L", RUPEES.format(125000, SUM_LTV));
        assertEquals("₹12.00K", RUPEES.format(12000, SUM_LTV));
        assertEquals("₹999.50", RUPEES.format(999.5, SUM_LTV));
        assertEquals("-₹2.50K", RUPEES.format(-2500, SUM_LTV));
    }

    @Test
    void testWesternUnits() {
        assertEquals("$3.20B", DOLLARS.format(3.2e9, SUM_LTV));
        assertEquals("$2.50M", DOLLARS.format(2_500_000, SUM_LTV));
        assertEquals("$125.00K", DOLLARS.format(125_000, SUM_LTV));
    }

    @Test
    void testUnitFollowsRoundedAmount() {
        assertEquals("₹1.00L", RUPEES.format(99999.999, SUM_LTV));
        assertEquals("₹1.00L", RUPEES.format(99999.5, SUM_LTV));
        assertEquals("₹1.00K", RUPEES.format(999.999, SUM_LTV));
        assertEquals("-₹1.00Cr", RUPEES.format(-9999999.9, SUM_LTV));
        assertEquals("$1.00M", DOLLARS.format(999999.996, SUM_LTV));
    }

    @Test
    void testZeroIsUnsigned() {
        assertEquals("₹0.00", RUPEES.format(-0.001, SUM_LTV));
        assertEquals("₹0.00", RUPEES.format(-0d, SUM_LTV));
        assertEquals("0.00", RUPEES.format(-0.004, AVG_VISITS));
        assertEquals("0.00%", RUPEES.format(-0.001, AVG_VISITS.asPercent()));
        assertEquals("-₹0.01", RUPEES.format(-0.005, SUM_LTV));
    }

    @Test
    void testPlainAndPercent() {
        assertEquals("1,234.50", RUPEES.format(1234.5, COUNT_LTV));
        assertEquals("3.00", RUPEES.format(3, AVG_VISITS));
        assertEquals("12.50%", RUPEES.format(12.5, AVG_VISITS.asPercent()));
        assertEquals("0.00", RUPEES.format(Double.NaN, AVG_VISITS));
    }

    @Test
    void testOptions() {
        ValueFormatter whole = new ValueFormatter(FormatOptions.defaults().withCurrencySymbol("₹").withDecimalPlaces(0));
        assertEquals("₹1L", whole.format(125000, SUM_LTV));
        assertEquals("3", whole.format(2.5, AVG_VISITS));

        ValueFormatter full = new ValueFormatter(
            FormatOptions.defaults().withLocale(Locale.US).withCurrencySymbol("$").withCompactCurrency(false)
        );
        assertEquals("$1,234,567.89", full.format(1234567.891, SUM_LTV));

        assertEquals(10, FormatOptions.defaults().withDecimalPlaces(11).decimalPlaces());
        assertEquals(0, FormatOptions.defaults().withDecimalPlaces(-1).decimalPlaces());
        assertEquals(FormatOptions.INDIA, FormatOptions.defaults().locale());
        assertTrue(FormatOptions.defaults().indianUnits());
        assertFalse(DOLLARS.options().indianUnits());
    }

    @Test
    void testParse() throws ParseException {
        assertEquals(12.5, RUPEES.parse("12.50%"));
        assertEquals(1234.5, RUPEES.parse("1,234.50"));
        assertEquals(-2500d, RUPEES.parse("-₹2.50K"));
        assertEquals(12300000d, RUPEES.parse("₹1.23Cr"), 1e-6);
        assertEquals(999.5, RUPEES.parse("₹999.50"));
        assertEquals(2500000d, DOLLARS.parse("$2.50M"));
        assertThrows(ParseException.class, () -> RUPEES.parse("lots"));
        assertThrows(ParseException.class, () -> RUPEES.parse("₹1.2.3L"));
    }

    @Test
    void testCurrencyRoundTrip() throws ParseException {
        double[][] valuesAndScales = {
            { 0, 1 },
            { 999.99, 1 },
            { 1234.5, 1e3 },
            { 125000, 1e5 },
            { 987654.321, 1e5 },
            { 98765432.1, 1e7 },
            { -4567.8, 1e3 },
        };
        for (double[] valueAndScale : valuesAndScales) {
            double value = valueAndScale[0];
            double tolerance = 0.5e-2 * valueAndScale[1];
            String text = RUPEES.format(value, SUM_LTV);
            assertEquals(value, RUPEES.parse(text), tolerance, text);
        }
    }
}
