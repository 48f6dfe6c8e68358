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

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaTest {
    private static final Map<String, Double> VALUES = Map.of(
        "sum(ltv)", 1200d,
        "count(count)", 8d,
        "countdistinct(status)", 3d
    );

    @Test
    void testArithmetic() {
        assertEquals(7d, eval("1 + 2 * 3"));
        assertEquals(9d, eval("(1 + 2) * 3"));
        assertEquals(6d, eval("-2 * -3"));
        assertEquals(2d, eval("1 - - 1"));
        assertEquals(2.5, eval("10 / 4"));
        assertEquals(0.5, eval(".5"));
        assertEquals(-1d, eval("2 - 3"));
        assertEquals(1d, eval("8 - 4 - 3"));
        assertEquals(1d, eval("8 / 4 / 2"));
    }

    @Test
    void testMeasureReferences() {
        Formula formula = Formula.parse("avg ltv", "SUM(ltv) / count(count)");

        assertEquals(Set.of("sum(ltv)", "count(count)"), formula.references());
        assertEquals(150d, formula.evaluate(VALUES::get));
        assertEquals(400d, eval("sum(ltv) / countDistinct(status)"));
    }

    @Test
    void testDivisionByZeroAndOverflowYieldZero() {
        assertEquals(0d, eval("5 / 0"));
        assertEquals(0d, eval("sum(ltv) / (count(count) - 8)"));
        Formula overflow = Formula.parse("big", "sum(ltv) * 10");
        assertEquals(0d, overflow.evaluate(name -> Double.MAX_VALUE));
    }

    @Test
    void testMalformed() {
        for (String expression : new String[]{ "", "1 +", "sum(ltv", "sum ltv", "2 $ 3", "1.2.3", "(1 + 2", "1 2" })
            assertThrows(IllegalArgumentException.class, () -> Formula.parse("bad", expression), expression);
    }

    @Test
    void testFlags() {
        Formula formula = Formula.parse("rate", "100 * count(count) / 10");

        assertFalse(formula.isPercent());
        assertTrue(formula.asPercent().isPercent());
        assertFalse(formula.isCurrency());
        assertEquals("rate", formula.name());
        assertEquals("100 * count(count) / 10", formula.expression());
        assertNotEquals(formula, formula.asPercent());
    }

    private static double eval(String expression) {
        return Formula.parse("f", expression).evaluate(VALUES::get);
    }
}
