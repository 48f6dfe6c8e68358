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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.text.ParseException;
import java.text.ParsePosition;
import java.util.List;
import java.util.Objects;

/**
 * Renders pivot values for display, as configured by {@link FormatOptions}. Formatting is presentation only: it never
 * changes the values in a {@link PivotResult}.
 *
 * <ul>
 *     <li>Percentage values are grouped numbers followed by {@code %}, such as {@code 12.50%}.
 *     <li>Currency values are prefixed by the currency symbol, and compacted into units once they reach a thousand:
 *     {@code Cr}, {@code L}, and {@code K} under the Indian numbering system, such as {@code ₹1.25L}, or else
 *     {@code B}, {@code M}, and {@code K}. A negative sign precedes the symbol.
 *     <li>All other values are grouped numbers, such as {@code 1,234.50}.
 * </ul>
 *
 * <p>Every number is rounded half-up to the configured decimal places, which are always shown. A value that rounds
 * to zero is shown unsigned.
 */
public class ValueFormatter {
    private static final List<Unit> INDIAN_UNITS = List.of(new Unit("Cr", 1e7), new Unit("L", 1e5), new Unit("K", 1e3));
    private static final List<Unit> WESTERN_UNITS = List.of(new Unit("B", 1e9), new Unit("M", 1e6), new Unit("K", 1e3));

    private final FormatOptions options;
    private final String symbol;
    private final List<Unit> units;
    private final NumberFormat prototype;

    public ValueFormatter() {
        this(FormatOptions.defaults());
    }

    public ValueFormatter(FormatOptions options) {
        this.options = Objects.requireNonNull(options);
        this.symbol = options.currencySymbol();
        this.units = options.indianUnits() ? INDIAN_UNITS : WESTERN_UNITS;
        this.prototype = NumberFormat.getNumberInstance(options.locale());
        prototype.setGroupingUsed(true);
        prototype.setMinimumFractionDigits(options.decimalPlaces());
        prototype.setMaximumFractionDigits(options.decimalPlaces());
        prototype.setRoundingMode(RoundingMode.HALF_UP);
    }

    public FormatOptions options() {
        return options;
    }

    /**
     * Formats the given value for display as the given measure or formula. A value that is not a finite number is
     * formatted as {@code 0}.
     *
     * @param value the value
     * @param as the measure or formula the value belongs to
     * @return the display string
     */
    public String format(double value, PivotValue as) {
        if (!Double.isFinite(value))
            value = 0d;
        if (as.isPercent())
            return number(value) + "%";
        if (as.isCurrency())
            return currency(value);
        return number(value);
    }

    private String currency(double value) {
        double abs = Math.abs(value);
        // The unit is chosen by the rounded amount it displays, so 99,999.999 reads 1.00L, not 100.00K
        if (options.compactCurrency() && round(abs) >= units.get(units.size() - 1).scale)
            for (Unit unit : units) {
                double scaled = round(abs / unit.scale);
                if (scaled >= 1)
                    return signOf(value, scaled) + symbol + number(scaled) + unit.suffix;
            }
        double rounded = round(abs);
        return signOf(value, rounded) + symbol + number(rounded);
    }

    private static String signOf(double value, double rounded) {
        return value < 0 && rounded != 0 ? "-" : "";
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(options.decimalPlaces(), RoundingMode.HALF_UP).doubleValue();
    }

    private String number(double value) {
        double rounded = round(value);
        return ((NumberFormat) prototype.clone()).format(rounded == 0 ? 0d : rounded);
    }

    /**
     * Parses a display string produced by this formatter back into a number. Accepts percentages, currency amounts
     * with or without a unit suffix, and plain grouped numbers. The result is only as precise as the display string.
     *
     * @param text the display string
     * @return the number
     * @throws ParseException if the text is not in a format this formatter produces
     */
    public double parse(String text) throws ParseException {
        Objects.requireNonNull(text);
        String rest = text.trim();
        if (rest.endsWith("%"))
            rest = rest.substring(0, rest.length() - 1).trim();
        double sign = 1d;
        if (rest.startsWith("-") && rest.startsWith(symbol, 1)) {
            sign = -1d;
            rest = rest.substring(1);
        }
        double scale = 1d;
        if (!symbol.isEmpty() && rest.startsWith(symbol)) {
            rest = rest.substring(symbol.length());
            for (Unit unit : units)
                if (rest.endsWith(unit.suffix)) {
                    scale = unit.scale;
                    rest = rest.substring(0, rest.length() - unit.suffix.length());
                    break;
                }
        }
        ParsePosition position = new ParsePosition(0);
        Number number = ((NumberFormat) prototype.clone()).parse(rest, position);
        if (number == null || position.getIndex() != rest.length())
            throw new ParseException("Unparseable value: \"" + text + "\"", Math.max(position.getErrorIndex(), 0));
        return sign * number.doubleValue() * scale;
    }

    private static class Unit {
        final String suffix;
        final double scale;

        Unit(String suffix, double scale) {
            this.suffix = suffix;
            this.scale = scale;
        }
    }
}
