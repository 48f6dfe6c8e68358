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

import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable display options for a {@link ValueFormatter}. Options are changed by making modified copies, starting from
 * {@link #defaults()}.
 */
public final class FormatOptions {
    /** Indian English, whose currency units are crores, lakhs, and thousands. */
    public static final Locale INDIA = new Locale("en", "IN");

    private static final FormatOptions DEFAULTS = new FormatOptions(INDIA, 2, null, true);

    private final Locale locale;
    private final int decimalPlaces;
    private final String currencySymbol; // null for the locale's symbol
    private final boolean compactCurrency;

    private FormatOptions(Locale locale, int decimalPlaces, String currencySymbol, boolean compactCurrency) {
        this.locale = locale;
        this.decimalPlaces = decimalPlaces;
        this.currencySymbol = currencySymbol;
        this.compactCurrency = compactCurrency;
    }

    /**
     * Returns the default options: the {@link #INDIA} locale and its currency symbol, 2 decimal places, and compacted
     * currency amounts.
     *
     * @return the default options
     */
    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the default options, with the decimal places of the given configuration.
     *
     * @param config the pivot configuration
     * @return options for the given configuration
     */
    public static FormatOptions of(PivotConfiguration config) {
        return DEFAULTS.withDecimalPlaces(config.decimalPlaces());
    }

    public FormatOptions withLocale(Locale locale) {
        return new FormatOptions(Objects.requireNonNull(locale), decimalPlaces, currencySymbol, compactCurrency);
    }

    /**
     * Returns a copy of these options with the given number of decimal places, clamped into {@code [0, 10]}.
     *
     * @param decimalPlaces the number of decimal places
     * @return a copy of these options with the given number of decimal places
     */
    public FormatOptions withDecimalPlaces(int decimalPlaces) {
        int clamped = Math.max(0, Math.min(PivotAPI.MAX_DECIMAL_PLACES, decimalPlaces));
        return new FormatOptions(locale, clamped, currencySymbol, compactCurrency);
    }

    /**
     * Returns a copy of these options with the given currency symbol, in place of the locale's currency symbol.
     *
     * @param currencySymbol the currency symbol
     * @return a copy of these options with the given currency symbol
     */
    public FormatOptions withCurrencySymbol(String currencySymbol) {
        return new FormatOptions(locale, decimalPlaces, Objects.requireNonNull(currencySymbol), compactCurrency);
    }

    public FormatOptions withCompactCurrency(boolean compactCurrency) {
        return new FormatOptions(locale, decimalPlaces, currencySymbol, compactCurrency);
    }

    public Locale locale() {
        return locale;
    }

    public int decimalPlaces() {
        return decimalPlaces;
    }

    /**
     * Returns the currency symbol: the one these options were given, or else the locale's.
     *
     * @return the currency symbol
     */
    public String currencySymbol() {
        return currencySymbol != null ? currencySymbol : DecimalFormatSymbols.getInstance(locale).getCurrencySymbol();
    }

    public boolean compactCurrency() {
        return compactCurrency;
    }

    /**
     * Returns {@code true} if currency amounts are compacted in crores and lakhs, rather than billions and millions.
     *
     * @return {@code true} if the locale uses the Indian numbering system
     */
    public boolean indianUnits() {
        return "IN".equals(locale.getCountry());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FormatOptions))
            return false;
        FormatOptions other = (FormatOptions) o;
        return decimalPlaces == other.decimalPlaces
            && compactCurrency == other.compactCurrency
            && locale.equals(other.locale)
            && Objects.equals(currencySymbol, other.currencySymbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locale, decimalPlaces, currencySymbol, compactCurrency);
    }

    @Override
    public String toString() {
        return "FormatOptions{locale=" + locale + ", decimalPlaces=" + decimalPlaces
            + ", currencySymbol=" + currencySymbol() + ", compactCurrency=" + compactCurrency + '}';
    }
}
