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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;

/**
 * The catalog of standard lead {@link Field fields}, and factory methods for defining further fields.
 *
 * <p>Every field resolves leniently. A categorical field reads its attribute as a string, and reads an absent or blank
 * value as {@value #NOT_AVAILABLE}. A numeric field reads numbers and plain numeric text as is, and otherwise strips
 * everything but digits, points, and minus signs from text before parsing it, so that {@code "₹1,25,000"} reads as
 * {@code 125000}; anything that still cannot be read is {@code 0}. A date field reads the creation timestamp, and
 * reads an absent or unreadable timestamp as {@value #UNKNOWN}. A field outside the catalog reads its attribute as
 * stored.
 */
public class Fields {
    private static final Logger LOGGER = LoggerFactory.getLogger(Fields.class);

    private Fields() {} // Prevent instantiation

    /** The category of records lacking a value for a categorical field. */
    public static final String NOT_AVAILABLE = "N/A";

    /** The category of records lacking a readable creation timestamp. */
    public static final String UNKNOWN = "Unknown";

    private static final List<String> CREATED_AT = List.of("createdAt", "created date", "date");

    public static final Field<String> STATUS = categorical("status", "Status", "status");
    public static final Field<String> STAGE = categorical("stage", "Stage", "stage", "stage name");
    public static final Field<String> SOURCE = categorical("source", "Source", "source", "source name", "lead source");
    public static final Field<String> ASSOCIATE = categorical("associate", "Associate", "associate", "assigned to");
    public static final Field<String> CENTER = categorical("center", "Center", "center", "location");
    public static final Field<String> FULL_NAME = categorical("fullName", "Full Name", "fullName", "name", "client name");
    public static final Field<String> EMAIL = categorical("email", "Email", "email", "email address");

    public static final Field<Double> LTV = currency("ltv", "Lifetime Value", "ltv", "lifetimeValue");
    public static final Field<Double> VISITS = numeric("visits", "Visits", "visits", "visitCount");
    public static final Field<Double> PURCHASES = numeric("purchases", "Purchases", "purchases", "purchaseCount");

    public static final Field<String> CREATED_AT_MONTH_YEAR =
        derived("createdAtMonthYear", "Created (Month-Year)", CREATED_AT, Dates::monthYear);
    public static final Field<String> CREATED_AT_YEAR =
        derived("createdAtYear", "Created (Year)", CREATED_AT, Dates::year);
    public static final Field<String> CREATED_AT_MONTH =
        derived("createdAtMonth", "Created (Month)", CREATED_AT, Dates::month);

    /** The constant {@code 1}, for counting records. */
    public static final Field<Double> COUNT = new Field<>("count", "Count", Field.Kind.CONSTANT, record -> 1d);

    private static final Map<String, Field<?>> CATALOG = new LinkedHashMap<>();
    static {
        for (Field<?> field : List.of(STATUS, STAGE, SOURCE, ASSOCIATE, CENTER, FULL_NAME, EMAIL, LTV, VISITS, PURCHASES,
                                      CREATED_AT_MONTH_YEAR, CREATED_AT_YEAR, CREATED_AT_MONTH, COUNT))
            CATALOG.put(field.id().toLowerCase(Locale.ROOT), field);
        CATALOG.put("createdat", CREATED_AT_MONTH_YEAR);
    }

    /**
     * Returns the standard fields, in catalog order.
     *
     * @return the standard fields
     */
    public static List<Field<?>> standard() {
        return List.copyOf(new LinkedHashSet<>(CATALOG.values()));
    }

    /**
     * Returns the standard field with the given identifier, matched case-insensitively. If there is no such field,
     * returns a field of kind {@link Field.Kind#ATTRIBUTE ATTRIBUTE} that reads the attribute of that name as stored,
     * and logs a warning.
     *
     * @param id the field identifier
     * @return the field with the given identifier, or a pass-through field
     */
    public static Field<?> of(String id) {
        Objects.requireNonNull(id);
        Field<?> field = CATALOG.get(id.toLowerCase(Locale.ROOT));
        if (field != null)
            return field;
        LOGGER.warn("Unknown field '{}'; reading it as a plain attribute", id);
        return attribute(id);
    }

    /**
     * Resolves the field with the given identifier on the given record, as by {@code Fields.of(id).resolve(record)},
     * but without logging.
     *
     * @param record the record
     * @param id the field identifier
     * @return the resolved value
     */
    public static Object resolve(Record record, String id) {
        Field<?> field = CATALOG.get(id.toLowerCase(Locale.ROOT));
        if (field != null)
            return field.resolve(record);
        return record.first(List.of(id));
    }

    /**
     * Returns a field that reads the first meaningful value of the named attribute as stored, or {@code null} if there
     * is none. Such values become categories when grouped on, and numbers when measured.
     *
     * @param name the attribute name, also used as the field identifier and label
     * @return a new attribute field
     */
    public static Field<Object> attribute(String name) {
        List<String> names = List.of(name);
        return new Field<>(name, name, Field.Kind.ATTRIBUTE, record -> record.first(names));
    }

    /**
     * Returns a categorical field that reads the first meaningful value among the given attributes.
     *
     * @param id the field identifier
     * @param label the display label
     * @param attributes the attribute names, in order of preference
     * @return a new categorical field
     */
    public static Field<String> categorical(String id, String label, String... attributes) {
        List<String> names = List.of(attributes);
        return new Field<>(id, label, Field.Kind.CATEGORICAL, record -> asCategory(record.first(names)));
    }

    /**
     * Returns a numeric field that reads the first meaningful value among the given attributes.
     *
     * @param id the field identifier
     * @param label the display label
     * @param attributes the attribute names, in order of preference
     * @return a new numeric field
     */
    public static Field<Double> numeric(String id, String label, String... attributes) {
        List<String> names = List.of(attributes);
        return new Field<>(id, label, Field.Kind.NUMERIC, record -> toNumber(record.first(names)));
    }

    /**
     * Returns a numeric field holding amounts of money, that reads the first meaningful value among the given
     * attributes.
     *
     * @param id the field identifier
     * @param label the display label
     * @param attributes the attribute names, in order of preference
     * @return a new currency field
     */
    public static Field<Double> currency(String id, String label, String... attributes) {
        List<String> names = List.of(attributes);
        return new Field<>(id, label, Field.Kind.CURRENCY, record -> toNumber(record.first(names)));
    }

    /**
     * Returns a field that applies the given function to the date read from the first meaningful value among the given
     * timestamp attributes. If no date can be read, the field resolves to {@value #UNKNOWN}.
     *
     * @param id the field identifier
     * @param label the display label
     * @param attributes the timestamp attribute names, in order of preference
     * @param labeler a function from the date to its label
     * @return a new date field
     */
    public static Field<String> derived(String id, String label, List<String> attributes,
                                        Function<? super LocalDate, String> labeler) {
        Objects.requireNonNull(labeler);
        List<String> names = List.copyOf(attributes);
        return new Field<>(id, label, Field.Kind.DATE, record -> {
            LocalDate date = Dates.parse(record.first(names));
            return date == null ? UNKNOWN : labeler.apply(date);
        });
    }

    /**
     * Returns the given value as a category: its string form, or {@value #NOT_AVAILABLE} if the value is {@code null}
     * or blank. Integral floating-point values are written without a fraction or exponent, so {@code 3.0} and
     * {@code 3} are the same category.
     *
     * @param value the value
     * @return the category of the value
     */
    public static String asCategory(Object value) {
        if (value == null)
            return NOT_AVAILABLE;
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d))
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        String text = String.valueOf(value);
        return text.isBlank() ? NOT_AVAILABLE : text;
    }

    /**
     * Returns the given value as a number. Numbers are returned as is. Anything else is read from its trimmed string
     * form, or failing that, from its string form after removing every character other than digits, {@code '.'}, and
     * {@code '-'}. If the value is {@code null}, or cannot be read as a finite number, returns {@code 0}.
     *
     * @param value the value
     * @return the value as a number
     */
    public static double toNumber(Object value) {
        if (value == null)
            return 0d;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : 0d;
        }
        String text = String.valueOf(value).trim();
        double d;
        try {
            d = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            d = parseStripped(text);
        }
        return Double.isFinite(d) ? d : 0d;
    }

    // Formatted text, such as "₹1,25,000"
    private static double parseStripped(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= '0' && c <= '9') || c == '.' || c == '-')
                sb.append(c);
        }
        if (sb.length() == 0)
            return 0d;
        try {
            return Double.parseDouble(sb.toString());
        } catch (NumberFormatException e) {
            return 0d; // Such as "-" or "1.2.3"
        }
    }
}
