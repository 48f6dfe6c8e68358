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

/**
 * Lays out a {@link PivotResult} as aligned plain text, for logs and terminals. For example:
 *
 * <pre>{@code
 * Status  Value     Ad     Web     Total
 * ------  --------  -----  ------  ------
 * Cold    sum(ltv)  ₹5.00  ₹0.00   ₹5.00
 * Hot     sum(ltv)  ₹0.00  ₹30.00  ₹30.00
 * Total   sum(ltv)  ₹5.00  ₹30.00  ₹35.00
 * }</pre>
 *
 * <p>Each row key spans one line per value. The totals column and totals lines are present only if the result's
 * configuration {@link PivotConfiguration#showTotals() shows totals}.
 */
public class PivotTableRenderer {
    private static final String TOTAL = "Total";
    private static final String GAP = "  ";

    private PivotTableRenderer() {} // Prevent instantiation

    /**
     * Renders the given result, formatting values with the given formatter.
     *
     * @param result the pivot result
     * @param formatter the value formatter
     * @return the rendered table, with lines separated by {@code '\n'}
     */
    public static String render(PivotResult result, ValueFormatter formatter) {
        Objects.requireNonNull(result);
        Objects.requireNonNull(formatter);
        boolean showTotals = result.configuration().showTotals();
        List<String> colKeys = result.colKeys();

        List<String[]> lines = new ArrayList<>();
        List<String> header = new ArrayList<>();
        header.add(result.configuration().rowField().label());
        header.add("Value");
        header.addAll(colKeys);
        if (showTotals)
            header.add(TOTAL);
        lines.add(header.toArray(new String[0]));

        for (String rowKey : result.rowKeys()) {
            boolean first = true;
            for (PivotValue value : result.values()) {
                List<String> line = new ArrayList<>();
                line.add(first ? rowKey : "");
                line.add(value.name());
                for (String colKey : colKeys)
                    line.add(formatter.format(result.cell(rowKey, colKey, value), value));
                if (showTotals)
                    line.add(formatter.format(result.rowTotal(rowKey, value), value));
                lines.add(line.toArray(new String[0]));
                first = false;
            }
        }
        if (showTotals) {
            boolean first = true;
            for (PivotValue value : result.values()) {
                List<String> line = new ArrayList<>();
                line.add(first ? TOTAL : "");
                line.add(value.name());
                for (String colKey : colKeys)
                    line.add(formatter.format(result.colTotal(colKey, value), value));
                line.add(formatter.format(result.grandTotal(value), value));
                lines.add(line.toArray(new String[0]));
                first = false;
            }
        }

        int[] widths = new int[header.size()];
        for (String[] line : lines)
            for (int i = 0; i < line.length; i++)
                widths[i] = Math.max(widths[i], line[i].length());

        StringBuilder sb = new StringBuilder();
        appendLine(sb, lines.get(0), widths);
        String[] rule = new String[widths.length];
        for (int i = 0; i < widths.length; i++)
            rule[i] = "-".repeat(widths[i]);
        sb.append('\n');
        appendLine(sb, rule, widths);
        for (int i = 1; i < lines.size(); i++) {
            sb.append('\n');
            appendLine(sb, lines.get(i), widths);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String[] cells, int[] widths) {
        int start = sb.length();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0)
                sb.append(GAP);
            sb.append(cells[i]);
            sb.append(" ".repeat(widths[i] - cells[i].length()));
        }
        // Trim trailing padding
        int end = sb.length();
        while (end > start && sb.charAt(end - 1) == ' ')
            end--;
        sb.setLength(end);
    }
}
