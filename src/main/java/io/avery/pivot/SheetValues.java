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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the "values" payload of a spreadsheet range into a {@link RecordSet}. The payload is a JSON object whose
 * {@code values} member is an array of rows, each an array of cells, the first row holding the attribute names:
 *
 * <pre>{@code
 * {
 *   "range": "Leads!A1:F3",
 *   "values": [
 *     ["ID", "Full Name", "Lead Source", "Status", "Created At", "LTV"],
 *     ["L-001", "Asha Rao", "Website", "Hot", "2024-03-14", "1,25,000"],
 *     ["L-002", "Vikram Shah", "Referral", "Cold", "2024-04-02"]
 *   ]
 * }
 * }</pre>
 *
 * <p>Rows shorter than the header are padded with empty strings. Every record gets an {@code id}: the sheet's own,
 * unless blank or absent, in which case {@code lead-N} for the Nth data row.
 */
public class SheetValues {
    private static final String ID = "id";

    private SheetValues() {} // Prevent instantiation

    /**
     * Reads a values payload.
     *
     * @param json the payload
     * @return the records; empty if the payload has no values, or only a header row
     * @throws IOException if the payload is not well-formed
     */
    public static RecordSet parse(String json) throws IOException {
        return parse(new StringReader(json));
    }

    /**
     * Reads a values payload.
     *
     * @param reader the payload
     * @return the records; empty if the payload has no values, or only a header row
     * @throws IOException if the payload cannot be read, or is not well-formed
     */
    public static RecordSet parse(Reader reader) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Malformed sheet values payload", e);
        }
        if (!root.isJsonObject())
            throw new IOException("Sheet values payload is not a JSON object");
        JsonObject object = root.getAsJsonObject();
        JsonElement values = object.get("values");
        if (values == null || values.isJsonNull())
            return RecordSet.empty();
        if (!values.isJsonArray())
            throw new IOException("Sheet values member is not an array");

        List<List<String>> rows = new ArrayList<>();
        for (JsonElement row : values.getAsJsonArray())
            rows.add(cells(row));
        if (rows.size() <= 1)
            return RecordSet.empty();

        List<String> header = new ArrayList<>();
        for (String name : rows.get(0))
            header.add(name.trim());
        int sheetWidth = header.size();
        int width = sheetWidth;
        int idIndex = new Header(header).indexOf(ID);
        if (idIndex == -1) {
            header.add(ID);
            idIndex = width++;
        }

        List<List<String>> table = new ArrayList<>(rows.size());
        table.add(header);
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() > sheetWidth)
                row = new ArrayList<>(row.subList(0, sheetWidth));
            while (row.size() < width)
                row.add("");
            if (row.get(idIndex).isBlank())
                row.set(idIndex, "lead-" + i);
            table.add(row);
        }
        return RecordSet.fromRows(table);
    }

    private static List<String> cells(JsonElement row) throws IOException {
        if (!row.isJsonArray())
            throw new IOException("Sheet values row is not an array: " + row);
        JsonArray array = row.getAsJsonArray();
        List<String> cells = new ArrayList<>(array.size());
        for (JsonElement cell : array) {
            if (cell.isJsonNull())
                cells.add("");
            else if (cell.isJsonPrimitive())
                cells.add(cell.getAsString());
            else
                cells.add(cell.toString());
        }
        return cells;
    }
}
