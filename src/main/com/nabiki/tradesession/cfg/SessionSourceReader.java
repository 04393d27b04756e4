/*
 * Copyright (c) 2020 Hongbao Chen <chenhongbao@outlook.com>
 *
 * Licensed under the  GNU Affero General Public License v3.0 and you may not use
 * this file except in compliance with the  License. You may obtain a copy of the
 * License at
 *
 *                    https://www.gnu.org/licenses/agpl-3.0.txt
 *
 * Permission is hereby  granted, free of charge, to any  person obtaining a copy
 * of this software and associated  documentation files (the "Software"), to deal
 * in the Software  without restriction, including without  limitation the rights
 * to  use, copy,  modify, merge,  publish, distribute,  sublicense, and/or  sell
 * copies  of  the Software,  and  to  permit persons  to  whom  the Software  is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE  IS PROVIDED "AS  IS", WITHOUT WARRANTY  OF ANY KIND,  EXPRESS OR
 * IMPLIED,  INCLUDING BUT  NOT  LIMITED TO  THE  WARRANTIES OF  MERCHANTABILITY,
 * FITNESS FOR  A PARTICULAR PURPOSE AND  NONINFRINGEMENT. IN NO EVENT  SHALL THE
 * AUTHORS  OR COPYRIGHT  HOLDERS  BE  LIABLE FOR  ANY  CLAIM,  DAMAGES OR  OTHER
 * LIABILITY, WHETHER IN AN ACTION OF  CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE  OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.nabiki.tradesession.cfg;

import com.google.gson.reflect.TypeToken;
import com.nabiki.tradesession.cfg.plain.SessionConfig;
import com.nabiki.tradesession.tools.OP;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.logging.Logger;

/**
 * Reads session rows from CSV text.
 *
 * <p>Each line is one record, cells separated by commas and quoted by double
 * quotes where a cell contains commas. Blank lines and lines starting with
 * {@code #} are skipped. The first record is a header if its first cell is
 * {@code product}, {@code product_id}, {@code productid} or {@code product_code}.
 * A record is one of the two forms below.
 * </p>
 * <pre>
 * ag,21,0,2,30,9,0,10,15,10,30,11,30,13,30,15,0
 * ag,SHFE,"[{""Begin"":""21:00:00"",""End"":""02:30:00""},{""Begin"":""09:00:00"",""End"":""10:15:00""}]"
 * </pre>
 * <p>The first form is the product followed by groups of four integers, start
 * hour, start minute, end hour and end minute. The second form is the product,
 * an optional exchange and a JSON array of slices, as exported from the
 * database.</p>
 */
public class SessionSourceReader {
    private static final Logger logger
            = Logger.getLogger(SessionSourceReader.class.getCanonicalName());
    private static final Set<String> headerCells = Set.of(
            "product", "product_id", "productid", "product_code");
    private static final TypeToken<List<Map<String, String>>> jsonSlicesType
            = new TypeToken<List<Map<String, String>>>() {
    };

    private SessionSourceReader() {
    }

    /**
     * Read rows from the specified UTF-8 file.
     *
     * @param file CSV file
     * @return rows in file order
     * @throws SessionSourceException if the file can't be read or a row is
     * malformed
     */
    public static List<SessionConfig> read(Path file) throws SessionSourceException {
        Objects.requireNonNull(file, "file null");
        if (!Files.isRegularFile(file))
            throw new SessionSourceException("file not found `" + file + "`");
        String content;
        try {
            content = OP.readText(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SessionSourceException("file not found `" + file + "`", e);
        } catch (IOException e) {
            throw new SessionSourceException("failed reading `" + file + "`", e);
        }
        return read(content);
    }

    /**
     * Read rows from CSV content.
     *
     * @param content CSV content
     * @return rows in content order
     * @throws SessionSourceException if a row is malformed
     */
    public static List<SessionConfig> read(String content) throws SessionSourceException {
        Objects.requireNonNull(content, "content null");
        var rows = new LinkedList<SessionConfig>();
        var lines = OP.stripBom(content).split("\r?\n", -1);
        var first = true;
        for (int i = 0; i < lines.length; ++i) {
            var text = lines[i].trim();
            if (text.isEmpty() || text.startsWith("#"))
                continue;
            var lineNo = i + 1;
            var cells = splitCells(text, lineNo);
            if (first) {
                first = false;
                if (headerCells.contains(cells.get(0).trim().toLowerCase(Locale.ROOT))) {
                    logger.fine(OP.formatLog("skip header", null, text, null));
                    continue;
                }
            }
            rows.add(parseRecord(cells, lineNo));
        }
        return rows;
    }

    /**
     * Read rows from a map of product ID to JSON array of slices, usually two
     * columns from a database table.
     *
     * @param productSlices product ID to JSON slices
     * @return rows ordered by product ID
     * @throws SessionSourceException if a JSON value is malformed
     */
    public static List<SessionConfig> fromJsonMap(Map<String, String> productSlices)
            throws SessionSourceException {
        Objects.requireNonNull(productSlices, "map null");
        var rows = new LinkedList<SessionConfig>();
        for (var e : new TreeMap<>(productSlices).entrySet()) {
            var row = new SessionConfig();
            row.productID = product(e.getKey(), 0);
            row.slices = parseJsonSlices(e.getValue(), 0);
            rows.add(row);
        }
        return rows;
    }

    static SessionConfig parseRecord(List<String> cells, int line)
            throws SessionSourceException {
        var row = new SessionConfig();
        row.line = line;
        row.productID = product(cells.get(0), line);
        var last = cells.get(cells.size() - 1).trim();
        if ((cells.size() == 2 || cells.size() == 3) && last.startsWith("[")) {
            if (cells.size() == 3)
                row.exchangeID = cells.get(1).trim();
            row.slices = parseJsonSlices(last, line);
        } else {
            row.slices = parseNumericSlices(cells, line);
        }
        return row;
    }

    private static String product(String cell, int line) throws SessionSourceException {
        if (cell == null || cell.trim().isEmpty())
            throw new SessionSourceException(line, "product null");
        return cell.trim();
    }

    private static List<SessionConfig.SingleSlice> parseNumericSlices(
            List<String> cells, int line) throws SessionSourceException {
        var n = cells.size() - 1;
        if (n == 0 || n % 4 != 0)
            throw new SessionSourceException(line, String.format(
                    "expected groups of 4 integers after product, got %d cells", n));
        var values = new int[n];
        for (int i = 0; i < n; ++i) {
            var cell = cells.get(i + 1).trim();
            try {
                values[i] = Integer.parseInt(cell);
            } catch (NumberFormatException e) {
                throw new SessionSourceException(line, "not an integer `" + cell + "`", e);
            }
        }
        var slices = new LinkedList<SessionConfig.SingleSlice>();
        for (int i = 0; i < n; i += 4) {
            try {
                slices.add(new SessionConfig.SingleSlice(
                        LocalTime.of(values[i], values[i + 1]),
                        LocalTime.of(values[i + 2], values[i + 3])));
            } catch (DateTimeException e) {
                throw new SessionSourceException(line, String.format(
                        "time out of range %d:%d-%d:%d", values[i], values[i + 1],
                        values[i + 2], values[i + 3]), e);
            }
        }
        return slices;
    }

    static List<SessionConfig.SingleSlice> parseJsonSlices(String json, int line)
            throws SessionSourceException {
        List<Map<String, String>> elements;
        try {
            elements = OP.fromJson(json, jsonSlicesType.getType());
        } catch (IOException e) {
            throw new SessionSourceException(line, "trade session must be JSON array", e);
        }
        if (elements == null)
            throw new SessionSourceException(line, "trade session must be JSON array");
        var slices = new LinkedList<SessionConfig.SingleSlice>();
        for (var elem : elements) {
            if (elem == null)
                throw new SessionSourceException(line, "slice null");
            // Keys are case insensitive, Begin, begin or BEGIN.
            var keys = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
            keys.putAll(elem);
            var begin = keys.get("begin");
            var end = keys.get("end");
            if (begin == null || end == null)
                throw new SessionSourceException(line, "slice needs begin and end: " + elem);
            try {
                slices.add(new SessionConfig.SingleSlice(
                        LocalTime.parse(begin.trim()), LocalTime.parse(end.trim())));
            } catch (DateTimeParseException e) {
                throw new SessionSourceException(line, "bad slice time: " + elem, e);
            }
        }
        return slices;
    }

    static List<String> splitCells(String text, int line) throws SessionSourceException {
        var cells = new ArrayList<String>();
        var cell = new StringBuilder();
        var quoted = false;
        for (int i = 0; i < text.length(); ++i) {
            var c = text.charAt(i);
            if (quoted) {
                if (c == '"') {
                    // Doubled quote is a literal quote.
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        cell.append('"');
                        ++i;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        if (quoted)
            throw new SessionSourceException(line, "unterminated quote");
        cells.add(cell.toString());
        return cells;
    }
}
