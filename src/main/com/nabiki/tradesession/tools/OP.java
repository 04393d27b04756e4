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

package com.nabiki.tradesession.tools;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

public class OP {
    // Instrument product ID pattern.
    private static final Pattern productPattern = Pattern.compile("^[a-zA-Z]+");
    private static final char BOM = '\uFEFF';
    private final static Gson gson;
    static {
        gson = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.IDENTITY)
                .serializeNulls()
                .create();
    }

    /**
     * Parse the specified JSON string to object of the specified {@link Type}.
     *
     * @param json JSON string
     * @param type type of the object, may be generic
     * @param <T> generic type of the object
     * @return object parsed from the specified JSON string
     * @throws IOException fail parsing JSON string
     */
    public static <T> T fromJson(String json, Type type) throws IOException {
        try {
            return gson.fromJson(json, type);
        } catch (com.google.gson.JsonParseException e) {
            throw new IOException("parse JSON string", e);
        }
    }

    /**
     * Read from the specified file and parse the content into a string using the
     * specified charset. A leading byte order mark is removed.
     *
     * @param file file to read from
     * @param charset charset for the returned string
     * @return string parsed from the content of the specified file
     * @throws IOException fail to read the file
     */
    public static String readText(Path file, Charset charset) throws IOException {
        Objects.requireNonNull(file, "file null");
        try (InputStream is = Files.newInputStream(file)) {
            return stripBom(new String(is.readAllBytes(), charset));
        }
    }

    /**
     * Remove the byte order mark at the beginning of the specified text.
     *
     * @param text text
     * @return text without leading byte order mark
     */
    public static String stripBom(String text) {
        if (text != null && text.length() > 0 && text.charAt(0) == BOM)
            return text.substring(1);
        return text;
    }

    /**
     * Format log.
     *
     * @param hint description
     * @param product product ID if it has
     * @param errMsg error message if it has
     * @param errCode error code if it has
     * @return log string
     */
    public static String formatLog(String hint, String product, String errMsg,
                                   Integer errCode) {
        return String.format("%s[%s]%s(%d)", hint, product, errMsg, errCode);
    }

    /**
     * Extract product ID from the specified instrument ID. The product ID is the
     * leading letters before the year-month number of an instrument ID, such as
     * {@code ag} of {@code ag2412} or {@code SR} of {@code SR505}. Letter case is
     * kept.
     *
     * @param instrID instrument ID
     * @return product ID, or {@code null} if the instrument ID doesn't start with
     * letters
     */
    public static String getProductID(String instrID) {
        if (instrID == null)
            return null;
        var m = productPattern.matcher(instrID);
        if (m.find())
            return m.group();
        else
            return null;
    }
}
