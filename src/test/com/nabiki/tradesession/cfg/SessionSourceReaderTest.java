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

import org.junit.Assert;
import org.junit.Test;

import java.time.LocalTime;
import java.util.HashMap;
import java.util.Locale;

public class SessionSourceReaderTest {
    static final String AG_JSON = "ag,SHFE,\"[{\"\"Begin\"\":\"\"09:00:00\"\",\"\"End\"\":\"\"10:15:00\"\"},"
            + "{\"\"Begin\"\":\"\"10:30:00\"\",\"\"End\"\":\"\"11:30:00\"\"},"
            + "{\"\"Begin\"\":\"\"13:30:00\"\",\"\"End\"\":\"\"15:00:00\"\"},"
            + "{\"\"Begin\"\":\"\"21:00:00\"\",\"\"End\"\":\"\"02:30:00\"\"}]\"";

    @Test
    public void numeric() throws SessionSourceException {
        var rows = SessionSourceReader.read(
                "product,slices\n"
                + "IF,9,30,11,30,13,0,15,0\n"
                + "\n"
                + "# bond futures\n"
                + "T, 9, 30, 11, 30, 13, 0, 15, 15\n");

        Assert.assertEquals(2, rows.size());
        var r = rows.get(0);
        Assert.assertEquals("IF", r.productID);
        Assert.assertNull(r.exchangeID);
        Assert.assertEquals(2, r.line);
        Assert.assertEquals(2, r.slices.size());
        Assert.assertEquals(LocalTime.of(9, 30), r.slices.get(0).from);
        Assert.assertEquals(LocalTime.of(15, 0), r.slices.get(1).to);

        r = rows.get(1);
        Assert.assertEquals("T", r.productID);
        Assert.assertEquals(5, r.line);
        Assert.assertEquals(LocalTime.of(15, 15), r.slices.get(1).to);
    }

    @Test
    public void json() throws SessionSourceException {
        var rows = SessionSourceReader.read(AG_JSON + "\r\n"
                + "rb,\"[{\"\"begin\"\":\"\"21:00\"\",\"\"END\"\":\"\"23:00\"\"}]\"\r\n"
                + "xx,[]\r\n");

        Assert.assertEquals(3, rows.size());
        var ag = rows.get(0);
        Assert.assertEquals("ag", ag.productID);
        Assert.assertEquals("SHFE", ag.exchangeID);
        Assert.assertEquals(4, ag.slices.size());
        Assert.assertEquals(LocalTime.of(21, 0), ag.slices.get(3).from);
        Assert.assertEquals(LocalTime.of(2, 30), ag.slices.get(3).to);

        var rb = rows.get(1);
        Assert.assertNull(rb.exchangeID);
        Assert.assertEquals(1, rb.slices.size());
        Assert.assertEquals(LocalTime.of(23, 0), rb.slices.get(0).to);

        Assert.assertTrue(rows.get(2).slices.isEmpty());
    }

    @Test
    public void bom() throws SessionSourceException {
        var rows = SessionSourceReader.read("\uFEFFProduct_Code,x\nag,9,0,10,0\n");
        Assert.assertEquals(1, rows.size());
        Assert.assertEquals("ag", rows.get(0).productID);
    }

    @Test
    public void headerLocale() throws SessionSourceException {
        var saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            var rows = SessionSourceReader.read("PRODUCT_ID,SLICES\nag,9,0,10,0\n");
            Assert.assertEquals(1, rows.size());
            Assert.assertEquals("ag", rows.get(0).productID);
            Assert.assertEquals(2, rows.get(0).line);
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void jsonMap() throws SessionSourceException {
        var m = new HashMap<String, String>();
        m.put("ru", "[{\"Begin\":\"21:00:00\",\"End\":\"23:00:00\"}]");
        m.put("IF", "[{\"Begin\":\"09:30:00\",\"End\":\"11:30:00\"}]");

        var rows = SessionSourceReader.fromJsonMap(m);
        Assert.assertEquals(2, rows.size());
        Assert.assertEquals("IF", rows.get(0).productID);
        Assert.assertEquals("ru", rows.get(1).productID);
        Assert.assertEquals(LocalTime.of(21, 0), rows.get(1).slices.get(0).from);
    }

    @Test
    public void bad() {
        String[] bad = new String[] {
                "ag",
                "ag,9,0,10",
                "ag,9,0,10,0,13",
                "ag,9,x,10,0",
                "ag,25,0,26,0",
                "ag,9,0,10,60",
                ",9,0,10,0",
                "ag,[{oops",
                "ag,\"[{\"\"Begin\"\":\"\"09:00:00\"\"}]\"",
                "ag,\"[{\"\"Begin\"\":\"\"9h\"\",\"\"End\"\":\"\"10:00\"\"}]\"",
                "ag,\"[null]\"",
                "ag,\"9,0,10,0"
        };
        for (var s : bad) {
            try {
                SessionSourceReader.read("product\nrb,21,0,23,0\n" + s + "\n");
                Assert.fail("`" + s + "` should be malformed");
            } catch (SessionSourceException e) {
                Assert.assertEquals(s, 3, e.getLine());
                System.out.println(e.getMessage());
            }
        }
    }

    @Test
    public void cells() throws SessionSourceException {
        var cells = SessionSourceReader.splitCells("a,\"b,c\",\"d\"\"e\",", 1);
        Assert.assertEquals(4, cells.size());
        Assert.assertEquals("a", cells.get(0));
        Assert.assertEquals("b,c", cells.get(1));
        Assert.assertEquals("d\"e", cells.get(2));
        Assert.assertEquals("", cells.get(3));
    }
}
