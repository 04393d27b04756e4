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

package com.nabiki.tradesession.hour;

import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.LocalTime;

public class ShiftedTimeTest {
    @Test
    public void shift() {
        Assert.assertEquals(4 * 3600, ShiftedTime.SHIFT_SECONDS);
        Assert.assertEquals(0, ShiftedTime.shift(20, 0));
        Assert.assertEquals(3600, ShiftedTime.shift(21, 0));
        Assert.assertEquals(4 * 3600, ShiftedTime.shift(0, 0));
        Assert.assertEquals(6 * 3600 + 1800, ShiftedTime.shift(2, 30));
        Assert.assertEquals(13 * 3600, ShiftedTime.shift(9, 0));
        Assert.assertEquals(19 * 3600, ShiftedTime.shift(15, 0));
        Assert.assertEquals(86399, ShiftedTime.shift(19, 59, 59));
        Assert.assertEquals(ShiftedTime.shift(21, 30),
                ShiftedTime.shift(LocalTime.of(21, 30)));
    }

    @Test
    public void order() {
        // Night leg sorts before the day leg, after midnight too.
        Assert.assertTrue(ShiftedTime.shift(21, 0) < ShiftedTime.shift(23, 59));
        Assert.assertTrue(ShiftedTime.shift(23, 59) < ShiftedTime.shift(0, 0));
        Assert.assertTrue(ShiftedTime.shift(2, 30) < ShiftedTime.shift(9, 0));
        Assert.assertTrue(ShiftedTime.shift(9, 0) < ShiftedTime.shift(15, 15));
    }

    @Test
    public void nominal() {
        for (int h = 0; h < 24; ++h)
            for (int m = 0; m < 60; ++m)
                Assert.assertEquals(h + ":" + m + " should round trip",
                        Duration.ofHours(h).plusMinutes(m),
                        ShiftedTime.nominal(ShiftedTime.shift(h, m)));
        Assert.assertEquals(Duration.ofHours(20),
                ShiftedTime.nominal(ShiftedTime.SECONDS_IN_DAY));
        Assert.assertEquals(LocalTime.of(2, 30),
                ShiftedTime.nominalTime(ShiftedTime.shift(2, 30)));
    }

    @Test
    public void nanos() {
        var nine = Duration.ofHours(9).toNanos();
        Assert.assertEquals(13 * 3600 * ShiftedTime.NANOS_IN_SECOND,
                ShiftedTime.shiftNanos(nine));
        Assert.assertEquals(ShiftedTime.shiftNanos(nine) + 1,
                ShiftedTime.shiftNanos(nine + 1));
        // 24:00 wraps to midnight.
        Assert.assertEquals(ShiftedTime.shiftNanos(0),
                ShiftedTime.shiftNanos(ShiftedTime.NANOS_IN_DAY));
        Assert.assertEquals(ShiftedTime.shiftNanos(nine),
                ShiftedTime.shiftNanos(LocalTime.of(9, 0)));
    }

    @Test
    public void format() {
        Assert.assertEquals("21:00", ShiftedTime.format(ShiftedTime.shift(21, 0)));
        Assert.assertEquals("02:30", ShiftedTime.format(ShiftedTime.shift(2, 30)));
        Assert.assertEquals("09:00:30", ShiftedTime.format(ShiftedTime.shift(9, 0, 30)));
    }

    @Test
    public void bad() {
        int[][] bad = new int[][] {
                {24, 0}, {-1, 0}, {9, 60}, {9, -1}
        };
        for (var b : bad) {
            try {
                ShiftedTime.shift(b[0], b[1]);
                Assert.fail(b[0] + ":" + b[1] + " should be out of range");
            } catch (InvalidSliceException e) {
                System.out.println(e.getMessage());
            }
        }
        try {
            ShiftedTime.shift(9, 0, 60);
            Assert.fail("second 60 should be out of range");
        } catch (InvalidSliceException e) {
            System.out.println(e.getMessage());
        }
        try {
            ShiftedTime.shiftNanos(-1);
            Assert.fail("negative nanos should fail");
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
        }
    }
}
