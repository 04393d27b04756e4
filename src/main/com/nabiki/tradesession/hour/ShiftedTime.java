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

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Clock normalizer for trading days that start the evening before.
 *
 * <p>A trading day starts at {@link #TRADING_DAY_START} of the previous calendar
 * day, so a night leg starting at 21:00 and ending at 02:30 sorts before the day
 * leg starting at 09:00. Every wall-clock value is moved forward by
 * {@link #SHIFT_SECONDS} and reduced modulo one day, which maps the trading day
 * onto {@code [0, 86400)} seconds with plain integer ordering.
 * </p>
 *
 * <p>Markers are kept in seconds. Query times are compared in nanoseconds so
 * sub-second values before or after a boundary are told apart.</p>
 */
public final class ShiftedTime {
    public static final int SECONDS_IN_DAY = (int) TimeUnit.DAYS.toSeconds(1);
    public static final long NANOS_IN_SECOND = TimeUnit.SECONDS.toNanos(1);
    public static final long NANOS_IN_DAY = TimeUnit.DAYS.toNanos(1);

    /**
     * Wall-clock time at which a new trading day begins. The earliest supported
     * night session opens at 21:00, after this point.
     */
    public static final LocalTime TRADING_DAY_START = LocalTime.of(20, 0);

    /**
     * Offset added to every raw second-of-day, moving {@link #TRADING_DAY_START}
     * onto zero.
     */
    public static final int SHIFT_SECONDS
            = SECONDS_IN_DAY - TRADING_DAY_START.toSecondOfDay();

    /**
     * Slices opening at or after this wall-clock time belong to the day leg.
     */
    public static final LocalTime MORNING_THRESHOLD = LocalTime.of(6, 0);

    private ShiftedTime() {
    }

    /**
     * Shift the specified hour and minute into the trading-day space.
     *
     * @param hour hour of day, 0 to 23
     * @param minute minute of hour, 0 to 59
     * @return shifted seconds
     * @throws InvalidSliceException if hour or minute is out of range
     */
    public static int shift(int hour, int minute) {
        return shift(hour, minute, 0);
    }

    /**
     * Shift the specified hour, minute and second into the trading-day space.
     *
     * @param hour hour of day, 0 to 23
     * @param minute minute of hour, 0 to 59
     * @param second second of minute, 0 to 59
     * @return shifted seconds
     * @throws InvalidSliceException if any field is out of range
     */
    public static int shift(int hour, int minute, int second) {
        if (hour < 0 || hour > 23)
            throw new InvalidSliceException("hour out of range: " + hour);
        if (minute < 0 || minute > 59)
            throw new InvalidSliceException("minute out of range: " + minute);
        if (second < 0 || second > 59)
            throw new InvalidSliceException("second out of range: " + second);
        return shiftSeconds(hour * 3600 + minute * 60 + second);
    }

    /**
     * Shift the specified local time, dropping any fraction of a second.
     *
     * @param time wall-clock time
     * @return shifted seconds
     */
    public static int shift(LocalTime time) {
        Objects.requireNonNull(time, "local time null");
        return shiftSeconds(time.toSecondOfDay());
    }

    static int shiftSeconds(int secondOfDay) {
        return (secondOfDay + SHIFT_SECONDS) % SECONDS_IN_DAY;
    }

    /**
     * Shift nanoseconds since midnight into the trading-day space. Values of one
     * day or more wrap around, so 24:00 is midnight.
     *
     * @param nanosOfDay nanoseconds since midnight, not negative
     * @return shifted nanoseconds
     */
    public static long shiftNanos(long nanosOfDay) {
        if (nanosOfDay < 0)
            throw new IllegalArgumentException("negative nanos of day: " + nanosOfDay);
        return (nanosOfDay % NANOS_IN_DAY + SHIFT_SECONDS * NANOS_IN_SECOND)
                % NANOS_IN_DAY;
    }

    /**
     * Shift a local time into the trading-day space, keeping nanoseconds.
     *
     * @param time wall-clock time
     * @return shifted nanoseconds
     */
    public static long shiftNanos(LocalTime time) {
        Objects.requireNonNull(time, "local time null");
        return shiftNanos(time.toNanoOfDay());
    }

    /**
     * Convert a shifted marker back to duration since midnight of the wall clock.
     *
     * @param shifted shifted seconds
     * @return nominal duration since midnight, less than one day
     */
    public static Duration nominal(int shifted) {
        var secs = ((shifted - SHIFT_SECONDS) % SECONDS_IN_DAY + SECONDS_IN_DAY)
                % SECONDS_IN_DAY;
        return Duration.ofSeconds(secs);
    }

    /**
     * Convert a shifted marker back to wall-clock time.
     *
     * @param shifted shifted seconds
     * @return wall-clock time
     */
    public static LocalTime nominalTime(int shifted) {
        return LocalTime.ofSecondOfDay(nominal(shifted).getSeconds());
    }

    /**
     * Format a shifted marker as {@code HH:mm}, or {@code HH:mm:ss} if it carries
     * seconds.
     *
     * @param shifted shifted seconds
     * @return wall-clock string
     */
    public static String format(int shifted) {
        var secs = nominal(shifted).getSeconds();
        if (secs % 60 == 0)
            return String.format("%02d:%02d", secs / 3600, secs % 3600 / 60);
        else
            return String.format("%02d:%02d:%02d", secs / 3600, secs % 3600 / 60,
                    secs % 60);
    }
}
