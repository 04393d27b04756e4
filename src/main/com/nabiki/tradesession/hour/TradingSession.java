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
import java.util.*;

/**
 * Trading hours of one product in a trading day.
 *
 * <p>A session is built by adding slices with {@code addSlice(...)} and then
 * calling {@link #seal()}. Sealing sorts the slices and merges the ones that
 * overlap or touch, producing an ascending marker array where each pair
 * {@code (markers[2i], markers[2i + 1])} is the open and close of one slice
 * {@code [open, close)}. Markers are seconds in the shifted clock of
 * {@link ShiftedTime}.
 * </p>
 *
 * <p><b>Instance of the class is thread-safe after sealed.</b> Before that it
 * must stay with the thread building it. Queries on an unsealed session throw
 * {@link IllegalStateException}.</p>
 */
public class TradingSession {
    /**
     * Single trading slice, {@code [begin, end)} in wall-clock duration since
     * midnight.
     */
    public static class Slice {
        private final int begin, end;

        Slice(int begin, int end) {
            this.begin = begin;
            this.end = end;
        }

        public Duration getBegin() {
            return ShiftedTime.nominal(this.begin);
        }

        public Duration getEnd() {
            return ShiftedTime.nominal(this.end);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Slice))
                return false;
            var s = (Slice) o;
            return this.begin == s.begin && this.end == s.end;
        }

        @Override
        public int hashCode() {
            return 31 * this.begin + this.end;
        }

        @Override
        public String toString() {
            return ShiftedTime.format(this.begin) + "-" + ShiftedTime.format(this.end);
        }
    }

    private static final int[] EMPTY = new int[0];
    private static final Duration DEFAULT_BEGIN = Duration.ofHours(9);
    private static final Duration DEFAULT_END = Duration.ofHours(15);

    // Shifted (begin, end) pairs waiting for seal.
    private final List<int[]> pending = new LinkedList<>();
    private volatile int[] markers;

    public TradingSession() {
    }

    /**
     * Add a slice with wall-clock hours and minutes. A slice may cross midnight if
     * it starts after {@link ShiftedTime#TRADING_DAY_START}, such as 21:00 to
     * 02:30.
     *
     * @param startHour start hour
     * @param startMinute start minute
     * @param endHour end hour
     * @param endMinute end minute
     * @return this session
     * @throws InvalidSliceException if the time is out of range or the end is not
     * after the start in trading-day order
     * @throws IllegalStateException if the session is sealed
     */
    public TradingSession addSlice(int startHour, int startMinute, int endHour,
                                   int endMinute) {
        return addShifted(ShiftedTime.shift(startHour, startMinute),
                ShiftedTime.shift(endHour, endMinute));
    }

    /**
     * Add a slice with wall-clock times. Fractions of a second are dropped.
     *
     * @param begin slice start
     * @param end slice end
     * @return this session
     * @throws InvalidSliceException if the end is not after the start in
     * trading-day order
     * @throws IllegalStateException if the session is sealed
     */
    public TradingSession addSlice(LocalTime begin, LocalTime end) {
        return addShifted(ShiftedTime.shift(begin), ShiftedTime.shift(end));
    }

    private TradingSession addShifted(int begin, int end) {
        if (isSealed())
            throw new IllegalStateException("session sealed");
        if (end <= begin)
            throw new InvalidSliceException(String.format(
                    "slice end must be after begin, got %s-%s",
                    ShiftedTime.format(begin), ShiftedTime.format(end)));
        this.pending.add(new int[] {begin, end});
        return this;
    }

    /**
     * Sort and merge all added slices into canonical markers. The session is
     * immutable afterwards. Sealing a sealed session does nothing.
     *
     * @return this session
     */
    public TradingSession seal() {
        if (isSealed())
            return this;
        var slices = new ArrayList<>(this.pending);
        slices.sort(Comparator.comparingInt((int[] s) -> s[0]));
        var merged = new int[slices.size() * 2];
        var n = 0;
        for (var s : slices) {
            // Overlapping or adjacent, extend the last slice.
            if (n > 0 && s[0] <= merged[n - 1]) {
                merged[n - 1] = Math.max(merged[n - 1], s[1]);
            } else {
                merged[n++] = s[0];
                merged[n++] = s[1];
            }
        }
        this.pending.clear();
        this.markers = Arrays.copyOf(merged, n);
        return this;
    }

    public boolean isSealed() {
        return this.markers != null;
    }

    /**
     * Get a copy of the canonical markers, strictly ascending and of even length.
     * The array can be passed to {@link #fromMarkers(int...)} to rebuild an equal
     * session.
     *
     * @return shifted markers in seconds
     */
    public int[] getMarkers() {
        return sealed().clone();
    }

    /**
     * Get slices in trading-day order.
     *
     * @return list of slices
     */
    public List<Slice> getSlices() {
        var m = sealed();
        var r = new ArrayList<Slice>(m.length / 2);
        for (int i = 0; i < m.length; i += 2)
            r.add(new Slice(m[i], m[i + 1]));
        return Collections.unmodifiableList(r);
    }

    /**
     * Get shifted minute indexes covered by this session. A minute is covered if
     * any part of it is in a slice.
     *
     * @return sorted minute indexes, each in {@code [0, 1440)}
     */
    public SortedSet<Integer> getMinutes() {
        var m = sealed();
        var r = new TreeSet<Integer>();
        for (int i = 0; i < m.length; i += 2) {
            var to = (m[i + 1] + 59) / 60;
            for (int minute = m[i] / 60; minute < to; ++minute)
                r.add(minute);
        }
        return r;
    }

    /**
     * Start of the trading day, usually the call auction before the first slice,
     * such as 21:00 for products with a night leg.
     *
     * @return duration since midnight
     */
    public Duration getDayBegin() {
        var m = sealed();
        if (m.length == 0)
            return DEFAULT_BEGIN;
        return ShiftedTime.nominal(m[0]);
    }

    /**
     * End of the trading day, the close of the last slice.
     *
     * @return duration since midnight
     */
    public Duration getDayEnd() {
        var m = sealed();
        if (m.length == 0)
            return DEFAULT_END;
        return ShiftedTime.nominal(m[m.length - 1]);
    }

    /**
     * Start of the day leg, the first slice opening at or after
     * {@link ShiftedTime#MORNING_THRESHOLD}. A slice opening after midnight that
     * spans the threshold is part of the day leg, and its open is the morning
     * begin. If there is no such slice, it is the same as {@link #getDayBegin()}.
     *
     * @return duration since midnight
     */
    public Duration getMorningBegin() {
        var m = sealed();
        var pos = lowerBound(m,
                ShiftedTime.shift(ShiftedTime.MORNING_THRESHOLD) * ShiftedTime.NANOS_IN_SECOND);
        if (pos % 2 == 1) {
            // Threshold falls inside a slice.
            if (m[pos - 1] >= ShiftedTime.shift(LocalTime.MIDNIGHT))
                return ShiftedTime.nominal(m[pos - 1]);
            ++pos;
        }
        if (pos >= m.length)
            return getDayBegin();
        return ShiftedTime.nominal(m[pos]);
    }

    /**
     * Check if this session has a leg opening before midnight.
     *
     * @return {@code true} if there is night trading
     */
    public boolean hasNight() {
        var m = sealed();
        return m.length > 0 && m[0] < ShiftedTime.shift(LocalTime.MIDNIGHT);
    }

    /**
     * Check if the specified time is in session, including the begin of a slice
     * but not the end.
     *
     * @param now wall-clock time
     * @return {@code true} if in session
     */
    public boolean inSession(LocalTime now) {
        return inSession(now, true, false);
    }

    /**
     * Check if the specified time is in session.
     *
     * @param now wall-clock time
     * @param includeBegin whether the open of a slice counts as in session
     * @param includeEnd whether the close of a slice counts as in session
     * @return {@code true} if in session
     */
    public boolean inSession(LocalTime now, boolean includeBegin, boolean includeEnd) {
        Objects.requireNonNull(now, "local time null");
        return inSession(now.toNanoOfDay(), includeBegin, includeEnd);
    }

    /**
     * Check if the specified nanoseconds since midnight is in session.
     *
     * @param nanosOfDay nanoseconds since midnight
     * @param includeBegin whether the open of a slice counts as in session
     * @param includeEnd whether the close of a slice counts as in session
     * @return {@code true} if in session
     */
    public boolean inSession(long nanosOfDay, boolean includeBegin, boolean includeEnd) {
        var m = sealed();
        var t = ShiftedTime.shiftNanos(nanosOfDay);
        var pos = upperBound(m, t);
        if (pos % 2 == 1)
            return includeBegin || nanos(m[pos - 1]) != t;
        else
            return includeEnd && pos > 0 && nanos(m[pos - 1]) == t;
    }

    /**
     * Check if any time in {@code [start, end]} is in session.
     *
     * @param start interval start
     * @param end interval end
     * @param includeBeginEnd whether touching a slice exactly at its open or close
     *                        counts as overlap
     * @return {@code true} if the interval intersects a slice
     */
    public boolean anyInSession(LocalTime start, LocalTime end, boolean includeBeginEnd) {
        Objects.requireNonNull(start, "local time start null");
        Objects.requireNonNull(end, "local time end null");
        return anyInSession(start.toNanoOfDay(), end.toNanoOfDay(), includeBeginEnd);
    }

    /**
     * Check if any time between the two nanoseconds since midnight is in session.
     *
     * @param startNanos interval start
     * @param endNanos interval end
     * @param includeBeginEnd whether touching a slice exactly at its open or close
     *                        counts as overlap
     * @return {@code true} if the interval intersects a slice
     */
    public boolean anyInSession(long startNanos, long endNanos, boolean includeBeginEnd) {
        var m = sealed();
        var start = ShiftedTime.shiftNanos(startNanos);
        var end = ShiftedTime.shiftNanos(endNanos);
        // First slice closing at or after start, it has the earliest open of all
        // slices that can intersect.
        var pos = includeBeginEnd ? lowerBound(m, start) : upperBound(m, start);
        var open = pos - pos % 2;
        if (open >= m.length)
            return false;
        if (includeBeginEnd)
            return nanos(m[open]) <= end;
        else
            return nanos(m[open]) < end;
    }

    /**
     * Check if the specified local time is between two trading days, when the
     * market is closed.
     *
     * @param now local time now
     * @return {@code true} if now is end of the previous trading day, {@code false}
     * otherwise
     */
    public boolean isEndDay(LocalTime now) {
        var m = sealed();
        if (m.length == 0)
            return true;    // no trading hour so it's always end-of-day
        if (inSession(now, true, true))
            return false;
        var t = ShiftedTime.shiftNanos(now);
        return t < nanos(m[0]) || t > nanos(m[m.length - 1]);
    }

    /**
     * Render slices in trading-day order, like {@code 21:00-02:30, 09:00-10:15}.
     *
     * @return readable slices
     */
    public String render() {
        var s = new StringJoiner(", ");
        for (var slice : getSlices())
            s.add(slice.toString());
        return s.toString();
    }

    private int[] sealed() {
        var m = this.markers;
        if (m == null)
            throw new IllegalStateException("session not sealed");
        return m;
    }

    private static long nanos(int marker) {
        return marker * ShiftedTime.NANOS_IN_SECOND;
    }

    // First index whose marker is after t.
    private static int upperBound(int[] m, long t) {
        int lo = 0, hi = m.length;
        while (lo < hi) {
            var mid = (lo + hi) >>> 1;
            if (nanos(m[mid]) <= t)
                lo = mid + 1;
            else
                hi = mid;
        }
        return lo;
    }

    // First index whose marker is at or after t.
    private static int lowerBound(int[] m, long t) {
        int lo = 0, hi = m.length;
        while (lo < hi) {
            var mid = (lo + hi) >>> 1;
            if (nanos(m[mid]) < t)
                lo = mid + 1;
            else
                hi = mid;
        }
        return lo;
    }

    /**
     * Sealed sessions are equal if they have the same markers. An unsealed session
     * is only equal to itself.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TradingSession))
            return false;
        var a = this.markers;
        var b = ((TradingSession) o).markers;
        return a != null && b != null && Arrays.equals(a, b);
    }

    @Override
    public int hashCode() {
        var m = this.markers;
        return m != null ? Arrays.hashCode(m) : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        if (!isSealed())
            return "TradingSession[open, " + this.pending.size() + " slices]";
        return String.format("day_begin:%s, morning_begin:%s, day_end:%s, slices:[%s]",
                format(getDayBegin()), format(getMorningBegin()), format(getDayEnd()),
                render());
    }

    private static String format(Duration du) {
        return String.format("%02d:%02d", du.toHours(), du.toMinutesPart());
    }

    /**
     * Rebuild a sealed session from markers returned by {@link #getMarkers()}.
     *
     * @param markers shifted markers in seconds
     * @return sealed session
     * @throws InvalidSliceException if markers are of odd length, not strictly
     * ascending or out of the trading day
     */
    public static TradingSession fromMarkers(int... markers) {
        Objects.requireNonNull(markers, "markers null");
        if (markers.length % 2 != 0)
            throw new InvalidSliceException("odd number of markers: " + markers.length);
        for (int i = 0; i < markers.length; ++i) {
            if (markers[i] < 0 || markers[i] > ShiftedTime.SECONDS_IN_DAY)
                throw new InvalidSliceException("marker out of range: " + markers[i]);
            if (i > 0 && markers[i] <= markers[i - 1])
                throw new InvalidSliceException("markers not ascending at " + i);
        }
        var s = new TradingSession();
        s.markers = markers.length == 0 ? EMPTY : markers.clone();
        return s;
    }

    /**
     * Build a sealed session from shifted minute indexes. Consecutive minutes make
     * one slice.
     *
     * @param minutes minute indexes in {@code [0, 1440)}
     * @return sealed session
     * @throws InvalidSliceException if a minute is out of range
     */
    public static TradingSession fromMinutes(Collection<Integer> minutes) {
        Objects.requireNonNull(minutes, "minutes null");
        var limit = ShiftedTime.SECONDS_IN_DAY / 60;
        var s = new TradingSession();
        for (var minute : minutes) {
            if (minute == null || minute < 0 || minute >= limit)
                throw new InvalidSliceException("minute out of range: " + minute);
            s.addShifted(minute * 60, minute * 60 + 60);
        }
        return s.seal();
    }

    /**
     * Build a sealed session covering every slice of the specified sessions.
     *
     * @param sessions sealed sessions
     * @return sealed union
     */
    public static TradingSession union(TradingSession... sessions) {
        var s = new TradingSession();
        for (var session : sessions) {
            var m = session.sealed();
            for (int i = 0; i < m.length; i += 2)
                s.addShifted(m[i], m[i + 1]);
        }
        return s.seal();
    }

    /**
     * Stock session, 09:30-11:30 and 13:00-15:00.
     *
     * @return sealed session
     */
    public static TradingSession newStockSession() {
        return new TradingSession()
                .addSlice(9, 30, 11, 30)
                .addSlice(13, 0, 15, 0)
                .seal();
    }

    /**
     * Stock index futures session, currently the same as stocks.
     *
     * @return sealed session
     */
    public static TradingSession newStockIndexSession() {
        return newStockSession();
    }

    /**
     * Treasury bond futures session, 15 minutes longer in the afternoon than stock
     * index futures.
     *
     * @return sealed session
     */
    public static TradingSession newBondSession() {
        return new TradingSession()
                .addSlice(9, 30, 11, 30)
                .addSlice(13, 0, 15, 15)
                .seal();
    }

    /**
     * Commodity futures session without night trading.
     *
     * @return sealed session
     */
    public static TradingSession newCommoditySession() {
        return new TradingSession()
                .addSlice(9, 0, 10, 15)
                .addSlice(10, 30, 11, 30)
                .addSlice(13, 30, 15, 0)
                .seal();
    }

    /**
     * Commodity futures session with night trading from 21:00 to 02:30.
     *
     * @return sealed session
     */
    public static TradingSession newCommodityNightSession() {
        return new TradingSession()
                .addSlice(21, 0, 2, 30)
                .addSlice(9, 0, 10, 15)
                .addSlice(10, 30, 11, 30)
                .addSlice(13, 30, 15, 0)
                .seal();
    }

    /**
     * Session covering all of commodity, stock index, bond and stock trading,
     * night included.
     *
     * @return sealed session
     */
    public static TradingSession newFullSession() {
        return new TradingSession()
                .addSlice(21, 0, 2, 30)
                .addSlice(9, 0, 11, 30)
                .addSlice(13, 0, 15, 15)
                .seal();
    }
}
