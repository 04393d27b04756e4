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

import com.nabiki.tradesession.cfg.plain.SessionConfig;
import com.nabiki.tradesession.hour.InvalidSliceException;
import com.nabiki.tradesession.hour.TradingSession;
import com.nabiki.tradesession.tools.OP;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Product ID to trading session mapping.
 *
 * <p>The mapping is an immutable snapshot. A load builds the new snapshot aside
 * and replaces the old one in a single step, so readers see either the mapping
 * before the load or after it, never something between. If any row fails, the
 * snapshot is not touched.
 * </p>
 *
 * <p><b>Instance of the class is thread-safe.</b> Reads don't lock. Loads are
 * serialized.</p>
 */
public class SessionRegistry {
    private static final Logger logger
            = Logger.getLogger(SessionRegistry.class.getCanonicalName());

    private final AtomicReference<Map<String, TradingSession>> sessions
            = new AtomicReference<>(Collections.emptyMap());
    private final Object writer = new Object();

    public SessionRegistry() {
    }

    /**
     * Create registry with the specified sessions.
     *
     * @param sessions product ID to sealed session
     * @throws IllegalArgumentException if a session is not sealed
     */
    public SessionRegistry(Map<String, TradingSession> sessions) {
        Objects.requireNonNull(sessions, "sessions null");
        var m = new HashMap<String, TradingSession>();
        for (var e : sessions.entrySet())
            m.put(Objects.requireNonNull(e.getKey(), "product null"),
                    requireSealed(e.getValue()));
        this.sessions.set(Collections.unmodifiableMap(m));
    }

    /**
     * Create registry from the specified CSV file.
     *
     * @param file CSV file
     * @return registry
     * @throws SessionSourceException if the file can't be read or a row is
     * malformed
     */
    public static SessionRegistry fromFile(Path file) throws SessionSourceException {
        var r = new SessionRegistry();
        r.loadFile(file, false);
        return r;
    }

    /**
     * Create registry from the specified CSV content.
     *
     * @param content CSV content
     * @return registry
     * @throws SessionSourceException if a row is malformed
     */
    public static SessionRegistry fromContent(String content)
            throws SessionSourceException {
        var r = new SessionRegistry();
        r.loadContent(content, false);
        return r;
    }

    /**
     * Get session of the specified product. Product IDs are case sensitive.
     *
     * @param product product ID
     * @return session, or empty if the product is unknown
     */
    public Optional<TradingSession> get(String product) {
        if (product == null)
            return Optional.empty();
        return Optional.ofNullable(this.sessions.get().get(product));
    }

    /**
     * Get session of the product that the specified instrument belongs to, such as
     * {@code ag} for {@code ag2412}.
     *
     * @param instrID instrument ID
     * @return session, or empty if the product is unknown
     */
    public Optional<TradingSession> getByInstrument(String instrID) {
        return get(OP.getProductID(instrID));
    }

    public boolean contains(String product) {
        return product != null && this.sessions.get().containsKey(product);
    }

    /**
     * Get number of registered products.
     *
     * @return number of products
     */
    public int count() {
        return this.sessions.get().size();
    }

    /**
     * Get all registered product IDs.
     *
     * @return sorted product IDs
     */
    public List<String> keys() {
        return Collections.unmodifiableList(
                new ArrayList<>(new TreeSet<>(this.sessions.get().keySet())));
    }

    /**
     * Get current mapping. The returned map doesn't change with later loads.
     *
     * @return unmodifiable map of product ID to session
     */
    public Map<String, TradingSession> snapshot() {
        return this.sessions.get();
    }

    public Optional<Duration> dayBegin(String product) {
        return get(product).map(TradingSession::getDayBegin);
    }

    public Optional<Duration> dayEnd(String product) {
        return get(product).map(TradingSession::getDayEnd);
    }

    public Optional<Duration> morningBegin(String product) {
        return get(product).map(TradingSession::getMorningBegin);
    }

    /**
     * Check if the specified time is in session of the product.
     *
     * @param product product ID
     * @param now wall-clock time
     * @param includeBegin whether the open of a slice counts as in session
     * @param includeEnd whether the close of a slice counts as in session
     * @return in session or not, empty if the product is unknown
     */
    public Optional<Boolean> inSession(String product, LocalTime now,
                                       boolean includeBegin, boolean includeEnd) {
        return get(product).map(s -> s.inSession(now, includeBegin, includeEnd));
    }

    /**
     * Check if any time in {@code [start, end]} is in session of the product.
     *
     * @param product product ID
     * @param start interval start
     * @param end interval end
     * @param includeBeginEnd whether touching a slice boundary counts
     * @return overlapped or not, empty if the product is unknown
     */
    public Optional<Boolean> anyInSession(String product, LocalTime start,
                                          LocalTime end, boolean includeBeginEnd) {
        return get(product).map(s -> s.anyInSession(start, end, includeBeginEnd));
    }

    /**
     * Set session of a single product, replacing the old one.
     *
     * @param product product ID
     * @param session sealed session
     * @throws IllegalArgumentException if the session is not sealed
     */
    public void put(String product, TradingSession session) {
        Objects.requireNonNull(product, "product null");
        requireSealed(session);
        synchronized (this.writer) {
            var shadow = new HashMap<>(this.sessions.get());
            shadow.put(product, session);
            this.sessions.set(Collections.unmodifiableMap(shadow));
        }
    }

    /**
     * Load rows, merging them into current sessions.
     *
     * @param rows session rows
     * @throws SessionSourceException if any row is invalid
     * @see #load(List, boolean)
     */
    public void load(List<SessionConfig> rows) throws SessionSourceException {
        load(rows, true);
    }

    /**
     * Load rows into the registry. Every row is built into a sealed session first.
     * If {@code merge} is {@code false}, the loaded sessions replace the whole
     * mapping. Otherwise products not in the rows are kept and products in the
     * rows get the new session, replacing the old one as a whole. If a product
     * shows up more than once, the last row wins.
     *
     * <p>The registry stays unchanged if any row fails.</p>
     *
     * @param rows session rows
     * @param merge keep products not in the rows
     * @throws SessionSourceException if any row is invalid
     */
    public void load(List<SessionConfig> rows, boolean merge)
            throws SessionSourceException {
        Objects.requireNonNull(rows, "rows null");
        try {
            commit(build(rows), merge);
        } catch (SessionSourceException e) {
            logger.warning(OP.formatLog("failed session load", null,
                    e.getMessage(), null));
            throw e;
        }
    }

    public void loadFile(Path file) throws SessionSourceException {
        loadFile(file, true);
    }

    /**
     * Read the specified CSV file and load its rows.
     *
     * @param file CSV file
     * @param merge keep products not in the file
     * @throws SessionSourceException if the file can't be read or a row is
     * malformed
     * @see #load(List, boolean)
     */
    public void loadFile(Path file, boolean merge) throws SessionSourceException {
        List<SessionConfig> rows;
        try {
            rows = SessionSourceReader.read(file);
        } catch (SessionSourceException e) {
            logger.warning(OP.formatLog("failed session file", null,
                    e.getMessage(), null));
            throw e;
        }
        load(rows, merge);
    }

    public void loadContent(String content) throws SessionSourceException {
        loadContent(content, true);
    }

    /**
     * Parse the specified CSV content and load its rows.
     *
     * @param content CSV content
     * @param merge keep products not in the content
     * @throws SessionSourceException if a row is malformed
     * @see #load(List, boolean)
     */
    public void loadContent(String content, boolean merge)
            throws SessionSourceException {
        List<SessionConfig> rows;
        try {
            rows = SessionSourceReader.read(content);
        } catch (SessionSourceException e) {
            logger.warning(OP.formatLog("failed session content", null,
                    e.getMessage(), null));
            throw e;
        }
        load(rows, merge);
    }

    private void commit(Map<String, TradingSession> loaded, boolean merge) {
        int total;
        synchronized (this.writer) {
            var shadow = merge ? new HashMap<>(this.sessions.get())
                    : new HashMap<String, TradingSession>();
            shadow.putAll(loaded);
            this.sessions.set(Collections.unmodifiableMap(shadow));
            total = shadow.size();
        }
        logger.info(OP.formatLog("loaded sessions", null,
                String.format("%d loaded, merge %s, %d total", loaded.size(), merge, total),
                null));
    }

    private static Map<String, TradingSession> build(List<SessionConfig> rows)
            throws SessionSourceException {
        var loaded = new HashMap<String, TradingSession>();
        for (var row : rows) {
            if (row == null)
                throw new SessionSourceException("row null");
            loaded.put(row.productID, build(row));
        }
        return loaded;
    }

    /**
     * Build a sealed session from the specified row.
     *
     * @param row session row
     * @return sealed session
     * @throws SessionSourceException if the row has no product or a slice is
     * invalid
     */
    public static TradingSession build(SessionConfig row) throws SessionSourceException {
        Objects.requireNonNull(row, "row null");
        if (row.productID == null || row.productID.trim().isEmpty())
            throw new SessionSourceException(row.line, "product null");
        if (row.slices == null)
            throw new SessionSourceException(row.line,
                    "slices null for product " + row.productID);
        var session = new TradingSession();
        for (var slice : row.slices) {
            if (slice == null || slice.from == null || slice.to == null)
                throw new SessionSourceException(row.line,
                        "slice null for product " + row.productID);
            try {
                session.addSlice(slice.from, slice.to);
            } catch (InvalidSliceException e) {
                throw new SessionSourceException(row.line,
                        "product " + row.productID + ": " + e.getMessage(), e);
            }
        }
        return session.seal();
    }

    private static TradingSession requireSealed(TradingSession session) {
        Objects.requireNonNull(session, "session null");
        if (!session.isSealed())
            throw new IllegalArgumentException("session not sealed");
        return session;
    }
}
