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

import java.io.IOException;

/**
 * Session source can't be read, or one of its rows is malformed. The registry is
 * left unchanged when a load fails with this exception.
 */
public class SessionSourceException extends IOException {
    private static final long serialVersionUID = 1L;

    private final int line;

    public SessionSourceException(String msg) {
        this(0, msg, null);
    }

    public SessionSourceException(String msg, Throwable cause) {
        this(0, msg, cause);
    }

    public SessionSourceException(int line, String msg) {
        this(line, msg, null);
    }

    public SessionSourceException(int line, String msg, Throwable cause) {
        super(line > 0 ? "line " + line + ": " + msg : msg, cause);
        this.line = line;
    }

    /**
     * Get line number of the failed row in the source.
     *
     * @return line number, or 0 if the failure isn't tied to a line
     */
    public int getLine() {
        return this.line;
    }
}
