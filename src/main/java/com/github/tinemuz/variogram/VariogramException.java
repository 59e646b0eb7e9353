/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
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
package com.github.tinemuz.variogram;

/**
 * Failure raised while building a lattice or a variogram.
 *
 * <p>Every failure carries a {@link Kind} so callers can branch on the cause
 * without inspecting the message. Errors are raised at the point of
 * detection, before any partial result exists.</p>
 */
public class VariogramException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** Stable failure categories. */
    public enum Kind {
        /** Missing, malformed or too few coordinates or values. */
        INVALID_INPUT,
        /** Two observations share one spatial location. */
        DUPLICATE_LOCATION,
        /** An axis has no distinct value at all. */
        EMPTY_AXIS,
        /** An observed value does not land on the filled axis sequence. */
        IRREGULAR_SPACING
    }

    private final Kind kind;

    public VariogramException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static VariogramException invalidInput(String message) {
        return new VariogramException(Kind.INVALID_INPUT, message);
    }
}
