/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
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

package org.ccfront.cc.ir.expression;

/** Binding strength of C operators; a larger number binds tighter. */
public final class CPrecedence {
    private CPrecedence() {}

    public static final int LOWEST = 0;
    public static final int COMMA = 1;
    public static final int ASSIGN = 2;
    public static final int COND = 3;
    public static final int OR_OR = 4;
    public static final int AND_AND = 5;
    public static final int OR = 6;
    public static final int XOR = 7;
    public static final int AND = 8;
    public static final int EQUALITY = 9;
    public static final int RELATIONAL = 10;
    public static final int SHIFT = 11;
    public static final int ADDITIVE = 12;
    public static final int MULTIPLICATIVE = 13;
    /** Prefix operators, casts, sizeof. */
    public static final int UNARY = 14;
    /** Calls, indexing, member access, postfix increment, compound literals. */
    public static final int POSTFIX = 15;
    /** Names, constants and anything already delimited. */
    public static final int PRIMARY = 16;
}
