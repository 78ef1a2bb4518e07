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

package org.ccfront.cc.compiler.backend;

import org.ccfront.util.Utilities;

/** Options controlling how {@link ToCVisitor} lays out C text. */
public final class CRenderOptions {
    /** If true, comments attached to nodes are not printed. */
    public final boolean hideComments;
    /** Spaces per nesting level; 0 prints everything on a single line. */
    public final int indentAmount;
    /** Print <code>a + b</code> instead of <code>a+b</code>. */
    public final boolean spacesAroundBinaryOperators;

    /** Used by <code>toString()</code> on nodes. */
    public static final CRenderOptions DEBUG = new CRenderOptions(true, 4, true);
    public static final CRenderOptions DEFAULT = new CRenderOptions(false, 4, true);
    /** Single line, minimal spacing. */
    public static final CRenderOptions COMPACT = new CRenderOptions(true, 0, false);

    public CRenderOptions(boolean hideComments, int indentAmount, boolean spacesAroundBinaryOperators) {
        Utilities.enforce(indentAmount >= 0, "Negative indent amount");
        this.hideComments = hideComments;
        this.indentAmount = indentAmount;
        this.spacesAroundBinaryOperators = spacesAroundBinaryOperators;
    }

    public CRenderOptions withHideComments(boolean hideComments) {
        return new CRenderOptions(hideComments, this.indentAmount, this.spacesAroundBinaryOperators);
    }

    public CRenderOptions withIndentAmount(int indentAmount) {
        return new CRenderOptions(this.hideComments, indentAmount, this.spacesAroundBinaryOperators);
    }

    @Override
    public String toString() {
        return "CRenderOptions{" +
                "hideComments=" + this.hideComments +
                ", indentAmount=" + this.indentAmount +
                ", spacesAroundBinaryOperators=" + this.spacesAroundBinaryOperators +
                '}';
    }
}
