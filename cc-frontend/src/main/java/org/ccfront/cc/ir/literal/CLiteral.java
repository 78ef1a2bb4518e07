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

package org.ccfront.cc.ir.literal;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.ir.CNode;
import org.ccfront.cc.ir.ICNode;

import java.util.Collections;
import java.util.List;

/** A leaf of the syntax graph holding a piece of source text.
 * The text is kept exactly as spelled in the source, so rendering a literal
 * always reproduces it. */
public abstract class CLiteral extends CNode {
    public final String text;

    protected CLiteral(SourcePositionRange position, String text) {
        super(position);
        this.text = text;
    }

    public String getText() {
        return this.text;
    }

    @Override
    public List<ICNode> getChildren() {
        return Collections.emptyList();
    }

    /** True if both literals have the same class and spelling. */
    public boolean sameText(CLiteral other) {
        return this.getClass() == other.getClass() && this.text.equals(other.text);
    }
}
