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

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;

/** A floating-point constant such as <code>1.5e-3f</code>. */
public final class CRealLiteral extends CLiteral {
    public CRealLiteral(SourcePositionRange position, String text) {
        super(position, text);
    }

    public CRealLiteral(String text) {
        this(SourcePositionRange.INVALID, text);
    }

    /** True for <code>float</code> constants, i.e. with an <code>f</code> suffix. */
    public boolean isFloat() {
        return !this.isHex() && (this.text.endsWith("f") || this.text.endsWith("F"));
    }

    boolean isHex() {
        return this.text.startsWith("0x") || this.text.startsWith("0X");
    }

    public double getValue() {
        String digits = this.text;
        if (digits.endsWith("l") || digits.endsWith("L") || this.isFloat())
            digits = digits.substring(0, digits.length() - 1);
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException ex) {
            throw new InternalCompilerError("Malformed floating-point constant " + this.text, this);
        }
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }
}
