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

import java.math.BigInteger;
import java.util.Locale;

/** An integer constant, e.g. <code>0x1fUL</code>.
 * The spelling is preserved; the numeric value is decoded on demand. */
public final class CIntegerLiteral extends CLiteral {
    public CIntegerLiteral(SourcePositionRange position, String text) {
        super(position, text);
        if (text.isEmpty() || !Character.isDigit(text.charAt(0)))
            this.error("Not an integer constant: " + text);
    }

    public CIntegerLiteral(String text) {
        this(SourcePositionRange.INVALID, text);
    }

    public CIntegerLiteral(long value) {
        this(SourcePositionRange.INVALID, Long.toString(value));
    }

    /** The suffix (<code>u</code>, <code>l</code>, <code>ll</code> in any combination), lowercased. */
    public String getSuffix() {
        int end = this.text.length();
        while (end > 0 && "uUlL".indexOf(this.text.charAt(end - 1)) >= 0)
            end--;
        return this.text.substring(end).toLowerCase(Locale.ROOT);
    }

    public boolean isUnsigned() {
        return this.getSuffix().contains("u");
    }

    public BigInteger getValue() {
        String digits = this.text.substring(0, this.text.length() - this.getSuffix().length());
        digits = digits.replace("'", "");
        int radix = 10;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.startsWith("0b") || digits.startsWith("0B")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
            digits = digits.substring(1);
        }
        try {
            return new BigInteger(digits, radix);
        } catch (NumberFormatException ex) {
            throw new InternalCompilerError("Malformed integer constant " + this.text, this);
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
