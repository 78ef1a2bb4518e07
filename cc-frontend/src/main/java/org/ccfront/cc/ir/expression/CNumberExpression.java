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

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.literal.CCharLiteral;
import org.ccfront.cc.ir.literal.CIntegerLiteral;
import org.ccfront.cc.ir.literal.CLiteral;
import org.ccfront.cc.ir.literal.CRealLiteral;

import java.util.Collections;
import java.util.List;

/** A constant.  NUMBER holds integer and floating-point constants;
 * LITERAL holds any other single-token constant, such as a character. */
public final class CNumberExpression extends CExpression {
    public final CLiteral text;

    public CNumberExpression(SourcePositionRange position, CExprOp op, CLiteral text) {
        super(position, op, CExprOp.Shape.NUMBER);
        this.text = text;
        if (op == CExprOp.NUMBER && !(text instanceof CIntegerLiteral) && !(text instanceof CRealLiteral))
            this.error("Not a numeric constant: " + text.getText());
    }

    public CNumberExpression(CLiteral text) {
        this(SourcePositionRange.INVALID,
                (text instanceof CIntegerLiteral || text instanceof CRealLiteral) ? CExprOp.NUMBER : CExprOp.LITERAL,
                text);
    }

    public CNumberExpression(long value) {
        this(new CIntegerLiteral(value));
    }

    public static CNumberExpression character(char c) {
        return new CNumberExpression(CCharLiteral.of(c));
    }

    @Override
    public List<ICNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("text");
        this.text.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }
}
