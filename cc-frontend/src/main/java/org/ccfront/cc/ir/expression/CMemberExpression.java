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
import org.ccfront.cc.ir.literal.CSymbolLiteral;

import java.util.List;

/** <code>left.member</code> or <code>left-&gt;member</code>. */
public final class CMemberExpression extends CExpression {
    public final CExpression left;
    public final CSymbolLiteral member;

    public CMemberExpression(SourcePositionRange position, CExprOp op, CExpression left, CSymbolLiteral member) {
        super(position, op, CExprOp.Shape.MEMBER);
        this.left = left;
        this.member = member;
    }

    public CMemberExpression(CExprOp op, CExpression left, String member) {
        this(SourcePositionRange.INVALID, op, left, new CSymbolLiteral(member));
    }

    public String getMemberName() {
        return this.member.getName();
    }

    /** The member name is payload, not a child. */
    @Override
    public List<ICNode> getChildren() {
        return children(this.left);
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("left");
        this.left.accept(visitor);
        visitor.property("member");
        this.member.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }
}
