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

import java.util.List;

/** <code>condition ? positive : negative</code>.  All three operands are required. */
public final class CConditionalExpression extends CExpression {
    public final CExpression condition;
    public final CExpression positive;
    public final CExpression negative;

    public CConditionalExpression(SourcePositionRange position, CExpression condition,
                                  CExpression positive, CExpression negative) {
        super(position, CExprOp.COND, CExprOp.Shape.COND);
        this.condition = this.checkNull(condition);
        this.positive = this.checkNull(positive);
        this.negative = this.checkNull(negative);
    }

    public CConditionalExpression(CExpression condition, CExpression positive, CExpression negative) {
        this(SourcePositionRange.INVALID, condition, positive, negative);
    }

    @Override
    public List<ICNode> getChildren() {
        return children(this.condition, this.positive, this.negative);
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("condition");
        this.condition.accept(visitor);
        visitor.property("positive");
        this.positive.accept(visitor);
        visitor.property("negative");
        this.negative.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }
}
