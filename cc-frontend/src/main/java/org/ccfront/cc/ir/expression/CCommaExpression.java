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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** <code>x, y, z</code> */
public final class CCommaExpression extends CExpression {
    public final List<CExpression> list;

    public CCommaExpression(SourcePositionRange position, List<CExpression> list) {
        super(position, CExprOp.COMMA, CExprOp.Shape.COMMA);
        this.list = Collections.unmodifiableList(new ArrayList<>(list));
        if (list.size() < 2)
            this.error("Comma expression with " + list.size() + " operands");
    }

    public CCommaExpression(CExpression... list) {
        this(SourcePositionRange.INVALID, List.of(list));
    }

    @Override
    public List<ICNode> getChildren() {
        List<ICNode> result = children();
        addAll(result, this.list);
        return result;
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("list");
        int index = 0;
        for (CExpression expr: this.list) {
            if (expr != null) {
                visitor.propertyIndex(index);
                expr.accept(visitor);
            }
            index++;
        }
        visitor.endArrayProperty("list");
        visitor.pop(this);
        visitor.postorder(this);
    }
}
