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

package org.ccfront.cc.ir.statement;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.CNode;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.literal.CSymbolLiteral;

import javax.annotation.Nullable;
import java.util.List;

/** A label attached to a statement. */
public final class CLabel extends CNode {
    public final CLabelKind kind;
    @Nullable
    public final CSymbolLiteral name;
    @Nullable
    public final CExpression expr;

    public CLabel(SourcePositionRange position, CLabelKind kind,
                  @Nullable CSymbolLiteral name, @Nullable CExpression expr) {
        super(position);
        this.kind = kind;
        this.name = name;
        this.expr = expr;
        switch (kind) {
            case CASE:
                if (expr == null || name != null)
                    this.error("case label needs an expression");
                break;
            case DEFAULT:
                if (expr != null || name != null)
                    this.error("default label takes no operands");
                break;
            case NAME:
                if (name == null || expr != null)
                    this.error("Named label needs a name");
                break;
        }
    }

    public static CLabel caseLabel(CExpression expr) {
        return new CLabel(SourcePositionRange.INVALID, CLabelKind.CASE, null, expr);
    }

    public static CLabel defaultLabel() {
        return new CLabel(SourcePositionRange.INVALID, CLabelKind.DEFAULT, null, null);
    }

    public static CLabel named(String name) {
        return new CLabel(SourcePositionRange.INVALID, CLabelKind.NAME, new CSymbolLiteral(name), null);
    }

    @Override
    public List<ICNode> getChildren() {
        return children(this.name, this.expr);
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.name != null) {
            visitor.property("name");
            this.name.accept(visitor);
        }
        if (this.expr != null) {
            visitor.property("expr");
            this.expr.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }
}
