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

package org.ccfront.cc.ir;

import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.literal.CSymbolLiteral;

import javax.annotation.Nullable;
import java.util.List;

/** One designator in a designated initializer: <code>.field</code> or <code>[index]</code>. */
public final class CPrefix extends CNode {
    @Nullable
    public final CSymbolLiteral dot;
    @Nullable
    public final CExpression index;

    /** Member designated by {@link #dot}; filled by name resolution. */
    @Nullable
    private CDeclaration declaration;

    public CPrefix(SourcePositionRange position, @Nullable CSymbolLiteral dot, @Nullable CExpression index) {
        super(position);
        this.dot = dot;
        this.index = index;
        if ((dot == null) == (index == null))
            this.error("Designator must have exactly one of a member name or an index");
    }

    public static CPrefix dot(String field) {
        return new CPrefix(SourcePositionRange.INVALID, new CSymbolLiteral(field), null);
    }

    public static CPrefix index(CExpression index) {
        return new CPrefix(SourcePositionRange.INVALID, null, index);
    }

    @Nullable
    public CDeclaration getDeclaration() {
        return this.declaration;
    }

    public void setDeclaration(CDeclaration declaration) {
        if (this.dot == null)
            this.error("Index designators do not name a member");
        this.declaration = declaration;
    }

    /** The member name is payload; only an index expression is a child. */
    @Override
    public List<ICNode> getChildren() {
        return children(this.index);
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.dot != null) {
            visitor.property("dot");
            this.dot.accept(visitor);
        }
        if (this.index != null) {
            visitor.property("index");
            this.index.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }
}
