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
import org.ccfront.cc.ir.type.CType;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 * An initializer: either a single expression or a braced list of
 * initializers.  Elements of a braced list may be designated by a
 * sequence of prefixes, as in <code>{ .pos[1] = 3 }</code>.
 */
public final class CInitializer extends CNode {
    public final List<CPrefix> prefixes;
    @Nullable
    public final CExpression expr;
    @Nullable
    public final List<CInitializer> braced;

    @Nullable
    private CType inferredType;

    public CInitializer(SourcePositionRange position, List<CPrefix> prefixes,
                        @Nullable CExpression expr, @Nullable List<CInitializer> braced) {
        super(position);
        this.prefixes = List.copyOf(prefixes);
        this.expr = expr;
        this.braced = braced == null ? null : Collections.unmodifiableList(braced);
        if ((expr == null) == (braced == null))
            this.error("Initializer must be either an expression or a braced list");
    }

    public CInitializer(CExpression expr) {
        this(SourcePositionRange.INVALID, Collections.emptyList(), expr, null);
    }

    public CInitializer(List<CInitializer> braced) {
        this(SourcePositionRange.INVALID, Collections.emptyList(), null, braced);
    }

    public static CInitializer braced(CInitializer... elements) {
        return new CInitializer(List.of(elements));
    }

    public static CInitializer braced(CExpression... elements) {
        CInitializer[] inits = new CInitializer[elements.length];
        for (int i = 0; i < elements.length; i++)
            inits[i] = new CInitializer(elements[i]);
        return braced(inits);
    }

    /** The same initializer preceded by designators. */
    public CInitializer designated(CPrefix... prefixes) {
        return new CInitializer(this.position, List.of(prefixes), this.expr, this.braced);
    }

    public boolean isBraced() {
        return this.braced != null;
    }

    @Nullable
    public CType getInferredType() {
        return this.inferredType;
    }

    public void setInferredType(CType type) {
        this.inferredType = type;
    }

    @Override
    public List<ICNode> getChildren() {
        List<ICNode> result = children();
        addAll(result, this.prefixes);
        if (this.expr != null)
            result.add(this.expr);
        if (this.braced != null)
            addAll(result, this.braced);
        return result;
    }

    @Override
    public void accept(CInnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("prefixes");
        int index = 0;
        for (CPrefix prefix: this.prefixes) {
            visitor.propertyIndex(index);
            prefix.accept(visitor);
            index++;
        }
        visitor.endArrayProperty("prefixes");
        if (this.expr != null) {
            visitor.property("expr");
            this.expr.accept(visitor);
        }
        if (this.braced != null) {
            visitor.startArrayProperty("braced");
            index = 0;
            for (CInitializer init: this.braced) {
                visitor.propertyIndex(index);
                init.accept(visitor);
                index++;
            }
            visitor.endArrayProperty("braced");
        }
        visitor.pop(this);
        visitor.postorder(this);
    }
}
