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

package org.ccfront.syntax.ast;

import com.fasterxml.jackson.databind.JsonNode;
import org.ccfront.syntax.codec.FormatError;
import org.ccfront.syntax.codec.SyntaxDecoder;
import org.ccfront.syntax.codec.SyntaxEncoder;

import java.util.List;

/** <code>(type) expr</code>.  Also carries an assignment operator, kept for
 * casts that appear as the target of a compound assignment. */
public final class CastExpr extends SyntaxExpr {
    public final AssignOp op;
    public final TypeName type;
    public final SyntaxExpr expr;

    public CastExpr(AssignOp op, TypeName type, SyntaxExpr expr) {
        this.op = op;
        this.type = type;
        this.expr = expr;
    }

    @Override
    public List<ISyntax> getChildren() {
        return List.of(this.type, this.expr);
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("op", this.op)
                .field("type", this.type)
                .field("expr", this.expr);
    }

    @SuppressWarnings("unused")
    public static CastExpr fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        AssignOp op = SyntaxDecoder.enumProperty(node, "op", AssignOp.class);
        TypeName type = decoder.child(node, "type", TypeName.class);
        SyntaxExpr expr = decoder.child(node, "expr", SyntaxExpr.class);
        return new CastExpr(op, type, expr);
    }

    @Override
    public boolean equivalent(ISyntax other) {
        CastExpr o = other.as(CastExpr.class);
        return o != null && this.op == o.op && this.type.equivalent(o.type) && this.expr.equivalent(o.expr);
    }

    @Override
    public String toString() {
        return "(" + this.type + ") " + this.expr;
    }
}
