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

public final class AssignExpr extends SyntaxExpr {
    public final AssignOp op;
    public final SyntaxExpr lhs;
    public final SyntaxExpr rhs;

    public AssignExpr(AssignOp op, SyntaxExpr lhs, SyntaxExpr rhs) {
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public List<ISyntax> getChildren() {
        return List.of(this.lhs, this.rhs);
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("op", this.op)
                .field("lhs", this.lhs)
                .field("rhs", this.rhs);
    }

    @SuppressWarnings("unused")
    public static AssignExpr fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        AssignOp op = SyntaxDecoder.enumProperty(node, "op", AssignOp.class);
        SyntaxExpr lhs = decoder.child(node, "lhs", SyntaxExpr.class);
        SyntaxExpr rhs = decoder.child(node, "rhs", SyntaxExpr.class);
        return new AssignExpr(op, lhs, rhs);
    }

    @Override
    public boolean equivalent(ISyntax other) {
        AssignExpr o = other.as(AssignExpr.class);
        return o != null && this.op == o.op && this.lhs.equivalent(o.lhs) && this.rhs.equivalent(o.rhs);
    }

    @Override
    public String toString() {
        return this.lhs + " " + this.op.text + " " + this.rhs;
    }
}
