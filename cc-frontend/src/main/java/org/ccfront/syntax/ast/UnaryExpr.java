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

public final class UnaryExpr extends SyntaxExpr {
    public final UnaryOp op;
    public final SyntaxExpr x;

    public UnaryExpr(UnaryOp op, SyntaxExpr x) {
        this.op = op;
        this.x = x;
    }

    @Override
    public List<ISyntax> getChildren() {
        return List.of(this.x);
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("op", this.op)
                .field("x", this.x);
    }

    @SuppressWarnings("unused")
    public static UnaryExpr fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        UnaryOp op = SyntaxDecoder.enumProperty(node, "op", UnaryOp.class);
        SyntaxExpr x = decoder.child(node, "x", SyntaxExpr.class);
        return new UnaryExpr(op, x);
    }

    @Override
    public boolean equivalent(ISyntax other) {
        UnaryExpr o = other.as(UnaryExpr.class);
        return o != null && this.op == o.op && this.x.equivalent(o.x);
    }

    @Override
    public String toString() {
        return this.op.text + this.x;
    }
}
