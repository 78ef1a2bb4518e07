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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class CallExpr extends SyntaxExpr {
    public final SyntaxExpr fun;
    public final List<SyntaxExpr> args;

    public CallExpr(SyntaxExpr fun, List<SyntaxExpr> args) {
        this.fun = fun;
        this.args = List.copyOf(args);
    }

    @Override
    public List<ISyntax> getChildren() {
        List<ISyntax> result = new ArrayList<>();
        result.add(this.fun);
        result.addAll(this.args);
        return result;
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("fun", this.fun)
                .field("args", this.args);
    }

    @SuppressWarnings("unused")
    public static CallExpr fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        SyntaxExpr fun = decoder.child(node, "fun", SyntaxExpr.class);
        List<SyntaxExpr> args = decoder.children(node, "args", SyntaxExpr.class);
        return new CallExpr(fun, args);
    }

    @Override
    public boolean equivalent(ISyntax other) {
        CallExpr o = other.as(CallExpr.class);
        return o != null && this.fun.equivalent(o.fun) && ISyntax.equivalent(this.args, o.args);
    }

    @Override
    public String toString() {
        return this.fun + "(" + this.args.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
