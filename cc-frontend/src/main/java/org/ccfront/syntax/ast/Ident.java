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

import java.util.Collections;
import java.util.List;

/** An identifier. */
public final class Ident extends SyntaxExpr {
    public final String name;

    public Ident(String name) {
        this.name = name;
    }

    @Override
    public List<ISyntax> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("name", this.name);
    }

    @SuppressWarnings("unused")
    public static Ident fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        return new Ident(SyntaxDecoder.stringProperty(node, "name"));
    }

    @Override
    public boolean equivalent(ISyntax other) {
        Ident o = other.as(Ident.class);
        return o != null && this.name.equals(o.name);
    }

    @Override
    public String toString() {
        return this.name;
    }
}
