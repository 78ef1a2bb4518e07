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

/** A literal token; the value keeps its source spelling, quotes included. */
public final class BasicLit extends SyntaxExpr {
    public final LitKind litKind;
    public final String value;

    public BasicLit(LitKind litKind, String value) {
        this.litKind = litKind;
        this.value = value;
    }

    @Override
    public List<ISyntax> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("litKind", this.litKind)
                .field("value", this.value);
    }

    @SuppressWarnings("unused")
    public static BasicLit fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        LitKind litKind = SyntaxDecoder.enumProperty(node, "litKind", LitKind.class);
        String value = SyntaxDecoder.stringProperty(node, "value");
        return new BasicLit(litKind, value);
    }

    @Override
    public boolean equivalent(ISyntax other) {
        BasicLit o = other.as(BasicLit.class);
        return o != null && this.litKind == o.litKind && this.value.equals(o.value);
    }

    @Override
    public String toString() {
        return this.value;
    }
}
