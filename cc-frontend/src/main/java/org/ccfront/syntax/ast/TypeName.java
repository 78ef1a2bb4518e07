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
import org.ccfront.util.Utilities;

import java.util.Collections;
import java.util.List;

/** A type as written in a cast: a name followed by zero or more <code>*</code>. */
public final class TypeName extends SyntaxNode {
    public final String name;
    public final int pointers;

    public TypeName(String name, int pointers) {
        Utilities.enforce(pointers >= 0, "Negative pointer count");
        Utilities.enforce(!name.isEmpty(), "Empty type name");
        this.name = name;
        this.pointers = pointers;
    }

    public TypeName(String name) {
        this(name, 0);
    }

    @Override
    public List<ISyntax> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public void encodeFields(SyntaxEncoder encoder) {
        encoder.field("name", this.name)
                .field("pointers", this.pointers);
    }

    @SuppressWarnings("unused")
    public static TypeName fromJson(JsonNode node, SyntaxDecoder decoder) throws FormatError {
        String name = SyntaxDecoder.stringProperty(node, "name");
        int pointers = SyntaxDecoder.intProperty(node, "pointers");
        return new TypeName(name, pointers);
    }

    @Override
    public boolean equivalent(ISyntax other) {
        TypeName o = other.as(TypeName.class);
        return o != null && this.name.equals(o.name) && this.pointers == o.pointers;
    }

    @Override
    public String toString() {
        if (this.pointers == 0)
            return this.name;
        return this.name + " " + "*".repeat(this.pointers);
    }
}
