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

package org.ccfront.syntax.codec;

import org.ccfront.syntax.ast.IJsonEnum;
import org.ccfront.syntax.ast.ISyntax;
import org.ccfront.util.IndentStreamBuilder;
import org.ccfront.util.JsonStream;
import org.ccfront.util.Logger;
import org.ccfront.util.IWritesLogs;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Serializes a syntax tree as JSON.  Each node becomes an object starting
 * with its <code>kind</code> and <code>id</code>, followed by its fields.
 * A node that has already been written in the same document is written as
 * <code>{"node": id}</code>, so shared subtrees survive a round trip.
 */
public class SyntaxEncoder implements IWritesLogs {
    public final JsonStream stream;
    final Set<Long> serialized;

    public SyntaxEncoder(JsonStream stream) {
        this.stream = stream;
        this.serialized = new HashSet<>();
    }

    public static String encode(ISyntax node) {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        JsonStream stream = new JsonStream(builder);
        SyntaxEncoder encoder = new SyntaxEncoder(stream);
        encoder.node(node);
        return builder.toString();
    }

    /** Write a node as a JSON value. */
    public void node(ISyntax node) {
        if (this.serialized.contains(node.getId())) {
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Reference to ")
                    .append(node.getKind())
                    .append("#")
                    .append(node.getId())
                    .newline();
            this.stream.beginObject()
                    .label("node")
                    .append(node.getId())
                    .endObject();
            return;
        }
        this.serialized.add(node.getId());
        this.stream.beginObject()
                .label("kind")
                .append(node.getKind())
                .label("id")
                .append(node.getId());
        node.encodeFields(this);
        this.stream.endObject();
    }

    public SyntaxEncoder field(String label, String value) {
        this.stream.label(label).append(value);
        return this;
    }

    public SyntaxEncoder field(String label, long value) {
        this.stream.label(label).append(value);
        return this;
    }

    public SyntaxEncoder field(String label, IJsonEnum value) {
        this.stream.label(label).append(value.getJsonName());
        return this;
    }

    public SyntaxEncoder field(String label, ISyntax value) {
        this.stream.label(label);
        this.node(value);
        return this;
    }

    public SyntaxEncoder field(String label, List<? extends ISyntax> values) {
        this.stream.label(label).beginArray();
        for (ISyntax value: values)
            this.node(value);
        this.stream.endArray();
        return this;
    }
}
