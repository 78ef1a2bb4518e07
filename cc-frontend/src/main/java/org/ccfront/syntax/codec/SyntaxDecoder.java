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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.syntax.ast.IJsonEnum;
import org.ccfront.syntax.ast.ISyntax;
import org.ccfront.syntax.ast.SyntaxNode;
import org.ccfront.util.IWritesLogs;
import org.ccfront.util.Logger;
import org.ccfront.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rebuilds syntax trees from the JSON written by {@link SyntaxEncoder}.
 *
 * <p>The <code>kind</code> of each object names a class in the
 * <code>org.ccfront.syntax.ast</code> package, whose static
 * <code>fromJson(JsonNode, SyntaxDecoder)</code> method builds the node.
 * Decoded nodes get fresh ids; objects of the form <code>{"node": id}</code>
 * resolve to the node decoded earlier in the same document with that original id.
 */
public class SyntaxDecoder implements IWritesLogs {
    static final String ROOT = "org.ccfront.syntax.ast";
    static final Pattern KIND = Pattern.compile("[A-Za-z]+");

    final ObjectMapper mapper;
    /** Maps ids in the document to the nodes decoded for them. */
    final Map<Long, ISyntax> decoded;

    public SyntaxDecoder() {
        this.mapper = Utilities.deterministicObjectMapper();
        this.decoded = new HashMap<>();
    }

    /** Decode a complete document. */
    public ISyntax decode(String json) throws FormatError {
        JsonNode root;
        try {
            root = this.mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new FormatError("Malformed JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode())
            throw new FormatError("Empty document");
        this.decoded.clear();
        return this.decode(root);
    }

    public <T extends ISyntax> T decode(String json, Class<T> clazz) throws FormatError {
        return checkClass(this.decode(json), clazz);
    }

    static <T extends ISyntax> T checkClass(ISyntax node, Class<T> clazz) throws FormatError {
        if (!clazz.isInstance(node))
            throw new FormatError("Expected " + clazz.getSimpleName() + ", found " + node.getKind());
        return clazz.cast(node);
    }

    static Class<? extends SyntaxNode> getClass(String kind) throws FormatError {
        if (!KIND.matcher(kind).matches())
            throw new FormatError("Unknown kind " + Utilities.singleQuote(kind));
        Class<?> clazz;
        try {
            clazz = Class.forName(ROOT + "." + kind);
        } catch (ClassNotFoundException ex) {
            throw new FormatError("Unknown kind " + Utilities.singleQuote(kind), ex);
        }
        if (!SyntaxNode.class.isAssignableFrom(clazz) || Modifier.isAbstract(clazz.getModifiers()))
            throw new FormatError("Unknown kind " + Utilities.singleQuote(kind));
        return clazz.asSubclass(SyntaxNode.class);
    }

    /** Decode a node nested in a document. */
    public ISyntax decode(JsonNode node) throws FormatError {
        if (!node.isObject())
            throw new FormatError("Expected a JSON object, found " + Utilities.toDepth(node, 1));
        JsonNode reference = node.get("node");
        if (reference != null) {
            if (!reference.isIntegralNumber())
                throw new FormatError("Node reference is not an integer: " + Utilities.toDepth(node, 1));
            ISyntax result = this.decoded.get(reference.asLong());
            if (result == null)
                throw new FormatError("Reference to unknown node " + reference.asLong());
            return result;
        }
        String kind = stringProperty(node, "kind");
        long originalId = longProperty(node, "id");
        if (this.decoded.containsKey(originalId))
            throw new FormatError("Duplicate node id " + originalId);
        Class<? extends SyntaxNode> clazz = getClass(kind);
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Decoding ")
                .append(kind)
                .append("#")
                .append(originalId)
                .newline();
        ISyntax result;
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, SyntaxDecoder.class);
            if (!Modifier.isStatic(method.getModifiers()) || method.getDeclaringClass() != clazz)
                throw new InternalCompilerError(kind + " does not declare a static fromJson method");
            result = (ISyntax) method.invoke(null, node, this);
        } catch (NoSuchMethodException | IllegalAccessException ex) {
            throw new InternalCompilerError("Cannot decode " + kind + ": " + ex.getMessage());
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof FormatError)
                throw (FormatError) cause;
            if (cause instanceof RuntimeException)
                throw new FormatError("Invalid " + kind + ": " + cause.getMessage(), cause);
            if (cause instanceof Error)
                throw (Error) cause;
            throw new InternalCompilerError("Cannot decode " + kind + ": " + cause);
        }
        // Children are decoded first and may have claimed the id
        if (this.decoded.containsKey(originalId))
            throw new FormatError("Duplicate node id " + originalId);
        this.decoded.put(originalId, result);
        return result;
    }

    /////////////////// Helpers for fromJson methods

    public static JsonNode property(JsonNode node, String property) throws FormatError {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            throw new FormatError("Node does not have property " + Utilities.singleQuote(property) +
                    " " + Utilities.toDepth(node, 1));
        return prop;
    }

    public static String stringProperty(JsonNode node, String property) throws FormatError {
        JsonNode prop = property(node, property);
        if (!prop.isTextual())
            throw new FormatError("Property " + Utilities.singleQuote(property) + " is not a string");
        return prop.asText();
    }

    public static long longProperty(JsonNode node, String property) throws FormatError {
        JsonNode prop = property(node, property);
        if (!prop.isIntegralNumber() || !prop.canConvertToLong())
            throw new FormatError("Property " + Utilities.singleQuote(property) + " is not an integer");
        return prop.asLong();
    }

    public static int intProperty(JsonNode node, String property) throws FormatError {
        JsonNode prop = property(node, property);
        if (!prop.isIntegralNumber() || !prop.canConvertToInt())
            throw new FormatError("Property " + Utilities.singleQuote(property) + " is not an integer");
        return prop.asInt();
    }

    public static <E extends Enum<E> & IJsonEnum> E enumProperty(
            JsonNode node, String property, Class<E> clazz) throws FormatError {
        String name = stringProperty(node, property);
        for (E value: clazz.getEnumConstants())
            if (value.getJsonName().equals(name))
                return value;
        throw new FormatError("Unknown " + clazz.getSimpleName() + " " + Utilities.singleQuote(name));
    }

    /** Decode the node stored in a property. */
    public <T extends ISyntax> T child(JsonNode node, String property, Class<T> clazz) throws FormatError {
        return checkClass(this.decode(property(node, property)), clazz);
    }

    public <T extends ISyntax> List<T> children(JsonNode node, String property, Class<T> clazz) throws FormatError {
        JsonNode prop = property(node, property);
        if (!prop.isArray())
            throw new FormatError("Property " + Utilities.singleQuote(property) + " is not an array");
        List<T> result = new ArrayList<>(prop.size());
        for (JsonNode element: prop)
            result.add(checkClass(this.decode(element), clazz));
        return result;
    }
}
