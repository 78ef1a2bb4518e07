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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ccfront.syntax.ast.AssignExpr;
import org.ccfront.syntax.ast.AssignOp;
import org.ccfront.syntax.ast.BasicLit;
import org.ccfront.syntax.ast.BinaryExpr;
import org.ccfront.syntax.ast.BinaryOp;
import org.ccfront.syntax.ast.CallExpr;
import org.ccfront.syntax.ast.CastExpr;
import org.ccfront.syntax.ast.ISyntax;
import org.ccfront.syntax.ast.Ident;
import org.ccfront.syntax.ast.LitKind;
import org.ccfront.syntax.ast.ParenExpr;
import org.ccfront.syntax.ast.SyntaxExpr;
import org.ccfront.syntax.ast.TypeName;
import org.ccfront.syntax.ast.UnaryExpr;
import org.ccfront.syntax.ast.UnaryOp;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class SyntaxCodecTests {
    static ISyntax roundTrip(ISyntax node) throws FormatError {
        String json = SyntaxEncoder.encode(node);
        ISyntax result = new SyntaxDecoder().decode(json);
        Assert.assertTrue(json, node.equivalent(result));
        Assert.assertEquals(node.getKind(), result.getKind());
        return result;
    }

    static void assertFormatError(String json, String messagePart) {
        FormatError error = Assert.assertThrows(FormatError.class, () -> new SyntaxDecoder().decode(json));
        Assert.assertTrue(error.getMessage(), error.getMessage().contains(messagePart));
    }

    @Test
    public void testCastRoundTrip() throws Exception {
        CastExpr cast = new CastExpr(AssignOp.EQ, new TypeName("float"), new Ident("x"));
        Assert.assertEquals("CastExpr", cast.getKind());
        Assert.assertEquals("(float) x", cast.toString());

        String json = SyntaxEncoder.encode(cast);
        JsonNode tree = new ObjectMapper().readTree(json);
        Assert.assertEquals("CastExpr", tree.get("kind").asText());
        Assert.assertEquals(cast.getId(), tree.get("id").asLong());
        Assert.assertEquals("Eq", tree.get("op").asText());
        Assert.assertEquals("TypeName", tree.get("type").get("kind").asText());
        Assert.assertEquals("float", tree.get("type").get("name").asText());
        Assert.assertEquals("Ident", tree.get("expr").get("kind").asText());

        CastExpr decoded = new SyntaxDecoder().decode(json, CastExpr.class);
        Assert.assertEquals(AssignOp.EQ, decoded.op);
        Assert.assertEquals("float", decoded.type.name);
        Assert.assertEquals("x", decoded.expr.to(Ident.class).name);
        Assert.assertNotEquals(cast.getId(), decoded.getId());
        Assert.assertEquals(List.of(decoded.type, decoded.expr), decoded.getChildren());
    }

    @Test
    public void testEveryKindRoundTrips() throws FormatError {
        SyntaxExpr call = new CallExpr(new Ident("f"), List.of(
                new BasicLit(LitKind.INT, "0x10"),
                new BasicLit(LitKind.STRING, "\"a\\\"b\""),
                new ParenExpr(new UnaryExpr(UnaryOp.MINUS, new Ident("y")))));
        SyntaxExpr expr = new AssignExpr(AssignOp.ADD_EQ, new Ident("a"),
                new BinaryExpr(BinaryOp.MUL, call,
                        new CastExpr(AssignOp.EQ, new TypeName("char", 2), new BasicLit(LitKind.CHAR, "'\\n'"))));
        ISyntax result = roundTrip(expr);
        Assert.assertEquals("a += f(0x10, \"a\\\"b\", (-y)) * (char **) '\\n'", result.toString());
    }

    @Test
    public void testSharedNodePreserved() throws FormatError {
        Ident x = new Ident("x");
        BinaryExpr sum = new BinaryExpr(BinaryOp.ADD, x, x);
        String json = SyntaxEncoder.encode(sum);
        Assert.assertTrue(json, json.contains("\"node\""));
        BinaryExpr decoded = new SyntaxDecoder().decode(json, BinaryExpr.class);
        Assert.assertSame(decoded.x, decoded.y);
        Assert.assertNotEquals(x.getId(), decoded.x.getId());
    }

    @Test
    public void testUnknownKind() {
        assertFormatError("{\"kind\": \"BogusExpr\", \"id\": 1}", "Unknown kind");
        assertFormatError("{\"kind\": \"SyntaxExpr\", \"id\": 1}", "Unknown kind");
        assertFormatError("{\"kind\": \"ISyntax\", \"id\": 1}", "Unknown kind");
        assertFormatError("{\"kind\": \"codec.FormatError\", \"id\": 1}", "Unknown kind");
    }

    @Test
    public void testMalformed() {
        assertFormatError("{\"kind\": ", "Malformed JSON");
        assertFormatError("", "Empty document");
        assertFormatError("[1, 2]", "Expected a JSON object");
        assertFormatError("{\"kind\": \"Ident\", \"id\": 1, \"name\": \"a\", \"name\": \"b\"}", "Malformed JSON");
    }

    @Test
    public void testMissingAndMistypedFields() {
        assertFormatError("{\"id\": 1, \"name\": \"a\"}", "kind");
        assertFormatError("{\"kind\": \"Ident\", \"name\": \"a\"}", "id");
        assertFormatError("{\"kind\": \"Ident\", \"id\": 1}", "name");
        assertFormatError("{\"kind\": \"Ident\", \"id\": 1, \"name\": null}", "name");
        assertFormatError("{\"kind\": \"Ident\", \"id\": 1, \"name\": 5}", "is not a string");
        assertFormatError("{\"kind\": \"Ident\", \"id\": \"one\", \"name\": \"a\"}", "is not an integer");
        assertFormatError("{\"kind\": \"TypeName\", \"id\": 1, \"name\": \"int\", \"pointers\": 1.5}",
                "is not an integer");
        assertFormatError("{\"kind\": \"CallExpr\", \"id\": 1, \"fun\": {\"kind\": \"Ident\", \"id\": 2, \"name\": \"f\"}, "
                + "\"args\": 3}", "is not an array");
        // a TypeName is not an expression
        assertFormatError("{\"kind\": \"ParenExpr\", \"id\": 1, \"x\": {\"kind\": \"TypeName\", \"id\": 2, "
                + "\"name\": \"int\", \"pointers\": 0}}", "Expected SyntaxExpr");
    }

    @Test
    public void testInvalidValues() {
        assertFormatError("{\"kind\": \"CastExpr\", \"id\": 1, \"op\": \"Bogus\", "
                + "\"type\": {\"kind\": \"TypeName\", \"id\": 2, \"name\": \"int\", \"pointers\": 0}, "
                + "\"expr\": {\"kind\": \"Ident\", \"id\": 3, \"name\": \"x\"}}", "Unknown AssignOp");
        assertFormatError("{\"kind\": \"TypeName\", \"id\": 1, \"name\": \"int\", \"pointers\": -1}",
                "Invalid TypeName");
    }

    @Test
    public void testReferences() {
        assertFormatError("{\"kind\": \"BinaryExpr\", \"id\": 1, \"op\": \"Add\", "
                + "\"x\": {\"node\": 7}, \"y\": {\"kind\": \"Ident\", \"id\": 7, \"name\": \"a\"}}",
                "unknown node 7");
        assertFormatError("{\"kind\": \"BinaryExpr\", \"id\": 1, \"op\": \"Add\", "
                + "\"x\": {\"node\": \"a\"}, \"y\": {\"kind\": \"Ident\", \"id\": 7, \"name\": \"a\"}}",
                "not an integer");
        assertFormatError("{\"kind\": \"BinaryExpr\", \"id\": 1, \"op\": \"Add\", "
                + "\"x\": {\"kind\": \"Ident\", \"id\": 7, \"name\": \"a\"}, "
                + "\"y\": {\"kind\": \"Ident\", \"id\": 7, \"name\": \"b\"}}",
                "Duplicate node id 7");
        assertFormatError("{\"kind\": \"ParenExpr\", \"id\": 1, "
                + "\"x\": {\"kind\": \"Ident\", \"id\": 1, \"name\": \"a\"}}",
                "Duplicate node id 1");
    }

    @Test
    public void testDecoderIsReusable() throws FormatError {
        SyntaxDecoder decoder = new SyntaxDecoder();
        String json = SyntaxEncoder.encode(new Ident("a"));
        ISyntax first = decoder.decode(json);
        ISyntax second = decoder.decode(json);
        Assert.assertNotSame(first, second);
        Assert.assertTrue(first.equivalent(second));
    }
}
