package org.ccfront.util;

import org.junit.Assert;
import org.junit.Test;

public class IndentStreamTests {
    @Test
    public void testIndentation() {
        IndentStreamBuilder builder = new IndentStreamBuilder(2);
        builder.append("a").increase()
                .append("b").newline()
                .append("c").decrease()
                .newline().append("d");
        Assert.assertEquals("a\n  b\n  c\nd", builder.toString());
    }

    @Test
    public void testSingleLine() {
        IndentStreamBuilder builder = new IndentStreamBuilder(0);
        builder.append("{").increase().append("x;\ny;").decrease().newline().append("}");
        Assert.assertEquals("{ x; y; }", builder.toString());
    }

    @Test
    public void testJsonStream() {
        IndentStreamBuilder builder = new IndentStreamBuilder(0);
        JsonStream stream = new JsonStream(builder);
        stream.beginObject()
                .label("a").append(1)
                .label("b").beginArray().append("x\"y").append(true).endArray()
                .endObject();
        Assert.assertEquals("{ \"a\": 1, \"b\": [ \"x\\\"y\", true ] }", builder.toString());
        Assert.assertThrows(RuntimeException.class, () -> new JsonStream(builder).endObject());
    }
}
