package org.ccfront.util;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.List;

/** API for producing JSON documents */
public class JsonStream {
    static class Context implements ICastable {
        public int index;
    }

    static class InArray extends Context {}

    static class InObject extends Context {
        public boolean expectLabel = true;
    }

    final List<Context> context = new ArrayList<>();
    private final IIndentStream stream;

    public JsonStream(IIndentStream stream) {
        this.stream = stream;
    }

    public JsonStream append(String string) {
        this.value();
        try {
            string = Utilities.deterministicObjectMapper().writeValueAsString(string);
            this.stream.append(string);
        } catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
        return this;
    }

    void value() {
        if (this.context.isEmpty())
            return;
        Context last = Utilities.last(this.context);
        if (last.is(InArray.class)) {
            if (last.index != 0) {
                this.stream.append(",").newline();
            } else {
                this.stream.increase();
            }
            last.index++;
        } else {
            InObject io = last.to(InObject.class);
            if (io.expectLabel)
                throw new RuntimeException("Missing label");
            io.index++;
            io.expectLabel = true;
        }
    }

    public JsonStream append(boolean b) {
        this.value();
        this.stream.append(b);
        return this;
    }

    public JsonStream append(long v) {
        this.value();
        this.stream.append(v);
        return this;
    }

    public JsonStream label(String label) {
        Utilities.enforce(!label.isEmpty());
        Context last = Utilities.last(this.context);
        InObject io = last.to(InObject.class,
                "Adding label but not within JsonObject");
        if (!io.expectLabel)
            throw new RuntimeException("Consecutive labels");
        io.expectLabel = false;
        if (io.index == 0)
            this.stream.increase();
        else
            this.stream.append(",").newline();
        this.stream.appendJsonLabelAndColon(label);
        return this;
    }

    public JsonStream beginArray() {
        this.value();
        this.context.add(new InArray());
        this.stream.append("[");
        return this;
    }

    public JsonStream endArray() {
        Context last = Utilities.removeLast(this.context);
        Utilities.enforce(last.is(InArray.class));
        if (last.index != 0)
            this.stream.newline().decrease();
        this.stream.append("]");
        return this;
    }

    public JsonStream beginObject() {
        this.value();
        this.context.add(new InObject());
        this.stream.append("{");
        return this;
    }

    public JsonStream endObject() {
        Context last = Utilities.removeLast(this.context);
        Utilities.enforce(last.is(InObject.class));
        if (last.index != 0)
            this.stream.newline().decrease();
        this.stream.append("}");
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
