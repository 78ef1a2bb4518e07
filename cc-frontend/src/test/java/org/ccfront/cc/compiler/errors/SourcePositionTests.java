package org.ccfront.cc.compiler.errors;

import org.junit.Assert;
import org.junit.Test;

public class SourcePositionTests {
    static SourcePositionRange range(int l0, int c0, int l1, int c1) {
        return new SourcePositionRange(new SourcePosition(l0, c0), new SourcePosition(l1, c1));
    }

    @Test
    public void testMerge() {
        SourcePositionRange a = range(2, 5, 2, 9);
        SourcePositionRange b = range(4, 1, 5, 3);
        Assert.assertEquals(range(2, 5, 5, 3), a.merge(b));
        Assert.assertEquals(range(2, 5, 5, 3), b.merge(a));
        Assert.assertSame(a, a.merge(SourcePositionRange.INVALID));
        Assert.assertSame(a, SourcePositionRange.INVALID.merge(a));
        Assert.assertEquals("#2-5", a.merge(b).toShortString());
        Assert.assertEquals("#2", a.toShortString());
        Assert.assertEquals("", SourcePositionRange.INVALID.toShortString());
        Assert.assertEquals("2:5--2:9", a.toString());
    }

    @Test
    public void testOrder() {
        SourcePosition p = new SourcePosition(1, 10);
        SourcePosition q = new SourcePosition(2, 1);
        Assert.assertTrue(p.compareTo(q) < 0);
        Assert.assertEquals(0, p.compareTo(new SourcePosition(1, 10)));
        Assert.assertFalse(SourcePosition.INVALID.isValid());
    }

    @Test
    public void testErrors() {
        InternalCompilerError error = new InternalCompilerError("broken");
        Assert.assertEquals("broken", error.getMessage());
        Assert.assertFalse(error.getPositionRange().isValid());
        CompilationError compilation = new CompilationError("bad input", range(1, 1, 1, 4));
        Assert.assertEquals("Compilation error", compilation.getErrorKind());
        Assert.assertTrue(compilation.getPositionRange().isValid());
    }
}
