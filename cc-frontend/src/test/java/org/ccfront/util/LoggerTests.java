package org.ccfront.util;

import org.ccfront.cc.compiler.errors.CompilationError;
import org.ccfront.cc.compiler.visitors.Walker;
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.syntax.ast.BinaryExpr;
import org.ccfront.syntax.ast.BinaryOp;
import org.ccfront.syntax.ast.Ident;
import org.ccfront.syntax.codec.SyntaxEncoder;
import org.junit.Assert;
import org.junit.Test;

public class LoggerTests {
    @Test
    public void testWalkerLogsRevisits() {
        StringBuilder log = new StringBuilder();
        Appendable previousStream = Logger.INSTANCE.setDebugStream(log);
        int previous = Logger.INSTANCE.setLoggingLevel("Walker", 3);
        try {
            CExpression x = CExpression.name("x");
            Walker.walkPreorder(x.binary(CExprOp.MUL, x), n -> {});
            Assert.assertTrue(log.toString(), log.toString().contains("Already visited CNameExpression#" + x.getId()));
        } finally {
            Logger.INSTANCE.setLoggingLevel(Walker.class, previous);
            Logger.INSTANCE.setDebugStream(previousStream);
        }
    }

    @Test
    public void testEncoderLogsReferences() {
        StringBuilder log = new StringBuilder();
        Appendable previousStream = Logger.INSTANCE.setDebugStream(log);
        int previous = Logger.INSTANCE.setLoggingLevel(SyntaxEncoder.class, 3);
        try {
            Ident y = new Ident("y");
            SyntaxEncoder.encode(new BinaryExpr(BinaryOp.SUB, y, y));
            Assert.assertTrue(log.toString(), log.toString().contains("Reference to Ident#" + y.getId()));
        } finally {
            Logger.INSTANCE.setLoggingLevel(SyntaxEncoder.class, previous);
            Logger.INSTANCE.setDebugStream(previousStream);
        }
    }

    @Test
    public void testLevels() {
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(LoggerTests.class));
        Assert.assertThrows(CompilationError.class, () -> Logger.INSTANCE.setLoggingLevel("NoSuchVisitor", 1));
    }
}
