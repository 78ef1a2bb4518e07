package org.ccfront.cc.compiler.visitors;

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CBinaryExpression;
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.expression.CNameExpression;
import org.ccfront.cc.ir.literal.CSymbolLiteral;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class CInnerVisitorTests {
    @Test
    public void testTypedDispatch() {
        List<String> names = new ArrayList<>();
        List<String> properties = new ArrayList<>();
        CInnerVisitor visitor = new CInnerVisitor() {
            @Override
            public void property(String name) {
                properties.add(name);
            }

            @Override
            public VisitDecision preorder(CSymbolLiteral literal) {
                ICNode parent = this.getParent();
                Assert.assertNotNull(parent);
                Assert.assertTrue(parent instanceof CNameExpression);
                names.add(literal.getName());
                return VisitDecision.CONTINUE;
            }

            @Override
            public VisitDecision preorder(CBinaryExpression expression) {
                Assert.assertNull(this.getParent());
                return VisitDecision.CONTINUE;
            }
        };
        CExpression sum = CExpression.name("a").binary(CExprOp.ADD, CExpression.name("b"));
        visitor.apply(sum);
        Assert.assertEquals(List.of("a", "b"), names);
        Assert.assertEquals(List.of("left", "text", "right", "text"), properties);
    }

    @Test
    public void testStopSkipsChildren() {
        List<ICNode> seen = new ArrayList<>();
        CInnerVisitor visitor = new CInnerVisitor() {
            @Override
            public VisitDecision preorder(ICNode node) {
                seen.add(node);
                return VisitDecision.CONTINUE;
            }

            @Override
            public VisitDecision preorder(CNameExpression expression) {
                seen.add(expression);
                return VisitDecision.STOP;
            }
        };
        visitor.apply(CExpression.name("a").binary(CExprOp.SUB, CExpression.name("b")));
        Assert.assertEquals(3, seen.size());
    }

    @Test
    public void testCorruptedContext() {
        CInnerVisitor visitor = new CInnerVisitor() {};
        CExpression a = CExpression.name("a");
        visitor.push(a);
        Assert.assertSame(a, visitor.getParent());
        Assert.assertThrows(InternalCompilerError.class, () -> visitor.pop(CExpression.name("b")));
    }
}
