package org.ccfront.cc.compiler.visitors;

import org.ccfront.cc.compiler.errors.SourcePosition;
import org.ccfront.cc.compiler.errors.SourcePositionRange;
import org.ccfront.cc.ir.expression.CBinaryExpression;
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.expression.CNameExpression;
import org.ccfront.cc.ir.literal.CSymbolLiteral;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.type.CTypeKind;
import org.junit.Assert;
import org.junit.Test;

public class SyntaxTreeTests {
    @Test
    public void testTree() {
        SourcePositionRange range = new SourcePositionRange(new SourcePosition(3, 1), new SourcePosition(3, 2));
        CExpression x = new CNameExpression(range, new CSymbolLiteral("x"));
        CBinaryExpression sum = x.binary(CExprOp.ADD, x);
        String tree = SyntaxTree.asTree(sum);
        Assert.assertTrue(tree, tree.startsWith("CBinaryExpression#" + sum.getId() + " ADD #3"));
        Assert.assertTrue(tree, tree.contains("left: CNameExpression#" + x.getId() + " NAME #3"));
        Assert.assertTrue(tree, tree.contains("text: CSymbolLiteral#"));
        Assert.assertTrue(tree, tree.contains("right: CNameExpression#" + x.getId() + " NAME #3 (see above)"));
        Assert.assertTrue(tree, tree.contains("\n  left:"));
    }

    @Test
    public void testCycle() {
        CType list = CType.tagged(CTypeKind.STRUCT, "list");
        list.addDeclaration(new CDeclaration("next", list.pointer()));
        String tree = SyntaxTree.asTree(list);
        Assert.assertTrue(tree, tree.startsWith("CType#" + list.getId() + " STRUCT list"));
        Assert.assertTrue(tree, tree.contains("decls[0]: CDeclaration#"));
        Assert.assertTrue(tree, tree.contains("base: CType#" + list.getId() + " STRUCT list (see above)"));
    }
}
