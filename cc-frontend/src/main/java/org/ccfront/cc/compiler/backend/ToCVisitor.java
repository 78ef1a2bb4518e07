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

package org.ccfront.cc.compiler.backend;

import org.ccfront.cc.compiler.errors.InternalCompilerError;
import org.ccfront.cc.compiler.visitors.CInnerVisitor;
import org.ccfront.cc.compiler.visitors.VisitDecision;
import org.ccfront.cc.ir.CComments;
import org.ccfront.cc.ir.CDeclaration;
import org.ccfront.cc.ir.CInitializer;
import org.ccfront.cc.ir.CPrefix;
import org.ccfront.cc.ir.CProgram;
import org.ccfront.cc.ir.CStorageClass;
import org.ccfront.cc.ir.ICNode;
import org.ccfront.cc.ir.expression.CBinaryExpression;
import org.ccfront.cc.ir.expression.CCallExpression;
import org.ccfront.cc.ir.expression.CCastExpression;
import org.ccfront.cc.ir.expression.CCommaExpression;
import org.ccfront.cc.ir.expression.CCompoundLiteralExpression;
import org.ccfront.cc.ir.expression.CConditionalExpression;
import org.ccfront.cc.ir.expression.CExprOp;
import org.ccfront.cc.ir.expression.CExpression;
import org.ccfront.cc.ir.expression.CIndexExpression;
import org.ccfront.cc.ir.expression.CKernelBracketExpression;
import org.ccfront.cc.ir.expression.CMemberExpression;
import org.ccfront.cc.ir.expression.CNameExpression;
import org.ccfront.cc.ir.expression.CNumberExpression;
import org.ccfront.cc.ir.expression.COffsetofExpression;
import org.ccfront.cc.ir.expression.CPrecedence;
import org.ccfront.cc.ir.expression.CSizeofTypeExpression;
import org.ccfront.cc.ir.expression.CStringExpression;
import org.ccfront.cc.ir.expression.CUnaryExpression;
import org.ccfront.cc.ir.expression.CVaArgExpression;
import org.ccfront.cc.ir.literal.CLiteral;
import org.ccfront.cc.ir.literal.CStringLiteral;
import org.ccfront.cc.ir.statement.CLabel;
import org.ccfront.cc.ir.statement.CStatement;
import org.ccfront.cc.ir.statement.CStatementKind;
import org.ccfront.cc.ir.type.CQualifier;
import org.ccfront.cc.ir.type.CType;
import org.ccfront.cc.ir.type.CTypeKind;
import org.ccfront.util.IIndentStream;
import org.ccfront.util.IndentStreamBuilder;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a C syntax graph as C source text.
 *
 * <p>Expressions are printed with the fewest parentheses that preserve their
 * structure: each operand is printed at the precedence its position requires,
 * and is parenthesized only if its own operator binds more loosely.
 * Types are printed using C declarator syntax.  Every preorder method
 * prints the whole node and returns STOP; the visitor drives the recursion itself.
 *
 * <p>All output goes through {@link #emit(String)}, which inserts a space
 * between two tokens that would otherwise lex as one, as in <code>- -x</code>.
 */
public class ToCVisitor extends CInnerVisitor {
    protected final IIndentStream builder;
    protected final CRenderOptions options;
    /** Expressions binding more loosely than this must be parenthesized. */
    int requiredPrecedence;
    /** Last character emitted; a space or newline after line breaks. */
    char lastChar;
    /** Set after a line comment: the next token must start on a new line. */
    boolean lineCommentOpen;
    /** Tagged types whose member lists are being printed. */
    final Set<Long> typesInProgress;

    ToCVisitor(IIndentStream builder, CRenderOptions options, Set<Long> typesInProgress) {
        this.builder = builder;
        this.options = options;
        this.requiredPrecedence = CPrecedence.LOWEST;
        this.lastChar = ' ';
        this.lineCommentOpen = false;
        this.typesInProgress = typesInProgress;
    }

    public ToCVisitor(IIndentStream builder, CRenderOptions options) {
        this(builder, options, new HashSet<>());
    }

    /** Print the node, including comments unless the options hide them. */
    public void render(ICNode node) {
        node.accept(this);
    }

    public static String toCString(ICNode node, CRenderOptions options) {
        IndentStreamBuilder builder = new IndentStreamBuilder(options.indentAmount);
        ToCVisitor visitor = new ToCVisitor(builder, options);
        visitor.render(node);
        return builder.toString();
    }

    /** Render a node to a string, for use inside a declarator. */
    String nested(ICNode node) {
        IndentStreamBuilder builder = new IndentStreamBuilder(this.options.indentAmount);
        ToCVisitor visitor = new ToCVisitor(builder, this.options, this.typesInProgress);
        visitor.render(node);
        return builder.toString();
    }

    /////////////////////// Output

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /** True if the two characters, printed next to each other, would be read as part of one token. */
    static boolean wouldMerge(char last, char next) {
        if (isIdentifierChar(last) && isIdentifierChar(next))
            return true;
        String pair = "" + last + next;
        switch (pair) {
            case "++": case "--": case "+=": case "-=": case "->":
            case "&&": case "&=": case "||": case "|=":
            case "<<": case "<=": case ">>": case ">=":
            case "==": case "!=": case "*=": case "%=": case "^=":
            case "/=": case "/*": case "//": case "..":
                return true;
            default:
                return false;
        }
    }

    protected void emit(String text) {
        if (text.isEmpty())
            return;
        if (this.lineCommentOpen) {
            this.newline();
            if (text.isBlank())
                return;
        }
        char first = text.charAt(0);
        if (wouldMerge(this.lastChar, first))
            this.builder.append(" ");
        this.builder.append(text);
        this.lastChar = text.charAt(text.length() - 1);
    }

    protected void newline() {
        this.builder.newline();
        this.lastChar = '\n';
        this.lineCommentOpen = false;
    }

    protected void increase() {
        this.builder.increase();
        this.lastChar = '\n';
        this.lineCommentOpen = false;
    }

    protected void decrease() {
        this.builder.decrease();
    }

    /** Comments on the lines before a statement or declaration. */
    void commentLines(ICNode node) {
        if (this.options.hideComments)
            return;
        for (String comment: node.getComments().before) {
            this.emit(comment);
            this.newline();
        }
    }

    /** Comments preceding a node within a line. */
    void commentsBefore(ICNode node) {
        if (this.options.hideComments)
            return;
        for (String comment: node.getComments().before) {
            this.emit(comment);
            if (comment.startsWith("//"))
                this.lineCommentOpen = true;
            else
                this.emit(" ");
        }
    }

    void commentsAfter(ICNode node) {
        if (this.options.hideComments)
            return;
        CComments comments = node.getComments();
        for (String comment: comments.suffix) {
            this.emit(" ");
            this.emit(comment);
            if (comment.startsWith("//"))
                this.lineCommentOpen = true;
        }
    }

    /////////////////////// Expressions

    /** Print an expression in a position that requires the given precedence. */
    void expression(CExpression expression, int precedence) {
        int saved = this.requiredPrecedence;
        this.requiredPrecedence = precedence;
        expression.accept(this);
        this.requiredPrecedence = saved;
    }

    /** Starts printing an expression; returns true if it was parenthesized. */
    boolean open(CExpression expression) {
        this.push(expression);
        this.commentsBefore(expression);
        boolean paren = expression.getPrecedence() < this.requiredPrecedence;
        if (paren)
            this.emit("(");
        return paren;
    }

    void close(CExpression expression, boolean paren) {
        if (paren)
            this.emit(")");
        this.commentsAfter(expression);
        this.pop(expression);
    }

    String binarySpace() {
        return this.options.spacesAroundBinaryOperators ? " " : "";
    }

    @Override
    public VisitDecision preorder(CBinaryExpression expression) {
        boolean paren = this.open(expression);
        int precedence = expression.getPrecedence();
        if (expression.isAssignment()) {
            this.expression(expression.left, CPrecedence.UNARY);
            this.emit(" " + expression.op.text + " ");
            this.expression(expression.right, precedence);
        } else {
            this.expression(expression.left, precedence);
            this.emit(this.binarySpace());
            this.emit(expression.op.text);
            this.emit(this.binarySpace());
            this.expression(expression.right, precedence + 1);
        }
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CUnaryExpression expression) {
        boolean paren = this.open(expression);
        switch (expression.op) {
            case PAREN:
                this.emit("(");
                this.expression(expression.left, CPrecedence.LOWEST);
                this.emit(")");
                break;
            case SIZEOF_EXPR:
                this.emit("sizeof(");
                this.expression(expression.left, CPrecedence.LOWEST);
                this.emit(")");
                break;
            case POST_INC:
            case POST_DEC:
                this.expression(expression.left, CPrecedence.POSTFIX);
                this.emit(expression.op.text);
                break;
            default:
                this.emit(expression.op.text);
                this.expression(expression.left, CPrecedence.UNARY);
                break;
        }
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCastExpression expression) {
        boolean paren = this.open(expression);
        this.emit("(");
        this.typeName(expression.type);
        this.emit(") ");
        this.expression(expression.operand, CPrecedence.UNARY);
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCompoundLiteralExpression expression) {
        boolean paren = this.open(expression);
        this.emit("(");
        this.typeName(expression.type);
        this.emit(")");
        expression.init.accept(this);
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    void arguments(List<CExpression> arguments) {
        boolean first = true;
        for (CExpression arg: arguments) {
            if (arg == null)
                continue;
            if (!first)
                this.emit(", ");
            first = false;
            this.expression(arg, CPrecedence.ASSIGN);
        }
    }

    @Override
    public VisitDecision preorder(CCallExpression expression) {
        boolean paren = this.open(expression);
        this.expression(expression.function, CPrecedence.POSTFIX);
        if (expression.isKernelLaunch()) {
            this.emit("<<<");
            this.arguments(expression.launchParams);
            this.emit(">>>");
        }
        this.emit("(");
        this.arguments(expression.arguments);
        this.emit(")");
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCommaExpression expression) {
        boolean paren = this.open(expression);
        boolean first = true;
        for (CExpression expr: expression.list) {
            if (expr == null)
                continue;
            if (!first)
                this.emit(", ");
            this.expression(expr, first ? CPrecedence.COMMA : CPrecedence.ASSIGN);
            first = false;
        }
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CConditionalExpression expression) {
        boolean paren = this.open(expression);
        this.expression(expression.checkNull(expression.condition), CPrecedence.OR_OR);
        this.emit(" ? ");
        this.expression(expression.checkNull(expression.positive), CPrecedence.LOWEST);
        this.emit(" : ");
        this.expression(expression.checkNull(expression.negative), CPrecedence.COND);
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIndexExpression expression) {
        boolean paren = this.open(expression);
        this.expression(expression.left, CPrecedence.POSTFIX);
        this.emit("[");
        this.expression(expression.right, CPrecedence.LOWEST);
        this.emit("]");
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CMemberExpression expression) {
        boolean paren = this.open(expression);
        this.expression(expression.left, CPrecedence.POSTFIX);
        this.emit(expression.op.text);
        this.emit(expression.getMemberName());
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(COffsetofExpression expression) {
        boolean paren = this.open(expression);
        this.emit("offsetof(");
        this.typeName(expression.type);
        this.emit(", ");
        this.expression(expression.left, CPrecedence.ASSIGN);
        this.emit(")");
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CSizeofTypeExpression expression) {
        boolean paren = this.open(expression);
        this.emit("sizeof(");
        this.typeName(expression.type);
        this.emit(")");
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CVaArgExpression expression) {
        boolean paren = this.open(expression);
        this.emit("va_arg(");
        this.expression(expression.left, CPrecedence.ASSIGN);
        this.emit(", ");
        this.typeName(expression.type);
        this.emit(")");
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CNameExpression expression) {
        boolean paren = this.open(expression);
        this.emit(expression.getName());
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CNumberExpression expression) {
        boolean paren = this.open(expression);
        this.emit(expression.text.getText());
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CStringExpression expression) {
        boolean paren = this.open(expression);
        boolean first = true;
        for (CStringLiteral text: expression.texts) {
            if (!first)
                this.emit(" ");
            first = false;
            this.emit(text.getText());
        }
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CKernelBracketExpression expression) {
        boolean paren = this.open(expression);
        this.emit(expression.op.text);
        this.close(expression, paren);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CLiteral literal) {
        this.commentsBefore(literal);
        this.emit(literal.getText());
        this.commentsAfter(literal);
        return VisitDecision.STOP;
    }

    /////////////////////// Types and declarations

    static String qualifiers(CType type) {
        StringBuilder result = new StringBuilder();
        for (CQualifier qualifier: CQualifier.values()) {
            if (!type.qualifiers.contains(qualifier))
                continue;
            if (result.length() > 0)
                result.append(" ");
            result.append(qualifier.cName);
        }
        return result.toString();
    }

    /** Print the type specifier of a type that is not derived. */
    void specifier(CType type) {
        String qualifiers = qualifiers(type);
        if (!qualifiers.isEmpty())
            this.emit(qualifiers + " ");
        if (type.kind.isBasic()) {
            this.emit(type.kind.toString());
            return;
        }
        switch (type.kind) {
            case NAMED:
                this.emit(type.checkNull(type.tag));
                break;
            case STRUCT:
            case UNION:
            case ENUM:
                this.emit(type.kind.toString());
                if (type.tag != null) {
                    this.emit(" ");
                    this.emit(type.tag);
                }
                if (type.getDeclarations().isEmpty()) {
                    if (type.tag == null)
                        throw new InternalCompilerError("Anonymous " + type.kind + " without members", type);
                } else if (this.typesInProgress.contains(type.getId())) {
                    // Reached again through one of its own members
                    if (type.tag == null)
                        throw new InternalCompilerError("Anonymous " + type.kind + " refers to itself", type);
                } else {
                    this.typesInProgress.add(type.getId());
                    this.members(type);
                    this.typesInProgress.remove(type.getId());
                }
                break;
            default:
                throw new InternalCompilerError("Unexpected type kind " + type.kind, type);
        }
    }

    void members(CType type) {
        this.emit(" {");
        this.increase();
        boolean first = true;
        for (CDeclaration member: type.getDeclarations()) {
            if (type.kind == CTypeKind.ENUM) {
                if (!first) {
                    this.emit(",");
                    this.newline();
                }
                member.accept(this);
            } else {
                member.accept(this);
                this.emit(";");
                this.commentsAfter(member);
                this.newline();
            }
            first = false;
        }
        if (type.kind == CTypeKind.ENUM)
            this.newline();
        this.decrease();
        this.emit("}");
    }

    /** Print a declaration of the given name with the given type.
     * An empty name produces an abstract declarator, as used in casts. */
    void declarator(CType type, String name) {
        String decl = name;
        CType current = type;
        while (current.kind.isDerived()) {
            CType base = current.checkNull(current.base);
            switch (current.kind) {
                case POINTER: {
                    String qualifiers = qualifiers(current);
                    if (!qualifiers.isEmpty())
                        decl = qualifiers + (decl.isEmpty() ? "" : " " + decl);
                    decl = "*" + decl;
                    if (base.kind == CTypeKind.ARRAY || base.kind == CTypeKind.FUNC)
                        decl = "(" + decl + ")";
                    break;
                }
                case ARRAY:
                    decl = decl + "[" + (current.width != null ? this.nested(current.width) : "") + "]";
                    break;
                case FUNC:
                    decl = decl + "(" + this.parameters(current) + ")";
                    break;
                default:
                    throw new InternalCompilerError("Unexpected derived type " + current.kind, current);
            }
            current = base;
        }
        this.specifier(current);
        if (!decl.isEmpty()) {
            this.emit(" ");
            this.emit(decl);
        }
    }

    String parameters(CType function) {
        StringBuilder result = new StringBuilder();
        for (CDeclaration parameter: function.getDeclarations()) {
            if (result.length() > 0)
                result.append(", ");
            result.append(this.nested(parameter));
        }
        if (function.variadic)
            result.append(result.length() > 0 ? ", ..." : "...");
        return result.toString();
    }

    void typeName(CType type) {
        this.declarator(type, "");
    }

    @Override
    public VisitDecision preorder(CType type) {
        this.commentsBefore(type);
        this.typeName(type);
        this.commentsAfter(type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CDeclaration declaration) {
        this.push(declaration);
        this.commentLines(declaration);
        for (CStorageClass storage: CStorageClass.values()) {
            if (declaration.storage.contains(storage))
                this.emit(storage.cName + " ");
        }
        String name = declaration.name != null ? declaration.name : "";
        if (declaration.type != null) {
            this.declarator(declaration.type, name);
        } else {
            if (name.isEmpty())
                throw new InternalCompilerError("Declaration without a name or a type", declaration);
            this.emit(name);
        }
        if (declaration.init != null) {
            this.emit(" = ");
            declaration.init.accept(this);
        }
        if (declaration.body != null) {
            this.emit(" ");
            this.statement(declaration.body);
        }
        this.pop(declaration);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CInitializer initializer) {
        this.commentsBefore(initializer);
        for (CPrefix prefix: initializer.prefixes)
            prefix.accept(this);
        if (!initializer.prefixes.isEmpty())
            this.emit(" = ");
        if (initializer.expr != null) {
            this.expression(initializer.expr, CPrecedence.ASSIGN);
        } else {
            List<CInitializer> braced = initializer.checkNull(initializer.braced);
            this.emit("{");
            boolean first = true;
            for (CInitializer element: braced) {
                if (!first)
                    this.emit(",");
                first = false;
                element.accept(this);
            }
            this.emit("}");
        }
        this.commentsAfter(initializer);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CPrefix prefix) {
        if (prefix.dot != null) {
            this.emit(".");
            this.emit(prefix.dot.getName());
        } else {
            this.emit("[");
            this.expression(prefix.checkNull(prefix.index), CPrecedence.LOWEST);
            this.emit("]");
        }
        return VisitDecision.STOP;
    }

    /////////////////////// Statements

    @Override
    public VisitDecision preorder(CLabel label) {
        switch (label.kind) {
            case CASE:
                this.emit("case ");
                this.expression(label.checkNull(label.expr), CPrecedence.COND);
                this.emit(":");
                break;
            case DEFAULT:
                this.emit("default:");
                break;
            case NAME:
                this.emit(label.checkNull(label.name).getName());
                this.emit(":");
                break;
        }
        return VisitDecision.STOP;
    }

    /** Print a statement; no newline is emitted after it. */
    void statement(CStatement statement) {
        this.push(statement);
        this.commentLines(statement);
        for (CLabel label: statement.labels) {
            label.accept(this);
            this.newline();
        }
        switch (statement.kind) {
            case EMPTY:
                this.emit(";");
                break;
            case EXPR:
                this.expression(statement.checkNull(statement.expr), CPrecedence.LOWEST);
                this.emit(";");
                break;
            case DECL: {
                CDeclaration decl = statement.checkNull(statement.decl);
                decl.accept(this);
                if (decl.body == null)
                    this.emit(";");
                this.commentsAfter(decl);
                break;
            }
            case BLOCK:
                this.emit("{");
                if (!statement.block.isEmpty()) {
                    this.increase();
                    for (CStatement s: statement.block) {
                        this.statement(s);
                        this.newline();
                    }
                    this.decrease();
                }
                this.emit("}");
                break;
            case IF: {
                this.emit("if (");
                this.expression(statement.checkNull(statement.expr), CPrecedence.LOWEST);
                this.emit(")");
                CStatement body = statement.checkNull(statement.body);
                boolean braced = body.kind == CStatementKind.BLOCK;
                if (statement.elseBranch != null && endsInOpenIf(body)) {
                    // Braces keep the else from binding to the inner if
                    this.emit(" {");
                    this.increase();
                    this.statement(body);
                    this.newline();
                    this.decrease();
                    this.emit("}");
                    braced = true;
                } else {
                    this.substatement(body);
                }
                if (statement.elseBranch != null) {
                    if (braced)
                        this.emit(" ");
                    else
                        this.newline();
                    this.emit("else");
                    if (statement.elseBranch.kind == CStatementKind.IF && statement.elseBranch.labels.isEmpty()) {
                        this.emit(" ");
                        this.statement(statement.elseBranch);
                    } else {
                        this.substatement(statement.elseBranch);
                    }
                }
                break;
            }
            case WHILE:
                this.emit("while (");
                this.expression(statement.checkNull(statement.expr), CPrecedence.LOWEST);
                this.emit(")");
                this.substatement(statement.checkNull(statement.body));
                break;
            case DO: {
                this.emit("do");
                CStatement body = statement.checkNull(statement.body);
                this.substatement(body);
                if (body.kind == CStatementKind.BLOCK)
                    this.emit(" ");
                else
                    this.newline();
                this.emit("while (");
                this.expression(statement.checkNull(statement.expr), CPrecedence.LOWEST);
                this.emit(");");
                break;
            }
            case FOR:
                this.emit("for (");
                if (statement.pre != null)
                    this.expression(statement.pre, CPrecedence.LOWEST);
                else if (statement.decl != null)
                    statement.decl.accept(this);
                this.emit(";");
                if (statement.expr != null) {
                    this.emit(" ");
                    this.expression(statement.expr, CPrecedence.LOWEST);
                }
                this.emit(";");
                if (statement.post != null) {
                    this.emit(" ");
                    this.expression(statement.post, CPrecedence.LOWEST);
                }
                this.emit(")");
                this.substatement(statement.checkNull(statement.body));
                break;
            case SWITCH:
                this.emit("switch (");
                this.expression(statement.checkNull(statement.expr), CPrecedence.LOWEST);
                this.emit(")");
                this.substatement(statement.checkNull(statement.body));
                break;
            case BREAK:
                this.emit("break;");
                break;
            case CONTINUE:
                this.emit("continue;");
                break;
            case RETURN:
                this.emit("return");
                if (statement.expr != null) {
                    this.emit(" ");
                    this.expression(statement.expr, CPrecedence.LOWEST);
                }
                this.emit(";");
                break;
            case GOTO:
                this.emit("goto ");
                this.emit(statement.checkNull(statement.text).getName());
                this.emit(";");
                break;
        }
        this.commentsAfter(statement);
        this.pop(statement);
    }

    /** True if an <code>else</code> printed right after this statement would attach to an if inside it. */
    static boolean endsInOpenIf(CStatement statement) {
        switch (statement.kind) {
            case IF:
                if (statement.elseBranch == null)
                    return true;
                return endsInOpenIf(statement.elseBranch);
            case WHILE:
            case FOR:
            case SWITCH:
                return endsInOpenIf(statement.checkNull(statement.body));
            default:
                return false;
        }
    }

    /** The body of a compound statement: blocks stay on the same line, anything else is indented. */
    void substatement(CStatement statement) {
        if (statement.kind == CStatementKind.BLOCK) {
            this.emit(" ");
            this.statement(statement);
        } else {
            this.increase();
            this.statement(statement);
            this.decrease();
        }
    }

    @Override
    public VisitDecision preorder(CStatement statement) {
        this.statement(statement);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CProgram program) {
        this.push(program);
        this.commentLines(program);
        for (CDeclaration decl: program.decls) {
            decl.accept(this);
            if (decl.body == null)
                this.emit(";");
            this.commentsAfter(decl);
            this.newline();
        }
        this.pop(program);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(ICNode node) {
        throw new InternalCompilerError("Cannot render " + node.getClass().getSimpleName(), node);
    }
}
