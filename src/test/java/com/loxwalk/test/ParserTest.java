package com.loxwalk.test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import com.loxwalk.lox.ErrorReporter;
import com.loxwalk.lox.Expr;
import com.loxwalk.lox.Parser;
import com.loxwalk.lox.Stmt;

public class ParserTest {
    private StringBuffer errors = null;
    private ErrorReporter reporter = null;

    @Test
    public void testExpressionStatement() {
        List<Stmt> stmts = parse("a = b = 1;");
        assertFalse(reporter.hadError());
        assertEquals(1, stmts.size());
        Expr expr = ((Stmt.Expression)stmts.get(0)).expression;
        assertTrue(expr instanceof Expr.Assign);
        Expr.Assign outer = (Expr.Assign)expr;
        assertEquals("a", outer.name.lexeme);
        assertTrue(outer.value instanceof Expr.Assign);
    }

    @Test
    public void testPropertyAssignmentBecomesSet() {
        List<Stmt> stmts = parse("a.b.c = 1;");
        Expr expr = ((Stmt.Expression)stmts.get(0)).expression;
        assertTrue(expr instanceof Expr.Set);
        Expr.Set set = (Expr.Set)expr;
        assertEquals("c", set.name.lexeme);
        assertTrue(set.object instanceof Expr.Get);
    }

    @Test
    public void testForIsDesugared() {
        List<Stmt> stmts = parse("for (var i = 0; i < 3; i = i + 1) print i;");
        assertEquals(1, stmts.size());
        Stmt.Block outer = (Stmt.Block)stmts.get(0);
        assertTrue(outer.statements.get(0) instanceof Stmt.Var);
        Stmt.While loop = (Stmt.While)outer.statements.get(1);
        Stmt.Block body = (Stmt.Block)loop.body;
        assertEquals(2, body.statements.size());
        assertTrue(body.statements.get(0) instanceof Stmt.Print);
        assertTrue(body.statements.get(1) instanceof Stmt.Expression);
    }

    @Test
    public void testEmptyForClausesLoopForever() {
        List<Stmt> stmts = parse("for (;;) print 1;");
        Stmt.While loop = (Stmt.While)stmts.get(0);
        assertEquals(true, ((Expr.Literal)loop.condition).value);
        assertTrue(loop.body instanceof Stmt.Print);
    }

    @Test
    public void testClassDeclaration() {
        List<Stmt> stmts = parse("class B < A { init() {} m(x, y) { return x; } }");
        assertFalse(reporter.hadError());
        Stmt.Class klass = (Stmt.Class)stmts.get(0);
        assertEquals("B", klass.name.lexeme);
        assertEquals("A", klass.superclass.name.lexeme);
        assertEquals(2, klass.methods.size());
        assertEquals(2, klass.methods.get(1).params.size());
    }

    @Test
    public void testIfWithoutElse() {
        List<Stmt> stmts = parse("if (x) print 1;");
        Stmt.If stmt = (Stmt.If)stmts.get(0);
        assertNull(stmt.elseBranch);
    }

    @Test
    public void testErrorsOnSeparateLinesAreAllReported() {
        parse("var = 1;\nprint ;\nprint 2;");
        assertTrue(reporter.hadError());
        assertEquals("[line 1] Error at '=': Expected variable name after 'var' keyword.\n" +
                     "[line 2] Error at ';': Expected expression.\n",
                     errors.toString());
    }

    @Test
    public void testScanErrorLeavesNothingToParse() {
        List<Stmt> stmts = parse("print 1;\nvar x = @;\nprint ;");
        assertTrue(reporter.hadError());
        assertEquals(1, reporter.errorCount());
        assertEquals(0, stmts.size());
        assertEquals("[line 2] Error: Unexpected character.\n", errors.toString());
    }

    @Test
    public void testSynchronizeKeepsGoodStatements() {
        List<Stmt> stmts = parse("print ;\nprint 2;");
        assertTrue(reporter.hadError());
        assertEquals(1, stmts.size());
        assertTrue(stmts.get(0) instanceof Stmt.Print);
    }

    @Test
    public void testErrorAtEnd() {
        parse("print 1");
        assertEquals("[line 1] Error at end: Expected ';' after 'print' expression.\n",
                     errors.toString());
    }

    @Test
    public void testInvalidAssignmentTarget() {
        parse("1 = 2;");
        assertEquals("[line 1] Error at '=': Invalid assignment target.\n", errors.toString());
    }

    @Test
    public void testReturnAtTopLevel() {
        parse("return 1;");
        assertEquals("[line 1] Error at 'return': Can't return from top-level code.\n",
                     errors.toString());
    }

    @Test
    public void testReturnValueFromInitializer() {
        parse("class A { init() { return 1; } }");
        assertEquals("[line 1] Error at 'return': Can't return a value from an initializer.\n",
                     errors.toString());

        parse("class A { init() { return; } }");
        assertFalse(reporter.hadError());
    }

    @Test
    public void testThisOutsideClass() {
        parse("print this;");
        assertEquals("[line 1] Error at 'this': Can't use 'this' outside of a class.\n",
                     errors.toString());

        parse("class A { m() { fun inner() { return this; } return inner; } }");
        assertFalse(reporter.hadError());
    }

    @Test
    public void testSuperChecks() {
        parse("super.m();");
        assertEquals("[line 1] Error at 'super': Can't use 'super' outside of a class.\n",
                     errors.toString());

        parse("class A { m() { super.m(); } }");
        assertEquals("[line 1] Error at 'super': Can't use 'super' in a class with no superclass.\n",
                     errors.toString());
    }

    @Test
    public void testClassCantInheritFromItself() {
        parse("class A < A {}");
        assertEquals("[line 1] Error at 'A': A class can't inherit from itself.\n",
                     errors.toString());
    }

    @Test
    public void testBreakOutsideLoop() {
        parse("break;");
        assertEquals("[line 1] Error at 'break': Can't use 'break' outside of a loop.\n",
                     errors.toString());

        parse("while (true) { fun f() { break; } }");
        assertTrue(reporter.hadError());

        parse("while (true) { if (x) break; }");
        assertFalse(reporter.hadError());
    }

    @Test
    public void testTooManyArguments() {
        StringBuilder args = new StringBuilder();
        for (int i = 0; i < 256; i++) {
            if (i > 0) args.append(", ");
            args.append(i);
        }
        parse("f(" + args + ");");
        assertTrue(errors.toString().contains("Can't have more than 255 arguments."));
    }

    @Test
    public void testTooManyParameters() {
        StringBuilder params = new StringBuilder();
        for (int i = 0; i < 256; i++) {
            if (i > 0) params.append(", ");
            params.append("p").append(i);
        }
        parse("fun f(" + params + ") {}");
        assertTrue(errors.toString().contains("Can't have more than 255 parameters."));
    }

    private List<Stmt> parse(String src) {
        errors = new StringBuffer();
        reporter = new ErrorReporter(errors);
        return Parser.newFromSource(src, reporter).parse();
    }
}
