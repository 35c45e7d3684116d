package com.loxwalk.test;

import static org.junit.Assert.assertEquals;
import org.junit.Test;
import com.loxwalk.lox.AstPrinter;

public class AstPrinterTest {

    @Test
    public void testEmpty() {
        String code = "";
        String ast = AstPrinter.print(code);
        assertEquals("", ast);
    }

    @Test
    public void testBinaryExpr() {
        String code = "1+1;";
        String ast = AstPrinter.print(code);
        assertEquals("(+ 1.0 1.0)\n", ast);
    }

    @Test
    public void testGroupingAndUnary() {
        String code = "-(1 - 2) * !true;";
        String ast = AstPrinter.print(code);
        assertEquals("(* (- (group (- 1.0 2.0))) (! true))\n", ast);
    }

    @Test
    public void testLogicalExpr() {
        String code = "var i = true and false;";
        String ast = AstPrinter.print(code);
        assertEquals("(varDecl i (and true false))\n", ast);
    }

    @Test
    public void testVarDeclWithoutInitializer() {
        String code = "var i; print nil;";
        String ast = AstPrinter.print(code);
        assertEquals("(varDecl i)\n(print nil)\n", ast);
    }

    @Test
    public void testErrorNoSemiColon() {
        String code = "1+1";
        String ast = AstPrinter.print(code);
        assertEquals(AstPrinter.PARSE_ERROR, ast);
    }

    @Test
    public void testStaticErrorIsParseError() {
        String code = "print this;";
        String ast = AstPrinter.print(code);
        assertEquals(AstPrinter.PARSE_ERROR, ast);
    }

    @Test
    public void testSimpleIfStmt() {
        String code = "if (true) { " +
                      "} else { } ";

        String ast = AstPrinter.print(code);
        assertEquals("(if true\n" +
                     "  (block)\n" +
                     "  (block)\n" +
                     ")\n",
                     ast);
    }

    @Test
    public void testSimpleWhileStmt() {
        String code = "while (true) {}";

        String ast = AstPrinter.print(code);
        assertEquals("(while true\n" +
                     "  (block)\n" +
                     ")\n",
                     ast);
    }

    @Test
    public void testForStmtIsDesugaredToWhile() {
        String code = "for (var i = 0; i < 3; i = i + 1) print i;";
        String ast = AstPrinter.print(code);
        assertEquals("(block\n" +
                     "  (varDecl i 0.0)\n" +
                     "  (while (< (var i) 3.0)\n" +
                     "    (block\n" +
                     "      (print (var i))\n" +
                     "      (assign i (+ (var i) 1.0))\n" +
                     "    )\n" +
                     "  )\n" +
                     ")\n",
                     ast);
    }

    @Test
    public void testAllNopForStmt() {
        String code = "for (;;) {}";
        String ast = AstPrinter.print(code);
        assertEquals("(while true\n" +
                     "  (block)\n" +
                     ")\n",
                     ast);
    }

    @Test
    public void testFunctionDecl() {
        String code = "fun add(a, b) { return a + b; }\nadd(1, \"two\");";
        String ast = AstPrinter.print(code);
        assertEquals("(fnDecl add a b\n" +
                     "  (return (+ (var a) (var b)))\n" +
                     ")\n" +
                     "(call (var add) 1.0 \"two\")\n",
                     ast);
    }

    @Test
    public void testClassDecl() {
        String code = "class A < B {\n" +
                      "  init(x) { this.x = x; }\n" +
                      "  get() { return super.get(); }\n" +
                      "}";
        String ast = AstPrinter.print(code);
        assertEquals("(classDecl A < B\n" +
                     "  (fnDecl init x\n" +
                     "    (propSet (this) x (var x))\n" +
                     "  )\n" +
                     "  (fnDecl get\n" +
                     "    (return (call (super get)))\n" +
                     "  )\n" +
                     ")\n",
                     ast);
    }

    @Test
    public void testEmptyClassAndPropertyGet() {
        String code = "class A {} A().b;";
        String ast = AstPrinter.print(code);
        assertEquals("(classDecl A)\n(prop (call (var A)) b)\n", ast);
    }

    @Test
    public void testBreakInLoop() {
        String code = "while (true) break;";
        String ast = AstPrinter.print(code);
        assertEquals("(while true\n" +
                     "  (break)\n" +
                     ")\n",
                     ast);
    }

}
