package com.loxwalk.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import com.loxwalk.lox.Interpreter;
import com.loxwalk.lox.Lox;

public class LoxTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Interpreter interp = null;

    @Test
    public void testSuccessfulScript() throws IOException {
        File script = script("ok.lox", "var a = 3;\nprint a * 2;\n");
        assertEquals(Lox.EXIT_OK, Lox.runFile(script.getPath(), bufferedInterpreter()));
        assertEquals("6\n", interp.printBuf.toString());
        assertEquals("", interp.errorBuf.toString());
    }

    @Test
    public void testParseErrorExitCode() throws IOException {
        File script = script("bad.lox", "print 1;\nprint ;\n");
        assertEquals(Lox.EXIT_DATAERR, Lox.runFile(script.getPath(), bufferedInterpreter()));
        assertEquals("", interp.printBuf.toString());
        assertEquals("[line 2] Error at ';': Expected expression.\n", interp.errorBuf.toString());
    }

    @Test
    public void testScanErrorExitCode() throws IOException {
        File script = script("scan.lox", "print \"open;\n");
        assertEquals(Lox.EXIT_DATAERR, Lox.runFile(script.getPath(), bufferedInterpreter()));
    }

    @Test
    public void testRuntimeErrorExitCode() throws IOException {
        File script = script("boom.lox", "print \"before\";\nprint -nil;\nprint \"after\";\n");
        assertEquals(Lox.EXIT_SOFTWARE, Lox.runFile(script.getPath(), bufferedInterpreter()));
        assertEquals("before\n", interp.printBuf.toString());
        assertEquals("Operand of '-' must be a number.\n[line 2]\n", interp.errorBuf.toString());
    }

    @Test
    public void testMissingScript() throws IOException {
        String path = new File(folder.getRoot(), "nope.lox").getPath();
        assertEquals(Lox.EXIT_NOINPUT, Lox.runFile(path, bufferedInterpreter()));
        assertEquals(Lox.EXIT_NOINPUT, Lox.run(new String[] { path }));
    }

    @Test
    public void testDirectoryIsNotAScript() throws IOException {
        assertEquals(Lox.EXIT_NOINPUT, Lox.run(new String[] { "-f", folder.getRoot().getPath() }));
    }

    @Test
    public void testUsageErrors() throws IOException {
        assertEquals(Lox.EXIT_USAGE, Lox.run(new String[] { "-x" }));
        assertEquals(Lox.EXIT_USAGE, Lox.run(new String[] { "a.lox", "b.lox" }));
        assertEquals(Lox.EXIT_USAGE, Lox.run(new String[] { "-f" }));
    }

    @Test
    public void testCommandLineForms() throws IOException {
        File script = script("quiet.lox", "var unused = 1;\n");
        assertEquals(Lox.EXIT_OK, Lox.run(new String[] { script.getPath() }));
        assertEquals(Lox.EXIT_OK, Lox.run(new String[] { "-f", script.getPath() }));
        assertEquals(Lox.EXIT_OK, Lox.run(new String[] { "-D", "none", script.getPath() }));
    }

    @Test
    public void testDebugKeysDoNotOutliveARun() throws IOException {
        File script = script("dbg.lox", "var a = 1;\n");
        String first = captureStderr(new String[] { "-D", "ast", script.getPath() });
        assertTrue(first.contains("[DEBUG] (ast): "));

        String second = captureStderr(new String[] { script.getPath() });
        assertFalse(second.contains("[DEBUG]"));
    }

    @Test
    public void testDeeplyNestedScriptIsAStaticError() throws IOException {
        StringBuilder src = new StringBuilder("print ");
        for (int i = 0; i < 50000; i++) src.append("(");
        src.append("1");
        for (int i = 0; i < 50000; i++) src.append(")");
        src.append(";\n");
        File script = script("deep.lox", src.toString());
        assertEquals(Lox.EXIT_DATAERR, Lox.runFile(script.getPath(), bufferedInterpreter()));
        assertTrue(interp.errorBuf.toString().contains("Too much nesting."));
    }

    @Test
    public void testExitCodesFollowSysexits() {
        assertEquals(0, Lox.EXIT_OK);
        assertEquals(64, Lox.EXIT_USAGE);
        assertEquals(65, Lox.EXIT_DATAERR);
        assertEquals(66, Lox.EXIT_NOINPUT);
        assertEquals(70, Lox.EXIT_SOFTWARE);
        assertEquals(74, Lox.EXIT_IOERR);
        assertTrue(Lox.EXIT_DATAERR != Lox.EXIT_SOFTWARE);
    }

    private String captureStderr(String[] args) throws IOException {
        PrintStream saved = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err, true, "UTF-8"));
        try {
            assertEquals(Lox.EXIT_OK, Lox.run(args));
        } finally {
            System.setErr(saved);
        }
        return err.toString("UTF-8");
    }

    private File script(String name, String src) throws IOException {
        File file = folder.newFile(name);
        Files.write(file.toPath(), src.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private Interpreter bufferedInterpreter() {
        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)true);
        opts.put("useErrorBuf", (Boolean)true);
        this.interp = new Interpreter(opts);
        return this.interp;
    }
}
