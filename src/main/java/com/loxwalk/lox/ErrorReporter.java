package com.loxwalk.lox;

/**
 * Formats and counts diagnostics for one interpreter. Scan and parse errors
 * set {@link #hadError()}, runtime errors set {@link #hadRuntimeError()}.
 * Output goes to the given buffer, or stderr when there is none.
 */
public class ErrorReporter {
    private final StringBuffer errorBuf;
    private boolean silenced = false;
    private boolean hadError = false;
    private int errorCount = 0;
    private boolean hadRuntimeError = false;

    public ErrorReporter() {
        this(null);
    }

    public ErrorReporter(StringBuffer errorBuf) {
        this.errorBuf = errorBuf;
    }

    // lex error
    public void error(int line, String message) {
        report(line, "", message);
    }

    // parse error
    public void error(Token tok, String message) {
        if (tok.type == TokenType.EOF) {
            report(tok.line, " at end", message);
        } else {
            report(tok.line, " at '" + tok.lexeme + "'", message);
        }
    }

    public void report(int line, String where, String message) {
        println("[line " + line + "] Error" + where + ": " + message);
        hadError = true;
        errorCount++;
    }

    public void runtimeError(RuntimeError error, String stacktrace) {
        StringBuilder builder = new StringBuilder();
        builder.append(error.getMessage());
        if (error.token != null) {
            builder.append("\n[line ").append(error.token.line).append("]");
        }
        if (stacktrace != null && !stacktrace.isEmpty()) {
            builder.append("\nStacktrace:\n").append(stacktrace);
        }
        println(builder.toString());
        hadRuntimeError = true;
    }

    public boolean hadError() {
        return hadError;
    }

    // scan and parse errors reported so far, across resets
    public int errorCount() {
        return errorCount;
    }

    public boolean hadRuntimeError() {
        return hadRuntimeError;
    }

    // The REPL keeps going after an error, so each line starts clean.
    public void reset() {
        hadError = false;
        hadRuntimeError = false;
    }

    public void setSilenced(boolean silenced) {
        this.silenced = silenced;
    }

    private void println(String msg) {
        if (silenced) {
            return;
        }
        if (errorBuf != null) {
            errorBuf.append(msg).append("\n");
        } else {
            System.err.println(msg);
        }
    }
}
