package com.loxwalk.lox;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;

import jline.console.ConsoleReader;

public class Lox {
    // sysexits.h
    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 64;
    public static final int EXIT_DATAERR = 65;
    public static final int EXIT_NOINPUT = 66;
    public static final int EXIT_SOFTWARE = 70;
    public static final int EXIT_IOERR = 74;

    private static final String USAGE = "Usage: lox [-D KEYS] [-f FILENAME | FILENAME]";
    private static final String PROMPT = "> ";

    public static void main(String[] args) throws IOException {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    public static int run(String[] args) throws IOException {
        String fname = null;
        String debugKeysStr = null;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length && fname == null) {
                fname = args[i+1];
                i += 2;
            } else if (args[i].equals("-D") && i + 1 < args.length) {
                debugKeysStr = args[i+1];
                i += 2;
            } else if (!args[i].startsWith("-") && fname == null) {
                fname = args[i];
                i += 1;
            } else {
                System.err.println(USAGE);
                return EXIT_USAGE;
            }
        }

        // debug keys belong to this invocation only
        LoxUtil.debugKeys.clear();
        if (debugKeysStr != null) {
            for (String key : debugKeysStr.split(",")) {
                if (!key.isEmpty()) {
                    LoxUtil.debugKeys.add(key);
                }
            }
        }

        if (fname == null) {
            runPrompt(new Interpreter());
            return EXIT_OK;
        }
        return runFile(fname, new Interpreter());
    }

    // Runs a whole script and maps the outcome to an exit code.
    public static int runFile(String path, Interpreter interpreter) {
        File file = new File(path);
        if (!file.exists() || file.isDirectory()) {
            System.err.println("Script file '" + path + "' not found.");
            return EXIT_NOINPUT;
        }
        String src;
        try {
            src = LoxUtil.readFile(path);
        } catch (IOException e) {
            System.err.println("Error reading script file '" + path + "': " + e.getMessage());
            return EXIT_IOERR;
        }
        interpreter.interpret(src);
        return exitCode(interpreter);
    }

    static int exitCode(Interpreter interpreter) {
        if (interpreter.hadError()) return EXIT_DATAERR;
        if (interpreter.hadRuntimeError()) return EXIT_SOFTWARE;
        return EXIT_OK;
    }

    private static void runPrompt(Interpreter interpreter) throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput());
        reader.setPrompt(PROMPT);

        StringBuilder pending = new StringBuilder();
        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            if (pending.length() == 0 && (line.equals("exit") || line.equals("quit"))) {
                break;
            }
            if (line.equals("cls")) {
                reader.clearScreen();
                out.println(""); // avoid double-prompt at next input
                out.flush();
                continue;
            }
            pending.append(line).append("\n");

            int depth = openBlocks(pending.toString());
            if (depth > 0) {
                StringBuilder prompt = new StringBuilder(PROMPT);
                for (int i = 0; i < depth; i++) {
                    prompt.append("  ");
                }
                reader.setPrompt(prompt.toString());
                continue;
            }

            // errors were already printed; globals survive into the next input
            interpreter.interpret(pending.toString());
            interpreter.getReporter().reset();
            pending.setLength(0);
            reader.setPrompt(PROMPT);
        }
    }

    // Scans without reporting, just to see whether braces are still open.
    static int openBlocks(String src) {
        ErrorReporter quiet = new ErrorReporter();
        quiet.setSilenced(true);
        Scanner scanner = new Scanner(src, quiet);
        scanner.scanTokens();
        return scanner.openBlocks();
    }
}
