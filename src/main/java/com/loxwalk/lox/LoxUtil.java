package com.loxwalk.lox;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

class LoxUtil {
    // given with the -D flag, comma-separated. Set once at startup.
    static final Set<String> debugKeys = new HashSet<>();

    static String readFile(String path) throws IOException {
        byte[] encoded = Files.readAllBytes(Paths.get(path));
        return new String(encoded, StandardCharsets.UTF_8);
    }

    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
            (c >= 'A' && c <= 'Z') ||
            c == '_';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    static boolean isDebugEnabled(String key) {
        return debugKeys.contains(key);
    }

    static void debug(String key, String msg) {
        if (isDebugEnabled(key)) {
            System.err.println("[DEBUG] (" + key + "): " + msg);
        }
    }

}
