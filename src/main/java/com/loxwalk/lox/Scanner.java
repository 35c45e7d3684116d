package com.loxwalk.lox;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.loxwalk.lox.TokenType.*;

public class Scanner {
    private final String source;
    private final ErrorReporter reporter;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    // depth of unclosed '{', the REPL keeps reading lines while this is > 0
    private int inBlock = 0;

    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("and",    AND);
        keywords.put("break",  BREAK);
        keywords.put("class",  CLASS);
        keywords.put("else",   ELSE);
        keywords.put("false",  FALSE);
        keywords.put("for",    FOR);
        keywords.put("fun",    FUN);
        keywords.put("if",     IF);
        keywords.put("nil",    NIL);
        keywords.put("or",     OR);
        keywords.put("print",  PRINT);
        keywords.put("return", RETURN);
        keywords.put("super",  SUPER);
        keywords.put("this",   THIS);
        keywords.put("true",   TRUE);
        keywords.put("var",    VAR);
        keywords.put("while",  WHILE);
    }

    public Scanner(String source, ErrorReporter reporter) {
        this.source = source;
        this.reporter = reporter;
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            // We are at the beginning of the next lexeme.
            start = current;
            scanToken();
        }
        tokens.add(new Token(EOF, "", null, line));
        return tokens;
    }

    public int openBlocks() {
        return inBlock;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(LEFT_PAREN); break;
            case ')': addToken(RIGHT_PAREN); break;
            case '{': addToken(LEFT_BRACE); inBlock++; break;
            case '}': addToken(RIGHT_BRACE); inBlock--; break;
            case ',': addToken(COMMA); break;
            case '.': addToken(DOT); break;
            case '-': addToken(MINUS); break;
            case '+': addToken(PLUS); break;
            case ';': addToken(SEMICOLON); break;
            case '*': addToken(STAR); break;
            case '!': addToken(match('=') ? BANG_EQUAL : BANG); break;
            case '=': addToken(match('=') ? EQUAL_EQUAL : EQUAL); break;
            case '<': addToken(match('=') ? LESS_EQUAL : LESS); break;
            case '>': addToken(match('=') ? GREATER_EQUAL : GREATER); break;
            case '/': {
                if (match('/')) { // single-line comment (// ...)
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) { // multi-line comment (/* ... */)
                    blockComment();
                } else {
                    addToken(SLASH);
                }
                break;
            }
            case ' ':
            case '\r':
            case '\t':
                // Ignore whitespace.
                break;

            case '\n':
                line++;
                break;
            case '"': string(); break;
            default:
                if (LoxUtil.isDigit(c)) {
                    number();
                } else if (LoxUtil.isAlpha(c)) {
                    identifier();
                } else {
                    reporter.error(line, "Unexpected character.");
                }
                break;
        }
    }

    private char advance() {
        current++;
        return source.charAt(current - 1);
    }

    private void blockComment() {
        boolean seenStar = false;
        while (!isAtEnd()) {
            char ch = peek();
            if (seenStar && ch == '/') {
                advance();
                return;
            }
            if (ch == '\n') {
                line++;
            }
            seenStar = (ch == '*');
            advance();
        }
    }

    private void identifier() {
        while (LoxUtil.isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType ttype = keywords.get(text);
        if (ttype == null) {
            ttype = IDENTIFIER;
        }
        addToken(ttype);
    }

    // Strings end on the same line they start on.
    private void string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            advance();
        }

        if (peek() != '"') {
            reporter.error(line, "Unterminated string.");
            return;
        }

        // The closing ".
        advance();

        // Trim the surrounding quotes.
        String value = source.substring(start + 1, current - 1);
        addToken(STRING, value);
    }

    private void number() {
        while (LoxUtil.isDigit(peek())) advance();

        // Look for a fractional part.
        if (peek() == '.' && LoxUtil.isDigit(peekNext())) {
            // Consume the "."
            advance();

            while (LoxUtil.isDigit(peek())) advance();
        }

        addToken(NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void addToken(TokenType ttype) {
        addToken(ttype, null);
    }

    private void addToken(TokenType ttype, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(ttype, text, literal, line));
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        } else {
            return source.charAt(current);
        }
    }

    private char peekNext() {
        if ((current + 1) >= source.length()) {
            return '\0';
        } else {
            return source.charAt(current + 1);
        }
    }

    private boolean match(char c) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != c) return false;
        current++;
        return true;
    }

}
