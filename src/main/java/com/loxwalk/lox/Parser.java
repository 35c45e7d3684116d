package com.loxwalk.lox;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.loxwalk.lox.TokenType.*;

/*
 * Grammar:
 * low prec
 * to
 * high prec
 *
 * program        : declaration* EOF ;
 * declaration    : classDecl
 *                | funDecl
 *                | varDecl
 *                | statement ;
 *
 * classDecl      : "class" IDENTIFIER ( "<" IDENTIFIER )? "{" function* "}" ;
 * funDecl        : "fun" function ;
 * function       : IDENTIFIER "(" parameters? ")" block ;
 * parameters     : IDENTIFIER ( "," IDENTIFIER )* ;
 * varDecl        : "var" IDENTIFIER ( "=" expression )? ";" ;
 *
 * statement      : exprStmt
 *                | forStmt
 *                | ifStmt
 *                | printStmt
 *                | returnStmt
 *                | breakStmt
 *                | whileStmt
 *                | block ;
 *
 * exprStmt       : expression ";" ;
 * forStmt        : "for" "(" ( varDecl | exprStmt | ";" ) expression? ";" expression? ")" statement ;
 * ifStmt         : "if" "(" expression ")" statement ( "else" statement )? ;
 * printStmt      : "print" expression ";" ;
 * returnStmt     : "return" expression? ";" ;
 * breakStmt      : "break" ";" ;
 * whileStmt      : "while" "(" expression ")" statement ;
 * block          : "{" declaration* "}" ;
 *
 * expression     : assignment ;
 * assignment     : ( call "." )? IDENTIFIER "=" assignment
 *                | logic_or ;
 * logic_or       : logic_and ( "or" logic_and )* ;
 * logic_and      : equality ( "and" equality )* ;
 * equality       : comparison ( ( "!=" | "==" ) comparison )* ;
 * comparison     : term ( ( ">" | ">=" | "<" | "<=" ) term )* ;
 * term           : factor ( ( "-" | "+" ) factor )* ;
 * factor         : unary ( ( "/" | "*" ) unary )* ;
 * unary          : ( "!" | "-" ) unary
 *                | call ;
 * call           : primary ( "(" arguments? ")" | "." IDENTIFIER )* ;
 * arguments      : expression ( "," expression )* ;
 * primary        : NUMBER | STRING | "false" | "true" | "nil" | "this"
 *                | "super" "." IDENTIFIER | IDENTIFIER | "(" expression ")" ;
 */
public class Parser {
    static class ParseError extends RuntimeException {}

    static final int MAX_ARGS = 255;

    enum FunctionType {
        NONE,
        FUNCTION,
        METHOD,
        INITIALIZER
    }

    enum ClassType {
        NONE,
        CLASS,
        SUBCLASS
    }

    private final List<Token> tokens;
    private final ErrorReporter reporter;
    private int current = 0;
    private FunctionType currentFn = FunctionType.NONE;
    private ClassType currentClass = ClassType.NONE;
    private int loopDepth = 0;

    public Parser(List<Token> tokens, ErrorReporter reporter) {
        this.tokens = tokens;
        this.reporter = reporter;
    }

    // A source that fails to scan is not parsed: the parser only sees EOF.
    public static Parser newFromSource(String source, ErrorReporter reporter) {
        int errorsBefore = reporter.errorCount();
        Scanner scanner = new Scanner(source, reporter);
        List<Token> tokens = scanner.scanTokens();
        if (reporter.errorCount() > errorsBefore) {
            tokens = tokens.subList(tokens.size() - 1, tokens.size());
        }
        return new Parser(tokens, reporter);
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                Stmt decl = declaration();
                if (decl != null) {
                    statements.add(decl);
                }
            }
        } catch (StackOverflowError err) {
            // the rest of the input is left unparsed
            reporter.error(peekTok(), "Too much nesting.");
        }
        return statements;
    }

    private Stmt declaration() {
        try {
            if (matchAny(CLASS)) return classDeclaration();
            if (matchAny(FUN)) return function(FunctionType.FUNCTION);
            if (matchAny(VAR)) return varDeclaration();
            return statement();
        } catch (ParseError error) {
            synchronize();
            return null;
        }
    }

    private Stmt classDeclaration() {
        Token name = consumeTok(IDENTIFIER, "Expected class name after 'class' keyword.");
        Expr.Variable superclass = null;
        if (matchAny(LESS)) {
            Token superName = consumeTok(IDENTIFIER, "Expected superclass name after '<'.");
            if (superName.lexeme.equals(name.lexeme)) {
                error(superName, "A class can't inherit from itself.");
            }
            superclass = new Expr.Variable(superName);
        }
        consumeTok(LEFT_BRACE, "Expected '{' before class body.");

        ClassType enclosingClass = this.currentClass;
        this.currentClass = superclass == null ? ClassType.CLASS : ClassType.SUBCLASS;
        List<Stmt.Function> methods = new ArrayList<>();
        try {
            while (!checkTok(RIGHT_BRACE) && !isAtEnd()) {
                Token methodName = peekTok();
                FunctionType fnType = methodName.lexeme.equals("init") ?
                    FunctionType.INITIALIZER : FunctionType.METHOD;
                methods.add(function(fnType));
            }
        } finally {
            this.currentClass = enclosingClass;
        }
        consumeTok(RIGHT_BRACE, "Expected '}' after class body.");
        return new Stmt.Class(name, superclass, methods);
    }

    private Stmt.Function function(FunctionType fnType) {
        String kind = fnType == FunctionType.FUNCTION ? "function" : "method";
        Token name = consumeTok(IDENTIFIER, "Expected " + kind + " name.");
        consumeTok(LEFT_PAREN, "Expected '(' after " + kind + " name.");
        List<Token> params = new ArrayList<>();
        if (!checkTok(RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_ARGS) {
                    error(peekTok(), "Can't have more than " + MAX_ARGS + " parameters.");
                }
                params.add(consumeTok(IDENTIFIER, "Expected parameter name."));
            } while (matchAny(COMMA));
        }
        consumeTok(RIGHT_PAREN, "Expected ')' after parameters.");
        consumeTok(LEFT_BRACE, "Expected '{' before " + kind + " body.");

        FunctionType enclosingFn = this.currentFn;
        int enclosingLoopDepth = this.loopDepth;
        List<Stmt> body;
        try {
            this.currentFn = fnType;
            // a loop around the declaration is not a target for 'break' inside the body
            this.loopDepth = 0;
            body = blockStmts();
        } finally {
            this.currentFn = enclosingFn;
            this.loopDepth = enclosingLoopDepth;
        }
        return new Stmt.Function(name, params, body);
    }

    private Stmt varDeclaration() {
        Token name = consumeTok(IDENTIFIER, "Expected variable name after 'var' keyword.");

        Expr initializer = null;
        if (matchAny(EQUAL)) {
            initializer = expression();
        }

        consumeTok(SEMICOLON, "Expected ';' after variable declaration.");
        return new Stmt.Var(name, initializer);
    }

    private Stmt statement() {
        if (matchAny(FOR)) return forStatement();
        if (matchAny(IF)) return ifStatement();
        if (matchAny(PRINT)) return printStatement();
        if (matchAny(RETURN)) return returnStatement();
        if (matchAny(BREAK)) return breakStatement();
        if (matchAny(WHILE)) return whileStatement();
        if (matchAny(LEFT_BRACE)) return new Stmt.Block(blockStmts());
        return expressionStatement();
    }

    // for (init; cond; incr) body  =>  { init; while (cond) { body; incr; } }
    private Stmt forStatement() {
        consumeTok(LEFT_PAREN, "Expected '(' after keyword 'for'.");
        Stmt initializer;
        if (matchAny(SEMICOLON)) {
            initializer = null;
        } else if (matchAny(VAR)) {
            initializer = varDeclaration();
        } else {
            initializer = expressionStatement();
        }

        Expr condition = null;
        if (!checkTok(SEMICOLON)) {
            condition = expression();
        }
        consumeTok(SEMICOLON, "Expected ';' after loop condition.");

        Expr increment = null;
        if (!checkTok(RIGHT_PAREN)) {
            increment = expression();
        }
        consumeTok(RIGHT_PAREN, "Expected ')' after for clauses.");

        Stmt body = loopBody();

        if (increment != null) {
            body = new Stmt.Block(Arrays.asList(body, new Stmt.Expression(increment)));
        }
        if (condition == null) {
            condition = new Expr.Literal(true);
        }
        body = new Stmt.While(condition, body);
        if (initializer != null) {
            body = new Stmt.Block(Arrays.asList(initializer, body));
        }
        return body;
    }

    private Stmt ifStatement() {
        consumeTok(LEFT_PAREN, "Expected '(' after keyword 'if'.");
        Expr condition = expression();
        consumeTok(RIGHT_PAREN, "Expected ')' after condition in 'if' statement.");
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (matchAny(ELSE)) {
            elseBranch = statement();
        }
        return new Stmt.If(condition, thenBranch, elseBranch);
    }

    private Stmt printStatement() {
        Expr value = expression();
        consumeTok(SEMICOLON, "Expected ';' after 'print' expression.");
        return new Stmt.Print(value);
    }

    private Stmt returnStatement() {
        Token keyword = prevTok();
        if (currentFn == FunctionType.NONE) {
            error(keyword, "Can't return from top-level code.");
        }
        Expr value = null;
        if (!checkTok(SEMICOLON)) {
            if (currentFn == FunctionType.INITIALIZER) {
                error(keyword, "Can't return a value from an initializer.");
            }
            value = expression();
        }
        consumeTok(SEMICOLON, "Expected ';' after return value.");
        return new Stmt.Return(keyword, value);
    }

    private Stmt breakStatement() {
        Token keyword = prevTok();
        if (loopDepth == 0) {
            error(keyword, "Can't use 'break' outside of a loop.");
        }
        consumeTok(SEMICOLON, "Expected ';' after keyword 'break'.");
        return new Stmt.Break(keyword);
    }

    private Stmt whileStatement() {
        consumeTok(LEFT_PAREN, "Expected '(' after keyword 'while'.");
        Expr condition = expression();
        consumeTok(RIGHT_PAREN, "Expected ')' after 'while' condition.");
        Stmt body = loopBody();
        return new Stmt.While(condition, body);
    }

    private Stmt loopBody() {
        loopDepth++;
        try {
            return statement();
        } finally {
            loopDepth--;
        }
    }

    private List<Stmt> blockStmts() {
        List<Stmt> statements = new ArrayList<>();
        while (!checkTok(RIGHT_BRACE) && !isAtEnd()) {
            Stmt decl = declaration();
            if (decl != null) {
                statements.add(decl);
            }
        }
        consumeTok(RIGHT_BRACE, "Expected '}' after block.");
        return statements;
    }

    private Stmt expressionStatement() {
        Expr value = expression();
        consumeTok(SEMICOLON, "Expected ';' after expression.");
        return new Stmt.Expression(value);
    }

    private Expr expression() {
        return assignment();
    }

    private Expr assignment() {
        Expr expr = logicOr();
        if (matchAny(EQUAL)) {
            Token equals = prevTok();
            Expr value = assignment();
            if (expr instanceof Expr.Variable) {
                Token name = ((Expr.Variable)expr).name;
                return new Expr.Assign(name, value);
            } else if (expr instanceof Expr.Get) {
                Expr.Get get = (Expr.Get)expr;
                return new Expr.Set(get.object, get.name, value);
            }
            // reported but not thrown: the parser is not confused, just the target
            error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr logicOr() {
        Expr expr = logicAnd();
        while (matchAny(OR)) {
            Token operator = prevTok();
            Expr right = logicAnd();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    private Expr logicAnd() {
        Expr expr = equality();
        while (matchAny(AND)) {
            Token operator = prevTok();
            Expr right = equality();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    private Expr equality() {
        Expr expr = comparison();

        while (matchAny(BANG_EQUAL, EQUAL_EQUAL)) {
            Token operator = prevTok();
            Expr right = comparison();
            expr = new Expr.Binary(expr, operator, right);
        }

        return expr;
    }

    private Expr comparison() {
        Expr expr = term();

        while (matchAny(GREATER, GREATER_EQUAL,
                    LESS, LESS_EQUAL)) {
            Token operator = prevTok();
            Expr right = term();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr term() {
        Expr expr = factor();

        while (matchAny(MINUS, PLUS)) {
            Token operator = prevTok();
            Expr right = factor();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr factor() {
        Expr expr = unary();

        while (matchAny(STAR, SLASH)) {
            Token operator = prevTok();
            Expr right = unary();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr unary() {
        if (matchAny(BANG, MINUS)) {
            Token operator = prevTok();
            Expr right = unary();
            return new Expr.Unary(operator, right);
        }

        return call();
    }

    private Expr call() {
        Expr expr = primary();
        while (true) {
            if (matchAny(LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (matchAny(DOT)) {
                Token name = consumeTok(IDENTIFIER, "Expected property name after '.'.");
                expr = new Expr.Get(expr, name);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expr finishCall(Expr callee) {
        List<Expr> args = new ArrayList<>();
        if (!checkTok(RIGHT_PAREN)) {
            do {
                if (args.size() >= MAX_ARGS) {
                    error(peekTok(), "Can't have more than " + MAX_ARGS + " arguments.");
                }
                args.add(expression());
            } while (matchAny(COMMA));
        }
        Token paren = consumeTok(RIGHT_PAREN, "Expected ')' after arguments.");
        return new Expr.Call(callee, paren, args);
    }

    private Expr primary() {
        if (matchAny(FALSE)) return new Expr.Literal(false);
        if (matchAny(TRUE)) return new Expr.Literal(true);
        if (matchAny(NIL)) return new Expr.Literal(null);

        if (matchAny(NUMBER, STRING)) {
            return new Expr.Literal(prevTok().literal);
        }

        if (matchAny(THIS)) {
            Token keyword = prevTok();
            if (currentClass == ClassType.NONE) {
                error(keyword, "Can't use 'this' outside of a class.");
            }
            return new Expr.This(keyword);
        }

        if (matchAny(SUPER)) {
            Token keyword = prevTok();
            if (currentClass == ClassType.NONE) {
                error(keyword, "Can't use 'super' outside of a class.");
            } else if (currentClass != ClassType.SUBCLASS) {
                error(keyword, "Can't use 'super' in a class with no superclass.");
            }
            consumeTok(DOT, "Expected '.' after 'super' keyword.");
            Token method = consumeTok(IDENTIFIER, "Expected superclass method name after 'super.'.");
            return new Expr.Super(keyword, method);
        }

        if (matchAny(IDENTIFIER)) {
            return new Expr.Variable(prevTok());
        }

        if (matchAny(LEFT_PAREN)) {
            Expr expr = expression();
            consumeTok(RIGHT_PAREN, "Expected ')' after group expression.");
            return new Expr.Grouping(expr);
        }

        throw error(peekTok(), "Expected expression.");
    }

    private boolean matchAny(TokenType... ttypes) {
        for (TokenType ttype : ttypes) {
            if (checkTok(ttype)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private Token consumeTok(TokenType ttype, String msg) {
        if (checkTok(ttype)) {
            return advance();
        }
        throw error(peekTok(), msg);
    }

    private boolean checkTok(TokenType ttype) {
        if (isAtEnd()) return false;
        return peekTok().type == ttype;
    }

    private Token peekTok() {
        return tokens.get(current);
    }

    private Token prevTok() {
        if (current == 0) return peekTok();
        return tokens.get(current - 1);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return prevTok();
    }

    private boolean isAtEnd() {
        return peekTok().type == EOF;
    }

    private ParseError error(Token token, String msg) {
        reporter.error(token, msg);
        return new ParseError();
    }

    private void synchronize() {
        advance();

        while (!isAtEnd()) {
            if (prevTok().type == SEMICOLON) return;

            switch (peekTok().type) {
                case CLASS:
                case FUN:
                case VAR:
                case FOR:
                case IF:
                case WHILE:
                case PRINT:
                case RETURN:
                case BREAK:
                    return;
                default:
                    break;
            }

            advance();
        }
    }
}
