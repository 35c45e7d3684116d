package com.loxwalk.lox;

import java.util.List;

/**
 * Renders parsed statements as indented s-expressions. Only used for
 * debugging (the "ast" debug key) and in tests; never needed to run a program.
 */
public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
    private int indent = 0;

    public static String PARSE_ERROR = "!error!";

    public AstPrinter() {
    }

    // Parses the source with a silenced reporter; returns PARSE_ERROR when
    // scanning or parsing failed.
    public static String print(String src) {
        ErrorReporter reporter = new ErrorReporter();
        reporter.setSilenced(true);
        Parser parser = Parser.newFromSource(src, reporter);
        List<Stmt> statements = parser.parse();
        if (reporter.hadError()) {
            return PARSE_ERROR;
        }
        return new AstPrinter().stmtsToString(statements);
    }

    public String stmtsToString(List<Stmt> stmts) {
        StringBuilder builder = new StringBuilder();
        for (Stmt stmt : stmts) {
            builder.append(stmt.accept(this));
            builder.append("\n");
        }
        return builder.toString();
    }

    public String exprToString(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitExpressionStmt(Stmt.Expression stmt) {
        return indent() + exprToString(stmt.expression);
    }

    @Override
    public String visitPrintStmt(Stmt.Print stmt) {
        return indent() + parenthesize("print", stmt.expression);
    }

    @Override
    public String visitVarStmt(Stmt.Var stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(varDecl " + stmt.name.lexeme);
        if (stmt.initializer != null) {
            builder.append(" " + stmt.initializer.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitBlockStmt(Stmt.Block blockStmt) {
        return block("block", blockStmt.statements);
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(if " + stmt.condition.accept(this) + "\n");
        indent++;
        builder.append(stmt.thenBranch.accept(this));
        if (stmt.elseBranch != null) {
            builder.append("\n" + stmt.elseBranch.accept(this));
        }
        indent--;
        builder.append("\n" + indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitWhileStmt(Stmt.While stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(while " + stmt.condition.accept(this) + "\n");
        indent++;
        builder.append(stmt.body.accept(this));
        indent--;
        builder.append("\n" + indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitBreakStmt(Stmt.Break stmt) {
        return indent() + "(break)";
    }

    @Override
    public String visitFunctionStmt(Stmt.Function stmt) {
        StringBuilder header = new StringBuilder("fnDecl " + stmt.name.lexeme);
        for (Token param : stmt.params) {
            header.append(" " + param.lexeme);
        }
        return block(header.toString(), stmt.body);
    }

    @Override
    public String visitClassStmt(Stmt.Class stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(classDecl " + stmt.name.lexeme);
        if (stmt.superclass != null) {
            builder.append(" < " + stmt.superclass.name.lexeme);
        }
        if (stmt.methods.size() == 0) {
            return builder.append(")").toString();
        }
        builder.append("\n");
        indent++;
        for (Stmt method : stmt.methods) {
            builder.append(method.accept(this));
            builder.append("\n");
        }
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    @Override
    public String visitReturnStmt(Stmt.Return stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(return");
        if (stmt.value != null) {
            builder.append(" " + stmt.value.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitLogicalExpr(Expr.Logical expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return parenthesize("group", expr.expression);
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        if (expr.value == null) return "nil";
        if (expr.value instanceof String) {
            return "\"" + expr.value.toString() + "\"";
        } else {
            return expr.value.toString();
        }
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return parenthesize(expr.operator.lexeme, expr.right);
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return "(var " + expr.name.lexeme + ")";
    }

    @Override
    public String visitAssignExpr(Expr.Assign expr) {
        StringBuilder builder = new StringBuilder();
        builder.append("(assign ").append(expr.name.lexeme + " ").
            append(expr.value.accept(this)).append(")");
        return builder.toString();
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        StringBuilder builder = new StringBuilder();
        builder.append("(call " + expr.callee.accept(this));
        for (Expr arg : expr.arguments) {
            builder.append(" " + arg.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitGetExpr(Expr.Get expr) {
        return "(prop " + expr.object.accept(this) + " " + expr.name.lexeme + ")";
    }

    @Override
    public String visitSetExpr(Expr.Set expr) {
        StringBuilder builder = new StringBuilder();
        builder.append("(propSet " + expr.object.accept(this) + " ");
        builder.append(expr.name.lexeme + " " +  expr.value.accept(this) + ")");
        return builder.toString();
    }

    @Override
    public String visitThisExpr(Expr.This expr) {
        return "(this)";
    }

    @Override
    public String visitSuperExpr(Expr.Super expr) {
        return "(super " + expr.method.lexeme + ")";
    }

    private String block(String header, List<Stmt> statements) {
        StringBuilder builder = new StringBuilder();
        if (statements.size() == 0) {
            return builder.append(indent() + "(" + header + ")").toString();
        }
        builder.append(indent() + "(" + header + "\n");
        indent++;
        for (Stmt stmt : statements) {
            builder.append(stmt.accept(this));
            builder.append("\n");
        }
        indent--;
        builder.append(indent() + ")");
        return builder.toString();
    }

    private String parenthesize(String name, Expr... exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append("(").append(name);
        for (Expr expr : exprs) {
            builder.append(" ");
            builder.append(expr.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    private String indent() {
        StringBuilder builder = new StringBuilder();
        int i = indent;
        while (i > 0) {
            builder.append("  ");
            i--;
        }
        return builder.toString();
    }

}
