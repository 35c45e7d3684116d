package com.loxwalk.lox;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

public class Interpreter implements Expr.Visitor<Object>, Stmt.Visitor<Completion> {
    // frames shown in a runtime error's stack trace, innermost first
    static final int MAX_TRACE_FRAMES = 20;

    final Environment globals = new Environment();
    final Runtime runtime;
    private Environment environment = globals;
    private final ErrorReporter reporter;

    public Map<String, Object> options = null;
    public StringBuffer printBuf = null;
    public StringBuffer errorBuf = null;

    Stack<StackFrame> stack = new Stack<>();

    public Interpreter() {
        this(defaultOptions());
    }

    public Interpreter(Map<String, Object> options) {
        this.options = options;
        if (this.options.get("usePrintBuf") == (Boolean)true) {
            this.printBuf = new StringBuffer();
        }
        if (this.options.get("useErrorBuf") == (Boolean)true) {
            this.errorBuf = new StringBuffer();
        }
        this.reporter = new ErrorReporter(errorBuf);
        this.runtime = Runtime.create(globals);
        this.runtime.init();
    }

    private static Map<String, Object> defaultOptions() {
        Map<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)false);
        opts.put("useErrorBuf", (Boolean)false);
        return opts;
    }

    public ErrorReporter getReporter() {
        return reporter;
    }

    public boolean hadError() {
        return reporter.hadError();
    }

    public boolean hadRuntimeError() {
        return reporter.hadRuntimeError();
    }

    // Runs already-parsed statements against this interpreter's globals.
    // Stops at the first runtime error, which is reported, not thrown.
    public boolean interpret(List<Stmt> statements) {
        try {
            for (Stmt statement : statements) {
                execute(statement);
            }
            return true;
        } catch (RuntimeError error) {
            reporter.runtimeError(error, stacktrace());
        } catch (StackOverflowError err) {
            // exhausted outside any Lox call, so there is no call token to blame
            reporter.runtimeError(new RuntimeError(null, "Stack overflow."), stacktrace());
        } finally {
            stack.clear();
        }
        return false;
    }

    public boolean interpret(String src) {
        Parser parser = Parser.newFromSource(src, reporter);
        List<Stmt> stmts = parser.parse();
        if (reporter.hadError()) {
            return false;
        }
        if (LoxUtil.isDebugEnabled("ast")) {
            LoxUtil.debug("ast", "\n" + new AstPrinter().stmtsToString(stmts));
        }
        return interpret(stmts);
    }

    String stacktrace() {
        StringBuilder builder = new StringBuilder();
        int shown = 0;
        for (int i = stack.size() - 1; i >= 0 && shown < MAX_TRACE_FRAMES; i--, shown++) {
            builder.append("  ").append(stack.get(i).toString()).append("\n");
        }
        if (stack.size() > shown) {
            builder.append("  ... ").append(stack.size() - shown).append(" more frames\n");
        }
        return builder.toString();
    }

    @Override
    public Object visitLiteralExpr(Expr.Literal expr) {
        return expr.value;
    }

    @Override
    public Object visitGroupingExpr(Expr.Grouping expr) {
        return evaluate(expr.expression);
    }

    @Override
    public Object visitUnaryExpr(Expr.Unary expr) {
        Object right = evaluate(expr.right);

        switch (expr.operator.type) {
            case BANG:
                return !isTruthy(right);
            case MINUS:
                checkNumberOperand(expr.operator, right);
                return -(double)right;
            default:
                break;
        }

        throw unreachable(expr.operator, "visitUnaryExpr");
    }

    @Override
    public Object visitBinaryExpr(Expr.Binary expr) {
        Object left = evaluate(expr.left);
        Object right = evaluate(expr.right);

        switch (expr.operator.type) {
            case MINUS:
                checkNumberOperands(expr.operator, left, right);
                return (double)left - (double)right;
            case SLASH:
                // x/0 is +-Infinity or NaN, not an error
                checkNumberOperands(expr.operator, left, right);
                return (double)left / (double)right;
            case STAR:
                checkNumberOperands(expr.operator, left, right);
                return (double)left * (double)right;
            case PLUS:
                if (left instanceof Double && right instanceof Double) {
                    return (double)left + (double)right;
                }
                if (left instanceof String && right instanceof String) {
                    return (String)left + (String)right;
                }
                throw new RuntimeError(expr.operator,
                    "Operands of '+' must be two numbers or two strings, LHS=" +
                    nativeTypeof(left) + ", RHS=" + nativeTypeof(right) + ".");
            case GREATER:
                checkNumberOperands(expr.operator, left, right);
                return (double)left > (double)right;
            case GREATER_EQUAL:
                checkNumberOperands(expr.operator, left, right);
                return (double)left >= (double)right;
            case LESS:
                checkNumberOperands(expr.operator, left, right);
                return (double)left < (double)right;
            case LESS_EQUAL:
                checkNumberOperands(expr.operator, left, right);
                return (double)left <= (double)right;
            case BANG_EQUAL: return !isEqual(left, right);
            case EQUAL_EQUAL: return isEqual(left, right);
            default:
                break;
        }

        throw unreachable(expr.operator, "visitBinaryExpr");
    }

    @Override
    public Object visitLogicalExpr(Expr.Logical expr) {
        Object left = evaluate(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (isTruthy(left)) return left;
        } else {
            if (!isTruthy(left)) return left;
        }

        return evaluate(expr.right);
    }

    @Override
    public Object visitVariableExpr(Expr.Variable expr) {
        return environment.get(expr.name);
    }

    @Override
    public Object visitAssignExpr(Expr.Assign expr) {
        Object value = evaluate(expr.value);
        environment.assign(expr.name, value);
        return value;
    }

    @Override
    public Object visitThisExpr(Expr.This expr) {
        return environment.get(expr.keyword);
    }

    // 'super' is bound in the environment that encloses the methods of the
    // class that declared them, so lookup starts above the defining class and
    // not above the runtime class of 'this'.
    @Override
    public Object visitSuperExpr(Expr.Super expr) {
        LoxClass superclass = (LoxClass)environment.get(expr.keyword);
        Token thisTok = new Token(TokenType.THIS, "this", null, expr.keyword.line);
        LoxInstance instance = (LoxInstance)environment.get(thisTok);
        LoxFunction method = superclass.findMethod(expr.method.lexeme);
        if (method == null) {
            throw new RuntimeError(expr.method,
                "Undefined property '" + expr.method.lexeme + "'.");
        }
        return method.bind(instance);
    }

    @Override
    public Object visitCallExpr(Expr.Call expr) {
        Object callee = evaluate(expr.callee);

        List<Object> args = new ArrayList<>();
        for (Expr arg : expr.arguments) {
            args.add(evaluate(arg));
        }

        if (!(callee instanceof LoxCallable)) {
            throw new RuntimeError(expr.paren, "Can only call functions and classes.");
        }

        LoxCallable callable = (LoxCallable)callee;
        if (args.size() != callable.arity()) {
            throw new RuntimeError(expr.paren, "Expected " + callable.arity() +
                " arguments but got " + args.size() + ".");
        }
        return evaluateCall(callable, args, expr.paren);
    }

    Object evaluateCall(LoxCallable callable, List<Object> args, Token callToken) {
        LoxUtil.debug("call", callable.toString() + " with " + args.size() +
            " argument(s) at line " + callToken.line);
        stack.push(new StackFrame(callable, callToken));
        Object result;
        try {
            result = callable.call(this, args, callToken);
        } catch (StackOverflowError err) {
            throw new RuntimeError(callToken, "Stack overflow.");
        }
        // not in a finally clause: on error the frames stay for the stack trace
        stack.pop();
        return result;
    }

    @Override
    public Object visitGetExpr(Expr.Get expr) {
        Object obj = evaluate(expr.object);
        if (obj instanceof LoxInstance) {
            return ((LoxInstance)obj).get(expr.name);
        }
        throw new RuntimeError(expr.name, "Only instances have properties.");
    }

    @Override
    public Object visitSetExpr(Expr.Set expr) {
        Object obj = evaluate(expr.object);
        if (!(obj instanceof LoxInstance)) {
            throw new RuntimeError(expr.name, "Only instances have fields.");
        }
        Object value = evaluate(expr.value);
        ((LoxInstance)obj).set(expr.name, value);
        return value;
    }

    @Override
    public Completion visitExpressionStmt(Stmt.Expression stmt) {
        evaluate(stmt.expression);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitPrintStmt(Stmt.Print stmt) {
        Object value = evaluate(stmt.expression);
        println(stringify(value));
        return Completion.NORMAL;
    }

    private void println(String val) {
        if (this.printBuf != null) {
            this.printBuf.append(val + "\n");
        } else {
            System.out.println(val);
        }
    }

    @Override
    public Completion visitVarStmt(Stmt.Var stmt) {
        Object value = null;
        if (stmt.initializer != null) {
            value = evaluate(stmt.initializer);
        }
        environment.define(stmt.name.lexeme, value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBlockStmt(Stmt.Block stmt) {
        return executeBlock(stmt.statements, new Environment(environment));
    }

    @Override
    public Completion visitIfStmt(Stmt.If stmt) {
        if (isTruthy(evaluate(stmt.condition))) {
            return execute(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            return execute(stmt.elseBranch);
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitWhileStmt(Stmt.While stmt) {
        while (isTruthy(evaluate(stmt.condition))) {
            Completion completion = execute(stmt.body);
            if (completion.kind == Completion.Kind.BREAK) {
                break;
            }
            if (completion.kind == Completion.Kind.RETURN) {
                return completion;
            }
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBreakStmt(Stmt.Break stmt) {
        return Completion.BREAK;
    }

    @Override
    public Completion visitReturnStmt(Stmt.Return stmt) {
        Object value = null;
        if (stmt.value != null) {
            value = evaluate(stmt.value);
        }
        return Completion.returning(value);
    }

    @Override
    public Completion visitFunctionStmt(Stmt.Function stmt) {
        LoxFunction function = new LoxFunction(stmt, environment, false);
        environment.define(stmt.name.lexeme, function);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitClassStmt(Stmt.Class stmt) {
        Object superKlassObj = null;
        if (stmt.superclass != null) {
            superKlassObj = evaluate(stmt.superclass);
            if (!(superKlassObj instanceof LoxClass)) {
                throw new RuntimeError(stmt.superclass.name,
                    "Superclass must be a class.");
            }
        }

        environment.define(stmt.name.lexeme, null);

        Environment methodEnv = environment;
        if (superKlassObj != null) {
            methodEnv = new Environment(environment);
            methodEnv.define("super", superKlassObj);
        }

        Map<String, LoxFunction> methods = new HashMap<>();
        for (Stmt.Function method : stmt.methods) {
            boolean isInitializer = method.name.lexeme.equals("init");
            methods.put(method.name.lexeme, new LoxFunction(method, methodEnv, isInitializer));
        }

        LoxClass klass = new LoxClass(stmt.name.lexeme, (LoxClass)superKlassObj, methods);
        environment.assign(stmt.name, klass);
        return Completion.NORMAL;
    }

    public Object evaluate(Expr expr) {
        return expr.accept(this);
    }

    Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    // Runs the statements in the given environment and restores the previous
    // one on every way out. A non-NORMAL completion ends the block early and
    // is handed back to the caller.
    Completion executeBlock(List<Stmt> statements, Environment environment) {
        Environment previous = this.environment;
        try {
            this.environment = environment;
            for (Stmt statement : statements) {
                Completion completion = execute(statement);
                if (!completion.isNormal()) {
                    return completion;
                }
            }
            return Completion.NORMAL;
        } finally {
            this.environment = previous;
        }
    }

    public boolean isTruthy(Object obj) {
        if (obj == null) return false;
        if (obj instanceof Boolean) return (boolean)obj;
        return true;
    }

    // used for '==': nil equals only nil, values of different types are never equal
    public boolean isEqual(Object a, Object b) {
        if (a == null && b == null) return true;
        if (a == null) return false;
        if (b == null) return false;
        if (a instanceof Double && b instanceof Double) {
            return (double)a == (double)b;
        }
        return a.equals(b);
    }

    private void checkNumberOperand(Token operator, Object operand) {
        if (operand instanceof Double) return;
        throw new RuntimeError(operator,
            "Operand of '" + operator.lexeme + "' must be a number.");
    }

    private void checkNumberOperands(Token operator, Object a, Object b) {
        if (a instanceof Double && b instanceof Double) return;
        throw new RuntimeError(operator,
            "Operands of '" + operator.lexeme + "' must be numbers.");
    }

    public String stringify(Object object) {
        if (object == null) return "nil";
        // Hack. Work around Java adding ".0" to integer-valued doubles.
        if (object instanceof Double) {
            String text = object.toString();
            if (text.endsWith(".0")) {
                text = text.substring(0, text.length() - 2);
            }
            return text;
        }
        return object.toString();
    }

    String nativeTypeof(Object object) {
        if (object == null) { return "nil"; }
        if (object instanceof Boolean) { return "bool"; }
        if (object instanceof Double) { return "number"; }
        if (object instanceof String) { return "string"; }
        if (object instanceof LoxClass) { return "class"; }
        if (object instanceof LoxInstance) { return "instance"; }
        if (object instanceof LoxCallable) { return "function"; }
        throw new IllegalStateException("typeof() BUG, unknown type (" + object.getClass().getName() + ")!");
    }

    private IllegalStateException unreachable(Token tok, String where) {
        return new IllegalStateException("Unreachable (" + where + "): operator " +
            tok.lexeme + " at line " + tok.line + ". BUG");
    }

}
