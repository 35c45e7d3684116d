package com.loxwalk.lox;

class StackFrame {
    final LoxCallable callable;
    final Token token;

    StackFrame(LoxCallable callable, Token tok) {
        this.callable = callable;
        this.token = tok;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(callable.toString());
        if (token != null) {
            builder.append(" called at line " + token.line + ".");
        }
        return builder.toString();
    }
}
