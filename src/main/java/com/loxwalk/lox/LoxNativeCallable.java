package com.loxwalk.lox;

import java.util.List;

/**
 * A callable implemented in Java. Subclasses (usually anonymous, see
 * {@link Runtime#defineGlobalFunctions()}) override {@link #_call}.
 */
class LoxNativeCallable implements LoxCallable {
    final String name;
    final int arity;

    LoxNativeCallable(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    @Override
    public Object call(Interpreter interp, List<Object> args, Token tok) {
        return _call(interp, args, tok);
    }

    // to override in subclass
    protected Object _call(Interpreter interp, List<Object> args, Token tok) {
        throw new RuntimeError(tok, name + "() unimplemented!");
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public int arity() {
        return this.arity;
    }

    @Override
    public String toString() {
        return "<native fn " + getName() + ">";
    }

}
