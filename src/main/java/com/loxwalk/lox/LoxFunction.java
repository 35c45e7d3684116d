package com.loxwalk.lox;

import java.util.List;

class LoxFunction implements LoxCallable {
    final Stmt.Function declaration;
    final Environment closure;
    final boolean isInitializer;

    LoxFunction(Stmt.Function declaration, Environment closure, boolean isInitializer) {
        this.declaration = declaration;
        this.closure = closure;
        this.isInitializer = isInitializer;
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Token callToken) {
        // parented to the closure, not to the caller's environment
        Environment environment = new Environment(closure);
        for (int i = 0; i < declaration.params.size(); i++) {
            environment.define(declaration.params.get(i).lexeme, args.get(i));
        }

        Completion completion = interpreter.executeBlock(declaration.body, environment);

        // init() always hands back the instance, even on a bare 'return;'
        if (isInitializer) {
            return closure.getAt(0, "this");
        }
        if (completion.kind == Completion.Kind.RETURN) {
            return completion.value;
        }
        return null;
    }

    // Returns a copy of this method whose closure binds 'this' to the given
    // instance. Calling init() directly on an instance goes through here too.
    LoxFunction bind(LoxInstance instance) {
        Environment environment = new Environment(closure);
        environment.define("this", instance);
        return new LoxFunction(declaration, environment, isInitializer);
    }

    @Override
    public String getName() {
        return declaration.name.lexeme;
    }

    @Override
    public int arity() {
        return declaration.params.size();
    }

    @Override
    public String toString() {
        return "<fn " + getName() + ">";
    }

}
