package com.loxwalk.lox;

import java.util.HashMap;
import java.util.Map;

/**
 * One lexical scope. Lookups and assignments walk outward through
 * {@code enclosing} until the global scope (the one with no enclosing).
 *
 * A function's closure is the Environment that was current when the function
 * was declared; every call runs in a fresh child of that closure, so several
 * functions can share (and mutate) the same captured scope.
 */
public class Environment {
    private final Map<String, Object> values = new HashMap<>();
    final Environment enclosing;

    public Environment() {
        enclosing = null;
    }

    public Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    // define or redefine in this scope only
    public void define(String name, Object value) {
        values.put(name, value);
    }

    public Object get(Token name) {
        Environment env = this;
        while (env != null) {
            // containsKey, not get(): a declared but unset variable holds nil (null)
            if (env.values.containsKey(name.lexeme)) {
                return env.values.get(name.lexeme);
            }
            env = env.enclosing;
        }

        throw new RuntimeError(name,
                "Undefined variable '" + name.lexeme + "'.");
    }

    // assign an already defined name, never creates a new binding
    public void assign(Token name, Object value) {
        Environment env = this;
        while (env != null) {
            if (env.values.containsKey(name.lexeme)) {
                env.values.put(name.lexeme, value);
                return;
            }
            env = env.enclosing;
        }

        throw new RuntimeError(name,
                "Undefined variable '" + name.lexeme + "'.");
    }

    // lookup without walking outward past the given number of hops; used for
    // the 'this' binding a bound method's closure carries
    public Object getAt(int distance, String name) {
        Environment env = this;
        while (distance > 0) {
            env = env.enclosing;
            distance--;
        }
        return env.values.get(name);
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    public Environment getEnclosing() {
        return enclosing;
    }

}
