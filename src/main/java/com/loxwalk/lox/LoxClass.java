package com.loxwalk.lox;

import java.util.List;
import java.util.Map;

class LoxClass implements LoxCallable {
    final String name;
    final LoxClass superClass;
    private final Map<String, LoxFunction> methods;

    LoxClass(String name, LoxClass superClass, Map<String, LoxFunction> methods) {
        this.name = name;
        this.superClass = superClass;
        this.methods = methods;
    }

    @Override
    public String getName() {
        return name;
    }

    public LoxClass getSuper() {
        return superClass;
    }

    // returns an unbound method, searching this class and then its ancestors
    public LoxFunction findMethod(String name) {
        LoxClass klass = this;
        while (klass != null) {
            LoxUtil.debug("mlookup", "Looking up method " + name + " in " + klass.toString());
            LoxFunction func = klass.methods.get(name);
            if (func != null) {
                LoxUtil.debug("mlookup", "  Method " + name + " found");
                return func;
            }
            klass = klass.getSuper();
        }
        LoxUtil.debug("mlookup", "Method " + name + " not found");
        return null;
    }

    // constructor arity
    @Override
    public int arity() {
        LoxFunction initializer = findMethod("init");
        if (initializer == null) {
            return 0;
        }
        return initializer.arity();
    }

    // constructor call, creates new instance and binds the constructor, if
    // any, to the instance and calls it. The instance is the result no
    // matter what init() returns.
    @Override
    public Object call(Interpreter interp, List<Object> args, Token callToken) {
        LoxInstance instance = new LoxInstance(this);
        LoxFunction initializer = findMethod("init");
        if (initializer != null) {
            initializer.bind(instance).call(interp, args, callToken);
        }
        return instance;
    }

    @Override
    public String toString() {
        return "<class " + name + ">";
    }

}
