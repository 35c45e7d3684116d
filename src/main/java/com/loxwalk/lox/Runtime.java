package com.loxwalk.lox;

import java.util.List;

/**
 * Registers the native functions into an interpreter's global environment.
 */
class Runtime {
    final Environment globalEnv;
    boolean inited = false;

    private Runtime(Environment globalEnv) {
        this.globalEnv = globalEnv;
    }

    public static Runtime create(Environment globalEnv) {
        return new Runtime(globalEnv);
    }

    public void init() {
        if (inited) {
            return;
        }
        defineGlobalFunctions();
        inited = true;
    }

    public void defineGlobalFunctions() {
        globalEnv.define("clock", new LoxNativeCallable("clock", 0) {
            @Override
            protected Object _call(Interpreter interpreter, List<Object> arguments, Token tok) {
                return (double)System.currentTimeMillis() / 1000.0;
            }
        });
    }
}
