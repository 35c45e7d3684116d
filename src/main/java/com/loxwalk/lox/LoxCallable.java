package com.loxwalk.lox;

import java.util.List;

interface LoxCallable {
    public Object call(Interpreter interp, List<Object> args, Token callToken);
    public int arity(); // exact number of arguments a call must pass
    public String getName(); // ex: "clock"
    public String toString(); // ex: "<fn clock>"
}
