package com.loxwalk.lox;

import java.util.HashMap;
import java.util.Map;

class LoxInstance {
    final LoxClass klass;
    private final Map<String, Object> fields = new HashMap<>();

    LoxInstance(LoxClass klass) {
        this.klass = klass;
    }

    // Property access, 'instance.prop'. A field wins over a method of the
    // same name; a method is returned uncalled but bound to the instance.
    public Object get(Token name) {
        if (fields.containsKey(name.lexeme)) {
            return fields.get(name.lexeme);
        }

        LoxFunction method = klass.findMethod(name.lexeme);
        if (method != null) return method.bind(this);

        throw new RuntimeError(name,
                "Undefined property '" + name.lexeme + "'.");
    }

    // fields need no declaration, the first assignment creates them
    public void set(Token name, Object value) {
        fields.put(name.lexeme, value);
    }

    @Override
    public String toString() {
        return "<instance " + klass.getName() + ">";
    }

}
