package com.loxwalk.lox;

/**
 * Outcome of executing a statement. {@code return} and {@code break} travel
 * outward as completions instead of exceptions: a loop consumes BREAK, a
 * function call consumes RETURN, and everything in between hands them back
 * to its caller untouched.
 */
final class Completion {
    enum Kind {
        NORMAL,
        BREAK,
        RETURN
    }

    static final Completion NORMAL = new Completion(Kind.NORMAL, null);
    static final Completion BREAK = new Completion(Kind.BREAK, null);

    final Kind kind;
    final Object value; // only set for RETURN

    private Completion(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    static Completion returning(Object value) {
        return new Completion(Kind.RETURN, value);
    }

    boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    @Override
    public String toString() {
        if (kind == Kind.RETURN) {
            return "RETURN(" + value + ")";
        }
        return kind.toString();
    }
}
