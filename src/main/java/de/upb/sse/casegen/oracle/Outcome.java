package de.upb.sse.casegen.oracle;

import java.util.Objects;

/** What one oracle invocation produced: a value, a raised error, or nothing before the deadline. */
public final class Outcome {
    public enum Kind { RETURNED, RAISED, TIMED_OUT }

    private static final Outcome TIMED_OUT = new Outcome(Kind.TIMED_OUT, null, null);

    public final Kind kind;
    public final Object value;
    public final Throwable error;

    private Outcome(Kind kind, Object value, Throwable error) {
        this.kind = kind;
        this.value = value;
        this.error = error;
    }

    public static Outcome returned(Object value) {
        return new Outcome(Kind.RETURNED, value, null);
    }

    public static Outcome raised(Throwable error) {
        return new Outcome(Kind.RAISED, null, Objects.requireNonNull(error, "error"));
    }

    public static Outcome timedOut() {
        return TIMED_OUT;
    }

    public Class<? extends Throwable> errorKind() {
        return error == null ? null : error.getClass();
    }

    public boolean isTimedOut() {
        return kind == Kind.TIMED_OUT;
    }

    @Override
    public String toString() {
        switch (kind) {
            case RETURNED:
                return "Returned(" + value + ")";
            case RAISED:
                return "Raised(" + error.getClass().getSimpleName() + ")";
            default:
                return "TimedOut";
        }
    }
}
