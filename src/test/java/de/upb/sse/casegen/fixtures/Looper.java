package de.upb.sse.casegen.fixtures;

public final class Looper {
    private Looper() {
    }

    /** Only stops when interrupted. */
    public static int spin() {
        long turns = 0;
        while (!Thread.currentThread().isInterrupted()) {
            turns++;
        }
        return (int) turns;
    }

    public static int quick(boolean flag) {
        return flag ? 1 : 0;
    }
}
