package de.upb.sse.casegen.fixtures;

public class Unconstructible {
    private String name;

    public Unconstructible() {
        throw new IllegalStateException("Cannot be built");
    }

    public static int version() {
        return 3;
    }

    public String greet(String who) {
        return "Hello " + who + " from " + name;
    }

    public String getName() {
        return name;
    }
}
