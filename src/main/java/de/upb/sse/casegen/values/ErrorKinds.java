package de.upb.sse.casegen.values;

import de.upb.sse.casegen.exceptions.LiteralParseException;

import java.util.List;

/** Resolves error kinds given by name, e.g. {@code ArithmeticException} or {@code java.io.IOException}. */
public final class ErrorKinds {
    private static final List<String> IMPLICIT_PACKAGES = List.of("java.lang.", "java.util.", "java.io.");

    private ErrorKinds() {
    }

    public static Class<? extends Throwable> resolve(String name, ClassLoader loader) throws LiteralParseException {
        if (name == null || name.isBlank()) throw new LiteralParseException(String.valueOf(name), "no error kind given");
        String trimmed = name.trim();

        Class<?> found = load(trimmed, loader);
        if (found == null && trimmed.indexOf('.') < 0) {
            for (String pkg : IMPLICIT_PACKAGES) {
                found = load(pkg + trimmed, loader);
                if (found != null) break;
            }
        }
        if (found == null) throw new LiteralParseException(name, "unknown error kind");
        if (!Throwable.class.isAssignableFrom(found)) throw new LiteralParseException(name, found.getName() + " is not a Throwable");
        return found.asSubclass(Throwable.class);
    }

    public static Class<? extends Throwable> resolve(String name) throws LiteralParseException {
        return resolve(name, ErrorKinds.class.getClassLoader());
    }

    private static Class<?> load(String className, ClassLoader loader) {
        try {
            // no initialization: resolving a name must not run static initializers
            return Class.forName(className, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
    }
}
