package de.upb.sse.casegen.model;

import java.lang.reflect.Method;
import java.util.Objects;

/** A JavaBean property: a getter and, when writable, a matching setter. */
public final class PropertyDescriptor {
    public final String name;
    public final TypeDescriptor type;
    public final Method getter;
    public final Method setter;   // null for read-only properties
    public final String definedIn;

    public PropertyDescriptor(String name, TypeDescriptor type, Method getter, Method setter, String definedIn) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.getter = Objects.requireNonNull(getter, "getter");
        this.setter = setter;
        this.definedIn = Objects.requireNonNull(definedIn, "definedIn");
    }

    public boolean hasSetter() {
        return setter != null;
    }

    @Override
    public String toString() {
        return definedIn + "." + name + (hasSetter() ? " (rw)" : " (r)");
    }
}
