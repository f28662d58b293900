package de.upb.sse.casegen.model;

import java.util.Objects;

public final class ParameterDescriptor {
    public final String name;
    public final TypeDescriptor type;

    public ParameterDescriptor(String name, TypeDescriptor type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() {
        return type + " " + name;
    }
}
