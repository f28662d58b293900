package de.upb.sse.casegen.model;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class ConstructorDescriptor {
    public final Constructor<?> constructor;
    public final List<ParameterDescriptor> parameters;
    public final String definedIn;

    public ConstructorDescriptor(Constructor<?> constructor, List<ParameterDescriptor> parameters, String definedIn) {
        this.constructor = Objects.requireNonNull(constructor, "constructor");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.definedIn = Objects.requireNonNull(definedIn, "definedIn");
    }

    public List<String> parameterNames() {
        return parameters.stream().map(p -> p.name).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return definedIn + "(" + parameters.stream().map(ParameterDescriptor::toString).collect(Collectors.joining(", ")) + ")";
    }
}
