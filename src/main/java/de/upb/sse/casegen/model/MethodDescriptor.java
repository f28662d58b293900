package de.upb.sse.casegen.model;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One analyzed method. {@link #key} is the name used in class descriptions and in the
 * case mapping; it equals {@link #name} unless the name is overloaded.
 */
public final class MethodDescriptor {
    public enum Category { INSTANCE, CLASS_BOUND, NO_INSTANCE, SPECIAL }

    public final String key;
    public final String name;
    public final Category category;
    public final Method method;
    public final List<ParameterDescriptor> parameters;
    public final TypeDescriptor returnType;
    public final String definedIn;

    public MethodDescriptor(String key, Category category, Method method, List<ParameterDescriptor> parameters,
                            TypeDescriptor returnType, String definedIn) {
        this.key = Objects.requireNonNull(key, "key");
        this.category = Objects.requireNonNull(category, "category");
        this.method = Objects.requireNonNull(method, "method");
        this.name = method.getName();
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returnType = returnType;
        this.definedIn = Objects.requireNonNull(definedIn, "definedIn");
    }

    public MethodDescriptor withKey(String newKey) {
        return new MethodDescriptor(newKey, category, method, parameters, returnType, definedIn);
    }

    public boolean isStatic() {
        return category == Category.CLASS_BOUND || category == Category.NO_INSTANCE;
    }

    @Override
    public String toString() {
        return definedIn + "." + name + "(" + parameters.stream().map(ParameterDescriptor::toString).collect(Collectors.joining(", ")) + ")";
    }
}
