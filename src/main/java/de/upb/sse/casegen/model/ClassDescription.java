package de.upb.sse.casegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized view of a class under test. Every member key appears in exactly one bucket,
 * attributed to the most-derived class of the hierarchy that defines it.
 */
public final class ClassDescription {
    public final String name;
    public final List<String> baseClasses;
    public final ConstructorDescriptor constructor;   // null when the class has no public constructor
    public final boolean noArgConstructor;
    public final Map<String, MethodDescriptor> methods;
    public final Map<String, MethodDescriptor> classMethods;
    public final Map<String, MethodDescriptor> staticMethods;
    public final Map<String, PropertyDescriptor> properties;
    public final Map<String, MethodDescriptor> specialMethods;
    public final String error;                        // non-null when the class itself could not be analyzed

    private ClassDescription(Builder b) {
        this.name = b.name;
        this.baseClasses = Collections.unmodifiableList(new ArrayList<>(b.baseClasses));
        this.constructor = b.constructor;
        this.noArgConstructor = b.noArgConstructor;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(b.methods));
        this.classMethods = Collections.unmodifiableMap(new LinkedHashMap<>(b.classMethods));
        this.staticMethods = Collections.unmodifiableMap(new LinkedHashMap<>(b.staticMethods));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.specialMethods = Collections.unmodifiableMap(new LinkedHashMap<>(b.specialMethods));
        this.error = b.error;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Minimal description for a class whose analysis failed outright. */
    public static ClassDescription failed(String name, String error) {
        Builder b = new Builder(name);
        b.error = error == null ? "unknown analysis failure" : error;
        return b.build();
    }

    public Optional<ConstructorDescriptor> getConstructor() {
        return Optional.ofNullable(constructor);
    }

    public boolean isFailed() {
        return error != null;
    }

    /** Looks the member up across all five buckets. */
    public Optional<String> categoryOf(String key) {
        if (methods.containsKey(key)) return Optional.of("methods");
        if (classMethods.containsKey(key)) return Optional.of("class_methods");
        if (staticMethods.containsKey(key)) return Optional.of("static_methods");
        if (properties.containsKey(key)) return Optional.of("properties");
        if (specialMethods.containsKey(key)) return Optional.of("special_methods");
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "ClassDescription{" +
                "name=" + name +
                ", baseClasses=" + baseClasses +
                ", constructor=" + constructor +
                ", methods=" + methods.keySet() +
                ", classMethods=" + classMethods.keySet() +
                ", staticMethods=" + staticMethods.keySet() +
                ", properties=" + properties.keySet() +
                ", specialMethods=" + specialMethods.keySet() +
                (error != null ? ", error=" + error : "") +
                '}';
    }

    public static final class Builder {
        private final String name;
        private final List<String> baseClasses = new ArrayList<>();
        private ConstructorDescriptor constructor;
        private boolean noArgConstructor;
        private final Map<String, MethodDescriptor> methods = new LinkedHashMap<>();
        private final Map<String, MethodDescriptor> classMethods = new LinkedHashMap<>();
        private final Map<String, MethodDescriptor> staticMethods = new LinkedHashMap<>();
        private final Map<String, PropertyDescriptor> properties = new LinkedHashMap<>();
        private final Map<String, MethodDescriptor> specialMethods = new LinkedHashMap<>();
        private String error;

        private Builder(String name) {
            this.name = name;
        }

        public Builder baseClass(String baseName) {
            baseClasses.add(baseName);
            return this;
        }

        public Builder constructor(ConstructorDescriptor descriptor, boolean hasNoArgConstructor) {
            this.constructor = descriptor;
            this.noArgConstructor = hasNoArgConstructor;
            return this;
        }

        public Builder method(MethodDescriptor descriptor) {
            switch (descriptor.category) {
                case INSTANCE:
                    methods.put(descriptor.key, descriptor);
                    break;
                case CLASS_BOUND:
                    classMethods.put(descriptor.key, descriptor);
                    break;
                case NO_INSTANCE:
                    staticMethods.put(descriptor.key, descriptor);
                    break;
                case SPECIAL:
                    specialMethods.put(descriptor.key, descriptor);
                    break;
            }
            return this;
        }

        public Builder property(PropertyDescriptor descriptor) {
            properties.put(descriptor.name, descriptor);
            return this;
        }

        public ClassDescription build() {
            return new ClassDescription(this);
        }
    }
}
