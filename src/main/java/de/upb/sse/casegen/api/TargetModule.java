package de.upb.sse.casegen.api;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The code handed to the generator: free functions (public static methods of utility classes)
 * and classes under test. Classes must already be loaded; nothing is read from disk.
 */
public final class TargetModule {
    public final String name;
    public final Map<String, Method> functions;   // key -> function, in registration order
    public final List<Class<?>> classes;

    private TargetModule(String name, Map<String, Method> functions, List<Class<?>> classes) {
        this.name = name;
        this.functions = Collections.unmodifiableMap(functions);
        this.classes = Collections.unmodifiableList(classes);
    }

    /**
     * Sorts each class into function holders, whose static methods become free functions, and
     * classes under test.
     */
    public static TargetModule of(String name, Class<?>... members) {
        Builder builder = builder(name);
        for (Class<?> member : members) {
            if (isFunctionHolder(member)) {
                builder.functionsOf(member);
            } else {
                builder.classUnderTest(member);
            }
        }
        return builder.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** No public constructor, and every public method it declares is static. */
    public static boolean isFunctionHolder(Class<?> cls) {
        if (cls.isInterface() || cls.isEnum() || cls.isAnnotation() || cls.isArray() || cls.isPrimitive()) return false;
        if (cls.getConstructors().length > 0) return false;
        List<Method> declared = publicDeclaredMethods(cls);
        return !declared.isEmpty() && declared.stream().allMatch(m -> Modifier.isStatic(m.getModifiers()));
    }

    private static List<Method> publicDeclaredMethods(Class<?> cls) {
        return Arrays.stream(cls.getDeclaredMethods())
                .filter(m -> Modifier.isPublic(m.getModifiers()) && !m.isSynthetic() && !m.isBridge())
                .sorted(Comparator.comparing(Method::getName).thenComparing(TargetModule::parameterList))
                .collect(Collectors.toList());
    }

    private static String parameterList(Method m) {
        return Arrays.stream(m.getParameterTypes()).map(Class::getSimpleName).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return "TargetModule{" + name + ", functions=" + functions.keySet() + ", classes="
                + classes.stream().map(Class::getSimpleName).collect(Collectors.toList()) + '}';
    }

    public static final class Builder {
        private final String name;
        private final List<Method> functions = new ArrayList<>();
        private final List<Class<?>> classes = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder function(Method function) {
            if (!Modifier.isStatic(function.getModifiers())) {
                throw new IllegalArgumentException(function + " is not static and cannot be called as a function");
            }
            if (!functions.contains(function)) functions.add(function);
            return this;
        }

        public Builder functionsOf(Class<?> holder) {
            for (Method m : publicDeclaredMethods(holder)) {
                if (Modifier.isStatic(m.getModifiers())) function(m);
            }
            return this;
        }

        public Builder classUnderTest(Class<?> cls) {
            if (!classes.contains(cls)) classes.add(cls);
            return this;
        }

        /**
         * Keys are plain names; overloaded names get their parameter list appended, and a key
         * still clashing across holders is prefixed with the holder's simple name.
         */
        public TargetModule build() {
            Map<String, Long> counts = functions.stream().collect(Collectors.groupingBy(Method::getName, Collectors.counting()));
            Map<String, Method> keyed = new LinkedHashMap<>();
            for (Method m : functions) {
                String key = counts.get(m.getName()) > 1 ? m.getName() + parameterList(m) : m.getName();
                if (keyed.containsKey(key)) key = m.getDeclaringClass().getSimpleName() + "." + key;
                keyed.put(key, m);
            }
            return new TargetModule(name, keyed, new ArrayList<>(classes));
        }
    }
}
