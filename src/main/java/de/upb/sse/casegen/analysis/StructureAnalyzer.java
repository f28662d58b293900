package de.upb.sse.casegen.analysis;

import de.upb.sse.casegen.exceptions.AnalysisException;
import de.upb.sse.casegen.model.*;
import de.upb.sse.casegen.model.MethodDescriptor.Category;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Walks the ancestor chain of a class and produces its {@link ClassDescription}.
 *
 * Static members are collected first from each class's own declarations, because they are not
 * inherited the way instance members are. The second walk then records properties, instance and
 * special methods, most-derived class first, so an override hides the member it overrides while
 * a member the derived class does not redefine is still inherited from its base.
 */
public class StructureAnalyzer {
    private static final Logger logger = Logger.getLogger(StructureAnalyzer.class.getName());

    private static final Comparator<Method> BY_SIGNATURE =
            Comparator.comparing(Method::getName).thenComparing(StructureAnalyzer::signature);

    static final Set<String> SPECIAL_METHODS = Set.of("equals", "hashCode", "toString", "compareTo", "clone", "finalize");

    private final ParameterNameReader parameterNames;
    private int faultCount;

    public StructureAnalyzer() {
        this(new ParameterNameReader());
    }

    public StructureAnalyzer(ParameterNameReader parameterNames) {
        this.parameterNames = parameterNames;
    }

    /** Number of members or classes skipped because reflection on them failed, over this analyzer's lifetime. */
    public int getFaultCount() {
        return faultCount;
    }

    public ClassDescription analyze(Class<?> cls) {
        String name = displayName(cls);
        try {
            ClassDescription.Builder builder = ClassDescription.builder(name);
            Class<?> superclass = cls.getSuperclass();
            if (superclass != null && superclass != Object.class) builder.baseClass(displayName(superclass));
            for (Class<?> iface : cls.getInterfaces()) builder.baseClass(displayName(iface));

            List<Class<?>> chain = linearize(cls);
            Map<String, Accessors> accessors = propertyAccessors(cls);
            Set<String> processed = new HashSet<>();
            Set<String> processedProperties = new HashSet<>();
            List<MethodDescriptor> collected = new ArrayList<>();

            for (Class<?> current : chain) {
                identifyStaticMembers(current, collected, processed);
            }

            describeConstructor(cls, builder);

            for (Class<?> current : chain) {
                analyzeClassMembers(current, accessors, builder, collected, processed, processedProperties);
            }

            assignKeys(collected).forEach(builder::method);
            ClassDescription description = builder.build();
            logger.fine(() -> "Analyzed " + description);
            return description;
        } catch (RuntimeException | LinkageError e) {
            faultCount++;
            AnalysisException fault = new AnalysisException(name, null, e);
            logger.warning(fault.getMessage());
            return ClassDescription.failed(name, fault.getMessage());
        }
    }

    /** The class, its superclasses, then every implemented interface; {@code Object} is left out. */
    public static List<Class<?>> linearize(Class<?> cls) {
        List<Class<?>> chain = new ArrayList<>();
        for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
            chain.add(c);
        }
        Set<Class<?>> seen = new LinkedHashSet<>();
        for (Class<?> c : new ArrayList<>(chain)) {
            collectInterfaces(c, seen);
        }
        seen.removeAll(chain);
        chain.addAll(seen);
        return chain;
    }

    private static void collectInterfaces(Class<?> c, Set<Class<?>> seen) {
        for (Class<?> iface : c.getInterfaces()) {
            if (seen.add(iface)) collectInterfaces(iface, seen);
        }
    }

    private void identifyStaticMembers(Class<?> current, List<MethodDescriptor> collected, Set<String> processed) {
        if (current.isInterface()) return;   // interface statics are not part of the class surface

        Method[] declared;
        try {
            declared = current.getDeclaredMethods();
        } catch (RuntimeException | LinkageError e) {
            skip(displayName(current), null, e);
            return;
        }
        Arrays.sort(declared, BY_SIGNATURE);
        for (Method m : declared) {
            if (!isCandidate(m) || !Modifier.isStatic(m.getModifiers())) continue;
            String signature = signature(m);
            if (processed.contains(signature)) continue;
            processed.add(signature);
            try {
                Category category = m.getReturnType() == current ? Category.CLASS_BOUND : Category.NO_INSTANCE;
                collected.add(describeMethod(m, category, current));
            } catch (RuntimeException | LinkageError e) {
                skip(displayName(current), m.getName(), e);
            }
        }
    }

    private void analyzeClassMembers(Class<?> current, Map<String, Accessors> accessors, ClassDescription.Builder builder,
                                     List<MethodDescriptor> collected, Set<String> processed,
                                     Set<String> processedProperties) {
        for (Accessors pair : accessors.values()) {
            if (processedProperties.contains(pair.property)) continue;
            boolean declaredHere = pair.getter.getDeclaringClass() == current
                    || (pair.setter != null && pair.setter.getDeclaringClass() == current);
            if (!declaredHere) continue;

            processedProperties.add(pair.property);
            processed.add(signature(pair.getter));
            if (pair.setter != null) processed.add(signature(pair.setter));
            try {
                TypeDescriptor type = TypeResolver.resolve(pair.getter.getGenericReturnType());
                builder.property(new PropertyDescriptor(pair.property, type, pair.getter, pair.setter, displayName(current)));
            } catch (RuntimeException | LinkageError e) {
                skip(displayName(current), pair.property, e);
            }
        }

        Method[] declared;
        try {
            declared = current.getDeclaredMethods();
        } catch (RuntimeException | LinkageError e) {
            skip(displayName(current), null, e);
            return;
        }
        Arrays.sort(declared, BY_SIGNATURE);
        for (Method m : declared) {
            if (!isCandidate(m) || Modifier.isStatic(m.getModifiers()) || Modifier.isAbstract(m.getModifiers())) continue;
            String signature = signature(m);
            if (processed.contains(signature)) continue;
            processed.add(signature);
            try {
                Category category = SPECIAL_METHODS.contains(m.getName()) ? Category.SPECIAL : Category.INSTANCE;
                collected.add(describeMethod(m, category, current));
            } catch (RuntimeException | LinkageError e) {
                skip(displayName(current), m.getName(), e);
            }
        }
    }

    private void describeConstructor(Class<?> cls, ClassDescription.Builder builder) {
        Constructor<?>[] constructors;
        try {
            constructors = cls.getConstructors();
        } catch (RuntimeException | LinkageError e) {
            skip(displayName(cls), "<init>", e);
            return;
        }
        if (constructors.length == 0) return;

        boolean noArg = Arrays.stream(constructors).anyMatch(c -> c.getParameterCount() == 0);
        Constructor<?> primary = constructors[0];
        for (Constructor<?> c : constructors) {
            if (c.getParameterCount() > primary.getParameterCount()) primary = c;
        }
        try {
            builder.constructor(new ConstructorDescriptor(primary, describeParameters(primary), displayName(cls)), noArg);
        } catch (RuntimeException | LinkageError e) {
            skip(displayName(cls), "<init>", e);
        }
    }

    private MethodDescriptor describeMethod(Method m, Category category, Class<?> definedIn) {
        TypeDescriptor returnType = TypeResolver.resolve(m.getGenericReturnType());
        return new MethodDescriptor(m.getName(), category, m, describeParameters(m), returnType, displayName(definedIn));
    }

    /** Parameter names and declared types, in declaration order. */
    public List<ParameterDescriptor> describeParameters(Executable executable) {
        List<String> names = parameterNames.parameterNames(executable);
        Type[] generic = executable.getGenericParameterTypes();
        // inner-class constructors report the implicit outer instance only in the erased view
        Type[] types = generic.length == executable.getParameterCount() ? generic : executable.getParameterTypes();

        List<ParameterDescriptor> parameters = new ArrayList<>(types.length);
        for (int i = 0; i < types.length; i++) {
            String name = i < names.size() ? names.get(i) : "arg" + i;
            parameters.add(new ParameterDescriptor(name, TypeResolver.resolve(types[i])));
        }
        return parameters;
    }

    private Map<String, Accessors> propertyAccessors(Class<?> cls) {
        Map<String, Accessors> result = new TreeMap<>();
        for (Method getter : cls.getMethods()) {
            if (!isCandidate(getter) || Modifier.isStatic(getter.getModifiers())) continue;
            if (getter.getDeclaringClass() == Object.class || Modifier.isAbstract(getter.getModifiers())) continue;
            String property = propertyName(getter);
            if (property == null || result.containsKey(property)) continue;

            Method setter = null;
            try {
                Method candidate = cls.getMethod("set" + getter.getName().substring(getter.getName().startsWith("is") ? 2 : 3),
                        getter.getReturnType());
                if (!Modifier.isStatic(candidate.getModifiers()) && !Modifier.isAbstract(candidate.getModifiers())) {
                    setter = candidate;
                }
            } catch (NoSuchMethodException e) {
                logger.finest(() -> property + " of " + cls.getName() + " is read-only");
            }
            result.put(property, new Accessors(property, getter, setter));
        }
        return result;
    }

    static String propertyName(Method getter) {
        if (getter.getParameterCount() != 0 || getter.getReturnType() == void.class) return null;
        String name = getter.getName();
        String suffix;
        if (name.startsWith("get") && name.length() > 3) {
            suffix = name.substring(3);
        } else if (name.startsWith("is") && name.length() > 2
                && (getter.getReturnType() == boolean.class || getter.getReturnType() == Boolean.class)) {
            suffix = name.substring(2);
        } else {
            return null;
        }
        if (!Character.isUpperCase(suffix.charAt(0))) return null;
        if (suffix.length() > 1 && Character.isUpperCase(suffix.charAt(1))) return suffix;   // URL stays URL
        return Character.toLowerCase(suffix.charAt(0)) + suffix.substring(1);
    }

    private static boolean isCandidate(Method m) {
        return Modifier.isPublic(m.getModifiers()) && !m.isSynthetic() && !m.isBridge();
    }

    static String signature(Method m) {
        return m.getName() + Arrays.stream(m.getParameterTypes()).map(Class::getName).collect(Collectors.joining(",", "(", ")"));
    }

    /** Overloaded names are keyed by their simple-name signature, everything else by plain name. */
    private static List<MethodDescriptor> assignKeys(List<MethodDescriptor> collected) {
        Map<String, Long> counts = collected.stream()
                .collect(Collectors.groupingBy(d -> d.name, Collectors.counting()));
        List<MethodDescriptor> keyed = new ArrayList<>(collected.size());
        for (MethodDescriptor d : collected) {
            if (counts.get(d.name) > 1) {
                String key = d.name + Arrays.stream(d.method.getParameterTypes())
                        .map(Class::getSimpleName).collect(Collectors.joining(", ", "(", ")"));
                keyed.add(d.withKey(key));
            } else {
                keyed.add(d);
            }
        }
        return keyed;
    }

    private void skip(String owner, String member, Throwable cause) {
        faultCount++;
        logger.warning(new AnalysisException(owner, member, cause).getMessage());
    }

    static String displayName(Class<?> cls) {
        String simple = cls.getSimpleName();
        return simple.isEmpty() ? cls.getName() : simple;
    }

    private static final class Accessors {
        final String property;
        final Method getter;
        final Method setter;

        Accessors(String property, Method getter, Method setter) {
            this.property = property;
            this.getter = getter;
            this.setter = setter;
        }
    }
}
