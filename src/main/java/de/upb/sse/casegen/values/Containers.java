package de.upb.sse.casegen.values;

import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Empty containers for declared collection and map types. Interfaces and abstract types get a
 * standard implementation chosen by the declared type ({@code TreeMap} for a {@code SortedMap},
 * {@code ArrayDeque} for a {@code Queue}); concrete types are instantiated through their public
 * no-arg constructor.
 */
public final class Containers {
    private static final Logger logger = Logger.getLogger(Containers.class.getName());

    private Containers() {
    }

    /** True when {@link #newCollection} or {@link #newMap} yields an instance of {@code rawType}. */
    public static boolean canBuild(Class<?> rawType) {
        Object standard = Map.class.isAssignableFrom(rawType) ? standardMap(rawType) : standardCollection(rawType);
        return rawType.isInstance(standard) || isConstructible(rawType);
    }

    public static Collection<Object> newCollection(Class<?> rawType) {
        return instantiate(rawType, standardCollection(rawType));
    }

    public static Map<Object, Object> newMap(Class<?> rawType) {
        return instantiate(rawType, standardMap(rawType));
    }

    private static Collection<Object> standardCollection(Class<?> rawType) {
        // SortedSet covers NavigableSet, Queue covers Deque
        if (SortedSet.class.isAssignableFrom(rawType)) return new TreeSet<>();
        if (Set.class.isAssignableFrom(rawType)) return new LinkedHashSet<>();
        if (Queue.class.isAssignableFrom(rawType) && !List.class.isAssignableFrom(rawType)) return new ArrayDeque<>();
        return new ArrayList<>();
    }

    private static Map<Object, Object> standardMap(Class<?> rawType) {
        if (SortedMap.class.isAssignableFrom(rawType)) return new TreeMap<>();
        if (ConcurrentMap.class.isAssignableFrom(rawType)) return new ConcurrentHashMap<>();
        return new LinkedHashMap<>();
    }

    private static boolean isConstructible(Class<?> rawType) {
        if (rawType.isInterface() || Modifier.isAbstract(rawType.getModifiers())) return false;
        try {
            rawType.getConstructor();
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T instantiate(Class<?> rawType, T standard) {
        if (rawType.isInstance(standard) || !isConstructible(rawType)) return standard;
        try {
            return (T) rawType.getConstructor().newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            logger.fine(() -> "Cannot instantiate " + rawType.getName() + ", using " + standard.getClass().getSimpleName());
            return standard;
        }
    }
}
