package de.upb.sse.casegen.synthesis;

import java.lang.reflect.Array;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.logging.Logger;

/**
 * A proposed input tuple. Boundary candidates remember which parameter was swept so the
 * description can name it.
 */
final class Candidate {
    private static final Logger logger = Logger.getLogger(Candidate.class.getName());

    enum Kind { BOUNDARY, RANDOM, NO_ARGS }

    final Kind kind;
    final List<Object> inputs;
    final String sweptParameter;
    final Object sweptValue;

    private Candidate(Kind kind, List<Object> inputs, String sweptParameter, Object sweptValue) {
        this.kind = kind;
        this.inputs = inputs;
        this.sweptParameter = sweptParameter;
        this.sweptValue = sweptValue;
    }

    static Candidate boundary(List<Object> inputs, String parameter, Object value) {
        return new Candidate(Kind.BOUNDARY, inputs, parameter, value);
    }

    static Candidate random(List<Object> inputs) {
        return new Candidate(Kind.RANDOM, inputs, null, null);
    }

    static Candidate noArgs() {
        return new Candidate(Kind.NO_ARGS, new ArrayList<>(), null, null);
    }

    Object[] arguments() {
        return inputs.toArray();
    }

    /** Suffix after the subject, e.g. {@code " with b=0"} or {@code " with inputs: [3, 4]"}. */
    String detail() {
        switch (kind) {
            case BOUNDARY:
                return " with " + sweptParameter + "=" + render(sweptValue);
            case RANDOM:
                return " with inputs: " + render(inputs);
            default:
                return " with no arguments";
        }
    }

    static String render(Object value) {
        if (value == null) return "null";
        if (value.getClass().isArray()) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (int i = 0; i < Array.getLength(value); i++) joiner.add(render(Array.get(value, i)));
            return joiner.toString();
        }
        if (value instanceof Collection<?>) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : (Collection<?>) value) joiner.add(render(element));
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Copies containers and arrays, recursively, so later mutation by target code does not
     * reach the recorded inputs. Other objects are kept by reference.
     */
    static Object snapshot(Object value) {
        if (value == null) return null;
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            for (int i = 0; i < length; i++) Array.set(copy, i, snapshot(Array.get(value, i)));
            return copy;
        }
        if (value instanceof List<?>) {
            List<Object> copy = sameKind(value, new ArrayList<>());
            for (Object element : (List<?>) value) copy.add(snapshot(element));
            return copy;
        }
        if (value instanceof Set<?>) {
            Set<Object> copy = sameKind(value, new LinkedHashSet<>());
            for (Object element : (Set<?>) value) copy.add(snapshot(element));
            return copy;
        }
        if (value instanceof Collection<?>) {
            Collection<Object> copy = sameKind(value, new ArrayList<>());
            for (Object element : (Collection<?>) value) copy.add(snapshot(element));
            return copy;
        }
        if (value instanceof Map<?, ?>) {
            Map<Object, Object> copy = sameKind(value, new LinkedHashMap<>());
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) copy.put(snapshot(e.getKey()), snapshot(e.getValue()));
            return copy;
        }
        return value;
    }

    /** An empty container of the original's class when it has a public no-arg constructor, e.g. {@code TreeSet}. */
    @SuppressWarnings("unchecked")
    private static <T> T sameKind(Object original, T fallback) {
        Class<?> type = original.getClass();
        if (type == fallback.getClass() || !Modifier.isPublic(type.getModifiers())) return fallback;
        try {
            return (T) type.getConstructor().newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            logger.finest(() -> "Copying " + type.getName() + " as " + fallback.getClass().getSimpleName());
            return fallback;
        }
    }

    static List<Object> snapshot(List<Object> inputs) {
        List<Object> copy = new ArrayList<>(inputs.size());
        for (Object input : inputs) copy.add(snapshot(input));
        return copy;
    }
}
