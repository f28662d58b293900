package de.upb.sse.casegen.dedup;

import java.lang.reflect.Array;
import java.util.*;

/**
 * Value equivalence of candidate input tuples. Numbers compare by value across boxed types, so
 * {@code 0} and {@code 0L} are the same input; containers compare structurally.
 */
public final class EquivalenceFilter {

    private EquivalenceFilter() {
    }

    public static boolean equivalent(List<?> a, List<?> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!equivalentValues(a.get(i), b.get(i))) return false;
        }
        return true;
    }

    /** Values of different shapes (scalar, sequence, map, other) are never equivalent. */
    public static boolean equivalentValues(Object x, Object y) {
        if (x == null || y == null) return x == null && y == null;

        Shape shape = shapeOf(x);
        if (shape != shapeOf(y)) return false;
        switch (shape) {
            case SCALAR:
                if (x instanceof Number && y instanceof Number) return sameNumber((Number) x, (Number) y);
                return x.equals(y);
            case SEQUENCE:
                return equivalent(asList(x), asList(y));
            case MAP:
                return sameMap((Map<?, ?>) x, (Map<?, ?>) y);
            default:
                try {
                    return String.valueOf(x).equals(String.valueOf(y));
                } catch (RuntimeException e) {
                    // target-defined toString failed, nothing left to compare by
                    return false;
                }
        }
    }

    private enum Shape { SCALAR, SEQUENCE, MAP, OTHER }

    private static Shape shapeOf(Object o) {
        if (o instanceof Number || o instanceof String || o instanceof Boolean || o instanceof Character
                || o instanceof Enum<?>) {
            return Shape.SCALAR;
        }
        if (o instanceof Collection<?> || o.getClass().isArray()) return Shape.SEQUENCE;
        if (o instanceof Map<?, ?>) return Shape.MAP;
        return Shape.OTHER;
    }

    private static boolean sameNumber(Number x, Number y) {
        if (isIntegral(x) && isIntegral(y)) return x.longValue() == y.longValue();
        return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static List<?> asList(Object o) {
        if (o instanceof List<?>) return (List<?>) o;
        if (o instanceof Collection<?>) return new ArrayList<>((Collection<?>) o);
        int length = Array.getLength(o);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) elements.add(Array.get(o, i));
        return elements;
    }

    private static boolean sameMap(Map<?, ?> x, Map<?, ?> y) {
        if (x.size() != y.size()) return false;
        if (!x.keySet().equals(y.keySet())) return false;
        for (Map.Entry<?, ?> e : x.entrySet()) {
            if (!equivalentValues(e.getValue(), y.get(e.getKey()))) return false;
        }
        return true;
    }
}
