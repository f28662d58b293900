package de.upb.sse.casegen.values;

import de.upb.sse.casegen.model.TypeDescriptor;
import de.upb.sse.casegen.model.TypeDescriptor.CollectionKind;
import de.upb.sse.casegen.model.TypeDescriptor.ScalarKind;

import java.lang.reflect.Array;
import java.util.*;
import java.util.logging.Logger;

/**
 * Boundary and random values per declared type. Every call hands out fresh instances, so a
 * target mutating its arguments cannot leak into later candidates.
 */
public class ValueSynthesizer {
    private static final Logger logger = Logger.getLogger(ValueSynthesizer.class.getName());

    public static final int RANDOM_MIN = -1000;
    public static final int RANDOM_MAX = 1000;
    public static final int MAX_STRING_LENGTH = 20;
    public static final int MAX_COLLECTION_SIZE = 5;

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
    private static final long[] INTEGRAL_BOUNDARIES = {0, 1, -1, 100, -100};

    private final Random random;

    public ValueSynthesizer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public List<Object> boundaryValues(TypeDescriptor type) {
        List<Object> values = new ArrayList<>();
        switch (type.kind) {
            case SCALAR:
                scalarBoundaries(type, values);
                break;
            case COLLECTION:
                values.add(collectionOf(type, Collections.emptyList()));
                values.add(collectionOf(type, canonicalElements(type.elementType, 1)));
                values.add(collectionOf(type, canonicalElements(type.elementType, 3)));
                break;
            case MAPPING:
                values.add(mapOf(type));
                values.add(canonicalMap(type, 1));
                values.add(canonicalMap(type, 2));
                break;
            default:
                values.add(null);
                break;
        }
        return values;
    }

    private void scalarBoundaries(TypeDescriptor type, List<Object> values) {
        switch (type.scalarKind) {
            case INT:
            case LONG:
            case SHORT:
            case BYTE:
                for (long v : INTEGRAL_BOUNDARIES) values.add(integral(type.scalarKind, v));
                break;
            case DOUBLE:
            case FLOAT:
                for (long v : INTEGRAL_BOUNDARIES) values.add(floating(type.scalarKind, v));
                break;
            case BOOLEAN:
                values.add(Boolean.TRUE);
                values.add(Boolean.FALSE);
                break;
            case CHAR:
                values.add('a');
                values.add('A');
                values.add('0');
                values.add(' ');
                break;
            case STRING:
                values.add("");
                values.add("a");
                values.add(" ");
                values.add("abc");
                values.add("A".repeat(100));
                break;
            case ENUM:
                Object[] constants = type.rawType.getEnumConstants();
                if (constants.length > 0) {
                    values.add(constants[0]);
                    if (constants.length > 1) values.add(constants[constants.length - 1]);
                }
                break;
        }
    }

    /** A single value drawn from the type's random range; {@code null} when no generator exists. */
    public Object randomValue(TypeDescriptor type) {
        switch (type.kind) {
            case SCALAR:
                return randomScalar(type);
            case COLLECTION: {
                int size = random.nextInt(MAX_COLLECTION_SIZE + 1);
                List<Object> elements = new ArrayList<>(size);
                for (int i = 0; i < size; i++) elements.add(randomElement(type.elementType));
                return collectionOf(type, elements);
            }
            case MAPPING: {
                int size = random.nextInt(MAX_COLLECTION_SIZE + 1);
                Map<Object, Object> map = mapOf(type);
                for (int i = 0; i < size; i++) {
                    Object key = type.elementType.kind == TypeDescriptor.Kind.UNKNOWN
                            ? randomString(LOWERCASE, 1, 5)
                            : randomElement(type.elementType);
                    put(type, map, key, randomElement(type.valueType));
                }
                return map;
            }
            default:
                logger.fine(() -> "No value generator for " + type + ", using null");
                return null;
        }
    }

    private Object randomScalar(TypeDescriptor type) {
        switch (type.scalarKind) {
            case INT:
            case LONG:
            case SHORT:
                return integral(type.scalarKind, RANDOM_MIN + random.nextInt(RANDOM_MAX - RANDOM_MIN + 1));
            case BYTE:
                return (byte) (Byte.MIN_VALUE + random.nextInt(256));
            case DOUBLE:
                return RANDOM_MIN + random.nextDouble() * (RANDOM_MAX - RANDOM_MIN);
            case FLOAT:
                return (float) (RANDOM_MIN + random.nextDouble() * (RANDOM_MAX - RANDOM_MIN));
            case BOOLEAN:
                return random.nextBoolean();
            case CHAR:
                return ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length()));
            case STRING:
                return randomString(ALPHANUMERIC, 0, MAX_STRING_LENGTH);
            case ENUM:
                Object[] constants = type.rawType.getEnumConstants();
                return constants.length == 0 ? null : constants[random.nextInt(constants.length)];
            default:
                return null;
        }
    }

    /** Untyped elements are small integers. */
    private Object randomElement(TypeDescriptor elementType) {
        if (elementType.kind == TypeDescriptor.Kind.UNKNOWN) return -100 + random.nextInt(201);
        return randomValue(elementType);
    }

    private String randomString(String alphabet, int minLength, int maxLength) {
        int length = minLength + random.nextInt(maxLength - minLength + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        return sb.toString();
    }

    private List<Object> canonicalElements(TypeDescriptor elementType, int count) {
        List<Object> elements = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) elements.add(canonical(elementType, i));
        return elements;
    }

    /** The i-th (1-based) member of a small, stable sequence of the type: 1, 2, 3 / "a", "b", "c" / ... */
    private Object canonical(TypeDescriptor type, int i) {
        if (type.kind == TypeDescriptor.Kind.UNKNOWN) return i;
        if (type.kind != TypeDescriptor.Kind.SCALAR) return randomValue(type);
        switch (type.scalarKind) {
            case INT:
            case LONG:
            case SHORT:
            case BYTE:
                return integral(type.scalarKind, i);
            case DOUBLE:
            case FLOAT:
                return floating(type.scalarKind, i);
            case BOOLEAN:
                return i % 2 == 1;
            case CHAR:
                return (char) ('a' + i - 1);
            case STRING:
                return String.valueOf((char) ('a' + i - 1));
            case ENUM:
                Object[] constants = type.rawType.getEnumConstants();
                return constants.length == 0 ? null : constants[(i - 1) % constants.length];
            default:
                return null;
        }
    }

    private Map<Object, Object> canonicalMap(TypeDescriptor type, int size) {
        Map<Object, Object> map = mapOf(type);
        boolean untyped = type.elementType.kind == TypeDescriptor.Kind.UNKNOWN
                && type.valueType.kind == TypeDescriptor.Kind.UNKNOWN;
        if (untyped) {
            if (size == 1) {
                put(type, map, "key", "value");
            } else {
                put(type, map, "a", 1);
                put(type, map, "b", 2);
            }
            return map;
        }
        for (int i = 1; i <= size; i++) {
            put(type, map, canonical(type.elementType, i), canonical(type.valueType, i));
        }
        return map;
    }

    private static Object collectionOf(TypeDescriptor type, List<Object> elements) {
        if (type.collectionKind == CollectionKind.ARRAY) {
            Class<?> component = type.rawType.getComponentType();
            Object array = Array.newInstance(component, elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Object element = elements.get(i);
                if (element == null && component.isPrimitive()) continue;
                Array.set(array, i, element);
            }
            return array;
        }
        Collection<Object> collection = Containers.newCollection(type.rawType);
        for (Object element : elements) {
            try {
                collection.add(element);
            } catch (NullPointerException | ClassCastException e) {
                logger.fine(() -> type + " does not accept " + element + ", leaving it out");
            }
        }
        return collection;
    }

    private static Map<Object, Object> mapOf(TypeDescriptor type) {
        return Containers.newMap(type.rawType);
    }

    private static void put(TypeDescriptor type, Map<Object, Object> map, Object key, Object value) {
        try {
            map.put(key, value);
        } catch (NullPointerException | ClassCastException e) {
            logger.fine(() -> type + " does not accept " + key + "=" + value + ", leaving it out");
        }
    }

    private static Object integral(ScalarKind kind, long value) {
        switch (kind) {
            case LONG:
                return value;
            case SHORT:
                return (short) value;
            case BYTE:
                return (byte) value;
            default:
                return (int) value;
        }
    }

    private static Object floating(ScalarKind kind, double value) {
        return kind == ScalarKind.FLOAT ? (Object) (float) value : (Object) value;
    }
}
