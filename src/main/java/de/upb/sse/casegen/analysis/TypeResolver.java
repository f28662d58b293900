package de.upb.sse.casegen.analysis;

import de.upb.sse.casegen.model.TypeDescriptor;
import de.upb.sse.casegen.model.TypeDescriptor.CollectionKind;
import de.upb.sse.casegen.model.TypeDescriptor.ScalarKind;
import de.upb.sse.casegen.values.Containers;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.*;

/**
 * Maps reflective {@link Type}s onto {@link TypeDescriptor}s.
 */
public final class TypeResolver {
    private static final Map<Class<?>, ScalarKind> SCALARS = new HashMap<>();

    static {
        SCALARS.put(int.class, ScalarKind.INT);
        SCALARS.put(Integer.class, ScalarKind.INT);
        SCALARS.put(long.class, ScalarKind.LONG);
        SCALARS.put(Long.class, ScalarKind.LONG);
        SCALARS.put(short.class, ScalarKind.SHORT);
        SCALARS.put(Short.class, ScalarKind.SHORT);
        SCALARS.put(byte.class, ScalarKind.BYTE);
        SCALARS.put(Byte.class, ScalarKind.BYTE);
        SCALARS.put(double.class, ScalarKind.DOUBLE);
        SCALARS.put(Double.class, ScalarKind.DOUBLE);
        SCALARS.put(float.class, ScalarKind.FLOAT);
        SCALARS.put(Float.class, ScalarKind.FLOAT);
        SCALARS.put(boolean.class, ScalarKind.BOOLEAN);
        SCALARS.put(Boolean.class, ScalarKind.BOOLEAN);
        SCALARS.put(char.class, ScalarKind.CHAR);
        SCALARS.put(Character.class, ScalarKind.CHAR);
        SCALARS.put(String.class, ScalarKind.STRING);
        SCALARS.put(CharSequence.class, ScalarKind.STRING);
    }

    private TypeResolver() {
    }

    public static TypeDescriptor resolve(Type type) {
        if (type == null) return TypeDescriptor.unknown();

        if (type instanceof Class<?>) {
            return resolveClass((Class<?>) type, null);
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            Type raw = pt.getRawType();
            if (raw instanceof Class<?>) {
                return resolveClass((Class<?>) raw, pt.getActualTypeArguments());
            }
            return TypeDescriptor.unknown();
        }
        if (type instanceof GenericArrayType) {
            Type component = ((GenericArrayType) type).getGenericComponentType();
            TypeDescriptor element = resolve(component);
            return TypeDescriptor.collection(CollectionKind.ARRAY, arrayClassOf(element), element);
        }
        if (type instanceof WildcardType) {
            Type[] upper = ((WildcardType) type).getUpperBounds();
            return upper.length == 1 ? resolve(upper[0]) : TypeDescriptor.unknown();
        }
        if (type instanceof TypeVariable<?>) {
            Type[] bounds = ((TypeVariable<?>) type).getBounds();
            // an unbounded variable is bounded by Object, which stays unknown
            return bounds.length == 1 ? resolve(bounds[0]) : TypeDescriptor.unknown();
        }
        return TypeDescriptor.unknown();
    }

    private static TypeDescriptor resolveClass(Class<?> cls, Type[] typeArguments) {
        ScalarKind scalar = SCALARS.get(cls);
        if (scalar != null) return TypeDescriptor.scalar(scalar, cls);
        if (cls.isEnum()) return TypeDescriptor.scalar(ScalarKind.ENUM, cls);
        if (cls == Object.class || cls == void.class || cls == Void.class) return TypeDescriptor.unknown();

        if (cls.isArray()) {
            TypeDescriptor element = resolveClass(cls.getComponentType(), null);
            return TypeDescriptor.collection(CollectionKind.ARRAY, cls, element);
        }
        boolean container = Map.class.isAssignableFrom(cls) || Collection.class.isAssignableFrom(cls);
        if (container && !Containers.canBuild(cls)) {
            // e.g. BlockingQueue or EnumSet, no value of the declared type can be built
            return TypeDescriptor.unknown();
        }
        if (Map.class.isAssignableFrom(cls)) {
            TypeDescriptor key = typeArguments != null && typeArguments.length == 2 ? resolve(typeArguments[0]) : null;
            TypeDescriptor value = typeArguments != null && typeArguments.length == 2 ? resolve(typeArguments[1]) : null;
            return TypeDescriptor.mapping(cls, key, value);
        }
        if (Set.class.isAssignableFrom(cls)) {
            return TypeDescriptor.collection(CollectionKind.SET, cls, firstArgument(typeArguments));
        }
        if (Collection.class.isAssignableFrom(cls) || cls == Iterable.class) {
            return TypeDescriptor.collection(CollectionKind.LIST, cls, firstArgument(typeArguments));
        }
        if (cls.isPrimitive() || cls.isInterface() || Number.class.isAssignableFrom(cls)) {
            // interfaces and other library abstractions have no generator
            return TypeDescriptor.unknown();
        }
        return TypeDescriptor.userClass(cls);
    }

    private static TypeDescriptor firstArgument(Type[] typeArguments) {
        return typeArguments != null && typeArguments.length == 1 ? resolve(typeArguments[0]) : null;
    }

    private static Class<?> arrayClassOf(TypeDescriptor element) {
        Class<?> component = element.kind == TypeDescriptor.Kind.UNKNOWN ? Object.class : element.rawType;
        return java.lang.reflect.Array.newInstance(component, 0).getClass();
    }
}
