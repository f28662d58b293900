package de.upb.sse.casegen.model;

import java.util.Objects;

/**
 * Closed description of a declared parameter or property type.
 * Built once by the analysis layer; value synthesis switches over {@link #kind}
 * instead of querying live type metadata.
 */
public final class TypeDescriptor {
    public enum Kind { SCALAR, COLLECTION, MAPPING, USER_CLASS, UNKNOWN }

    public enum ScalarKind { INT, LONG, SHORT, BYTE, DOUBLE, FLOAT, BOOLEAN, CHAR, STRING, ENUM }

    public enum CollectionKind { LIST, SET, ARRAY }

    private static final TypeDescriptor UNKNOWN_TYPE = new TypeDescriptor(Kind.UNKNOWN, Object.class, null, null, null, null);

    public final Kind kind;
    public final Class<?> rawType;           // declared (erased) type, primitive for primitive params
    public final ScalarKind scalarKind;      // SCALAR only
    public final CollectionKind collectionKind; // COLLECTION only
    public final TypeDescriptor elementType; // COLLECTION element, MAPPING key
    public final TypeDescriptor valueType;   // MAPPING value

    private TypeDescriptor(Kind kind, Class<?> rawType, ScalarKind scalarKind, CollectionKind collectionKind,
                           TypeDescriptor elementType, TypeDescriptor valueType) {
        this.kind = kind;
        this.rawType = rawType;
        this.scalarKind = scalarKind;
        this.collectionKind = collectionKind;
        this.elementType = elementType;
        this.valueType = valueType;
    }

    public static TypeDescriptor scalar(ScalarKind scalarKind, Class<?> rawType) {
        return new TypeDescriptor(Kind.SCALAR, Objects.requireNonNull(rawType, "rawType"),
                Objects.requireNonNull(scalarKind, "scalarKind"), null, null, null);
    }

    public static TypeDescriptor collection(CollectionKind collectionKind, Class<?> rawType, TypeDescriptor elementType) {
        return new TypeDescriptor(Kind.COLLECTION, Objects.requireNonNull(rawType, "rawType"), null,
                Objects.requireNonNull(collectionKind, "collectionKind"),
                elementType == null ? UNKNOWN_TYPE : elementType, null);
    }

    public static TypeDescriptor mapping(Class<?> rawType, TypeDescriptor keyType, TypeDescriptor valueType) {
        return new TypeDescriptor(Kind.MAPPING, Objects.requireNonNull(rawType, "rawType"), null, null,
                keyType == null ? UNKNOWN_TYPE : keyType,
                valueType == null ? UNKNOWN_TYPE : valueType);
    }

    public static TypeDescriptor userClass(Class<?> ref) {
        return new TypeDescriptor(Kind.USER_CLASS, Objects.requireNonNull(ref, "ref"), null, null, null, null);
    }

    public static TypeDescriptor unknown() {
        return UNKNOWN_TYPE;
    }

    public boolean isScalar(ScalarKind expected) {
        return kind == Kind.SCALAR && scalarKind == expected;
    }

    /** True for the USER_CLASS descriptor of exactly {@code type}. */
    public boolean refersTo(Class<?> type) {
        return kind == Kind.USER_CLASS && type != null && rawType.equals(type);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SCALAR:
                return rawType.getSimpleName();
            case COLLECTION:
                if (collectionKind == CollectionKind.ARRAY) return elementType + "[]";
                return rawType.getSimpleName() + "<" + elementType + ">";
            case MAPPING:
                return rawType.getSimpleName() + "<" + elementType + ", " + valueType + ">";
            case USER_CLASS:
                return rawType.getSimpleName();
            default:
                return "?";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeDescriptor that = (TypeDescriptor) o;
        return kind == that.kind && rawType.equals(that.rawType) && scalarKind == that.scalarKind
                && collectionKind == that.collectionKind
                && Objects.equals(elementType, that.elementType) && Objects.equals(valueType, that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rawType, scalarKind, collectionKind, elementType, valueType);
    }
}
