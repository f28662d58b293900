package de.upb.sse.casegen.values;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.expr.*;
import de.upb.sse.casegen.exceptions.LiteralParseException;
import de.upb.sse.casegen.model.TypeDescriptor;
import de.upb.sse.casegen.model.TypeDescriptor.CollectionKind;

import java.lang.reflect.Array;
import java.util.*;

/**
 * Turns user-supplied text into values without evaluating anything. The text is parsed as a Java
 * expression and only literal shapes are accepted:
 * <ul>
 *   <li>number, char, string, text block, boolean and {@code null} literals, optionally signed</li>
 *   <li>brace initializers {@code {1, 2}} and {@code new int[] {1, 2}}</li>
 *   <li>{@code List.of}, {@code Set.of}, {@code Map.of} and {@code Arrays.asList} over literals</li>
 * </ul>
 * Names, calls, object creation and operators are rejected.
 */
public class LiteralParser {
    private static final Set<String> COLLECTION_FACTORIES = Set.of("List.of", "Set.of", "Map.of", "Arrays.asList",
            "java.util.List.of", "java.util.Set.of", "java.util.Map.of", "java.util.Arrays.asList");

    private final JavaParser parser;

    public LiteralParser() {
        ParserConfiguration configuration = new ParserConfiguration();
        configuration.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(configuration);
    }

    public Object parse(String text) throws LiteralParseException {
        if (text == null) throw new LiteralParseException("null", "no text");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) throw new LiteralParseException(text, "empty text");

        // a bare brace initializer only parses inside an array creation
        String source = trimmed.startsWith("{") ? "new Object[] " + trimmed : trimmed;
        ParseResult<Expression> result = parser.parseExpression(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String reason = result.getProblems().isEmpty() ? "syntax error" : result.getProblem(0).getMessage();
            throw new LiteralParseException(text, reason);
        }
        return toValue(result.getResult().get(), text);
    }

    /** Parses and converts the value to the declared type, e.g. {@code 5} for a {@code double} parameter. */
    public Object parse(String text, TypeDescriptor target) throws LiteralParseException {
        if (text == null) throw new LiteralParseException("null", "no text");
        if (target.isScalar(TypeDescriptor.ScalarKind.ENUM)) {
            Object constant = enumConstant(text.trim(), target.rawType);
            if (constant != null) return constant;
        }
        return coerce(parse(text), target, text);
    }

    private Object toValue(Expression expr, String text) throws LiteralParseException {
        if (expr.isEnclosedExpr()) return toValue(expr.asEnclosedExpr().getInner(), text);
        if (expr.isNullLiteralExpr()) return null;
        if (expr.isBooleanLiteralExpr()) return expr.asBooleanLiteralExpr().getValue();
        if (expr.isIntegerLiteralExpr()) return expr.asIntegerLiteralExpr().asNumber();
        if (expr.isLongLiteralExpr()) return expr.asLongLiteralExpr().asNumber();
        if (expr.isDoubleLiteralExpr()) {
            String value = expr.asDoubleLiteralExpr().getValue();
            if (value.endsWith("f") || value.endsWith("F")) return Float.parseFloat(value);
            return expr.asDoubleLiteralExpr().asDouble();
        }
        if (expr.isCharLiteralExpr()) return expr.asCharLiteralExpr().asChar();
        if (expr.isStringLiteralExpr()) return expr.asStringLiteralExpr().asString();
        if (expr.isTextBlockLiteralExpr()) return expr.asTextBlockLiteralExpr().asString();
        if (expr.isUnaryExpr()) return signed(expr.asUnaryExpr(), text);
        if (expr.isArrayCreationExpr()) {
            Optional<ArrayInitializerExpr> initializer = expr.asArrayCreationExpr().getInitializer();
            if (initializer.isEmpty()) throw new LiteralParseException(text, "array creation without initializer");
            return elements(initializer.get().getValues(), text);
        }
        if (expr.isArrayInitializerExpr()) return elements(expr.asArrayInitializerExpr().getValues(), text);
        if (expr.isMethodCallExpr()) return collectionFactory(expr.asMethodCallExpr(), text);
        throw new LiteralParseException(text, expr.getClass().getSimpleName() + " is not a literal");
    }

    private Object signed(UnaryExpr unary, String text) throws LiteralParseException {
        UnaryExpr.Operator operator = unary.getOperator();
        if (operator != UnaryExpr.Operator.MINUS && operator != UnaryExpr.Operator.PLUS) {
            throw new LiteralParseException(text, "operator " + operator.asString() + " is not allowed");
        }
        Object operand = toValue(unary.getExpression(), text);
        if (!(operand instanceof Number)) throw new LiteralParseException(text, "sign applied to a non-number");
        if (operator == UnaryExpr.Operator.PLUS) return operand;

        Number n = (Number) operand;
        if (n instanceof Double) return -n.doubleValue();
        if (n instanceof Float) return -n.floatValue();
        long negated = -n.longValue();
        // 2147483648 only exists as -2147483648
        if (unary.getExpression().isIntegerLiteralExpr() && negated >= Integer.MIN_VALUE) return (int) negated;
        return negated;
    }

    private List<Object> elements(List<Expression> expressions, String text) throws LiteralParseException {
        List<Object> values = new ArrayList<>(expressions.size());
        for (Expression e : expressions) values.add(toValue(e, text));
        return values;
    }

    private Object collectionFactory(MethodCallExpr call, String text) throws LiteralParseException {
        String qualified = call.getScope().map(s -> s.toString() + ".").orElse("") + call.getNameAsString();
        if (!COLLECTION_FACTORIES.contains(qualified)) {
            throw new LiteralParseException(text, "call to " + qualified + " is not allowed");
        }
        List<Object> arguments = elements(call.getArguments(), text);
        if (qualified.endsWith("Set.of")) return new LinkedHashSet<>(arguments);
        if (qualified.endsWith("Map.of")) {
            if (arguments.size() % 2 != 0) throw new LiteralParseException(text, "Map.of needs key/value pairs");
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < arguments.size(); i += 2) map.put(arguments.get(i), arguments.get(i + 1));
            return map;
        }
        return arguments;
    }

    private Object coerce(Object value, TypeDescriptor target, String text) throws LiteralParseException {
        if (value == null) {
            if (target.rawType.isPrimitive()) throw new LiteralParseException(text, "null for primitive " + target);
            return null;
        }
        switch (target.kind) {
            case SCALAR:
                return coerceScalar(value, target, text);
            case COLLECTION: {
                Collection<?> source = asCollection(value);
                if (source == null) throw new LiteralParseException(text, "expected a collection for " + target);
                List<Object> converted = new ArrayList<>(source.size());
                for (Object element : source) converted.add(coerce(element, target.elementType, text));
                if (target.collectionKind == CollectionKind.ARRAY) {
                    Object array = Array.newInstance(target.rawType.getComponentType(), converted.size());
                    for (int i = 0; i < converted.size(); i++) Array.set(array, i, converted.get(i));
                    return array;
                }
                Collection<Object> collection = Containers.newCollection(target.rawType);
                for (Object element : converted) {
                    try {
                        collection.add(element);
                    } catch (NullPointerException | ClassCastException e) {
                        throw new LiteralParseException(text, target + " does not accept " + element, e);
                    }
                }
                return collection;
            }
            case MAPPING: {
                if (!(value instanceof Map<?, ?>)) throw new LiteralParseException(text, "expected a map for " + target);
                Map<Object, Object> converted = Containers.newMap(target.rawType);
                for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                    Object key = coerce(e.getKey(), target.elementType, text);
                    Object entryValue = coerce(e.getValue(), target.valueType, text);
                    try {
                        converted.put(key, entryValue);
                    } catch (NullPointerException | ClassCastException ex) {
                        throw new LiteralParseException(text, target + " does not accept " + key + "=" + entryValue, ex);
                    }
                }
                return converted;
            }
            default:
                return value;
        }
    }

    private Object coerceScalar(Object value, TypeDescriptor target, String text) throws LiteralParseException {
        switch (target.scalarKind) {
            case INT:
            case LONG:
            case SHORT:
            case BYTE: {
                if (!(value instanceof Integer || value instanceof Long)) {
                    throw new LiteralParseException(text, "expected an integer for " + target);
                }
                long v = ((Number) value).longValue();
                switch (target.scalarKind) {
                    case LONG:
                        return v;
                    case INT:
                        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) break;
                        return (int) v;
                    case SHORT:
                        if (v < Short.MIN_VALUE || v > Short.MAX_VALUE) break;
                        return (short) v;
                    default:
                        if (v < Byte.MIN_VALUE || v > Byte.MAX_VALUE) break;
                        return (byte) v;
                }
                throw new LiteralParseException(text, v + " is out of range for " + target);
            }
            case DOUBLE:
                if (value instanceof Number) return ((Number) value).doubleValue();
                break;
            case FLOAT:
                if (value instanceof Number) return ((Number) value).floatValue();
                break;
            case BOOLEAN:
                if (value instanceof Boolean) return value;
                break;
            case CHAR:
                if (value instanceof Character) return value;
                if (value instanceof String && ((String) value).length() == 1) return ((String) value).charAt(0);
                break;
            case STRING:
                if (value instanceof String) return value;
                if (value instanceof Character) return value.toString();
                break;
            case ENUM:
                if (value instanceof String) {
                    Object constant = enumConstant((String) value, target.rawType);
                    if (constant != null) return constant;
                }
                break;
        }
        throw new LiteralParseException(text, value.getClass().getSimpleName() + " does not fit " + target);
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection<?>) return (Collection<?>) value;
        if (value.getClass().isArray()) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) list.add(Array.get(value, i));
            return list;
        }
        return null;
    }

    private static Object enumConstant(String text, Class<?> enumType) {
        String name = text;
        if (name.length() > 1 && name.startsWith("\"") && name.endsWith("\"")) name = name.substring(1, name.length() - 1);
        name = name.substring(name.lastIndexOf('.') + 1);
        for (Object constant : enumType.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(name)) return constant;
        }
        return null;
    }
}
