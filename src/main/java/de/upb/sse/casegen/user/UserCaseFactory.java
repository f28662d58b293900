package de.upb.sse.casegen.user;

import de.upb.sse.casegen.analysis.StructureAnalyzer;
import de.upb.sse.casegen.analysis.TypeResolver;
import de.upb.sse.casegen.exceptions.LiteralParseException;
import de.upb.sse.casegen.model.*;
import de.upb.sse.casegen.model.ClassMethodTestCase.AccessorKind;
import de.upb.sse.casegen.values.ErrorKinds;
import de.upb.sse.casegen.values.LiteralParser;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds case records from hand-written values, e.g. rows typed in by a user. Inputs and
 * expected outputs are literal text converted to the declared types; an expected error is
 * given by class name. Nothing is executed.
 */
public class UserCaseFactory {
    private static final Logger logger = Logger.getLogger(UserCaseFactory.class.getName());

    private final LiteralParser parser;
    private final StructureAnalyzer analyzer;

    public UserCaseFactory() {
        this(new LiteralParser(), new StructureAnalyzer());
    }

    public UserCaseFactory(LiteralParser parser, StructureAnalyzer analyzer) {
        this.parser = parser;
        this.analyzer = analyzer;
    }

    /**
     * @param expectedText literal of the expected return value, ignored when {@code errorName} is given
     * @param errorName    simple or qualified name of the expected throwable, or {@code null}
     */
    public TestCase functionCase(Method function, List<String> inputTexts, String expectedText, String errorName)
            throws LiteralParseException {
        List<Object> inputs = parseAll(inputTexts, analyzer.describeParameters(function), function.getName());
        if (errorName != null) {
            Class<? extends Throwable> error = ErrorKinds.resolve(errorName, function.getDeclaringClass().getClassLoader());
            return TestCase.raising(inputs, "User case with inputs: " + inputs + " (raises " + error.getSimpleName() + ")", error);
        }
        Object expected = parseExpected(expectedText, TypeResolver.resolve(function.getGenericReturnType()));
        return new TestCase(inputs, expected, "User case with inputs: " + inputs);
    }

    /**
     * Looks the member up by key, method name or accessor name. {@code <init>} denotes the
     * constructor; then member texts must be empty.
     */
    public ClassMethodTestCase memberCase(Class<?> cls, List<String> constructorTexts, String memberName,
                                          List<String> memberTexts, String expectedText, String errorName)
            throws LiteralParseException {
        ClassDescription description = analyzer.analyze(cls);
        if (description.isFailed()) throw new IllegalArgumentException("Cannot describe " + cls.getName() + ": " + description.error);

        List<ParameterDescriptor> constructorParameters = description.getConstructor()
                .map(c -> c.parameters)
                .orElse(Collections.emptyList());
        List<Object> constructorInputs = parseAll(constructorTexts, constructorParameters, ClassMethodTestCase.CONSTRUCTOR);
        Class<? extends Throwable> error = errorName == null
                ? null
                : ErrorKinds.resolve(errorName, cls.getClassLoader());
        String suffix = error == null ? "" : " (raises " + error.getSimpleName() + ")";

        if (ClassMethodTestCase.CONSTRUCTOR.equals(memberName)) {
            if (memberTexts != null && !memberTexts.isEmpty()) {
                throw new IllegalArgumentException("Constructor cases take no member inputs");
            }
            return ClassMethodTestCase.constructorCase(cls, constructorInputs,
                    "User constructor case with inputs: " + constructorInputs + suffix, error);
        }

        Member member = findMember(description, memberName);
        List<Object> memberInputs = parseAll(memberTexts, member.parameters, memberName);
        Object expected = error == null ? parseExpected(expectedText, member.resultType) : null;
        String text = "User case for " + member.name + " with inputs: " + memberInputs + suffix;
        return new ClassMethodTestCase(cls, member.isStatic ? List.of() : constructorInputs, member.name, memberInputs,
                expected, text, error, member.accessorKind);
    }

    private Member findMember(ClassDescription description, String memberName) {
        for (MethodDescriptor m : allMethods(description)) {
            if (m.key.equals(memberName)) return new Member(m.name, m.parameters, m.returnType, m.isStatic(), AccessorKind.NONE);
        }
        for (MethodDescriptor m : allMethods(description)) {
            if (m.name.equals(memberName)) return new Member(m.name, m.parameters, m.returnType, m.isStatic(), AccessorKind.NONE);
        }
        for (PropertyDescriptor p : description.properties.values()) {
            if (p.getter.getName().equals(memberName) || p.name.equals(memberName)) {
                return new Member(p.getter.getName(), List.of(), p.type, false, AccessorKind.GETTER);
            }
            if (p.hasSetter() && p.setter.getName().equals(memberName)) {
                return new Member(p.setter.getName(), List.of(new ParameterDescriptor("value", p.type)), p.type, false,
                        AccessorKind.SETTER);
            }
        }
        throw new IllegalArgumentException("No member " + memberName + " in " + description.name);
    }

    private static List<MethodDescriptor> allMethods(ClassDescription description) {
        List<MethodDescriptor> all = new ArrayList<>(description.methods.values());
        all.addAll(description.classMethods.values());
        all.addAll(description.staticMethods.values());
        return all;
    }

    private List<Object> parseAll(List<String> texts, List<ParameterDescriptor> parameters, String callable)
            throws LiteralParseException {
        List<String> given = texts == null ? List.of() : texts;
        if (given.size() != parameters.size()) {
            throw new LiteralParseException(String.join(", ", given),
                    callable + " expects " + parameters.size() + " inputs, got " + given.size());
        }
        List<Object> values = new ArrayList<>(given.size());
        for (int i = 0; i < given.size(); i++) {
            values.add(parser.parse(given.get(i), parameters.get(i).type));
        }
        return values;
    }

    private Object parseExpected(String text, TypeDescriptor type) throws LiteralParseException {
        if (text == null || text.isBlank()) {
            logger.fine("No expected output given, recording null");
            return null;
        }
        return type.kind == TypeDescriptor.Kind.UNKNOWN ? parser.parse(text) : parser.parse(text, type);
    }

    private static final class Member {
        final String name;
        final List<ParameterDescriptor> parameters;
        final TypeDescriptor resultType;
        final boolean isStatic;
        final AccessorKind accessorKind;

        Member(String name, List<ParameterDescriptor> parameters, TypeDescriptor resultType, boolean isStatic,
               AccessorKind accessorKind) {
            this.name = name;
            this.parameters = parameters;
            this.resultType = resultType;
            this.isStatic = isStatic;
            this.accessorKind = accessorKind;
        }
    }
}
