package de.upb.sse.casegen.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A generated case of a class member. Constructor cases use {@link #CONSTRUCTOR} as member
 * name and carry no member inputs.
 */
@Getter
@ToString
public final class ClassMethodTestCase {
    public static final String CONSTRUCTOR = "<init>";

    public enum AccessorKind { NONE, GETTER, SETTER }

    private final Class<?> classType;
    private final List<Object> constructorInputs;
    private final String memberName;
    private final List<Object> memberInputs;
    private final Object expectedOutput;
    private final String description;
    private final Class<? extends Throwable> expectedError;
    private final AccessorKind accessorKind;

    public ClassMethodTestCase(Class<?> classType, List<?> constructorInputs, String memberName, List<?> memberInputs,
                               Object expectedOutput, String description, Class<? extends Throwable> expectedError,
                               AccessorKind accessorKind) {
        this.classType = Objects.requireNonNull(classType, "classType");
        this.constructorInputs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(constructorInputs, "constructorInputs")));
        this.memberName = Objects.requireNonNull(memberName, "memberName");
        this.memberInputs = CONSTRUCTOR.equals(memberName)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(memberInputs, "memberInputs")));
        this.expectedOutput = expectedError == null ? expectedOutput : null;
        this.description = description == null ? "" : description;
        this.expectedError = expectedError;
        this.accessorKind = accessorKind == null ? AccessorKind.NONE : accessorKind;
    }

    public static ClassMethodTestCase constructorCase(Class<?> classType, List<?> constructorInputs, String description,
                                                      Class<? extends Throwable> expectedError) {
        return new ClassMethodTestCase(classType, constructorInputs, CONSTRUCTOR, Collections.emptyList(),
                null, description, expectedError, AccessorKind.NONE);
    }

    public boolean expectsError() {
        return expectedError != null;
    }

    public boolean isConstructorCase() {
        return CONSTRUCTOR.equals(memberName);
    }

    public boolean isPropertyGetter() {
        return accessorKind == AccessorKind.GETTER;
    }

    public boolean isPropertySetter() {
        return accessorKind == AccessorKind.SETTER;
    }
}
