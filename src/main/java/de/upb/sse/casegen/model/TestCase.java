package de.upb.sse.casegen.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single generated case of a free function. When {@link #getExpectedError()} is set the
 * expected output is unobservable and always {@code null}.
 */
@Getter
@ToString
public final class TestCase {
    private final List<Object> inputs;
    private final Object expectedOutput;
    private final String description;
    private final Class<? extends Throwable> expectedError;

    public TestCase(List<?> inputs, Object expectedOutput, String description) {
        this(inputs, expectedOutput, description, null);
    }

    public TestCase(List<?> inputs, Object expectedOutput, String description, Class<? extends Throwable> expectedError) {
        this.inputs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(inputs, "inputs")));
        this.expectedOutput = expectedError == null ? expectedOutput : null;
        this.description = description == null ? "" : description;
        this.expectedError = expectedError;
    }

    public static TestCase raising(List<?> inputs, String description, Class<? extends Throwable> expectedError) {
        return new TestCase(inputs, null, description, Objects.requireNonNull(expectedError, "expectedError"));
    }

    public boolean expectsError() {
        return expectedError != null;
    }
}
