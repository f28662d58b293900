package de.upb.sse.casegen.synthesis;

import java.lang.reflect.Constructor;
import java.util.Collections;
import java.util.List;

/**
 * How to build a working instance of a class under test, worked out once per class and then
 * replayed for every method case. Each replay gets its own copy of the constructor arguments.
 *
 * A recipe without a constructor either carries the error the class itself raised while being
 * built, which instance-method cases record, or only a reason (a timeout, a call refused by
 * reflection), in which case the instance members produce no cases at all.
 */
final class InstanceRecipe {
    private final Constructor<?> constructor;
    private final List<Object> arguments;
    private final Throwable failure;
    private final String reason;

    private InstanceRecipe(Constructor<?> constructor, List<Object> arguments, Throwable failure, String reason) {
        this.constructor = constructor;
        this.arguments = arguments;
        this.failure = failure;
        this.reason = reason;
    }

    static InstanceRecipe of(Constructor<?> constructor, List<Object> arguments) {
        return new InstanceRecipe(constructor, Collections.unmodifiableList(Candidate.snapshot(arguments)), null, null);
    }

    static InstanceRecipe failed(List<Object> arguments, Throwable failure) {
        return new InstanceRecipe(null, Collections.unmodifiableList(Candidate.snapshot(arguments)), failure,
                failure.getClass().getSimpleName() + ": " + failure.getMessage());
    }

    static InstanceRecipe unavailable(List<Object> arguments, String reason) {
        return new InstanceRecipe(null, Collections.unmodifiableList(Candidate.snapshot(arguments)), null, reason);
    }

    boolean isUsable() {
        return constructor != null;
    }

    /** True when construction raised an error of the class's own that cases can expect. */
    boolean hasRecordableFailure() {
        return failure != null;
    }

    Throwable getFailure() {
        return failure;
    }

    String getReason() {
        return reason;
    }

    /** The constructor arguments as recorded in method cases. */
    List<Object> getArguments() {
        return arguments;
    }

    Object newInstance() throws ReflectiveOperationException {
        if (constructor == null) throw new IllegalStateException("No working constructor: " + reason, failure);
        return constructor.newInstance(Candidate.snapshot(arguments).toArray());
    }
}
