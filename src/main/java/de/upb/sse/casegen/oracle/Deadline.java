package de.upb.sse.casegen.oracle;

import de.upb.sse.casegen.configuration.CaseGenConfiguration;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * How a target call is bounded in time. Chosen once at start-up and handed to the
 * {@link OracleRunner}.
 */
public interface Deadline {
    String PROPERTY = "casegen.deadline";

    /**
     * Runs the call and returns its result. A throwable raised by the call surfaces as the cause
     * of an {@link ExecutionException}; overrunning {@code limit} raises {@link TimeoutException}.
     */
    Object enforce(TargetCall call, Object[] args, Duration limit)
            throws TimeoutException, ExecutionException, InterruptedException;

    boolean isPreemptive();

    static Deadline select(CaseGenConfiguration config) {
        boolean forcedInline = "inline".equalsIgnoreCase(System.getProperty(PROPERTY, ""));
        if (config.isPreemptiveDeadline() && !forcedInline) {
            return new PreemptiveDeadline();
        }
        return new InlineDeadline();
    }
}
