package de.upb.sse.casegen.oracle;

import de.upb.sse.casegen.exceptions.CallRejectedException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Executes target code as its own oracle. Whatever the target returns or raises is the
 * outcome; a timeout means the oracle produced nothing.
 */
public class OracleRunner {
    private static final Logger logger = Logger.getLogger(OracleRunner.class.getName());

    private final Deadline deadline;

    public OracleRunner(Deadline deadline) {
        this.deadline = deadline;
    }

    /**
     * @throws CallRejectedException if reflection refused the call, which is not an outcome of the target
     */
    public Outcome invoke(TargetCall call, Object[] args, Duration limit) {
        try {
            return Outcome.returned(deadline.enforce(call, args, limit));
        } catch (TimeoutException e) {
            logger.fine(() -> "No result within " + limit.toMillis() + "ms for " + Arrays.deepToString(args));
            return Outcome.timedOut();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CallRejectedException) throw (CallRejectedException) e.getCause();
            return Outcome.raised(unwrap(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for target code", e);
        }
    }

    public Deadline getDeadline() {
        return deadline;
    }

    /** Strips reflection and worker wrappers down to the throwable the target itself raised. */
    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current.getCause() != null
                && (current instanceof InvocationTargetException
                || current instanceof ExecutionException
                || current.getClass() == UndeclaredThrowableException.class)) {
            current = current.getCause();
        }
        return current;
    }
}
