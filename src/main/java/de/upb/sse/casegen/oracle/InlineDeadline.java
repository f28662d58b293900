package de.upb.sse.casegen.oracle;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * Runs the call on the caller's thread. The limit is not enforced: a call that never returns
 * blocks generation. Used where spawning worker threads for target code is not wanted.
 */
public class InlineDeadline implements Deadline {
    private static final Logger logger = Logger.getLogger(InlineDeadline.class.getName());

    public InlineDeadline() {
        logger.info("Target calls run inline, per-call deadlines are not enforced");
    }

    @Override
    public Object enforce(TargetCall call, Object[] args, Duration limit) throws ExecutionException {
        try {
            return call.call(args);
        } catch (Throwable t) {
            throw new ExecutionException(t);
        }
    }

    @Override
    public boolean isPreemptive() {
        return false;
    }
}
