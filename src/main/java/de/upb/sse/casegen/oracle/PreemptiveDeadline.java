package de.upb.sse.casegen.oracle;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs every call on its own daemon worker. When the deadline passes, the worker is interrupted
 * and abandoned; side effects it already produced are not rolled back, and code that ignores
 * interrupts keeps running in the background until it finishes on its own.
 */
public class PreemptiveDeadline implements Deadline {
    private static final Logger logger = Logger.getLogger(PreemptiveDeadline.class.getName());
    private static final AtomicInteger WORKERS = new AtomicInteger();

    @Override
    public Object enforce(TargetCall call, Object[] args, Duration limit)
            throws TimeoutException, ExecutionException, InterruptedException {
        ExecutorService worker = Executors.newSingleThreadExecutor(task -> {
            Thread t = new Thread(task, "casegen-oracle-" + WORKERS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Future<Object> future = worker.submit(call.bind(args));
        try {
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.fine(() -> "Abandoned worker after " + limit.toMillis() + "ms");
            throw e;
        } finally {
            worker.shutdownNow();
        }
    }

    @Override
    public boolean isPreemptive() {
        return true;
    }
}
