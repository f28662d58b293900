package de.upb.sse.casegen.oracle;

import de.upb.sse.casegen.exceptions.CallRejectedException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.Callable;

/** A callable under test, applied to one candidate argument list. */
@FunctionalInterface
public interface TargetCall {
    Object call(Object[] args) throws Throwable;

    default Callable<Object> bind(Object[] args) {
        return () -> {
            try {
                return call(args);
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new UndeclaredThrowableException(t);
            }
        };
    }

    /**
     * For calls made through {@code Method.invoke} or {@code Constructor.newInstance}: what the
     * target raised arrives wrapped in an {@link InvocationTargetException}; anything the
     * reflection layer throws itself becomes a {@link CallRejectedException}.
     */
    static TargetCall reflective(TargetCall call) {
        return args -> {
            try {
                return call.call(args);
            } catch (InvocationTargetException e) {
                throw e;
            } catch (IllegalArgumentException | IllegalAccessException | InstantiationException e) {
                throw new CallRejectedException(e);
            }
        };
    }
}
