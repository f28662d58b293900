package de.upb.sse.casegen.exceptions;

/**
 * Reflection refused a call before any target code ran, e.g. an argument of the wrong type or an
 * inaccessible member. Says nothing about the target's behavior, so no case may record it.
 */
public class CallRejectedException extends RuntimeException {

    public CallRejectedException(Throwable cause) {
        super("Call rejected by reflection: " + cause, cause);
    }
}
