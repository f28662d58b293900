package de.upb.sse.casegen.exceptions;

/**
 * Reflection on a class or one of its members failed. Raised inside the analyzer, where it is
 * logged and the offending member is left out of the description.
 */
public class AnalysisException extends RuntimeException {
    private final String owner;
    private final String member;

    public AnalysisException(String owner, String member, Throwable cause) {
        super("Cannot analyze " + (member == null ? owner : owner + "." + member) + ": " + describe(cause), cause);
        this.owner = owner;
        this.member = member;
    }

    public String getOwner() {
        return owner;
    }

    public String getMember() {
        return member;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown cause";
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? " (" + cause.getMessage() + ")" : "");
    }
}
