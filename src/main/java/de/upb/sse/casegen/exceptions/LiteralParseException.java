package de.upb.sse.casegen.exceptions;

/** Text supplied as a literal value is not accepted by the literal grammar. */
public class LiteralParseException extends Exception {
    private final String text;

    public LiteralParseException(String text, String reason) {
        super("Not a literal: '" + text + "' (" + reason + ")");
        this.text = text;
    }

    public LiteralParseException(String text, String reason, Throwable cause) {
        super("Not a literal: '" + text + "' (" + reason + ")", cause);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
