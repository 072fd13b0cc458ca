package com.astradesk.reviewtracker.analysis;

/**
 * Raised when a timestamp cannot be turned into an instant. A ticket whose
 * history contains one is rejected as a whole, since the order of its
 * transitions can no longer be trusted.
 */
public class MalformedTimestampException extends RuntimeException {

    private final String rawValue;

    public MalformedTimestampException(String rawValue) {
        super("Malformed timestamp '%s'".formatted(rawValue));
        this.rawValue = rawValue;
    }

    public MalformedTimestampException(String rawValue, Throwable cause) {
        super("Malformed timestamp '%s'".formatted(rawValue), cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
