package pl.marcinmilkowski.constraint_kb.ingest;

import java.io.IOException;

/**
 * A required source is missing, or a present source is malformed.
 * Terminates the build; not worth retrying.
 */
public class SourceFormatException extends IOException {

    private final String source;
    private final String location;

    public SourceFormatException(String source, String location, String message) {
        super(format(source, location, message));
        this.source = source;
        this.location = location;
    }

    public SourceFormatException(String source, String location, String message, Throwable cause) {
        super(format(source, location, message), cause);
        this.source = source;
        this.location = location;
    }

    private static String format(String source, String location, String message) {
        return location == null || location.isEmpty()
            ? source + ": " + message
            : source + " at " + location + ": " + message;
    }

    /** Name of the failing source */
    public String getSource() {
        return source;
    }

    /** Path of the offending entry inside the source, or empty for whole-file problems */
    public String getLocation() {
        return location;
    }
}
