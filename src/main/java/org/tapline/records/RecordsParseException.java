package org.tapline.records;

import org.tapline.BuildException;

/**
 * Thrown when a persisted records file exists but cannot be parsed.
 * <p>
 * The message always starts with {@link #MESSAGE_PREFIX} followed by the parser's own
 * diagnostic.
 */
public class RecordsParseException extends BuildException {

    /** Fixed marker prepended to every records parse failure. */
    public static final String MESSAGE_PREFIX = "Cannot parse records: ";

    public RecordsParseException(String detail) {
        super(MESSAGE_PREFIX + detail);
    }

    public RecordsParseException(String detail, Throwable cause) {
        super(MESSAGE_PREFIX + detail, cause);
    }
}
