package gov.llnl.sina.data;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals a failure in parsing a string or a JSON document.
 * <p>
 * This exception is thrown when a range expression, a JSON record or relationship, or a whole
 * JSON document cannot be parsed, either because of a syntax error or because the parsed content
 * violates the constraints of the record model (e.g., a list mixing numbers and strings, or a
 * relationship referring to an undefined local id).
 * </p>
 */
public class ParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parsedString;

    /**
     * Creates a new instance with the parsed string and the optional error message specified.
     *
     * @param parsedString
     *            the parsed string, for debugging purposes
     * @param message
     *            an optional error message, to which the parsed string is concatenated
     */
    public ParseException(final String parsedString, @Nullable final String message) {
        this(parsedString, message, null);
    }

    /**
     * Creates a new instance with the parsed string, optional error message and cause specified.
     *
     * @param parsedString
     *            the parsed string, for debugging purposes
     * @param message
     *            an optional error message, to which the parsed string is concatenated
     * @param cause
     *            the optional cause of this exception
     */
    public ParseException(final String parsedString, @Nullable final String message,
            @Nullable final Throwable cause) {
        super(message + " (parsed: " + abbreviate(parsedString) + ")", cause);
        this.parsedString = Preconditions.checkNotNull(parsedString);
    }

    /**
     * Returns the parsed string. This property is intended for debugging purposes.
     *
     * @return the parsed string
     */
    public final String getParsedString() {
        return this.parsedString;
    }

    private static String abbreviate(@Nullable final String string) {
        if (string == null) {
            return "null";
        }
        return string.length() <= 200 ? string : string.substring(0, 200) + "...";
    }

}
