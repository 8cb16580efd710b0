package io.rtfde.core.encoding;

/**
 * Raised when a control parameter cannot be interpreted as an integer.
 */
public class InvalidParameterException extends RuntimeException {

    private final String value;

    public InvalidParameterException(String value) {
        super("Control parameter is not an integer: '" + value + "'");
        this.value = value;
    }

    public InvalidParameterException(String value, Throwable cause) {
        super("Control parameter is not an integer: '" + value + "'", cause);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
