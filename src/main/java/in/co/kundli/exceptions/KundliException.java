package in.co.kundli.exceptions;

/**
 * Base type for every failure raised by the chart calculation core.
 */
public class KundliException extends RuntimeException {

    public KundliException(String message) {
        super(message);
    }

    public KundliException(String message, Throwable cause) {
        super(message, cause);
    }
}
