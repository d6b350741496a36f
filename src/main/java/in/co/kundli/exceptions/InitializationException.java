package in.co.kundli.exceptions;

/**
 * The ephemeris engine could not be constructed (unusable data directory,
 * provider rejected its configuration, malformed settings file).
 */
public class InitializationException extends KundliException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
