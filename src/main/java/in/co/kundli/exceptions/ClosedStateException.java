package in.co.kundli.exceptions;

public class ClosedStateException extends KundliException {

    public ClosedStateException(String message) {
        super(message);
    }
}
