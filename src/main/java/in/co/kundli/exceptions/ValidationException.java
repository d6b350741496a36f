package in.co.kundli.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * Caller input outside the supported domain. Raised before the numerical provider is touched.
 * Carries every rule that failed, not only the first.
 */
public class ValidationException extends KundliException {

    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public ValidationException(List<String> errors) {
        super(errors.isEmpty() ? "Unknown validation error" : String.join("; ", errors));
        this.errors = Collections.unmodifiableList(List.copyOf(errors));
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getFirstError() {
        return errors.isEmpty() ? "Unknown validation error" : errors.get(0);
    }
}
