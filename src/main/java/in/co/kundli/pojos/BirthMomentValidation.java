package in.co.kundli.pojos;

import java.util.List;

/**
 * Outcome of {@link BirthMoment#validate}: either valid, or invalid with every error found.
 */
public final class BirthMomentValidation {

    private static final BirthMomentValidation VALID = new BirthMomentValidation(List.of());

    private final List<String> errors;

    private BirthMomentValidation(List<String> errors) {
        this.errors = List.copyOf(errors);
    }

    public static BirthMomentValidation valid() {
        return VALID;
    }

    public static BirthMomentValidation invalid(List<String> errors) {
        return errors.isEmpty() ? VALID : new BirthMomentValidation(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getFirstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
