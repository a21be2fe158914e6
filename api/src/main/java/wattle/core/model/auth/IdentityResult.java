package wattle.core.model.auth;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Outcome of an identity operation such as creating a user or changing a password.
 */
public final class IdentityResult implements LoggableResult {

    private static final IdentityResult SUCCESS = new IdentityResult(true, List.of());

    private final boolean succeeded;
    private final List<IdentityError> errors;

    private IdentityResult(boolean succeeded, List<IdentityError> errors) {
        this.succeeded = succeeded;
        this.errors = errors;
    }

    public static IdentityResult success() {
        return SUCCESS;
    }

    /**
     * Creates a failed result.
     *
     * @param errors the errors that caused the failure, may be empty
     * @return the failed result
     */
    public static IdentityResult failed(IdentityError... errors) {
        return new IdentityResult(false, errors == null ? List.of() : List.copyOf(Arrays.asList(errors)));
    }

    public boolean succeeded() {
        return succeeded;
    }

    public List<IdentityError> errors() {
        return errors;
    }

    @Override
    public Logger.Level logLevel() {
        return succeeded ? Logger.Level.DEBUG : Logger.Level.WARN;
    }

    @Override
    public String toString() {
        if (succeeded) {
            return "Succeeded";
        }
        return "Failed : " + errors.stream().map(IdentityError::code).collect(Collectors.joining(","));
    }
}
