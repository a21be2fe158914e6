package wattle.core.model.auth;

import org.jboss.logging.Logger;

/**
 * Outcome of a sign-in attempt.
 *
 * <p>Successful sign-ins and sign-ins waiting on a second factor are routine and log at DEBUG.
 * Every other outcome logs at WARN.
 */
public enum SignInResult implements LoggableResult {
    SUCCEEDED("Succeeded"),
    FAILED("Failed"),
    LOCKED_OUT("Lockedout"),
    NOT_ALLOWED("NotAllowed"),
    REQUIRES_TWO_FACTOR("RequiresTwoFactor");

    private final String label;

    SignInResult(String label) {
        this.label = label;
    }

    public boolean succeeded() {
        return this == SUCCEEDED;
    }

    public boolean isLockedOut() {
        return this == LOCKED_OUT;
    }

    public boolean isNotAllowed() {
        return this == NOT_ALLOWED;
    }

    public boolean requiresTwoFactor() {
        return this == REQUIRES_TWO_FACTOR;
    }

    @Override
    public Logger.Level logLevel() {
        return succeeded() || requiresTwoFactor() ? Logger.Level.DEBUG : Logger.Level.WARN;
    }

    @Override
    public String toString() {
        return label;
    }
}
