package wattle.core.model.auth;

import org.jboss.logging.Logger;

/**
 * An operation outcome that knows the level it should be logged at.
 */
public interface LoggableResult {

    /**
     * Return the level this outcome is logged at.
     *
     * @return the log level
     */
    Logger.Level logLevel();
}
