package wattle.adapter.out.telemetry;

import java.util.function.Function;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import wattle.core.model.auth.IdentityResult;
import wattle.core.model.auth.LoggableResult;
import wattle.core.model.auth.SignInResult;

/**
 * Logs identity operation results without building messages for disabled levels.
 *
 * <p>Every method returns its result unchanged so calls can wrap an expression:
 * <pre>
 * return identityLogger.logIdentityResult(store.create(user), "createUser");
 * </pre>
 *
 * <p>The overloads without a method name use the name of the calling method, looked up only when
 * the message is actually logged.
 *
 * <p>The sink is a plain field. Swapping it while other threads log is not synchronized.
 */
public class IdentityLogger {

    private static final StackWalker STACK_WALKER =
            StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private static final String LAMBDA_PREFIX = "lambda$";

    private Logger logger;

    public IdentityLogger() {}

    public IdentityLogger(Logger logger) {
        this.logger = logger;
    }

    public Logger getLogger() {
        return logger;
    }

    public void setLogger(Logger logger) {
        this.logger = logger;
    }

    /**
     * Logs a result at the level derived from it.
     *
     * <p>The message builder runs at most once, and only if the resolved level is enabled.
     *
     * @param result         the result to log
     * @param getLevel       resolves the log level from the result
     * @param messageBuilder builds the message
     * @param <T>            the result type
     * @return {@code result}
     */
    public <T> T logResult(T result, Function<T, Logger.Level> getLevel, Supplier<String> messageBuilder) {
        final var level = getLevel.apply(result);

        if (logger.isEnabled(level)) {
            logger.log(level, messageBuilder.get(), (Throwable) null);
        }

        return result;
    }

    public SignInResult logSignInResult(SignInResult result, String methodName) {
        return logOutcome(result, () -> IdentityMessages.signInResult(methodName, result));
    }

    public SignInResult logSignInResult(SignInResult result) {
        return logOutcome(result, () -> IdentityMessages.signInResult(callerMethodName(), result));
    }

    public IdentityResult logIdentityResult(IdentityResult result, String methodName) {
        return logOutcome(result, () -> IdentityMessages.identityResult(methodName, result));
    }

    public IdentityResult logIdentityResult(IdentityResult result) {
        return logOutcome(result, () -> IdentityMessages.identityResult(callerMethodName(), result));
    }

    /**
     * Logs a boolean outcome: DEBUG when true, WARN when false.
     *
     * @param result     the outcome
     * @param methodName the operation that produced it
     * @return {@code result}
     */
    public boolean logResult(boolean result, String methodName) {
        return logResult(
                result, IdentityLogger::levelOf, () -> IdentityMessages.identityResult(methodName, result));
    }

    public boolean logResult(boolean result) {
        return logResult(
                result, IdentityLogger::levelOf, () -> IdentityMessages.identityResult(callerMethodName(), result));
    }

    private <R extends LoggableResult> R logOutcome(R result, Supplier<String> messageBuilder) {
        return logResult(result, LoggableResult::logLevel, messageBuilder);
    }

    private static Logger.Level levelOf(Boolean succeeded) {
        return succeeded ? Logger.Level.DEBUG : Logger.Level.WARN;
    }

    // First frame outside this class hierarchy. Lambda bodies are declared on this class and are skipped.
    private static String callerMethodName() {
        return STACK_WALKER.walk(frames -> frames.filter(
                                frame -> !IdentityLogger.class.isAssignableFrom(frame.getDeclaringClass()))
                        .findFirst()
                        .map(frame -> memberName(frame.getMethodName()))
                        .orElse(null));
    }

    /**
     * Maps a synthetic lambda method ({@code lambda$createUser$0}) to the method that declares the lambda.
     */
    static String memberName(String methodName) {
        if (!methodName.startsWith(LAMBDA_PREFIX)) {
            return methodName;
        }
        final var end = methodName.indexOf('$', LAMBDA_PREFIX.length());
        return end < 0
                ? methodName.substring(LAMBDA_PREFIX.length())
                : methodName.substring(LAMBDA_PREFIX.length(), end);
    }
}
