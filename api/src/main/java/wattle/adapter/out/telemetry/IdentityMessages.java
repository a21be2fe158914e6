package wattle.adapter.out.telemetry;

/**
 * Log message templates for identity operation results.
 */
public final class IdentityMessages {

    static final String UNKNOWN_METHOD = "(unknown)";

    // method name, result
    private static final String RESULT = "%s : %s";

    private IdentityMessages() {}

    public static String signInResult(String methodName, Object result) {
        return format(methodName, result);
    }

    public static String identityResult(String methodName, Object result) {
        return format(methodName, result);
    }

    private static String format(String methodName, Object result) {
        final var method = methodName == null || methodName.isBlank() ? UNKNOWN_METHOD : methodName;
        return String.format(RESULT, method, result);
    }
}
