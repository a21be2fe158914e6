package wattle.core.model.auth;

/**
 * Well-known claim types.
 *
 * <p>Identity claims use the WS-Federation URIs so that tokens and cookies issued by
 * other stacks resolve to the same types.
 */
public final class ClaimTypes {

    private static final String WS_IDENTITY = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/";
    private static final String MS_IDENTITY = "http://schemas.microsoft.com/ws/2008/06/identity/claims/";

    /** Display name of the subject. */
    public static final String NAME = WS_IDENTITY + "name";

    /** Stable identifier of the subject. */
    public static final String NAME_IDENTIFIER = WS_IDENTITY + "nameidentifier";

    public static final String EMAIL = WS_IDENTITY + "emailaddress";

    public static final String ROLE = MS_IDENTITY + "role";

    private ClaimTypes() {}
}
