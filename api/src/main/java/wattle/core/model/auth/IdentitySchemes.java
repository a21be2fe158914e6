package wattle.core.model.auth;

/**
 * Authentication scheme labels carried by identities issued by the identity system.
 */
public final class IdentitySchemes {

    /** Scheme of the identity issued when a user signs in to the application. */
    public static final String APPLICATION_COOKIE = "Identity.Application";

    private IdentitySchemes() {}
}
