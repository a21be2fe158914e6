package wattle.core.service.auth;

import java.util.Optional;

import wattle.core.model.auth.Claim;
import wattle.core.model.auth.ClaimTypes;
import wattle.core.model.auth.ClaimsIdentity;
import wattle.core.model.auth.ClaimsPrincipal;
import wattle.core.model.auth.IdentitySchemes;

/**
 * Claim lookups over identities and principals using the platform's default claim types.
 *
 * <p>Every operation rejects a null receiver with {@link IllegalArgumentException}. A missing claim
 * or identity collection is never an error.
 *
 * <p>Callers holding a {@link java.security.Principal} or a framework identity must adapt it to
 * {@link ClaimsIdentity} or {@link ClaimsPrincipal} first.
 *
 * @see ClaimsAccessor for the configurable variant
 */
public final class ClaimsIdentities {

    private ClaimsIdentities() {}

    /**
     * Returns the user name of the identity.
     *
     * @param identity the identity
     * @return the value of the first {@link ClaimTypes#NAME} claim, or empty if there is none
     */
    public static Optional<String> getUserName(ClaimsIdentity identity) {
        return findFirstValue(identity, ClaimTypes.NAME);
    }

    /**
     * Returns the user id of the identity.
     *
     * @param identity the identity
     * @return the value of the first {@link ClaimTypes#NAME_IDENTIFIER} claim, or empty if there is none
     */
    public static Optional<String> getUserId(ClaimsIdentity identity) {
        return findFirstValue(identity, ClaimTypes.NAME_IDENTIFIER);
    }

    /**
     * Returns the user id of the principal.
     *
     * @param principal the principal
     * @return the value of the first {@link ClaimTypes#NAME_IDENTIFIER} claim, or empty if there is none
     */
    public static Optional<String> getUserId(ClaimsPrincipal principal) {
        return findFirstValue(principal, ClaimTypes.NAME_IDENTIFIER);
    }

    /**
     * Checks whether the principal has signed in to the application.
     *
     * @param principal the principal
     * @return true if any identity was authenticated by {@link IdentitySchemes#APPLICATION_COOKIE}
     */
    public static boolean isLoggedIn(ClaimsPrincipal principal) {
        return isLoggedIn(principal, IdentitySchemes.APPLICATION_COOKIE);
    }

    /**
     * Checks whether any identity of the principal was authenticated by the given scheme.
     *
     * <p>A principal without an identity collection and one with an empty collection are both
     * reported as not logged in.
     *
     * @param principal the principal
     * @param scheme    the application sign-in scheme
     * @return true if some identity's authentication type equals {@code scheme}
     */
    public static boolean isLoggedIn(ClaimsPrincipal principal, String scheme) {
        requireReceiver(principal, "principal");
        final var identities = principal.identities();
        return identities != null
                && identities.stream().anyMatch(i -> scheme != null && scheme.equals(i.authenticationType()));
    }

    public static Optional<String> findFirstValue(ClaimsIdentity identity, String claimType) {
        requireReceiver(identity, "identity");
        return identity.findFirst(claimType).map(Claim::value);
    }

    public static Optional<String> findFirstValue(ClaimsPrincipal principal, String claimType) {
        requireReceiver(principal, "principal");
        return principal.findFirst(claimType).map(Claim::value);
    }

    static void requireReceiver(Object receiver, String name) {
        if (receiver == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
