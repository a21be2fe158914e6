package wattle.core.model.auth;

import java.util.List;
import java.util.Optional;

/**
 * A single authenticated entity and the claims asserted about it.
 *
 * <p>Implementations own their claims. Lookups see the claims as they are at the time of the call;
 * nothing is cached.
 */
public interface ClaimsIdentity {

    /**
     * Return the scheme that authenticated this identity.
     *
     * @return the scheme label, or null if the identity is not authenticated
     */
    String authenticationType();

    /**
     * Return the claims of this identity in issue order.
     *
     * @return the claims, never null
     */
    List<Claim> claims();

    /**
     * Return the first claim of the given type.
     *
     * @param type the claim type
     * @return the first matching claim in iteration order, or empty if there is none
     */
    default Optional<Claim> findFirst(String type) {
        for (final var claim : claims()) {
            if (claim.type().equals(type)) {
                return Optional.of(claim);
            }
        }
        return Optional.empty();
    }

    default List<Claim> findAll(String type) {
        return claims().stream().filter(c -> c.type().equals(type)).toList();
    }

    default boolean hasClaim(String type, String value) {
        return claims().stream().anyMatch(c -> c.type().equals(type) && c.value().equals(value));
    }

    default boolean isAuthenticated() {
        final var scheme = authenticationType();
        return scheme != null && !scheme.isBlank();
    }

    /**
     * Creates an identity holding an immutable copy of the given claims.
     *
     * @param authenticationType the scheme label, or null for an unauthenticated identity
     * @param claims             the claims in issue order
     * @return the identity
     */
    static ClaimsIdentity of(String authenticationType, List<Claim> claims) {
        return new ImmutableClaimsIdentity(authenticationType, claims);
    }
}
