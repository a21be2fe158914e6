package wattle.core.model.auth;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The acting security context of a request, aggregating zero or more identities.
 */
public interface ClaimsPrincipal {

    /**
     * Return the identities of this principal.
     *
     * @return the identities in order, or null if the principal carries no identity collection
     */
    List<ClaimsIdentity> identities();

    /**
     * Return the first claim of the given type across all identities.
     *
     * <p>Identities are searched in order; within an identity the first matching claim wins.
     *
     * @param type the claim type
     * @return the first matching claim, or empty if there is none
     */
    default Optional<Claim> findFirst(String type) {
        final var identities = identities();
        if (identities == null) {
            return Optional.empty();
        }
        for (final var identity : identities) {
            final var claim = identity.findFirst(type);
            if (claim.isPresent()) {
                return claim;
            }
        }
        return Optional.empty();
    }

    default List<Claim> findAll(String type) {
        final var identities = identities();
        if (identities == null) {
            return List.of();
        }
        final var result = new ArrayList<Claim>();
        for (final var identity : identities) {
            result.addAll(identity.findAll(type));
        }
        return result;
    }

    /**
     * Return the identity used for the principal's name, the first authenticated one if any.
     *
     * @return the primary identity, or empty if there are no identities
     */
    default Optional<ClaimsIdentity> primaryIdentity() {
        final var identities = identities();
        if (identities == null || identities.isEmpty()) {
            return Optional.empty();
        }
        return identities.stream()
                .filter(ClaimsIdentity::isAuthenticated)
                .findFirst()
                .or(() -> Optional.of(identities.get(0)));
    }

    static ClaimsPrincipal of(ClaimsIdentity... identities) {
        final List<ClaimsIdentity> list = List.copyOf(Arrays.asList(identities));
        return () -> list;
    }
}
