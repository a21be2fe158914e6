package wattle.adapter.in.auth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import io.quarkus.security.identity.SecurityIdentity;

import wattle.core.model.auth.Claim;
import wattle.core.model.auth.ClaimTypes;
import wattle.core.model.auth.ClaimsIdentity;
import wattle.core.model.auth.ClaimsPrincipal;

/**
 * Exposes a Quarkus {@link SecurityIdentity} as a {@link ClaimsPrincipal}.
 *
 * <p>The resulting principal contains one identity authenticated by the given scheme with these claims,
 * in order:
 * <ul>
 *   <li>{@link ClaimTypes#NAME}: the principal name</li>
 *   <li>{@link ClaimTypes#NAME_IDENTIFIER}: the {@code sub} token claim, or the principal name</li>
 *   <li>{@link ClaimTypes#ROLE}: one per role, sorted</li>
 *   <li>every entry of the {@code claims} attribute, keyed by its own name</li>
 * </ul>
 *
 * <p>An anonymous identity yields a principal with no identities.
 */
public final class SecurityIdentityPrincipal implements ClaimsPrincipal {

    static final String CLAIMS_ATTRIBUTE = "claims";
    static final String SUBJECT_CLAIM = "sub";

    private final List<ClaimsIdentity> identities;

    private SecurityIdentityPrincipal(List<ClaimsIdentity> identities) {
        this.identities = identities;
    }

    /**
     * Adapts a security identity.
     *
     * @param securityIdentity     the Quarkus identity
     * @param authenticationScheme the scheme that authenticated it
     * @return the principal
     */
    public static SecurityIdentityPrincipal from(SecurityIdentity securityIdentity, String authenticationScheme) {
        if (securityIdentity == null) {
            throw new IllegalArgumentException("securityIdentity cannot be null");
        }
        if (securityIdentity.isAnonymous()) {
            return new SecurityIdentityPrincipal(List.of());
        }

        final var tokenClaims = tokenClaims(securityIdentity);
        final var name = securityIdentity.getPrincipal().getName();
        final var claims = new ArrayList<Claim>();

        if (name != null) {
            claims.add(Claim.of(ClaimTypes.NAME, name));
        }

        final var subject = tokenClaims.get(SUBJECT_CLAIM);
        if (subject != null) {
            claims.add(Claim.of(ClaimTypes.NAME_IDENTIFIER, subject.toString()));
        } else if (name != null) {
            claims.add(Claim.of(ClaimTypes.NAME_IDENTIFIER, name));
        }

        for (final var role : new TreeSet<>(securityIdentity.getRoles())) {
            claims.add(Claim.of(ClaimTypes.ROLE, role));
        }

        for (final var entry : tokenClaims.entrySet()) {
            addTokenClaim(claims, entry.getKey(), entry.getValue());
        }

        return new SecurityIdentityPrincipal(List.of(ClaimsIdentity.of(authenticationScheme, claims)));
    }

    @Override
    public List<ClaimsIdentity> identities() {
        return identities;
    }

    private static Map<?, ?> tokenClaims(SecurityIdentity securityIdentity) {
        final Object attribute = securityIdentity.getAttribute(CLAIMS_ATTRIBUTE);
        if (attribute instanceof Map<?, ?> map) {
            return map;
        }
        return Map.of();
    }

    private static void addTokenClaim(List<Claim> claims, Object key, Object value) {
        if (key == null || key.toString().isBlank() || value == null) {
            return;
        }
        if (value instanceof Collection<?> values) {
            for (final var element : values) {
                if (element != null) {
                    claims.add(Claim.of(key.toString(), element.toString()));
                }
            }
        } else {
            claims.add(Claim.of(key.toString(), value.toString()));
        }
    }
}
