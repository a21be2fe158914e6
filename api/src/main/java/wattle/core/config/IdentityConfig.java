package wattle.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import wattle.core.model.auth.ClaimTypes;
import wattle.core.model.auth.IdentitySchemes;

/**
 * Configuration for claim lookups and login detection.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code wattle.identity.application-scheme} - scheme label of the application sign-in identity</li>
 *   <li>{@code wattle.identity.claims.user-name-claim-type} - claim type holding the user name</li>
 *   <li>{@code wattle.identity.claims.user-id-claim-type} - claim type holding the user id</li>
 *   <li>{@code wattle.identity.claims.role-claim-type} - claim type holding roles</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 * wattle.identity.application-scheme=MyApp.Cookie
 * wattle.identity.claims.user-id-claim-type=sub
 * </pre>
 */
@ConfigMapping(prefix = "wattle.identity")
public interface IdentityConfig {

    /**
     * Scheme label that marks an identity as signed in to the application.
     *
     * @return the scheme label (default: {@value IdentitySchemes#APPLICATION_COOKIE})
     */
    @WithDefault(IdentitySchemes.APPLICATION_COOKIE)
    String applicationScheme();

    /**
     * Claim type configuration.
     */
    ClaimTypeConfig claims();

    interface ClaimTypeConfig {

        @WithDefault(ClaimTypes.NAME)
        String userNameClaimType();

        @WithDefault(ClaimTypes.NAME_IDENTIFIER)
        String userIdClaimType();

        @WithDefault(ClaimTypes.ROLE)
        String roleClaimType();
    }
}
