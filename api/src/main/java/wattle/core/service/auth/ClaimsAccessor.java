package wattle.core.service.auth;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import wattle.core.config.IdentityConfig;
import wattle.core.model.auth.Claim;
import wattle.core.model.auth.ClaimsIdentity;
import wattle.core.model.auth.ClaimsPrincipal;

/**
 * Claim lookups keyed on the configured claim types and application scheme.
 *
 * <p>Behaves like {@link ClaimsIdentities} but reads the claim types and the sign-in scheme from
 * {@link IdentityConfig}, for deployments whose tokens use other claim names.
 */
@ApplicationScoped
public class ClaimsAccessor {

    private static final Logger LOG = Logger.getLogger(ClaimsAccessor.class);

    private final IdentityConfig config;

    @Inject
    public ClaimsAccessor(IdentityConfig config) {
        this.config = config;
        LOG.debugf(
                "Claims accessor configured: scheme=%s, userName=%s, userId=%s, role=%s",
                config.applicationScheme(),
                config.claims().userNameClaimType(),
                config.claims().userIdClaimType(),
                config.claims().roleClaimType());
    }

    public Optional<String> getUserName(ClaimsIdentity identity) {
        return ClaimsIdentities.findFirstValue(identity, config.claims().userNameClaimType());
    }

    public Optional<String> getUserId(ClaimsIdentity identity) {
        return ClaimsIdentities.findFirstValue(identity, config.claims().userIdClaimType());
    }

    public Optional<String> getUserId(ClaimsPrincipal principal) {
        return ClaimsIdentities.findFirstValue(principal, config.claims().userIdClaimType());
    }

    /**
     * Checks whether the principal has signed in with the configured application scheme.
     *
     * @param principal the principal
     * @return true if some identity was authenticated by the configured scheme
     */
    public boolean isLoggedIn(ClaimsPrincipal principal) {
        return ClaimsIdentities.isLoggedIn(principal, config.applicationScheme());
    }

    /**
     * Returns all role values of the principal in identity and claim order.
     *
     * @param principal the principal
     * @return the roles, empty if there are none
     */
    public List<String> getRoles(ClaimsPrincipal principal) {
        ClaimsIdentities.requireReceiver(principal, "principal");
        return principal.findAll(config.claims().roleClaimType()).stream()
                .map(Claim::value)
                .toList();
    }
}
