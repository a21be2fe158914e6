package wattle.core.model.auth;

import java.util.List;

record ImmutableClaimsIdentity(String authenticationType, List<Claim> claims) implements ClaimsIdentity {

    ImmutableClaimsIdentity {
        claims = claims == null ? List.of() : List.copyOf(claims);
    }
}
