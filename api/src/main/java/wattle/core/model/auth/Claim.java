package wattle.core.model.auth;

/**
 * A single statement about an authenticated subject.
 *
 * @param type   the claim type, usually one of {@link ClaimTypes}
 * @param value  the claim value
 * @param issuer who asserted the claim, {@link #LOCAL_AUTHORITY} when not given
 */
public record Claim(String type, String value, String issuer) {

    public static final String LOCAL_AUTHORITY = "LOCAL AUTHORITY";

    public Claim {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Claim type cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Claim value cannot be null");
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = LOCAL_AUTHORITY;
        }
    }

    public static Claim of(String type, String value) {
        return new Claim(type, value, null);
    }
}
