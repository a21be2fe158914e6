package wattle.core.model.auth;

/**
 * An error reported by an identity operation.
 *
 * @param code        machine-readable error code (e.g., "DuplicateUserName")
 * @param description human-readable description
 */
public record IdentityError(String code, String description) {

    public IdentityError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Error code cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
    }
}
