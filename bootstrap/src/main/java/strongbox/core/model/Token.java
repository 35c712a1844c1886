package strongbox.core.model;

/**
 * A token issued by the secret store.
 *
 * <p>The value is opaque to this system. Tokens move one way from active to
 * revoked. {@link #toString()} never prints the token value.
 *
 * @param value    the token value sent as {@code X-Vault-Token}
 * @param accessor the token accessor, or null when the engine did not report one
 * @param scope    capability level
 * @param revoked  whether the token has been revoked
 */
public record Token(String value, String accessor, TokenScope scope, boolean revoked) {

    public Token {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Token value cannot be null or blank");
        }
        if (scope == null) {
            throw new IllegalArgumentException("Token scope is required");
        }
    }

    public static Token root(String value) {
        return new Token(value, null, TokenScope.ROOT, false);
    }

    public static Token delegate(String value, String accessor) {
        return new Token(value, accessor, TokenScope.DELEGATE, false);
    }

    /**
     * Copy of this token marked as revoked.
     */
    public Token markRevoked() {
        return new Token(value, accessor, scope, true);
    }

    @Override
    public String toString() {
        return "Token[scope=" + scope + ", accessor=" + accessor + ", revoked=" + revoked + "]";
    }
}
