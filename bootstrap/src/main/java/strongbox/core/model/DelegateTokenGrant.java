package strongbox.core.model;

import io.smallrye.mutiny.Uni;

/**
 * A least-privilege token issued for a delegated token provider, together
 * with the handle that revokes it.
 *
 * @param token      the delegate token
 * @param revocation revokes the token when invoked
 */
public record DelegateTokenGrant(Token token, RevocationHandle revocation) {

    /**
     * Revokes a previously issued token.
     *
     * <p>Completes with the token marked revoked, or unchanged when the
     * revocation failed.
     */
    @FunctionalInterface
    public interface RevocationHandle {
        Uni<Token> revoke();
    }
}
