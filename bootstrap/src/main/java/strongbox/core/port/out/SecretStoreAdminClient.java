package strongbox.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.InitMaterial;
import strongbox.core.model.RootTokenAttempt;
import strongbox.core.model.Token;
import strongbox.core.model.TokenMetadata;
import strongbox.core.model.TokenRequest;
import strongbox.core.model.UnsealStatus;

/**
 * Port for the administrative API of the secret store.
 *
 * <p>Every method taking an {@code authToken} sends it as the request token.
 * Implementations fail the returned Uni on transport errors and on any
 * non-success response.
 */
public interface SecretStoreAdminClient {

    /**
     * Initialize the engine.
     *
     * @param threshold   shares required to unseal
     * @param totalShares shares to generate
     * @return Uni with the root token and plaintext key shares
     */
    Uni<InitMaterial> initialize(int threshold, int totalShares);

    /**
     * Submit key shares one at a time until the engine reports it is unsealed
     * or the shares run out.
     *
     * @param keyShares hex encoded key shares
     * @return Uni with the last reported seal status
     */
    Uni<UnsealStatus> unseal(List<String> keyShares);

    /**
     * Cancel any root token generation in progress.
     */
    Uni<Void> cancelRootTokenGeneration();

    /**
     * Start a root token generation attempt.
     *
     * @return Uni with the attempt nonce and the one-time pad
     */
    Uni<RootTokenAttempt> startRootTokenGeneration();

    /**
     * Submit one key share to the running root token generation attempt.
     */
    Uni<RootTokenAttempt> submitRootTokenShare(String nonce, String keyShare);

    Uni<TokenMetadata> lookupSelf(String authToken);

    Uni<List<String>> listAccessors(String authToken);

    Uni<TokenMetadata> lookupAccessor(String authToken, String accessor);

    Uni<Void> revokeAccessor(String authToken, String accessor);

    /**
     * Revoke the token used to authenticate the request.
     */
    Uni<Void> revokeSelf(String authToken);

    /**
     * Create or replace an ACL policy.
     */
    Uni<Void> installPolicy(String authToken, String name, String policy);

    Uni<Token> createToken(String authToken, TokenRequest request);

    /**
     * Check whether a secrets engine of the given type is mounted at the given path.
     *
     * @param mountPoint mount path with a trailing slash, e.g. {@code secret/}
     * @param engineType engine type, e.g. {@code kv}
     */
    Uni<Boolean> isSecretsEngineInstalled(String authToken, String mountPoint, String engineType);

    /**
     * Mount a key-value secrets engine.
     *
     * @param mountPoint mount path without a trailing slash
     * @param kvVersion  key-value engine version
     */
    Uni<Void> enableKvSecretsEngine(String authToken, String mountPoint, String kvVersion);
}
