package strongbox.core.service.token;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.DelegateTokenGrant;
import strongbox.core.model.ErrorKind;
import strongbox.core.model.InitMaterial;
import strongbox.core.model.RootTokenAttempt;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.Token;
import strongbox.core.model.TokenMetadata;
import strongbox.core.model.TokenRequest;
import strongbox.core.port.out.SecretStoreAdminClient;

/**
 * Mints, rotates and revokes the tokens the bootstrapper works with.
 *
 * <p>A transient root token is regenerated from the key shares on every
 * run. Tokens left behind by earlier runs are revoked on a best-effort
 * basis: a token that cannot be revoked only produces a warning.
 */
@ApplicationScoped
public class TokenLifecycleService {

    private static final Logger LOG = Logger.getLogger(TokenLifecycleService.class);

    public static final String TOKEN_ISSUING_POLICY = "token-issuing-policy";
    static final String TOKEN_ISSUING_DISPLAY_NAME = "token-issuing-token";
    static final Duration TOKEN_ISSUING_PERIOD = Duration.ofHours(1);

    static final String TOKEN_ISSUING_POLICY_DOCUMENT = """
            path "auth/token/create" {
              capabilities = ["create", "update", "sudo"]
            }

            path "auth/token/create-orphan" {
              capabilities = ["create", "update", "sudo"]
            }

            path "auth/token/create/*" {
              capabilities = ["create", "update", "sudo"]
            }

            path "sys/policies/acl/edgex-service-*" {
              capabilities = ["create", "read", "update", "delete"]
            }
            """;

    private final SecretStoreAdminClient adminClient;

    @Inject
    public TokenLifecycleService(SecretStoreAdminClient adminClient) {
        this.adminClient = adminClient;
    }

    /**
     * Generate a fresh root token from the key shares.
     *
     * <p>Any generation already in progress is cancelled first. Shares are
     * submitted one at a time until the engine reports completion.
     *
     * @param material unsealed material holding plaintext shares
     * @return Uni with the new root token; fails with FATAL if generation fails
     */
    public Uni<Token> regenerateRootToken(InitMaterial material) {
        return adminClient
                .cancelRootTokenGeneration()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("No root token generation to cancel: %s", error.getMessage());
                    return null;
                })
                .onItem()
                .transformToUni(ignored -> adminClient.startRootTokenGeneration())
                .onItem()
                .transformToUni(attempt -> submitShares(attempt, material.keys(), 0)
                        .map(completed -> decodeRootToken(completed.encodedToken(), attempt.otp())))
                .map(Token::root)
                .invoke(() -> LOG.info("Generated transient root token"))
                .onFailure(error -> !(error instanceof SecretStoreException))
                .transform(error -> SecretStoreException.fatal(
                        "Could not regenerate root token: " + error.getMessage(), error));
    }

    private Uni<RootTokenAttempt> submitShares(RootTokenAttempt attempt, List<String> shares, int index) {
        if (attempt.complete()) {
            return Uni.createFrom().item(attempt);
        }
        if (index >= shares.size()) {
            return Uni.createFrom()
                    .failure(SecretStoreException.fatal("Ran out of key shares before root token generation completed ("
                            + attempt.progress() + "/" + attempt.required() + ")"));
        }
        return adminClient
                .submitRootTokenShare(attempt.nonce(), shares.get(index))
                .onItem()
                .transformToUni(next -> submitShares(next, shares, index + 1));
    }

    /**
     * Decode an encoded root token with its one-time pad.
     *
     * <p>The encoded token is base64 (padding optional) of the token bytes
     * XOR-ed with the pad.
     */
    static String decodeRootToken(String encodedToken, String otp) {
        if (encodedToken == null || encodedToken.isEmpty()) {
            throw SecretStoreException.fatal("Root token generation completed without an encoded token");
        }
        if (otp == null || otp.isEmpty()) {
            throw SecretStoreException.fatal("Root token generation did not return a one-time pad");
        }

        final byte[] encoded = Base64.getDecoder().decode(stripPadding(encodedToken));
        final byte[] pad = otp.getBytes(StandardCharsets.UTF_8);
        if (encoded.length != pad.length) {
            throw SecretStoreException.fatal("Encoded root token length (" + encoded.length
                    + ") does not match the one-time pad length (" + pad.length + ")");
        }

        final byte[] token = new byte[encoded.length];
        for (int i = 0; i < encoded.length; i++) {
            token[i] = (byte) (encoded[i] ^ pad[i]);
        }
        return new String(token, StandardCharsets.UTF_8);
    }

    private static String stripPadding(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '=') {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Revoke the given token using itself as the credential.
     *
     * <p>Never fails; an error is logged.
     *
     * @return Uni with the token marked revoked, or the unchanged token if it could not be revoked
     */
    public Uni<Token> revokeSelf(Token token) {
        LOG.info("Revoking transient root token");
        return recoverBestEffort(
                asBestEffort(adminClient.revokeSelf(token.value()).replaceWith(token::markRevoked),
                        "revoke transient root token"),
                token);
    }

    /**
     * Revoke every root token other than the caller's.
     *
     * @return Uni with the number of tokens revoked; never fails
     */
    public Uni<Integer> revokeRootTokens(Token rootToken) {
        return revokeMatching(rootToken, TokenMetadata::isRoot, "root");
    }

    /**
     * Revoke every non-root token, such as admin and service tokens from earlier runs.
     *
     * @return Uni with the number of tokens revoked; never fails
     */
    public Uni<Integer> revokeNonRootTokens(Token rootToken) {
        return revokeMatching(rootToken, metadata -> !metadata.isRoot(), "non-root");
    }

    private Uni<Integer> revokeMatching(Token rootToken, Predicate<TokenMetadata> matches, String kind) {
        final String authToken = rootToken.value();

        final Uni<Integer> revoked = adminClient
                .lookupSelf(authToken)
                .map(TokenMetadata::accessor)
                .onItem()
                .transformToUni(self -> adminClient
                        .listAccessors(authToken)
                        .onItem()
                        .transformToMulti(accessors -> Multi.createFrom().iterable(accessors))
                        .select()
                        .where(accessor -> !accessor.equals(self))
                        .onItem()
                        .transformToUniAndConcatenate(accessor -> revokeIfMatching(authToken, accessor, matches))
                        .select()
                        .where(Boolean::booleanValue)
                        .collect()
                        .asList()
                        .map(List::size))
                .invoke(count -> LOG.infof("Revoked %d %s token(s)", count, kind));
        return recoverBestEffort(asBestEffort(revoked, "revoke " + kind + " tokens"), 0);
    }

    private Uni<Boolean> revokeIfMatching(String authToken, String accessor, Predicate<TokenMetadata> matches) {
        final Uni<Boolean> revoked = adminClient
                .lookupAccessor(authToken, accessor)
                .onItem()
                .transformToUni(metadata -> {
                    if (!matches.test(metadata)) {
                        return Uni.createFrom().item(false);
                    }
                    LOG.debugf("Revoking %s token %s (%s)", metadata.scope(), accessor, metadata.displayName());
                    return adminClient.revokeAccessor(authToken, accessor).replaceWith(true);
                });
        return recoverBestEffort(asBestEffort(revoked, "revoke token with accessor " + accessor), false);
    }

    /**
     * Create an orphan periodic token that may only issue tokens and manage
     * service policies.
     *
     * @param rootToken token used to install the policy and create the token
     * @return Uni with the token and its revocation handle; fails with FATAL
     */
    public Uni<DelegateTokenGrant> createTokenIssuingToken(Token rootToken) {
        final TokenRequest request = new TokenRequest(
                TOKEN_ISSUING_DISPLAY_NAME, List.of(TOKEN_ISSUING_POLICY), TOKEN_ISSUING_PERIOD, true);

        return adminClient
                .installPolicy(rootToken.value(), TOKEN_ISSUING_POLICY, TOKEN_ISSUING_POLICY_DOCUMENT)
                .onItem()
                .transformToUni(ignored -> adminClient.createToken(rootToken.value(), request))
                .map(token -> new DelegateTokenGrant(token, () -> revokeIssuingToken(rootToken, token)))
                .invoke(() -> LOG.info("Created token issuing token"))
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Failed to create token issuing token: " + error.getMessage(), error));
    }

    private Uni<Token> revokeIssuingToken(Token rootToken, Token issuingToken) {
        final Uni<Token> revoked = adminClient
                .revokeAccessor(rootToken.value(), issuingToken.accessor())
                .replaceWith(issuingToken::markRevoked)
                .invoke(() -> LOG.info("Revoked token issuing token"));
        return recoverBestEffort(asBestEffort(revoked, "revoke token issuing token"), issuingToken);
    }

    /**
     * Raise any failure of the operation as a {@link ErrorKind#BEST_EFFORT} failure.
     */
    static <T> Uni<T> asBestEffort(Uni<T> operation, String description) {
        return operation
                .onFailure(error -> !SecretStoreException.hasKind(error, ErrorKind.BEST_EFFORT))
                .transform(error -> SecretStoreException.bestEffort(
                        "Could not " + description + ": " + error.getMessage(), error));
    }

    private static <T> Uni<T> recoverBestEffort(Uni<T> operation, T fallback) {
        return operation
                .onFailure(error -> SecretStoreException.hasKind(error, ErrorKind.BEST_EFFORT))
                .recoverWithItem(error -> {
                    LOG.warn(error.getMessage());
                    return fallback;
                });
    }
}
