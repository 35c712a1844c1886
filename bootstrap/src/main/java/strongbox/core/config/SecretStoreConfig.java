package strongbox.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Connection and lifecycle settings for the secret store being bootstrapped.
 *
 * <p>Configuration prefix: {@code strongbox.secret-store}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code IKM_HOOK} - executable printing the hex encoded input keying material</li>
 *   <li>{@code STRONGBOX_SECRET_STORE_SERVER} - secret store host</li>
 *   <li>{@code STRONGBOX_SECRET_STORE_CA_FILE_PATH} - CA certificate enabling TLS verification</li>
 * </ul>
 */
@ConfigMapping(prefix = "strongbox.secret-store")
public interface SecretStoreConfig {

    /**
     * Protocol used to reach the administrative API.
     *
     * @return http or https (default: http)
     */
    @WithDefault("http")
    String protocol();

    @WithDefault("localhost")
    String server();

    @WithDefault("8200")
    int port();

    /**
     * CA certificate used to verify the secret store's TLS certificate.
     *
     * <p>When absent, certificate verification is bypassed.
     *
     * @return path to a PEM encoded CA certificate
     */
    Optional<String> caFilePath();

    /**
     * Server name presented for SNI and expected in the TLS certificate.
     *
     * @return the TLS server name, or empty to use {@link #server()}
     */
    Optional<String> serverName();

    /**
     * Folder holding the persisted initialization material and the KDF salt.
     */
    @WithDefault("/vault/config/assets")
    String tokenFolderPath();

    /**
     * Name of the file, inside {@link #tokenFolderPath()}, holding the initialization material.
     */
    @WithDefault("resp-init.json")
    String tokenFile();

    /**
     * Number of key shares required to unseal or to regenerate a root token.
     */
    @WithDefault("1")
    int secretThreshold();

    /**
     * Number of key shares generated on initialization.
     */
    @WithDefault("1")
    int secretShares();

    /**
     * Whether root tokens from earlier runs are revoked.
     *
     * <p>When enabled the initial root token is never persisted.
     *
     * @return true to revoke old root tokens (default: true)
     */
    @WithDefault("true")
    boolean revokeRootTokens();

    /**
     * Interval between init/unseal attempts.
     *
     * @return the retry interval (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration healthInterval();

    /**
     * Interval between readiness probes once the engine is unsealed.
     *
     * @return the readiness poll interval (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration readinessPollInterval();

    /**
     * Timeout applied to each request against the administrative API.
     */
    @WithDefault("PT30S")
    Duration requestTimeout();

    /**
     * Upper bound on init/unseal attempts.
     *
     * <p>Unbounded when absent: the bootstrapper keeps retrying until the
     * secret store can be unsealed. A value below 1 fails the bootstrap.
     *
     * @return the maximum number of attempts
     */
    Optional<Integer> maxInitAttempts();

    /**
     * Executable printing the hex encoded input keying material used to
     * encrypt the persisted key shares. Encryption is disabled when absent.
     */
    Optional<String> ikmHook();

    /**
     * Delegated token provider settings.
     */
    TokenProvider tokenProvider();

    /**
     * Proxy TLS certificate settings.
     */
    Certificate certificate();

    /**
     * Delegated token provider launched after the token issuing token is created.
     */
    interface TokenProvider {

        /**
         * Token provider executable. No provider is launched when absent.
         */
        Optional<String> executable();

        /**
         * Arguments passed to the executable.
         */
        Optional<List<String>> args();

        /**
         * Whether the provider runs once or keeps its token fresh.
         *
         * @return the provider type (default: oneshot)
         */
        @WithDefault("oneshot")
        ProviderType type();

        /**
         * File the token issuing token is written to. No token issuing
         * token is created when absent.
         */
        Optional<String> adminTokenPath();
    }

    /**
     * Certificate pair uploaded for the API proxy.
     */
    interface Certificate {

        /**
         * Secret path, relative to the key-value mount, the pair is stored at.
         */
        Optional<String> path();

        /**
         * PEM encoded certificate file.
         */
        Optional<String> certFile();

        /**
         * PEM encoded private key file.
         */
        Optional<String> keyFile();
    }

    enum ProviderType {
        /** Runs to completion; its token issuing token is revoked at the end of the run. */
        ONESHOT,
        /** Keeps running and manages the freshness of its own token. */
        LONG_RUNNING
    }
}
