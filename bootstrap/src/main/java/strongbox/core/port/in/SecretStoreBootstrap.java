package strongbox.core.port.in;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.BootstrapResult;

/**
 * Port for driving the secret store to a ready, provisioned state.
 *
 * <p>One run will:
 * <ul>
 *   <li>Initialize or unseal the engine and wait until it accepts requests</li>
 *   <li>Mint a transient root token and revoke stale tokens from earlier runs</li>
 *   <li>Optionally issue a token issuing token and launch the token provider</li>
 *   <li>Enable the key-value engine and upload database credentials and the proxy certificate</li>
 *   <li>Revoke the transient root token, whatever the outcome</li>
 * </ul>
 */
public interface SecretStoreBootstrap {

    /**
     * Run the bootstrap once.
     *
     * @return Uni with the result; fails with a {@code SecretStoreException} of kind FATAL
     *         when the secret store cannot be made ready
     */
    Uni<BootstrapResult> bootstrap();
}
