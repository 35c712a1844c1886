package strongbox.core.port.out;

import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.SecretPath;

/**
 * Port for reading and writing secrets in the key-value mount.
 */
public interface SecretStoreKvClient {

    /**
     * Read a secret.
     *
     * @return Uni with the secret data, or empty if nothing is stored at the path
     */
    Uni<Optional<Map<String, String>>> read(String authToken, SecretPath path);

    /**
     * Write a secret, replacing whatever is stored at the path.
     */
    Uni<Void> write(String authToken, SecretPath path, Map<String, String> data);
}
