package strongbox.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port for probing the health endpoint of the secret store.
 */
public interface SecretStoreHealthProbe {

    /**
     * Probe the health endpoint.
     *
     * @return Uni with the HTTP status code; fails when the engine could not be reached
     */
    Uni<Integer> healthStatus();
}
