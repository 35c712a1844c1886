package strongbox.adapter.out.vault;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;

import strongbox.core.port.out.SecretStoreHealthProbe;

/**
 * Probes {@code GET /v1/sys/health}.
 *
 * <p>The engine encodes its state in the status code, so every response is
 * a valid probe result. Only transport errors fail.
 */
@ApplicationScoped
public class VaultHealthProbe implements SecretStoreHealthProbe {

    static final String HEALTH_PATH = "/v1/sys/health";

    private final VaultTransport transport;

    @Inject
    public VaultHealthProbe(VaultTransport transport) {
        this.transport = transport;
    }

    @Override
    public Uni<Integer> healthStatus() {
        return transport.send(HttpMethod.GET, HEALTH_PATH, null, null).map(response -> response.statusCode());
    }
}
