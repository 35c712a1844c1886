package strongbox.adapter.out.vault;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;

import strongbox.core.model.SecretPath;
import strongbox.core.port.out.SecretStoreKvClient;

/**
 * Reads and writes secrets in the version 1 key-value mount.
 */
@ApplicationScoped
public class VaultKvClient implements SecretStoreKvClient {

    private static final int NOT_FOUND = 404;

    private final VaultTransport transport;

    @Inject
    public VaultKvClient(VaultTransport transport) {
        this.transport = transport;
    }

    @Override
    public Uni<Optional<Map<String, String>>> read(String authToken, SecretPath path) {
        return transport.send(HttpMethod.GET, uriOf(path), authToken, null).map(response -> {
            if (response.statusCode() == NOT_FOUND) {
                return Optional.empty();
            }
            VaultTransport.requireSuccess(response, "Read of secret " + path);

            final JsonObject data = VaultTransport.jsonBody(response).getJsonObject("data", new JsonObject());
            final Map<String, String> secret = new LinkedHashMap<>();
            data.forEach(entry -> {
                if (entry.getValue() != null) {
                    secret.put(entry.getKey(), entry.getValue().toString());
                }
            });
            return Optional.of(secret);
        });
    }

    @Override
    public Uni<Void> write(String authToken, SecretPath path, Map<String, String> data) {
        final JsonObject body = new JsonObject();
        data.forEach(body::put);

        return transport
                .send(HttpMethod.POST, uriOf(path), authToken, body)
                .map(response -> VaultTransport.requireSuccess(response, "Write of secret " + path))
                .replaceWithVoid();
    }

    private static String uriOf(SecretPath path) {
        return "/v1/" + SecretPath.MOUNT + "/" + path.value();
    }
}
