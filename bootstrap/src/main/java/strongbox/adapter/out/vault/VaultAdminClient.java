package strongbox.adapter.out.vault;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import strongbox.core.model.InitMaterial;
import strongbox.core.model.RootTokenAttempt;
import strongbox.core.model.Token;
import strongbox.core.model.TokenMetadata;
import strongbox.core.model.TokenRequest;
import strongbox.core.model.UnsealStatus;
import strongbox.core.port.out.SecretStoreAdminClient;

/**
 * Administrative API of a HashiCorp Vault compatible secret store.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code PUT /v1/sys/init}, {@code PUT /v1/sys/unseal}</li>
 *   <li>{@code DELETE|PUT /v1/sys/generate-root/attempt}, {@code PUT /v1/sys/generate-root/update}</li>
 *   <li>{@code /v1/auth/token/*} for lookups, creation and revocation</li>
 *   <li>{@code PUT /v1/sys/policies/acl/<name>}</li>
 *   <li>{@code GET /v1/sys/mounts}, {@code POST /v1/sys/mounts/<path>}</li>
 * </ul>
 */
@ApplicationScoped
public class VaultAdminClient implements SecretStoreAdminClient {

    private static final Logger LOG = Logger.getLogger(VaultAdminClient.class);

    private final VaultTransport transport;

    @Inject
    public VaultAdminClient(VaultTransport transport) {
        this.transport = transport;
    }

    @Override
    public Uni<InitMaterial> initialize(int threshold, int totalShares) {
        final JsonObject body =
                new JsonObject().put("secret_shares", totalShares).put("secret_threshold", threshold);

        return call(HttpMethod.PUT, "/v1/sys/init", null, body, "Initialization").map(json -> {
            final InitMaterial material = InitMaterial.initialized(
                    json.getString("root_token"),
                    strings(json.getJsonArray("keys")),
                    strings(json.getJsonArray("keys_base64")),
                    threshold,
                    totalShares);
            LOG.infof("Secret store initialized with %d key share(s)", material.keys().size());
            return material;
        });
    }

    @Override
    public Uni<UnsealStatus> unseal(List<String> keyShares) {
        return submitUnsealShare(keyShares, 0, new UnsealStatus(true, 0, 0));
    }

    private Uni<UnsealStatus> submitUnsealShare(List<String> keyShares, int index, UnsealStatus last) {
        if (!last.sealed() || index >= keyShares.size()) {
            return Uni.createFrom().item(last);
        }

        final JsonObject body = new JsonObject().put("key", keyShares.get(index));
        return call(HttpMethod.PUT, "/v1/sys/unseal", null, body, "Unseal")
                .map(json -> new UnsealStatus(
                        json.getBoolean("sealed", true), json.getInteger("t", 0), json.getInteger("progress", 0)))
                .invoke(status -> LOG.debugf(
                        "Submitted key share %d, sealed=%s progress=%d/%d",
                        index + 1, status.sealed(), status.progress(), status.threshold()))
                .onItem()
                .transformToUni(status -> submitUnsealShare(keyShares, index + 1, status));
    }

    @Override
    public Uni<Void> cancelRootTokenGeneration() {
        return call(HttpMethod.DELETE, "/v1/sys/generate-root/attempt", null, null, "Root token generation cancel")
                .replaceWithVoid();
    }

    @Override
    public Uni<RootTokenAttempt> startRootTokenGeneration() {
        return call(HttpMethod.PUT, "/v1/sys/generate-root/attempt", null, new JsonObject(), "Root token generation")
                .map(VaultAdminClient::toAttempt);
    }

    @Override
    public Uni<RootTokenAttempt> submitRootTokenShare(String nonce, String keyShare) {
        final JsonObject body = new JsonObject().put("key", keyShare).put("nonce", nonce);
        return call(HttpMethod.PUT, "/v1/sys/generate-root/update", null, body, "Root token generation update")
                .map(VaultAdminClient::toAttempt);
    }

    private static RootTokenAttempt toAttempt(JsonObject json) {
        return new RootTokenAttempt(
                json.getString("nonce"),
                json.getString("otp"),
                json.getBoolean("complete", false),
                json.getString("encoded_token"),
                json.getInteger("progress", 0),
                json.getInteger("required", 0));
    }

    @Override
    public Uni<TokenMetadata> lookupSelf(String authToken) {
        return call(HttpMethod.GET, "/v1/auth/token/lookup-self", authToken, null, "Token lookup")
                .map(VaultAdminClient::toMetadata);
    }

    @Override
    public Uni<List<String>> listAccessors(String authToken) {
        return call(HttpMethod.GET, "/v1/auth/token/accessors?list=true", authToken, null, "Token accessor listing")
                .map(json -> strings(json.getJsonObject("data", new JsonObject()).getJsonArray("keys")));
    }

    @Override
    public Uni<TokenMetadata> lookupAccessor(String authToken, String accessor) {
        return call(
                        HttpMethod.POST,
                        "/v1/auth/token/lookup-accessor",
                        authToken,
                        new JsonObject().put("accessor", accessor),
                        "Token accessor lookup")
                .map(VaultAdminClient::toMetadata);
    }

    private static TokenMetadata toMetadata(JsonObject json) {
        final JsonObject data = json.getJsonObject("data", new JsonObject());
        final Set<String> policies = new HashSet<>(strings(data.getJsonArray("policies")));
        return new TokenMetadata(data.getString("accessor"), policies, data.getString("display_name"));
    }

    @Override
    public Uni<Void> revokeAccessor(String authToken, String accessor) {
        return call(
                        HttpMethod.POST,
                        "/v1/auth/token/revoke-accessor",
                        authToken,
                        new JsonObject().put("accessor", accessor),
                        "Token revocation")
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> revokeSelf(String authToken) {
        return call(HttpMethod.POST, "/v1/auth/token/revoke-self", authToken, null, "Token self revocation")
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> installPolicy(String authToken, String name, String policy) {
        return call(
                        HttpMethod.PUT,
                        "/v1/sys/policies/acl/" + name,
                        authToken,
                        new JsonObject().put("policy", policy),
                        "Policy installation")
                .invoke(() -> LOG.debugf("Installed policy %s", name))
                .replaceWithVoid();
    }

    @Override
    public Uni<Token> createToken(String authToken, TokenRequest request) {
        final JsonObject body = new JsonObject()
                .put("display_name", request.displayName())
                .put("policies", new JsonArray(new ArrayList<>(request.policies())))
                .put("no_parent", request.orphan());
        if (request.period() != null) {
            body.put("period", request.period().toSeconds() + "s");
        }

        return call(HttpMethod.POST, "/v1/auth/token/create", authToken, body, "Token creation")
                .map(json -> {
                    final JsonObject auth = json.getJsonObject("auth", new JsonObject());
                    return Token.delegate(auth.getString("client_token"), auth.getString("accessor"));
                });
    }

    @Override
    public Uni<Boolean> isSecretsEngineInstalled(String authToken, String mountPoint, String engineType) {
        return call(HttpMethod.GET, "/v1/sys/mounts", authToken, null, "Secrets engine listing")
                .map(json -> {
                    // newer servers nest the mounts under "data", older ones return them at the top level
                    final JsonObject mounts = json.getJsonObject("data", json);
                    final Object mount = mounts.getValue(mountPoint);
                    return mount instanceof JsonObject
                            && engineType.equals(((JsonObject) mount).getString("type"));
                });
    }

    @Override
    public Uni<Void> enableKvSecretsEngine(String authToken, String mountPoint, String kvVersion) {
        final JsonObject body = new JsonObject()
                .put("type", "kv")
                .put("options", new JsonObject().put("version", kvVersion));

        return call(HttpMethod.POST, "/v1/sys/mounts/" + mountPoint, authToken, body, "Secrets engine mount")
                .replaceWithVoid();
    }

    private Uni<JsonObject> call(
            HttpMethod method, String path, String authToken, JsonObject body, String operation) {
        return transport
                .send(method, path, authToken, body)
                .map(response -> VaultTransport.jsonBody(VaultTransport.requireSuccess(response, operation)));
    }

    private static List<String> strings(JsonArray array) {
        if (array == null) {
            return List.of();
        }
        final List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            final Object value = array.getValue(i);
            if (value != null) {
                values.add(value.toString());
            }
        }
        return values;
    }
}
