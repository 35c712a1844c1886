package strongbox.adapter.out.vault;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import io.vertx.core.net.PemTrustOptions;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;

/**
 * Shared HTTP plumbing for the secret store adapters.
 *
 * <p>TLS verification uses the configured CA certificate and server name.
 * Without a CA certificate, verification is bypassed.
 */
@ApplicationScoped
public class VaultTransport {

    private static final Logger LOG = Logger.getLogger(VaultTransport.class);

    static final String TOKEN_HEADER = "X-Vault-Token";

    private final Vertx vertx;
    private final SecretStoreConfig config;
    private WebClient webClient;

    @Inject
    public VaultTransport(Vertx vertx, SecretStoreConfig config) {
        this.vertx = vertx;
        this.config = config;
    }

    @PostConstruct
    void init() {
        final WebClientOptions options =
                new WebClientOptions().setConnectTimeout((int) config.requestTimeout().toMillis());

        if ("https".equalsIgnoreCase(config.protocol())) {
            options.setSsl(true);
            final var caFile = config.caFilePath().filter(p -> !p.isBlank());
            if (caFile.isPresent()) {
                LOG.info("Using certificate verification for secret store connection");
                options.setTrustOptions(new PemTrustOptions().addCertPath(caFile.get()))
                        .setVerifyHost(true);
            } else {
                LOG.info("Bypassing certificate verification for secret store connection");
                options.setTrustAll(true).setVerifyHost(false);
            }
        }

        this.webClient = WebClient.create(vertx, options);
    }

    @PreDestroy
    void close() {
        if (webClient != null) {
            webClient.close();
        }
    }

    /**
     * Send a request to the secret store.
     *
     * @param method    HTTP method
     * @param path      request URI starting with {@code /v1/}
     * @param authToken token sent as {@value #TOKEN_HEADER}, or null
     * @param body      JSON body, or null to send none
     * @return Uni with the response, whatever its status
     */
    public Uni<HttpResponse<Buffer>> send(HttpMethod method, String path, String authToken, JsonObject body) {
        final HttpRequest<Buffer> request = webClient
                .request(method, config.port(), config.server(), path)
                .timeout(config.requestTimeout().toMillis())
                .putHeader("Accept", "application/json");

        config.serverName().filter(n -> !n.isBlank()).ifPresent(request::virtualHost);
        if (authToken != null) {
            request.putHeader(TOKEN_HEADER, authToken);
        }

        LOG.debugf("%s %s", method, path);
        return body != null ? request.sendJsonObject(body) : request.send();
    }

    /**
     * Fail unless the response has a 2xx status.
     *
     * @param operation name of the operation, used in the error message
     */
    static HttpResponse<Buffer> requireSuccess(HttpResponse<Buffer> response, String operation) {
        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new VaultResponseException(status, operation + " failed with status " + status + ": "
                    + VaultResponseException.errorsOf(response.bodyAsString()));
        }
        return response;
    }

    /**
     * Body of a successful response, or an empty object when there is none.
     */
    static JsonObject jsonBody(HttpResponse<Buffer> response) {
        final Buffer body = response.body();
        if (body == null || body.length() == 0) {
            return new JsonObject();
        }
        return response.bodyAsJsonObject();
    }
}
