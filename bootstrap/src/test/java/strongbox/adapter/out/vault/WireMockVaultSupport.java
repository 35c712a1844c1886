package strongbox.adapter.out.vault;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import strongbox.core.config.SecretStoreConfig;

/**
 * Starts a WireMock server standing in for the secret store and a transport pointed at it.
 */
abstract class WireMockVaultSupport {

    protected WireMockServer vaultServer;
    protected VaultTransport transport;
    private Vertx vertx;

    @BeforeEach
    void startVault() {
        vaultServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        vaultServer.start();

        final SecretStoreConfig config = mock(SecretStoreConfig.class);
        lenient().when(config.protocol()).thenReturn("http");
        lenient().when(config.server()).thenReturn("localhost");
        lenient().when(config.port()).thenReturn(vaultServer.port());
        lenient().when(config.serverName()).thenReturn(Optional.empty());
        lenient().when(config.caFilePath()).thenReturn(Optional.empty());
        lenient().when(config.requestTimeout()).thenReturn(Duration.ofSeconds(5));

        vertx = Vertx.vertx();
        transport = new VaultTransport(vertx, config);
        transport.init();
    }

    @AfterEach
    void stopVault() {
        transport.close();
        vertx.closeAndAwait();
        if (vaultServer != null) {
            vaultServer.stop();
        }
    }
}
