package strongbox.adapter.out.vault;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("VaultHealthProbe")
class VaultHealthProbeTest extends WireMockVaultSupport {

    @ParameterizedTest(name = "status {0}")
    @ValueSource(ints = {200, 429, 501, 503, 500})
    @DisplayName("should report the status code of the health endpoint")
    void shouldReportStatus(int status) {
        vaultServer.stubFor(get(urlEqualTo("/v1/sys/health")).willReturn(aResponse().withStatus(status)));

        var probe = new VaultHealthProbe(transport);

        assertEquals(status, probe.healthStatus().await().atMost(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("should fail when the secret store is unreachable")
    void shouldFailWhenUnreachable() {
        var probe = new VaultHealthProbe(transport);
        vaultServer.stop();

        assertThrows(RuntimeException.class, () -> probe.healthStatus().await().atMost(Duration.ofSeconds(5)));
    }
}
