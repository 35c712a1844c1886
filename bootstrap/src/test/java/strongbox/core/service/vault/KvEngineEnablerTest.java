package strongbox.core.service.vault;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strongbox.core.model.ErrorKind;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.Token;
import strongbox.core.port.out.SecretStoreAdminClient;

@DisplayName("KvEngineEnabler")
@ExtendWith(MockitoExtension.class)
class KvEngineEnablerTest {

    private static final Token ROOT = Token.root("s.root");

    @Mock
    private SecretStoreAdminClient adminClient;

    private KvEngineEnabler enabler;

    @BeforeEach
    void setUp() {
        enabler = new KvEngineEnabler(adminClient);
    }

    @Test
    @DisplayName("should leave an installed engine alone")
    void shouldSkipInstalledEngine() {
        when(adminClient.isSecretsEngineInstalled("s.root", "secret/", "kv"))
                .thenReturn(Uni.createFrom().item(true));

        assertFalse(enabler.enable(ROOT).await().indefinitely());
        verify(adminClient, never()).enableKvSecretsEngine(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("should mount a version 1 engine at secret")
    void shouldMountEngine() {
        when(adminClient.isSecretsEngineInstalled("s.root", "secret/", "kv"))
                .thenReturn(Uni.createFrom().item(false));
        when(adminClient.enableKvSecretsEngine("s.root", "secret", "1"))
                .thenReturn(Uni.createFrom().voidItem());

        assertTrue(enabler.enable(ROOT).await().indefinitely());
    }

    @Test
    @DisplayName("should fail FATAL when the mount cannot be created")
    void shouldFailFatal() {
        when(adminClient.isSecretsEngineInstalled("s.root", "secret/", "kv"))
                .thenReturn(Uni.createFrom().item(false));
        when(adminClient.enableKvSecretsEngine("s.root", "secret", "1"))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("permission denied")));

        var error = assertThrows(SecretStoreException.class, () -> enabler.enable(ROOT).await().indefinitely());

        assertEquals(ErrorKind.FATAL, error.kind());
    }
}
