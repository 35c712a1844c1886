package strongbox.core.service.vault;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.EngineAction;
import strongbox.core.model.EngineState;
import strongbox.core.model.ErrorKind;
import strongbox.core.model.InitMaterial;
import strongbox.core.model.ReadinessResult;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.UnsealStatus;
import strongbox.core.port.out.SecretStoreAdminClient;
import strongbox.core.port.out.SecretStoreHealthProbe;
import strongbox.core.service.ShutdownSignal;

@DisplayName("VaultStateController")
@ExtendWith(MockitoExtension.class)
class VaultStateControllerTest {

    private static final Duration INTERVAL = Duration.ofMillis(5);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final InitMaterial FRESH =
            InitMaterial.initialized("s.root", List.of("k1", "k2", "k3", "k4", "k5"), 3, 5);

    @Mock
    private SecretStoreHealthProbe healthProbe;

    @Mock
    private SecretStoreAdminClient adminClient;

    @Mock
    private InitMaterialService materials;

    @Mock
    private SecretStoreConfig config;

    private ShutdownSignal shutdownSignal;
    private VaultStateController controller;

    @BeforeEach
    void setUp() {
        lenient().when(config.secretThreshold()).thenReturn(3);
        lenient().when(config.secretShares()).thenReturn(5);
        lenient().when(config.revokeRootTokens()).thenReturn(true);
        lenient().when(config.maxInitAttempts()).thenReturn(Optional.empty());
        lenient().when(materials.save(any())).thenReturn(Uni.createFrom().voidItem());

        shutdownSignal = new ShutdownSignal();
        controller = new VaultStateController(healthProbe, adminClient, materials, config, shutdownSignal);
    }

    private static Uni<Integer> status(int code) {
        return Uni.createFrom().item(code);
    }

    private static Uni<UnsealStatus> unsealed() {
        return Uni.createFrom().item(new UnsealStatus(false, 3, 0));
    }

    private ReadinessResult run() {
        return controller.runUntilReady(INTERVAL).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Transition table")
    class Transitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "UNREACHABLE, RETRY_LATER",
            "UNSEALED, LOAD_AND_FINISH",
            "STANDBY, STOP_STANDBY",
            "UNINITIALIZED, INITIALIZE_AND_UNSEAL",
            "SEALED, LOAD_AND_UNSEAL"
        })
        @DisplayName("should map every state to one action")
        void shouldMapStates(EngineState state, EngineAction action) {
            assertEquals(action, VaultStateController.actionFor(state));
        }
    }

    @Nested
    @DisplayName("Uninitialized engine")
    class Uninitialized {

        @BeforeEach
        void setUp() {
            when(healthProbe.healthStatus()).thenReturn(status(501));
            when(adminClient.initialize(3, 5)).thenReturn(Uni.createFrom().item(FRESH));
        }

        @Test
        @DisplayName("should initialize, persist and unseal in one attempt")
        void shouldInitializeAndUnseal() {
            when(adminClient.unseal(FRESH.keys())).thenReturn(unsealed());

            var result = run();

            assertTrue(result.isReady());
            assertSame(FRESH, result.material());
            verify(adminClient).initialize(3, 5);
            verify(adminClient).unseal(FRESH.keys());
        }

        @Test
        @DisplayName("should persist the material without the root token before unsealing")
        void shouldStripRootTokenBeforePersisting() {
            when(adminClient.unseal(FRESH.keys())).thenReturn(unsealed());

            run();

            var captor = ArgumentCaptor.forClass(InitMaterial.class);
            verify(materials).save(captor.capture());
            assertFalse(captor.getValue().hasRootToken());
            assertEquals(FRESH.keys(), captor.getValue().keys());
        }

        @Test
        @DisplayName("should keep the root token when root tokens are not revoked")
        void shouldKeepRootToken() {
            when(config.revokeRootTokens()).thenReturn(false);
            when(adminClient.unseal(FRESH.keys())).thenReturn(unsealed());

            run();

            verify(materials).save(FRESH);
        }
    }

    @Nested
    @DisplayName("Sealed engine")
    class Sealed {

        @Test
        @DisplayName("should unseal with the persisted shares")
        void shouldUnsealWithPersistedShares() {
            var persisted = FRESH.withoutRootToken();
            when(healthProbe.healthStatus()).thenReturn(status(503));
            when(materials.load()).thenReturn(Uni.createFrom().item(persisted));
            when(adminClient.unseal(persisted.keys())).thenReturn(unsealed());

            var result = run();

            assertTrue(result.isReady());
            assertEquals(persisted, result.material());
            verify(adminClient, never()).initialize(anyInt(), anyInt());
        }

        @Test
        @DisplayName("should fail FATAL when the persisted material cannot be loaded")
        void shouldFailWhenMaterialLost() {
            when(healthProbe.healthStatus()).thenReturn(status(503));
            when(materials.load()).thenReturn(Uni.createFrom().failure(SecretStoreException.fatal("gone")));

            var error = assertThrows(SecretStoreException.class, VaultStateControllerTest.this::run);

            assertEquals(ErrorKind.FATAL, error.kind());
            verify(adminClient, never()).unseal(any());
        }

        @Test
        @DisplayName("should retry when the unseal call fails")
        void shouldRetryFailedUnseal() {
            when(healthProbe.healthStatus()).thenReturn(status(503));
            when(materials.load()).thenReturn(Uni.createFrom().item(FRESH));
            when(adminClient.unseal(FRESH.keys()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("connection reset")))
                    .thenReturn(unsealed());

            var result = run();

            assertTrue(result.isReady());
            verify(adminClient, times(2)).unseal(FRESH.keys());
        }

        @Test
        @DisplayName("should retry while the engine stays sealed after the shares")
        void shouldRetryWhileStillSealed() {
            when(healthProbe.healthStatus()).thenReturn(status(503));
            when(materials.load()).thenReturn(Uni.createFrom().item(FRESH));
            when(adminClient.unseal(FRESH.keys()))
                    .thenReturn(Uni.createFrom().item(new UnsealStatus(true, 3, 2)))
                    .thenReturn(unsealed());

            assertTrue(run().isReady());
            verify(adminClient, times(2)).unseal(FRESH.keys());
        }
    }

    @Nested
    @DisplayName("Other states")
    class OtherStates {

        @Test
        @DisplayName("should stop without any admin call when in standby")
        void shouldStopOnStandby() {
            when(healthProbe.healthStatus()).thenReturn(status(429));

            var result = run();

            assertFalse(result.isReady());
            assertEquals(ReadinessResult.Status.STANDBY, result.status());
            verify(adminClient, never()).initialize(anyInt(), anyInt());
            verify(adminClient, never()).unseal(any());
        }

        @Test
        @DisplayName("should load the material when already unsealed")
        void shouldLoadWhenUnsealed() {
            when(healthProbe.healthStatus()).thenReturn(status(200));
            when(materials.load()).thenReturn(Uni.createFrom().item(FRESH));

            var result = run();

            assertTrue(result.isReady());
            verify(adminClient, never()).unseal(any());
        }

        @Test
        @DisplayName("should keep probing while the engine is unreachable")
        void shouldRetryWhenUnreachable() {
            when(healthProbe.healthStatus())
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("connection refused")))
                    .thenReturn(status(500))
                    .thenReturn(status(200));
            when(materials.load()).thenReturn(Uni.createFrom().item(FRESH));

            assertTrue(run().isReady());
            verify(healthProbe, times(3)).healthStatus();
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1})
        @DisplayName("should fail FATAL without probing when the attempt bound is not positive")
        void shouldRejectNonPositiveBound(int maxAttempts) {
            when(config.maxInitAttempts()).thenReturn(Optional.of(maxAttempts));

            var error = assertThrows(SecretStoreException.class, VaultStateControllerTest.this::run);

            assertEquals(ErrorKind.FATAL, error.kind());
            assertTrue(error.getMessage().contains("max-init-attempts"));
            verify(healthProbe, never()).healthStatus();
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("should fail FATAL once the attempt bound is reached")
        void shouldFailAfterMaxAttempts() {
            when(config.maxInitAttempts()).thenReturn(Optional.of(3));
            when(healthProbe.healthStatus()).thenReturn(status(500));

            var error = assertThrows(SecretStoreException.class, VaultStateControllerTest.this::run);

            assertEquals(ErrorKind.FATAL, error.kind());
            verify(healthProbe, times(3)).healthStatus();
        }

        @Test
        @DisplayName("should fail TERMINAL when a shutdown is requested")
        void shouldStopOnShutdown() {
            shutdownSignal.request();

            var error = assertThrows(SecretStoreException.class, VaultStateControllerTest.this::run);

            assertEquals(ErrorKind.TERMINAL, error.kind());
            verify(healthProbe, never()).healthStatus();
        }
    }
}
