package strongbox.core.service.vault;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strongbox.core.model.ErrorKind;
import strongbox.core.model.InitMaterial;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.InitMaterialRepository;
import strongbox.core.port.out.KdfSaltRepository;
import strongbox.core.port.out.KeyMaterialSource;
import strongbox.core.service.crypto.KeyDerivationService;
import strongbox.core.service.crypto.MasterKeyEncryptionService;

@DisplayName("InitMaterialService")
@ExtendWith(MockitoExtension.class)
class InitMaterialServiceTest {

    private static final InitMaterial MATERIAL =
            InitMaterial.initialized("", List.of("aa01", "bb02", "cc03", "dd04", "ee05"), 3, 5);

    @Mock
    private KeyMaterialSource keyMaterialSource;

    @Mock
    private KdfSaltRepository saltRepository;

    private InMemoryRepository repository;
    private MasterKeyEncryptionService encryption;
    private InitMaterialService service;

    @BeforeEach
    void setUp() {
        lenient().when(saltRepository.loadOrCreate(32)).thenReturn(new byte[32]);
        repository = new InMemoryRepository();
        encryption = new MasterKeyEncryptionService(keyMaterialSource, new KeyDerivationService(saltRepository));
        service = new InitMaterialService(repository, encryption);
    }

    private void enableEncryption() {
        when(keyMaterialSource.read("hook")).thenReturn(new byte[] {1, 2, 3, 4, 5, 6, 7, 8});
        encryption.loadIkm("hook");
    }

    @Nested
    @DisplayName("Encryption disabled")
    class EncryptionDisabled {

        @Test
        @DisplayName("should persist plaintext shares")
        void shouldPersistPlaintext() {
            service.save(MATERIAL).await().indefinitely();

            assertSame(MATERIAL, repository.stored.get());
        }

        @Test
        @DisplayName("should load exactly what was saved")
        void shouldBeIdentity() {
            service.save(MATERIAL).await().indefinitely();

            assertEquals(MATERIAL, service.load().await().indefinitely());
        }

        @Test
        @DisplayName("should fail FATAL when the persisted shares are encrypted")
        void shouldFailOnEncryptedFile() {
            repository.stored.set(MATERIAL.withEncryptedKeys(List.of("00"), List.of("11")));

            var error = assertThrows(SecretStoreException.class, () -> service.load().await().indefinitely());

            assertEquals(ErrorKind.FATAL, error.kind());
        }
    }

    @Nested
    @DisplayName("Encryption enabled")
    class EncryptionEnabled {

        @BeforeEach
        void enable() {
            enableEncryption();
        }

        @Test
        @DisplayName("should persist only ciphertext")
        void shouldPersistCiphertext() {
            service.save(MATERIAL).await().indefinitely();

            var stored = repository.stored.get();
            assertTrue(stored.isEncrypted());
            assertTrue(stored.keys().isEmpty());
        }

        @Test
        @DisplayName("should decrypt to the original shares")
        void shouldRoundTrip() {
            service.save(MATERIAL).await().indefinitely();

            var loaded = service.load().await().indefinitely();

            assertEquals(MATERIAL.keys(), loaded.keys());
            assertFalse(loaded.isEncrypted());
            assertEquals(3, loaded.threshold());
        }

        @Test
        @DisplayName("should accept a plaintext file written before encryption was enabled")
        void shouldAcceptLegacyPlaintext() {
            repository.stored.set(MATERIAL);

            assertEquals(MATERIAL, service.load().await().indefinitely());
        }
    }

    @Test
    @DisplayName("should fail FATAL when the file cannot be read")
    void shouldFailFatalOnMissingFile() {
        var error = assertThrows(SecretStoreException.class, () -> service.load().await().indefinitely());

        assertEquals(ErrorKind.FATAL, error.kind());
    }

    private static class InMemoryRepository implements InitMaterialRepository {

        private final AtomicReference<InitMaterial> stored = new AtomicReference<>();

        @Override
        public Uni<InitMaterial> load() {
            return Uni.createFrom().item(() -> {
                if (stored.get() == null) {
                    throw new IllegalStateException("no initialization material stored");
                }
                return stored.get();
            });
        }

        @Override
        public Uni<Void> save(InitMaterial material) {
            stored.set(material);
            return Uni.createFrom().voidItem();
        }
    }
}
