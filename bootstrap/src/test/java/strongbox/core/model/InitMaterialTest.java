package strongbox.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InitMaterial")
class InitMaterialTest {

    private static final InitMaterial MATERIAL =
            InitMaterial.initialized("s.root-token", List.of("aa11", "bb22", "cc33"), 2, 3);

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should default missing fields to empty values")
        void shouldDefaultMissingFields() {
            var material = new InitMaterial(null, null, null, null, null, 1, 1);

            assertEquals("", material.rootToken());
            assertTrue(material.keys().isEmpty());
            assertTrue(material.keysBase64().isEmpty());
            assertFalse(material.hasRootToken());
            assertFalse(material.isEncrypted());
        }

        @Test
        @DisplayName("should reject encrypted shares without matching nonces")
        void shouldRejectMismatchedNonces() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new InitMaterial("", List.of(), List.of(), List.of("aa", "bb"), List.of("00"), 1, 2));
        }
    }

    @Nested
    @DisplayName("Copies")
    class Copies {

        @Test
        @DisplayName("should strip the root token and keep the shares")
        void shouldStripRootToken() {
            var stripped = MATERIAL.withoutRootToken();

            assertFalse(stripped.hasRootToken());
            assertEquals(MATERIAL.keys(), stripped.keys());
            assertEquals(2, stripped.threshold());
            assertTrue(MATERIAL.hasRootToken());
        }

        @Test
        @DisplayName("should hold only encrypted shares after encryption")
        void shouldHoldOnlyEncryptedShares() {
            var encrypted = MATERIAL.withEncryptedKeys(List.of("e1", "e2", "e3"), List.of("n1", "n2", "n3"));

            assertTrue(encrypted.isEncrypted());
            assertTrue(encrypted.keys().isEmpty());
            assertEquals("s.root-token", encrypted.rootToken());
        }

        @Test
        @DisplayName("should hold only plaintext shares after decryption")
        void shouldHoldOnlyPlaintextShares() {
            var encrypted = MATERIAL.withEncryptedKeys(List.of("e1"), List.of("n1"));
            var decrypted = encrypted.withKeys(List.of("aa11"), List.of("qhE="));

            assertFalse(decrypted.isEncrypted());
            assertTrue(decrypted.nonces().isEmpty());
            assertEquals(List.of("aa11"), decrypted.keys());
            assertEquals(List.of("qhE="), decrypted.keysBase64());
        }
    }

    @Test
    @DisplayName("should never print the root token or shares")
    void shouldRedactSecretsInToString() {
        var text = MATERIAL.toString();

        assertFalse(text.contains("s.root-token"));
        assertFalse(text.contains("aa11"));
        assertTrue(text.contains("keys=3"));
    }
}
