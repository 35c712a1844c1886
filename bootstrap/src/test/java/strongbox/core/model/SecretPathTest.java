package strongbox.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecretPath")
class SecretPathTest {

    @Test
    @DisplayName("should build the service-scoped path")
    void shouldBuildServiceScopedPath() {
        assertEquals("edgex/core-data/redisdb", SecretPath.serviceScoped("core-data", "redisdb").value());
    }

    @Test
    @DisplayName("should build the database-scoped path")
    void shouldBuildDatabaseScopedPath() {
        assertEquals("edgex/redisdb/core-data", SecretPath.databaseScoped("redisdb", "core-data").value());
    }

    @Test
    @DisplayName("should strip leading slashes")
    void shouldStripLeadingSlashes() {
        assertEquals("edgex/pki/tls/proxy", SecretPath.of("//edgex/pki/tls/proxy").value());
    }

    @Test
    @DisplayName("should reject a blank path")
    void shouldRejectBlankPath() {
        assertThrows(IllegalArgumentException.class, () -> SecretPath.of("  "));
    }
}
