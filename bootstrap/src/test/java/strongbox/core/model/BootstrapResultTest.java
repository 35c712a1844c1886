package strongbox.core.model;

import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BootstrapResult")
class BootstrapResultTest {

    @Test
    @DisplayName("should never ask the host process to keep running")
    void shouldNeverContinueRunning() {
        assertFalse(BootstrapResult.provisioned(3, true).continueRunning());
        assertFalse(BootstrapResult.standby().continueRunning());
        assertFalse(BootstrapResult.cancelled().continueRunning());
    }
}
