package strongbox.adapter.out.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProcessBuilderLauncher")
class ProcessBuilderLauncherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final ProcessBuilderLauncher launcher = new ProcessBuilderLauncher();

    @BeforeEach
    void requireShell() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
    }

    @Test
    @DisplayName("should capture standard output")
    void shouldCaptureOutput() {
        var output = launcher.runForOutput(List.of("/bin/sh", "-c", "echo generated")).await().atMost(TIMEOUT);

        assertEquals("generated\n", output);
    }

    @Test
    @DisplayName("should fail with the exit status when the command fails")
    void shouldFailOnNonZeroExit() {
        var error = assertThrows(ProcessBuilderLauncher.ProcessFailedException.class,
                () -> launcher.runForOutput(List.of("/bin/sh", "-c", "exit 4")).await().atMost(TIMEOUT));

        assertEquals(4, error.exitCode());
    }

    @Test
    @DisplayName("should report the exit status of a command run to completion")
    void shouldReturnExitStatus() {
        assertEquals(0, launcher.runToCompletion(List.of("/bin/sh", "-c", "true")).await().atMost(TIMEOUT));
        assertEquals(2, launcher.runToCompletion(List.of("/bin/sh", "-c", "exit 2")).await().atMost(TIMEOUT));
    }
}
