package strongbox.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

/**
 * Port for running external executables.
 */
public interface ProcessLauncher {

    /**
     * Run a command and capture its standard output.
     *
     * @return Uni with the output; fails if the command exits with a non-zero status
     */
    Uni<String> runForOutput(List<String> command);

    /**
     * Run a command with inherited output and wait for it to exit.
     *
     * @return Uni with the exit status
     */
    Uni<Integer> runToCompletion(List<String> command);

    /**
     * Start a command with inherited output without waiting for it.
     */
    Uni<Void> start(List<String> command);
}
