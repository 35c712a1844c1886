package strongbox.adapter.out.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import strongbox.core.port.out.ProcessLauncher;

/**
 * Runs external executables with {@link ProcessBuilder}.
 *
 * <p>Blocking waits run on the Mutiny default worker pool.
 */
@ApplicationScoped
public class ProcessBuilderLauncher implements ProcessLauncher {

    private static final Logger LOG = Logger.getLogger(ProcessBuilderLauncher.class);

    @Override
    public Uni<String> runForOutput(List<String> command) {
        return Uni.createFrom()
                .item(() -> {
                    final Process process = startProcess(new ProcessBuilder(command)
                            .redirectError(ProcessBuilder.Redirect.INHERIT)
                            .redirectInput(ProcessBuilder.Redirect.INHERIT));
                    final String output;
                    try (InputStream stdout = process.getInputStream()) {
                        output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
                    } catch (IOException e) {
                        process.destroy();
                        throw new UncheckedIOException("Could not read output of " + command.get(0), e);
                    }

                    final int exitCode = waitFor(process, command);
                    if (exitCode != 0) {
                        throw new ProcessFailedException(command.get(0), exitCode);
                    }
                    return output;
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @Override
    public Uni<Integer> runToCompletion(List<String> command) {
        return Uni.createFrom()
                .item(() -> waitFor(startProcess(new ProcessBuilder(command).inheritIO()), command))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @Override
    public Uni<Void> start(List<String> command) {
        return Uni.createFrom().item(() -> {
            final Process process = startProcess(new ProcessBuilder(command).inheritIO());
            LOG.infof("Started %s (pid %d)", command.get(0), process.pid());
            return null;
        });
    }

    private static Process startProcess(ProcessBuilder builder) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not start " + builder.command().get(0), e);
        }
    }

    private static int waitFor(Process process, List<String> command) {
        try {
            final int exitCode = process.waitFor();
            LOG.debugf("%s exited with status %d", command.get(0), exitCode);
            return exitCode;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new IllegalStateException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    /**
     * An executable exited with a non-zero status.
     */
    public static class ProcessFailedException extends RuntimeException {

        private final int exitCode;

        public ProcessFailedException(String executable, int exitCode) {
            super(executable + " exited with status " + exitCode);
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
