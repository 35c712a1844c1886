package strongbox.core.service.token;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.DelegateTokenGrant;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.AdminTokenWriter;
import strongbox.core.port.out.ProcessLauncher;

/**
 * Hands the token issuing token to the delegated token provider and starts it.
 */
@ApplicationScoped
public class TokenProviderLauncher {

    private static final Logger LOG = Logger.getLogger(TokenProviderLauncher.class);

    private final SecretStoreConfig config;
    private final AdminTokenWriter adminTokenWriter;
    private final ProcessLauncher processLauncher;

    @Inject
    public TokenProviderLauncher(
            SecretStoreConfig config, AdminTokenWriter adminTokenWriter, ProcessLauncher processLauncher) {
        this.config = config;
        this.adminTokenWriter = adminTokenWriter;
        this.processLauncher = processLauncher;
    }

    /**
     * Whether a token provider executable is configured.
     */
    public boolean isConfigured() {
        return config.tokenProvider().executable().filter(e -> !e.isBlank()).isPresent();
    }

    /**
     * Write the token issuing token to the configured admin token path.
     *
     * <p>The grant is revoked if the token cannot be written.
     *
     * @return Uni completing once the file is written; fails with FATAL
     */
    public Uni<Void> writeAdminToken(DelegateTokenGrant grant) {
        final String configured = config.tokenProvider()
                .adminTokenPath()
                .filter(p -> !p.isBlank())
                .orElseThrow(() -> SecretStoreException.fatal(
                        "Admin token path is required to write the token issuing token"));
        final Path path = Path.of(configured).toAbsolutePath();

        return adminTokenWriter
                .write(path, grant.token())
                .invoke(() -> LOG.infof("Token issuing token written to %s", path))
                .onFailure()
                .call(error -> {
                    LOG.errorf("Failed to write token issuing token to %s: %s", path, error.getMessage());
                    return grant.revocation().revoke();
                })
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Failed to write token issuing token: " + error.getMessage(), error));
    }

    /**
     * Launch the configured token provider.
     *
     * <p>A one-shot provider is awaited and a non-zero exit status is FATAL.
     * A long-running provider is started and left running.
     */
    public Uni<Void> launch() {
        final List<String> command = new ArrayList<>();
        command.add(config.tokenProvider()
                .executable()
                .orElseThrow(() -> SecretStoreException.fatal("No token provider executable configured")));
        command.addAll(config.tokenProvider().args().orElse(List.of()));

        LOG.infof("Launching token provider %s (%s)", command.get(0), config.tokenProvider().type());

        if (config.tokenProvider().type() == SecretStoreConfig.ProviderType.LONG_RUNNING) {
            return processLauncher
                    .start(command)
                    .onFailure()
                    .transform(error -> SecretStoreException.fatal(
                            "Failed to start token provider: " + error.getMessage(), error));
        }

        return processLauncher
                .runToCompletion(command)
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Failed to run token provider: " + error.getMessage(), error))
                .map(exitCode -> {
                    if (exitCode != 0) {
                        throw SecretStoreException.fatal("Token provider exited with status " + exitCode);
                    }
                    LOG.info("Token provider completed");
                    return null;
                })
                .replaceWithVoid();
    }
}
