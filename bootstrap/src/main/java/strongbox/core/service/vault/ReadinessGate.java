package strongbox.core.service.vault;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.EngineState;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.SecretStoreHealthProbe;
import strongbox.core.service.ShutdownSignal;

/**
 * Blocks the bootstrap until the secret store reports itself unsealed.
 *
 * <p>Probes run on a dedicated daemon thread at a fixed rate. Probe failures
 * are not errors here; the gate keeps waiting until the engine is unsealed or
 * a shutdown is requested.
 */
@ApplicationScoped
public class ReadinessGate {

    private static final Logger LOG = Logger.getLogger(ReadinessGate.class);

    private final SecretStoreHealthProbe healthProbe;
    private final SecretStoreConfig config;
    private final ShutdownSignal shutdownSignal;

    @Inject
    public ReadinessGate(SecretStoreHealthProbe healthProbe, SecretStoreConfig config, ShutdownSignal shutdownSignal) {
        this.healthProbe = healthProbe;
        this.config = config;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * Wait until the secret store is unsealed.
     *
     * @return Uni completing once the engine is unsealed; fails with TERMINAL
     *         when a shutdown is requested first
     */
    public Uni<Void> awaitReady() {
        return Uni.createFrom()
                .completionStage(() -> poll(config.readinessPollInterval()))
                .replaceWithVoid();
    }

    private CompletableFuture<Void> poll(Duration interval) {
        final CompletableFuture<Void> ready = new CompletableFuture<>();
        final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "secret-store-readiness");
            t.setDaemon(true);
            return t;
        });

        executor.scheduleAtFixedRate(
                () -> check(ready), 0, Math.max(1, interval.toMillis()), TimeUnit.MILLISECONDS);
        ready.whenComplete((ignored, error) -> executor.shutdownNow());

        return ready;
    }

    private void check(CompletableFuture<Void> ready) {
        if (ready.isDone()) {
            return;
        }
        if (shutdownSignal.isRequested()) {
            ready.completeExceptionally(
                    SecretStoreException.terminal("Shutdown requested while waiting for the secret store"));
            return;
        }

        try {
            final Integer status = healthProbe.healthStatus().await().atMost(config.requestTimeout());
            final EngineState state = EngineState.fromStatusCode(status);
            if (state == EngineState.UNSEALED) {
                LOG.info("Secret store is ready");
                ready.complete(null);
            } else {
                LOG.debugf("Secret store not ready yet (%s)", state);
            }
        } catch (RuntimeException e) {
            LOG.debugf("Secret store readiness probe failed: %s", e.getMessage());
        }
    }
}
