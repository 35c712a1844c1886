package strongbox.core.service.vault;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.EngineAction;
import strongbox.core.model.EngineState;
import strongbox.core.model.ErrorKind;
import strongbox.core.model.InitMaterial;
import strongbox.core.model.ReadinessResult;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.SecretStoreAdminClient;
import strongbox.core.port.out.SecretStoreHealthProbe;
import strongbox.core.service.ShutdownSignal;

/**
 * Drives the secret store from whatever state it is in to unsealed.
 *
 * <p>Each iteration probes the health endpoint, classifies the result into an
 * {@link EngineState} and performs the {@link EngineAction} the transition
 * table assigns to that state. Transient failures (unreachable engine,
 * failed init or unseal call) are retried on a fixed interval; losing the
 * persisted initialization material is FATAL.
 *
 * <h2>Transitions</h2>
 * <pre>
 * UNREACHABLE   -&gt; RETRY_LATER
 * UNSEALED      -&gt; LOAD_AND_FINISH
 * STANDBY       -&gt; STOP_STANDBY
 * UNINITIALIZED -&gt; INITIALIZE_AND_UNSEAL
 * SEALED        -&gt; LOAD_AND_UNSEAL
 * </pre>
 */
@ApplicationScoped
public class VaultStateController {

    private static final Logger LOG = Logger.getLogger(VaultStateController.class);

    private static final Map<EngineState, EngineAction> TRANSITIONS = new EnumMap<>(EngineState.class);

    static {
        TRANSITIONS.put(EngineState.UNREACHABLE, EngineAction.RETRY_LATER);
        TRANSITIONS.put(EngineState.UNSEALED, EngineAction.LOAD_AND_FINISH);
        TRANSITIONS.put(EngineState.STANDBY, EngineAction.STOP_STANDBY);
        TRANSITIONS.put(EngineState.UNINITIALIZED, EngineAction.INITIALIZE_AND_UNSEAL);
        TRANSITIONS.put(EngineState.SEALED, EngineAction.LOAD_AND_UNSEAL);
    }

    private final SecretStoreHealthProbe healthProbe;
    private final SecretStoreAdminClient adminClient;
    private final InitMaterialService materials;
    private final SecretStoreConfig config;
    private final ShutdownSignal shutdownSignal;

    @Inject
    public VaultStateController(
            SecretStoreHealthProbe healthProbe,
            SecretStoreAdminClient adminClient,
            InitMaterialService materials,
            SecretStoreConfig config,
            ShutdownSignal shutdownSignal) {
        this.healthProbe = healthProbe;
        this.adminClient = adminClient;
        this.materials = materials;
        this.config = config;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * Look up the action for a state.
     */
    public static EngineAction actionFor(EngineState state) {
        return TRANSITIONS.get(state);
    }

    /**
     * Probe and act until the secret store is unsealed or found in standby.
     *
     * @param healthInterval wait between attempts
     * @return Uni with the readiness result; fails with FATAL when the persisted
     *         material is unusable, the configured attempt bound is not positive
     *         or is exhausted, and with TERMINAL when a shutdown is requested
     */
    public Uni<ReadinessResult> runUntilReady(Duration healthInterval) {
        final var maxAttempts = config.maxInitAttempts();
        if (maxAttempts.isPresent() && maxAttempts.get() < 1) {
            return Uni.createFrom().failure(SecretStoreException.fatal(
                    "strongbox.secret-store.max-init-attempts must be at least 1, was " + maxAttempts.get()));
        }
        final var attempts = new AtomicInteger();

        return Uni.createFrom()
                .deferred(() -> iterate(attempts.incrementAndGet(), healthInterval))
                .repeat()
                .withDelay(healthInterval)
                .whilst(Optional::isEmpty)
                .select()
                .where(Optional::isPresent)
                .toUni()
                .map(Optional::get);
    }

    private Uni<Optional<ReadinessResult>> iterate(int attempt, Duration healthInterval) {
        shutdownSignal.throwIfRequested("waiting to unseal the secret store");

        return healthProbe
                .healthStatus()
                .map(EngineState::fromStatusCode)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Secret store health check failed: %s", error.getMessage());
                    return EngineState.UNREACHABLE;
                })
                .onItem()
                .transformToUni(this::act)
                .map(result -> {
                    if (result.isEmpty()) {
                        checkAttemptBound(attempt);
                        LOG.infof("Trying secret store init/unseal again in %s", healthInterval);
                    }
                    return result;
                });
    }

    private Uni<Optional<ReadinessResult>> act(EngineState state) {
        final EngineAction action = actionFor(state);
        LOG.debugf("Secret store state %s, action %s", state, action);

        switch (action) {
            case LOAD_AND_FINISH:
                return loadAndFinish();
            case STOP_STANDBY:
                LOG.error("Secret store is unsealed and in standby mode; this node will not unseal it");
                return Uni.createFrom().item(Optional.of(ReadinessResult.standby()));
            case INITIALIZE_AND_UNSEAL:
                return initializeAndUnseal();
            case LOAD_AND_UNSEAL:
                return loadAndUnseal();
            case RETRY_LATER:
            default:
                LOG.error("Secret store is unreachable or in an unknown state");
                return Uni.createFrom().item(Optional.empty());
        }
    }

    private Uni<Optional<ReadinessResult>> loadAndFinish() {
        return materials.load().map(material -> {
            LOG.info("Secret store is initialized and unsealed");
            return Optional.of(ReadinessResult.ready(material));
        });
    }

    private Uni<Optional<ReadinessResult>> initializeAndUnseal() {
        LOG.info("Secret store is not initialized. Starting initialization and unseal phases");

        return adminClient
                .initialize(config.secretThreshold(), config.secretShares())
                .onFailure()
                .transform(error -> SecretStoreException.retryable("Secret store initialization failed", error))
                .onItem()
                .transformToUni(material -> materials.save(forPersistence(material)).replaceWith(material))
                .onItem()
                .transformToUni(this::unseal)
                .onFailure(error -> SecretStoreException.hasKind(error, ErrorKind.TRANSIENT))
                .recoverWithItem(this::retryAfter);
    }

    private Uni<Optional<ReadinessResult>> loadAndUnseal() {
        LOG.info("Secret store is sealed. Starting unseal phase");

        return materials
                .load()
                .onItem()
                .transformToUni(this::unseal)
                .onFailure(error -> SecretStoreException.hasKind(error, ErrorKind.TRANSIENT))
                .recoverWithItem(this::retryAfter);
    }

    private Uni<Optional<ReadinessResult>> unseal(InitMaterial material) {
        return adminClient
                .unseal(material.keys())
                .onFailure()
                .transform(error -> SecretStoreException.retryable("Secret store unseal failed", error))
                .map(status -> {
                    if (status.sealed()) {
                        LOG.warnf(
                                "Secret store is still sealed after submitting key shares (progress %d/%d)",
                                status.progress(), status.threshold());
                        return Optional.<ReadinessResult>empty();
                    }
                    LOG.info("Secret store unsealed");
                    return Optional.of(ReadinessResult.ready(material));
                });
    }

    private InitMaterial forPersistence(InitMaterial material) {
        if (config.revokeRootTokens() && material.hasRootToken()) {
            LOG.info("Root token stripped from initialization material before persisting it");
            return material.withoutRootToken();
        }
        return material;
    }

    private Optional<ReadinessResult> retryAfter(Throwable error) {
        final Throwable cause = error.getCause() != null ? error.getCause() : error;
        LOG.errorf("%s: %s", error.getMessage(), cause.getMessage());
        return Optional.empty();
    }

    private void checkAttemptBound(int attempt) {
        final var maxAttempts = config.maxInitAttempts();
        if (maxAttempts.isPresent() && attempt >= maxAttempts.get()) {
            throw SecretStoreException.fatal(
                    "Secret store could not be unsealed after " + attempt + " attempts");
        }
    }
}
