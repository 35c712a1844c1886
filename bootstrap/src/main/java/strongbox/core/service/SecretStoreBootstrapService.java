package strongbox.core.service;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.BootstrapResult;
import strongbox.core.model.DelegateTokenGrant;
import strongbox.core.model.ErrorKind;
import strongbox.core.model.InitMaterial;
import strongbox.core.model.ReadinessResult;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.Token;
import strongbox.core.port.in.SecretStoreBootstrap;
import strongbox.core.service.credential.CertificateProvisioner;
import strongbox.core.service.credential.CredentialProvisioner;
import strongbox.core.service.crypto.MasterKeyEncryptionService;
import strongbox.core.service.token.TokenLifecycleService;
import strongbox.core.service.token.TokenProviderLauncher;
import strongbox.core.service.vault.InitMaterialService;
import strongbox.core.service.vault.KvEngineEnabler;
import strongbox.core.service.vault.ReadinessGate;
import strongbox.core.service.vault.VaultStateController;

/**
 * Runs one bootstrap of the secret store.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Load the input keying material when {@code IKM_HOOK} is set</li>
 *   <li>Initialize and unseal the engine, then wait until it serves requests</li>
 *   <li>Regenerate a transient root token from the key shares</li>
 *   <li>Revoke tokens left behind by earlier runs</li>
 *   <li>Create the token issuing token and launch the token provider</li>
 *   <li>Mount the key-value engine, then upload credentials and the proxy certificate</li>
 * </ol>
 *
 * <h2>Cleanup</h2>
 * <ul>
 *   <li>The keying material is wiped once its load was attempted, whatever happens next</li>
 *   <li>The transient root token is revoked exactly once after it was minted</li>
 *   <li>A one-shot provider's token issuing token is revoked at the end of the run</li>
 * </ul>
 */
@ApplicationScoped
public class SecretStoreBootstrapService implements SecretStoreBootstrap {

    private static final Logger LOG = Logger.getLogger(SecretStoreBootstrapService.class);

    private final SecretStoreConfig config;
    private final MasterKeyEncryptionService encryption;
    private final VaultStateController controller;
    private final ReadinessGate readinessGate;
    private final InitMaterialService materials;
    private final TokenLifecycleService tokens;
    private final TokenProviderLauncher tokenProvider;
    private final KvEngineEnabler kvEngine;
    private final CredentialProvisioner credentials;
    private final CertificateProvisioner certificates;

    @Inject
    public SecretStoreBootstrapService(
            SecretStoreConfig config,
            MasterKeyEncryptionService encryption,
            VaultStateController controller,
            ReadinessGate readinessGate,
            InitMaterialService materials,
            TokenLifecycleService tokens,
            TokenProviderLauncher tokenProvider,
            KvEngineEnabler kvEngine,
            CredentialProvisioner credentials,
            CertificateProvisioner certificates) {
        this.config = config;
        this.encryption = encryption;
        this.controller = controller;
        this.readinessGate = readinessGate;
        this.materials = materials;
        this.tokens = tokens;
        this.tokenProvider = tokenProvider;
        this.kvEngine = kvEngine;
        this.credentials = credentials;
        this.certificates = certificates;
    }

    @Override
    public Uni<BootstrapResult> bootstrap() {
        final Optional<String> hook = config.ikmHook().filter(h -> !h.isBlank());
        if (hook.isEmpty()) {
            LOG.info("Secret store master key encryption not enabled, IKM_HOOK not set");
            return unsealAndProvision();
        }

        return Uni.createFrom()
                .deferred(() -> {
                    encryption.loadIkm(hook.get());
                    LOG.info("Enabled encryption of the secret store master key");
                    return unsealAndProvision();
                })
                .eventually(encryption::wipeIkm);
    }

    private Uni<BootstrapResult> unsealAndProvision() {
        return controller
                .runUntilReady(config.healthInterval())
                .onItem()
                .transformToUni(readiness -> {
                    if (readiness.status() == ReadinessResult.Status.STANDBY) {
                        return Uni.createFrom().item(BootstrapResult.standby());
                    }
                    final InitMaterial material = readiness.material();
                    return readinessGate
                            .awaitReady()
                            .onItem()
                            .transformToUni(ignored -> tokens.regenerateRootToken(material))
                            .onItem()
                            .transformToUni(
                                    root -> provision(material, root).eventually(() -> tokens.revokeSelf(root)));
                })
                .onFailure(error -> SecretStoreException.hasKind(error, ErrorKind.TERMINAL))
                .recoverWithItem(error -> {
                    LOG.warnf("Secret store bootstrap cancelled: %s", error.getMessage());
                    return BootstrapResult.cancelled();
                });
    }

    private Uni<BootstrapResult> provision(InitMaterial material, Token root) {
        return stripPersistedRootToken(material)
                .onItem()
                .transformToUni(ignored -> revokeStaleTokens(root))
                .onItem()
                .transformToUni(ignored -> issueDelegate(root))
                .onItem()
                .transformToUni(grant -> launchAndUpload(root)
                        .eventually(() -> revokeOneShotGrant(grant)));
    }

    private Uni<Void> stripPersistedRootToken(InitMaterial material) {
        if (!config.revokeRootTokens() || !material.hasRootToken()) {
            return Uni.createFrom().voidItem();
        }
        return materials
                .save(material.withoutRootToken())
                .invoke(() -> LOG.info("Root token stripped from the persisted initialization material"));
    }

    private Uni<Void> revokeStaleTokens(Token root) {
        final Uni<Void> rootCleanup;
        if (config.revokeRootTokens()) {
            rootCleanup = tokens.revokeRootTokens(root)
                    .invoke(() -> LOG.info("Completed cleanup of old root tokens"))
                    .replaceWithVoid();
        } else {
            LOG.info("Not revoking existing root tokens");
            rootCleanup = Uni.createFrom().voidItem();
        }

        return rootCleanup
                .onItem()
                .transformToUni(ignored -> tokens.revokeNonRootTokens(root))
                .invoke(() -> LOG.info("Completed cleanup of old admin and service tokens"))
                .replaceWithVoid();
    }

    private Uni<Optional<DelegateTokenGrant>> issueDelegate(Token root) {
        if (config.tokenProvider().adminTokenPath().filter(p -> !p.isBlank()).isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return tokens.createTokenIssuingToken(root)
                .onItem()
                .transformToUni(grant -> tokenProvider.writeAdminToken(grant).replaceWith(Optional.of(grant)));
    }

    private Uni<BootstrapResult> launchAndUpload(Token root) {
        final Uni<Void> launched;
        if (tokenProvider.isConfigured()) {
            launched = tokenProvider.launch();
        } else {
            LOG.info("No token provider configured");
            launched = Uni.createFrom().voidItem();
        }

        return launched.onItem()
                .transformToUni(ignored -> kvEngine.enable(root))
                .onItem()
                .transformToUni(ignored -> credentials.provision(root))
                .onItem()
                .transformToUni(uploaded -> certificates
                        .provision(root)
                        .map(certificateUploaded -> BootstrapResult.provisioned(uploaded, certificateUploaded)))
                .invoke(() -> LOG.info("Secret store bootstrap completed successfully"));
    }

    private Uni<Void> revokeOneShotGrant(Optional<DelegateTokenGrant> grant) {
        if (grant.isEmpty() || config.tokenProvider().type() != SecretStoreConfig.ProviderType.ONESHOT) {
            return Uni.createFrom().voidItem();
        }
        return grant.get().revocation().revoke().replaceWithVoid();
    }
}
