package strongbox.core.service.vault;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.model.InitMaterial;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.InitMaterialRepository;
import strongbox.core.service.crypto.MasterKeyEncryptionService;

/**
 * Persists and restores the initialization material, encrypting the key
 * shares when master key encryption is enabled.
 *
 * <p>When encryption is disabled, saving and loading are the identity
 * transform. Any failure here is FATAL: the secret store cannot be unsealed
 * without the persisted material.
 */
@ApplicationScoped
public class InitMaterialService {

    private static final Logger LOG = Logger.getLogger(InitMaterialService.class);

    private final InitMaterialRepository repository;
    private final MasterKeyEncryptionService encryption;

    @Inject
    public InitMaterialService(InitMaterialRepository repository, MasterKeyEncryptionService encryption) {
        this.repository = repository;
        this.encryption = encryption;
    }

    /**
     * Save the material, encrypting the key shares first if enabled.
     */
    public Uni<Void> save(InitMaterial material) {
        return Uni.createFrom()
                .item(() -> encryption.isEncrypting() ? encryption.encrypt(material) : material)
                .onItem()
                .transformToUni(repository::save)
                .invoke(() -> LOG.debugf("Saved initialization material: %s", material))
                .onFailure()
                .transform(error -> asFatal("Unable to save initialization material", error));
    }

    /**
     * Load the material, decrypting the key shares if they were saved encrypted.
     */
    public Uni<InitMaterial> load() {
        return repository
                .load()
                .map(this::restore)
                .onFailure()
                .transform(error -> asFatal("Unable to load initialization material", error));
    }

    private InitMaterial restore(InitMaterial stored) {
        if (!stored.isEncrypted()) {
            if (encryption.isEncrypting()) {
                LOG.warn("Persisted key shares are not encrypted although master key encryption is enabled");
            }
            return stored;
        }
        if (!encryption.isEncrypting()) {
            throw SecretStoreException.fatal(
                    "Persisted key shares are encrypted but master key encryption is not enabled; set IKM_HOOK");
        }
        return encryption.decrypt(stored);
    }

    private static Throwable asFatal(String message, Throwable error) {
        if (error instanceof SecretStoreException) {
            return error;
        }
        return SecretStoreException.fatal(message + ": " + error.getMessage(), error);
    }
}
