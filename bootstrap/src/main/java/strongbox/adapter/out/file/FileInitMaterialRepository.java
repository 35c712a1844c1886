package strongbox.adapter.out.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.InitMaterial;
import strongbox.core.port.out.InitMaterialRepository;

/**
 * Stores the initialization material as JSON at
 * {@code <token-folder-path>/<token-file>}.
 *
 * <p>The document keeps the field names the secret store uses in its init
 * response, so a file written by an earlier bootstrapper stays readable.
 */
@ApplicationScoped
public class FileInitMaterialRepository implements InitMaterialRepository {

    private static final Logger LOG = Logger.getLogger(FileInitMaterialRepository.class);

    private final ObjectMapper objectMapper;
    private final Path file;

    @Inject
    public FileInitMaterialRepository(ObjectMapper objectMapper, SecretStoreConfig config) {
        this(objectMapper, Path.of(config.tokenFolderPath(), config.tokenFile()));
    }

    FileInitMaterialRepository(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
    }

    @Override
    public Uni<InitMaterial> load() {
        return Uni.createFrom().item(() -> {
            try {
                final InitMaterialDocument document =
                        objectMapper.readValue(Files.readAllBytes(file), InitMaterialDocument.class);
                LOG.debugf("Loaded initialization material from %s", file);
                return document.toModel();
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read initialization material file " + file, e);
            }
        });
    }

    @Override
    public Uni<Void> save(InitMaterial material) {
        return Uni.createFrom().item(() -> {
            try {
                OwnerOnlyFiles.write(file, objectMapper.writeValueAsBytes(InitMaterialDocument.fromModel(material)));
                LOG.debugf("Saved initialization material to %s", file);
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Could not write initialization material file " + file, e);
            }
        });
    }

    /**
     * JSON shape of the persisted file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record InitMaterialDocument(
            @JsonProperty("root_token") String rootToken,
            @JsonProperty("keys") List<String> keys,
            @JsonProperty("keys_base64") List<String> keysBase64,
            @JsonProperty("encrypted_keys") List<String> encryptedKeys,
            @JsonProperty("nonces") List<String> nonces,
            @JsonProperty("secret_threshold") int secretThreshold,
            @JsonProperty("secret_shares") int secretShares) {

        static InitMaterialDocument fromModel(InitMaterial material) {
            return new InitMaterialDocument(
                    material.rootToken(),
                    material.keys(),
                    material.keysBase64(),
                    material.encryptedKeys(),
                    material.nonces(),
                    material.threshold(),
                    material.totalShares());
        }

        InitMaterial toModel() {
            return new InitMaterial(
                    rootToken, keys, keysBase64, encryptedKeys, nonces, secretThreshold, secretShares);
        }
    }
}
