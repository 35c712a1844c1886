package strongbox.adapter.out.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.port.out.KdfSaltRepository;

/**
 * Keeps the key derivation salt as raw bytes in {@code <token-folder-path>/kdf-salt.dat}.
 */
@ApplicationScoped
public class FileKdfSaltRepository implements KdfSaltRepository {

    private static final Logger LOG = Logger.getLogger(FileKdfSaltRepository.class);

    static final String SALT_FILE = "kdf-salt.dat";

    private final Path file;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public FileKdfSaltRepository(SecretStoreConfig config) {
        this(Path.of(config.tokenFolderPath(), SALT_FILE));
    }

    FileKdfSaltRepository(Path file) {
        this.file = file;
    }

    @Override
    public synchronized byte[] loadOrCreate(int length) {
        try {
            if (Files.exists(file)) {
                final byte[] salt = Files.readAllBytes(file);
                if (salt.length != length) {
                    throw new IllegalStateException(
                            "Salt file " + file + " holds " + salt.length + " bytes, expected " + length);
                }
                return salt;
            }

            final byte[] salt = new byte[length];
            secureRandom.nextBytes(salt);
            OwnerOnlyFiles.write(file, salt);
            LOG.infof("Created key derivation salt at %s", file);
            return salt;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not access salt file " + file, e);
        }
    }
}
