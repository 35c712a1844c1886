package strongbox.core.service.crypto;

import java.nio.charset.StandardCharsets;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import strongbox.core.port.out.KdfSaltRepository;

/**
 * HKDF-SHA256 key derivation from externally supplied keying material.
 *
 * <p>The salt is generated once and persisted next to the initialization
 * material so the same IKM always derives the same key. The {@code info}
 * label separates keys derived for different purposes.
 */
@ApplicationScoped
public class KeyDerivationService {

    static final int SALT_LENGTH = 32;

    private final KdfSaltRepository saltRepository;

    @Inject
    public KeyDerivationService(KdfSaltRepository saltRepository) {
        this.saltRepository = saltRepository;
    }

    /**
     * Derive a key.
     *
     * @param ikm       input keying material
     * @param keyLength length of the derived key in bytes
     * @param info      context label bound into the derivation
     * @return the derived key; the caller must wipe it after use
     */
    public byte[] deriveKey(byte[] ikm, int keyLength, String info) {
        if (ikm == null || ikm.length == 0) {
            throw new IllegalArgumentException("Input keying material cannot be empty");
        }
        final byte[] salt = saltRepository.loadOrCreate(SALT_LENGTH);

        final HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(ikm, salt, info.getBytes(StandardCharsets.UTF_8)));

        final byte[] key = new byte[keyLength];
        hkdf.generateBytes(key, 0, keyLength);
        return key;
    }
}
