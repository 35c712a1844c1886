package strongbox.core.service.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import strongbox.core.model.InitMaterial;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.KeyMaterialSource;

/**
 * Encryption of the persisted secret store key shares.
 *
 * <p>Uses AES-256-GCM with a unique nonce per share. The key is derived from
 * the externally supplied IKM for every call and wiped before the call
 * returns; it is never stored or persisted.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #loadIkm(String)} is called at most once at startup</li>
 *   <li>{@link #isEncrypting()} is fixed from then on</li>
 *   <li>{@link #wipeIkm()} must run once the load was attempted, whatever happens next</li>
 * </ol>
 */
@ApplicationScoped
public class MasterKeyEncryptionService {

    private static final Logger LOG = Logger.getLogger(MasterKeyEncryptionService.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final String KEY_CONTEXT = "vault0";
    private static final HexFormat HEX = HexFormat.of();

    private final KeyMaterialSource keyMaterialSource;
    private final KeyDerivationService keyDerivation;
    private final SecureRandom secureRandom;

    private byte[] ikm;
    private boolean loadAttempted;
    private boolean wiped;
    private volatile boolean encrypting;

    @Inject
    public MasterKeyEncryptionService(KeyMaterialSource keyMaterialSource, KeyDerivationService keyDerivation) {
        this.keyMaterialSource = keyMaterialSource;
        this.keyDerivation = keyDerivation;
        this.secureRandom = new SecureRandom();
    }

    /**
     * Read the IKM through the given handle and check that a key can be derived from it.
     *
     * @param handle the IKM source handle
     * @throws SecretStoreException of kind FATAL if the IKM cannot be read or no key can be derived
     */
    public synchronized void loadIkm(String handle) {
        if (loadAttempted) {
            throw new IllegalStateException("Input keying material has already been loaded");
        }
        loadAttempted = true;

        try {
            final byte[] material = keyMaterialSource.read(handle);
            if (material == null || material.length == 0) {
                throw SecretStoreException.fatal("IKM source returned no key material");
            }
            this.ikm = material;
            Arrays.fill(deriveKey(), (byte) 0);
        } catch (SecretStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SecretStoreException.fatal("Failed to set up master key encryption: " + e.getMessage(), e);
        }

        this.encrypting = true;
        LOG.debug("Input keying material loaded");
    }

    /**
     * Check if persisted key shares are encrypted.
     *
     * @return true if IKM was loaded successfully
     */
    public boolean isEncrypting() {
        return encrypting;
    }

    /**
     * Encrypt the key shares of the given material.
     *
     * @param material material holding plaintext shares
     * @return a copy holding only encrypted shares and their nonces
     */
    public InitMaterial encrypt(InitMaterial material) {
        final byte[] key = activeKey();
        try {
            final List<String> encryptedKeys = new ArrayList<>(material.keys().size());
            final List<String> nonces = new ArrayList<>(material.keys().size());

            for (String share : material.keys()) {
                final byte[] nonce = new byte[NONCE_LENGTH];
                secureRandom.nextBytes(nonce);

                final byte[] plaintext = HEX.parseHex(share);
                try {
                    final Cipher cipher = Cipher.getInstance(ALGORITHM);
                    cipher.init(
                            Cipher.ENCRYPT_MODE,
                            new SecretKeySpec(key, "AES"),
                            new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
                    encryptedKeys.add(HEX.formatHex(cipher.doFinal(plaintext)));
                    nonces.add(HEX.formatHex(nonce));
                } finally {
                    Arrays.fill(plaintext, (byte) 0);
                }
            }

            return material.withEncryptedKeys(encryptedKeys, nonces);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw SecretStoreException.fatal("Failed to encrypt key shares", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Decrypt the key shares of the given material.
     *
     * @param material material holding encrypted shares
     * @return a copy holding only plaintext shares
     */
    public InitMaterial decrypt(InitMaterial material) {
        final byte[] key = activeKey();
        try {
            final List<String> keys = new ArrayList<>(material.encryptedKeys().size());
            final List<String> keysBase64 = new ArrayList<>(material.encryptedKeys().size());

            for (int i = 0; i < material.encryptedKeys().size(); i++) {
                final byte[] nonce = HEX.parseHex(material.nonces().get(i));
                final byte[] ciphertext = HEX.parseHex(material.encryptedKeys().get(i));

                final Cipher cipher = Cipher.getInstance(ALGORITHM);
                cipher.init(
                        Cipher.DECRYPT_MODE,
                        new SecretKeySpec(key, "AES"),
                        new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
                final byte[] plaintext = cipher.doFinal(ciphertext);
                try {
                    keys.add(HEX.formatHex(plaintext));
                    keysBase64.add(Base64.getEncoder().encodeToString(plaintext));
                } finally {
                    Arrays.fill(plaintext, (byte) 0);
                }
            }

            return material.withKeys(keys, keysBase64);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw SecretStoreException.fatal("Failed to decrypt key shares", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Overwrite the in-memory IKM with zeroes.
     *
     * <p>Safe to call when no IKM was loaded. Encryption and decryption fail
     * after the wipe.
     */
    public synchronized void wipeIkm() {
        if (wiped) {
            return;
        }
        wiped = true;
        if (ikm != null) {
            Arrays.fill(ikm, (byte) 0);
            LOG.info("Input keying material wiped from memory");
        }
    }

    private synchronized byte[] activeKey() {
        if (!encrypting) {
            throw new IllegalStateException("Master key encryption is not enabled");
        }
        if (wiped) {
            throw new IllegalStateException("Input keying material has already been wiped");
        }
        return deriveKey();
    }

    private byte[] deriveKey() {
        return keyDerivation.deriveKey(ikm, KEY_LENGTH, KEY_CONTEXT);
    }
}
