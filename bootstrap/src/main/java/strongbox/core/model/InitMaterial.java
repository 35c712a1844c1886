package strongbox.core.model;

import java.util.List;

/**
 * Material produced once when the secret store is initialized.
 *
 * <p>In plaintext form {@code keys} holds the hex encoded key shares and
 * {@code keysBase64} the same shares base64 encoded. Once encrypted for
 * storage, both are empty and {@code encryptedKeys} and {@code nonces} hold
 * one hex encoded ciphertext and GCM nonce per share.
 *
 * <p>{@link #toString()} never prints the root token or any share.
 *
 * @param rootToken     initial root token, empty when stripped before persisting
 * @param keys          plaintext key shares (hex)
 * @param keysBase64    plaintext key shares (base64), empty when not known
 * @param encryptedKeys encrypted key shares (hex)
 * @param nonces        nonces used to encrypt each share (hex)
 * @param threshold     number of shares required to unseal
 * @param totalShares   number of shares generated
 */
public record InitMaterial(
        String rootToken,
        List<String> keys,
        List<String> keysBase64,
        List<String> encryptedKeys,
        List<String> nonces,
        int threshold,
        int totalShares) {

    public InitMaterial {
        rootToken = rootToken != null ? rootToken : "";
        keys = keys != null ? List.copyOf(keys) : List.of();
        keysBase64 = keysBase64 != null ? List.copyOf(keysBase64) : List.of();
        encryptedKeys = encryptedKeys != null ? List.copyOf(encryptedKeys) : List.of();
        nonces = nonces != null ? List.copyOf(nonces) : List.of();
        if (encryptedKeys.size() != nonces.size()) {
            throw new IllegalArgumentException("Each encrypted key share needs exactly one nonce");
        }
    }

    /**
     * Material as returned by a fresh initialization.
     */
    public static InitMaterial initialized(String rootToken, List<String> keys, int threshold, int totalShares) {
        return initialized(rootToken, keys, List.of(), threshold, totalShares);
    }

    public static InitMaterial initialized(
            String rootToken, List<String> keys, List<String> keysBase64, int threshold, int totalShares) {
        return new InitMaterial(rootToken, keys, keysBase64, List.of(), List.of(), threshold, totalShares);
    }

    public boolean hasRootToken() {
        return !rootToken.isEmpty();
    }

    public boolean isEncrypted() {
        return !encryptedKeys.isEmpty();
    }

    /**
     * Copy of this material with the root token cleared.
     */
    public InitMaterial withoutRootToken() {
        return new InitMaterial("", keys, keysBase64, encryptedKeys, nonces, threshold, totalShares);
    }

    /**
     * Copy of this material holding only the encrypted form of the shares.
     */
    public InitMaterial withEncryptedKeys(List<String> encryptedKeys, List<String> nonces) {
        return new InitMaterial(rootToken, List.of(), List.of(), encryptedKeys, nonces, threshold, totalShares);
    }

    /**
     * Copy of this material holding only the plaintext form of the shares.
     */
    public InitMaterial withKeys(List<String> keys, List<String> keysBase64) {
        return new InitMaterial(rootToken, keys, keysBase64, List.of(), List.of(), threshold, totalShares);
    }

    @Override
    public String toString() {
        return "InitMaterial[threshold=" + threshold
                + ", totalShares=" + totalShares
                + ", keys=" + keys.size()
                + ", encryptedKeys=" + encryptedKeys.size()
                + ", rootToken=" + (hasRootToken() ? "<redacted>" : "<none>")
                + "]";
    }
}
