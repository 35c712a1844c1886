package strongbox.core.port.out;

/**
 * Storage for the salt fed to the key derivation function.
 */
public interface KdfSaltRepository {

    /**
     * Load the salt, creating and persisting a random one on first use.
     *
     * @param length salt length in bytes
     * @return the salt
     */
    byte[] loadOrCreate(int length);
}
