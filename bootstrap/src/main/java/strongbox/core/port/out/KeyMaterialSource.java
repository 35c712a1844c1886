package strongbox.core.port.out;

/**
 * Source of the externally supplied input keying material (IKM).
 */
public interface KeyMaterialSource {

    /**
     * Read the key material through the given handle.
     *
     * <p>The caller owns the returned buffer and is responsible for wiping it.
     *
     * @param handle reference to the source, such as the path of a hook executable
     * @return the raw key material
     */
    byte[] read(String handle);
}
