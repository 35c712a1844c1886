package strongbox.core.model;

/**
 * Seal status reported after submitting an unseal key share.
 *
 * @param sealed    whether the engine is still sealed
 * @param threshold shares required to unseal
 * @param progress  shares accepted so far
 */
public record UnsealStatus(boolean sealed, int threshold, int progress) {}
