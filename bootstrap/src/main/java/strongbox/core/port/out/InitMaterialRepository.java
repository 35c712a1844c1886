package strongbox.core.port.out;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.InitMaterial;

/**
 * Durable storage for the initialization material.
 *
 * <p>Implementations must restrict access to the owner of the process. A
 * single bootstrapper writes the material; no locking is expected.
 */
public interface InitMaterialRepository {

    /**
     * Load the persisted material exactly as it was saved.
     *
     * @return Uni with the material; fails if it is missing or unreadable
     */
    Uni<InitMaterial> load();

    /**
     * Persist the material, replacing any previous version.
     */
    Uni<Void> save(InitMaterial material);
}
