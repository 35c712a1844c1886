package strongbox.core.port.out;

import java.nio.file.Path;

import io.smallrye.mutiny.Uni;

import strongbox.core.model.Token;

/**
 * Hands a token over to another process through the filesystem.
 */
public interface AdminTokenWriter {

    /**
     * Write the token to the given file, readable by the owner only.
     */
    Uni<Void> write(Path path, Token token);
}
