package strongbox.adapter.out.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;

import strongbox.core.model.Token;
import strongbox.core.port.out.AdminTokenWriter;

/**
 * Writes a token in the shape of a token creation response:
 * {@code {"auth":{"client_token":"...","accessor":"..."}}}.
 */
@ApplicationScoped
public class FileAdminTokenWriter implements AdminTokenWriter {

    private final ObjectMapper objectMapper;

    @Inject
    public FileAdminTokenWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Uni<Void> write(Path path, Token token) {
        return Uni.createFrom().item(() -> {
            final ObjectNode document = objectMapper.createObjectNode();
            final ObjectNode auth = document.putObject("auth");
            auth.put("client_token", token.value());
            if (token.accessor() != null) {
                auth.put("accessor", token.accessor());
            }

            try {
                OwnerOnlyFiles.write(path, objectMapper.writeValueAsBytes(document));
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Could not write token file " + path, e);
            }
        });
    }
}
