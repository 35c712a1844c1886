package strongbox.adapter.out.vault;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * The secret store answered with an unexpected HTTP status.
 */
public class VaultResponseException extends RuntimeException {

    private final int statusCode;

    public VaultResponseException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Extract the {@code errors} list from an error body, falling back to the raw body.
     */
    static String errorsOf(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        try {
            final JsonArray errors = new JsonObject(body).getJsonArray("errors");
            return errors != null ? errors.encode() : body;
        } catch (DecodeException | ClassCastException e) {
            return body;
        }
    }
}
