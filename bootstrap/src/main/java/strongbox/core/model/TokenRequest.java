package strongbox.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Parameters for creating a token.
 *
 * @param displayName display name recorded on the token
 * @param policies    policies to attach
 * @param period      renewal period of a periodic token
 * @param orphan      whether the token is created without a parent
 */
public record TokenRequest(String displayName, List<String> policies, Duration period, boolean orphan) {

    public TokenRequest {
        policies = policies != null ? List.copyOf(policies) : List.of();
    }
}
