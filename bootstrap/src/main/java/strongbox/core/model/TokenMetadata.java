package strongbox.core.model;

import java.util.Set;

/**
 * Token properties returned by an accessor lookup.
 *
 * @param accessor    the token accessor
 * @param policies    policies attached to the token
 * @param displayName display name given at creation
 */
public record TokenMetadata(String accessor, Set<String> policies, String displayName) {

    public static final String ROOT_POLICY = "root";
    public static final String SERVICE_POLICY_PREFIX = "edgex-service-";

    public TokenMetadata {
        policies = policies != null ? Set.copyOf(policies) : Set.of();
        displayName = displayName != null ? displayName : "";
    }

    public boolean isRoot() {
        return policies.contains(ROOT_POLICY);
    }

    /**
     * Scope of the token, read from its policies.
     */
    public TokenScope scope() {
        if (isRoot()) {
            return TokenScope.ROOT;
        }
        if (policies.stream().anyMatch(policy -> policy.startsWith(SERVICE_POLICY_PREFIX))) {
            return TokenScope.SERVICE;
        }
        return TokenScope.DELEGATE;
    }
}
