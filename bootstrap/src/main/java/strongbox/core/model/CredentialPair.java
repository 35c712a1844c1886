package strongbox.core.model;

import java.util.Map;

/**
 * Username and password shared by every service of one database.
 */
public record CredentialPair(String username, String password) {

    public CredentialPair {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
    }

    /**
     * Key/value form stored in the secret store.
     */
    public Map<String, String> toSecretData() {
        return Map.of("username", username, "password", password);
    }

    @Override
    public String toString() {
        return "CredentialPair[username=" + username + ", password=<redacted>]";
    }
}
