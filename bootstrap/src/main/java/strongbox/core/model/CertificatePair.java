package strongbox.core.model;

import java.util.Map;

/**
 * PEM encoded TLS certificate and private key.
 */
public record CertificatePair(String certificate, String privateKey) {

    public CertificatePair {
        if (certificate == null || certificate.isBlank()) {
            throw new IllegalArgumentException("Certificate cannot be null or blank");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("Private key cannot be null or blank");
        }
    }

    public Map<String, String> toSecretData() {
        return Map.of("cert", certificate, "key", privateKey);
    }

    @Override
    public String toString() {
        return "CertificatePair[certificate=" + certificate.length() + " chars, privateKey=<redacted>]";
    }
}
