package strongbox.core.service.credential;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.SecretStoreConfig;
import strongbox.core.model.CertificatePair;
import strongbox.core.model.SecretPath;
import strongbox.core.model.SecretStoreException;
import strongbox.core.model.Token;
import strongbox.core.port.out.SecretStoreKvClient;

/**
 * Uploads the API proxy's TLS certificate pair.
 *
 * <p>The upload is skipped when no certificate setting is configured, and
 * when a pair is already stored. A partial configuration is FATAL.
 */
@ApplicationScoped
public class CertificateProvisioner {

    private static final Logger LOG = Logger.getLogger(CertificateProvisioner.class);

    private static final String PRIVATE_KEY_BEGIN = "-----BEGIN";
    private static final String PRIVATE_KEY_END = "PRIVATE KEY-----";

    private final SecretStoreConfig.Certificate config;
    private final SecretStoreKvClient kvClient;

    @Inject
    public CertificateProvisioner(SecretStoreConfig config, SecretStoreKvClient kvClient) {
        this.config = config.certificate();
        this.kvClient = kvClient;
    }

    /**
     * Upload the configured certificate pair unless it is already stored.
     *
     * @param rootToken token used to read and write secrets
     * @return Uni with true if the pair was uploaded during this call
     */
    public Uni<Boolean> provision(Token rootToken) {
        final Optional<String> path = nonBlank(config.path());
        final Optional<String> certFile = nonBlank(config.certFile());
        final Optional<String> keyFile = nonBlank(config.keyFile());

        final long configured = Stream.of(path, certFile, keyFile).filter(Optional::isPresent).count();
        if (configured == 0) {
            LOG.info("Proxy certificate pair upload skipped because the certificate settings are blank");
            return Uni.createFrom().item(false);
        }
        if (configured < 3) {
            return Uni.createFrom()
                    .failure(SecretStoreException.fatal(
                            "Certificate path, certificate file and key file must all be configured"));
        }

        final SecretPath secretPath = SecretPath.of(path.get());
        return alreadyInStore(rootToken, secretPath)
                .onItem()
                .transformToUni(existing -> {
                    if (existing) {
                        LOG.info("Proxy certificate pair is already in the secret store, skipping upload");
                        return Uni.createFrom().item(false);
                    }
                    LOG.info("Proxy certificate pair is not in the secret store yet, uploading it");
                    return Uni.createFrom()
                            .item(() -> readFrom(Path.of(certFile.get()), Path.of(keyFile.get())))
                            .onItem()
                            .transformToUni(pair -> uploadToStore(rootToken, secretPath, pair))
                            .replaceWith(true);
                })
                .onFailure(error -> !(error instanceof SecretStoreException))
                .transform(error -> SecretStoreException.fatal(
                        "Failed to provision proxy certificate pair: " + error.getMessage(), error));
    }

    /**
     * Check whether a complete pair is stored at the path.
     */
    Uni<Boolean> alreadyInStore(Token rootToken, SecretPath path) {
        return kvClient.read(rootToken.value(), path).map(secret -> secret.map(CertificateProvisioner::isComplete)
                .orElse(false));
    }

    private static boolean isComplete(Map<String, String> secret) {
        final String cert = secret.get("cert");
        final String key = secret.get("key");
        return cert != null && !cert.isBlank() && key != null && !key.isBlank();
    }

    /**
     * Read and validate a PEM certificate and private key.
     *
     * @throws SecretStoreException of kind FATAL if a file is missing, the
     *         certificate does not parse or the key has no private key block
     */
    CertificatePair readFrom(Path certFile, Path keyFile) {
        final String certificate;
        final String privateKey;
        try {
            certificate = Files.readString(certFile, StandardCharsets.UTF_8);
            privateKey = Files.readString(keyFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw SecretStoreException.fatal("Failed to read certificate pair from volume: " + e.getMessage(), e);
        }

        try {
            CertificateFactory.getInstance("X.509")
                    .generateCertificate(new ByteArrayInputStream(certificate.getBytes(StandardCharsets.UTF_8)));
        } catch (CertificateException e) {
            throw SecretStoreException.fatal("Proxy certificate in " + certFile + " is not a valid X.509 PEM", e);
        }

        if (!privateKey.contains(PRIVATE_KEY_BEGIN) || !privateKey.contains(PRIVATE_KEY_END)) {
            throw SecretStoreException.fatal("Proxy key in " + keyFile + " has no PEM private key block");
        }

        LOG.info("Proxy certificate pair loaded from volume");
        return new CertificatePair(certificate, privateKey);
    }

    Uni<Void> uploadToStore(Token rootToken, SecretPath path, CertificatePair pair) {
        return kvClient
                .write(rootToken.value(), path, pair.toSecretData())
                .invoke(() -> LOG.infof("Proxy certificate pair uploaded to %s", path))
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Failed to upload the proxy certificate pair: " + error.getMessage(), error));
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value.filter(v -> !v.isBlank());
    }
}
