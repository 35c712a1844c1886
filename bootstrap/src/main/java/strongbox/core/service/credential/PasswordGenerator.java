package strongbox.core.service.credential;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strongbox.core.config.CredentialConfig;
import strongbox.core.model.SecretStoreException;
import strongbox.core.port.out.ProcessLauncher;

/**
 * Generates database passwords.
 *
 * <p>The built-in provider draws 32 bytes from a {@link SecureRandom} and
 * encodes them URL-safe base64 without padding. Any other provider name is
 * run as an executable and its trimmed standard output is the password.
 */
@ApplicationScoped
public class PasswordGenerator {

    private static final Logger LOG = Logger.getLogger(PasswordGenerator.class);

    static final String DEFAULT_PROVIDER = "default";
    private static final int PASSWORD_BYTES = 32;

    private final CredentialConfig config;
    private final ProcessLauncher processLauncher;
    private final SecureRandom secureRandom;

    @Inject
    public PasswordGenerator(CredentialConfig config, ProcessLauncher processLauncher) {
        this.config = config;
        this.processLauncher = processLauncher;
        this.secureRandom = new SecureRandom();
    }

    /**
     * Generate one password.
     *
     * @return Uni with the password; fails with FATAL if the provider fails or prints nothing
     */
    public Uni<String> generate() {
        final String provider = config.passwordProvider().name();
        if (provider == null || provider.isBlank() || DEFAULT_PROVIDER.equals(provider)) {
            return Uni.createFrom().item(this::randomPassword);
        }

        final List<String> command = new ArrayList<>();
        command.add(provider);
        command.addAll(config.passwordProvider().args().orElse(List.of()));
        LOG.debugf("Generating password with provider %s", provider);

        return processLauncher
                .runForOutput(command)
                .map(String::trim)
                .map(password -> {
                    if (password.isEmpty()) {
                        throw new IllegalStateException("Password provider " + provider + " printed no password");
                    }
                    return password;
                })
                .onFailure()
                .transform(error -> SecretStoreException.fatal(
                        "Failed to generate password: " + error.getMessage(), error));
    }

    private String randomPassword() {
        final byte[] bytes = new byte[PASSWORD_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
