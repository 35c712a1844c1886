package strongbox.core.model;

/**
 * Progress of a root token generation attempt.
 *
 * @param nonce        attempt nonce that every submitted share must carry
 * @param otp          one-time pad used to decode the generated token, only present when the attempt starts
 * @param complete     true once enough shares were submitted
 * @param encodedToken encoded root token, only present once complete
 * @param progress     shares submitted so far
 * @param required     shares required to complete
 */
public record RootTokenAttempt(
        String nonce, String otp, boolean complete, String encodedToken, int progress, int required) {

    @Override
    public String toString() {
        return "RootTokenAttempt[nonce=" + nonce + ", complete=" + complete
                + ", progress=" + progress + "/" + required + "]";
    }
}
