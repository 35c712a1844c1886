package strongbox.adapter.out.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.CharBuffer;
import java.util.Arrays;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

import strongbox.core.port.out.KeyMaterialSource;

/**
 * Reads key material from the standard output of a hook executable.
 *
 * <p>The hook prints the material hex encoded; surrounding whitespace is
 * ignored. Intermediate buffers are wiped before returning.
 */
@ApplicationScoped
public class PipedHexReader implements KeyMaterialSource {

    @Override
    public byte[] read(String handle) {
        final Process process;
        try {
            process = new ProcessBuilder(handle)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not start key material hook " + handle, e);
        }

        byte[] output = new byte[0];
        char[] hex = new char[0];
        try (InputStream stdout = process.getInputStream()) {
            output = stdout.readAllBytes();
            final int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IllegalStateException("Key material hook " + handle + " exited with status " + exitCode);
            }

            hex = new char[output.length];
            for (int i = 0; i < output.length; i++) {
                hex[i] = (char) (output[i] & 0xff);
            }
            final CharBuffer trimmed = trim(hex);
            if (trimmed.length() == 0) {
                throw new IllegalStateException("Key material hook " + handle + " printed nothing");
            }
            return HexFormat.of().parseHex(trimmed);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read output of key material hook " + handle, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new IllegalStateException("Interrupted while running key material hook " + handle, e);
        } finally {
            Arrays.fill(output, (byte) 0);
            Arrays.fill(hex, '\0');
        }
    }

    private static CharBuffer trim(char[] chars) {
        int start = 0;
        int end = chars.length;
        while (start < end && Character.isWhitespace(chars[start])) {
            start++;
        }
        while (end > start && Character.isWhitespace(chars[end - 1])) {
            end--;
        }
        return CharBuffer.wrap(chars, start, end - start);
    }
}
