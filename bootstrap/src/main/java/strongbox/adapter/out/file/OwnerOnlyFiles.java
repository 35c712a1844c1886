package strongbox.adapter.out.file;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Writes files readable and writable by the owner only.
 *
 * <p>Permissions are applied where the file system supports POSIX attributes:
 * {@code rw-------} for files, {@code rwx------} for directories created here.
 * Content goes to an owner-only temporary file in the target directory which
 * then replaces the target, so an existing file is never rewritten in place.
 */
final class OwnerOnlyFiles {

    static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
    static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS = PosixFilePermissions.fromString("rwx------");

    private OwnerOnlyFiles() {}

    /**
     * Write the bytes, replacing the file and creating missing parent directories.
     */
    static void write(Path file, byte[] content) throws IOException {
        final Path target = file.toAbsolutePath();
        final Path parent = target.getParent();
        if (!Files.isDirectory(parent)) {
            if (isPosix()) {
                Files.createDirectories(parent, PosixFilePermissions.asFileAttribute(DIRECTORY_PERMISSIONS));
            } else {
                Files.createDirectories(parent);
            }
        }

        final String prefix = "." + target.getFileName() + ".";
        final Path temp = isPosix()
                ? Files.createTempFile(parent, prefix, ".tmp", PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS))
                : Files.createTempFile(parent, prefix, ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                final ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
