package fun.fengwk.mfr.core.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Writes state files through a temp file and a rename.
 *
 * @author fengwk
 */
public final class AtomicFiles {

    private AtomicFiles() {
    }

    public static void writeString(Path targetPath, String content) throws IOException {
        Path absolutePath = targetPath.toAbsolutePath().normalize();
        Path parent = absolutePath.getParent();
        Files.createDirectories(parent);
        Path tmpPath = parent.resolve(absolutePath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(tmpPath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            move(tmpPath, absolutePath);
        } catch (IOException ex) {
            try {
                Files.deleteIfExists(tmpPath);
            } catch (IOException cleanupEx) {
                ex.addSuppressed(cleanupEx);
            }
            throw ex;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

}
