package org.Aayush.redirects.table;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.core.RedirectException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Serializes pair sets to the canonical table format.
 *
 * <p>Rows are written to a sibling temporary file which then replaces the table, so readers
 * never see a truncated table. On POSIX file stores the replaced table keeps its permissions;
 * new tables get {@code rw-r--r--}.</p>
 */
@Slf4j
public final class RedirectTableWriter {
    public static final String HEADER = "# FROM-URL\tTO-URL";

    static final Set<PosixFilePermission> NEW_TABLE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    /**
     * Renders table text: header, then one row per pair in the given order.
     */
    public static String render(List<RedirectPair> pairs) {
        StringBuilder out = new StringBuilder(HEADER.length() + 1 + pairs.size() * 64);
        out.append(HEADER).append('\n');
        for (RedirectPair pair : pairs) {
            out.append(pair.from()).append('\t').append(pair.to()).append('\n');
        }
        return out.toString();
    }

    /**
     * Replaces the table file with the given pairs.
     *
     * @param file target table path; parent folders are created.
     * @param pairs validated, sorted pairs.
     */
    public void write(Path file, List<RedirectPair> pairs) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(pairs, "pairs");
        Path folder = file.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(folder);
            temp = Files.createTempFile(folder, file.getFileName().toString(), ".tmp");
            copyPermissions(file, temp);
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(render(pairs));
            }
            moveIntoPlace(temp, file);
        } catch (IOException ex) {
            deleteQuietly(temp, ex);
            throw new RedirectException(RedirectException.REASON_TABLE_WRITE_FAILED,
                    "cannot write redirect table " + file, ex);
        }
        log.info("Wrote {} redirects to {}", pairs.size(), file);
    }

    /**
     * Gives the temp file the permissions of the table it replaces. Temp files are created
     * owner-only, and umask does not apply to an explicit set.
     */
    private static void copyPermissions(Path file, Path temp) throws IOException {
        if (!Files.getFileStore(temp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(file)
                ? Files.getPosixFilePermissions(file)
                : NEW_TABLE_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    private static void moveIntoPlace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, replacing", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException primary) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
        }
    }
}
