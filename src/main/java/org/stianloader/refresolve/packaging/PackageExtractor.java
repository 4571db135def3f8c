package org.stianloader.refresolve.packaging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Comparator;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.logging.LoggingAdapter;

/**
 * Extracts {@link PackageArchive package archives} into a {@link PackageFolder}.
 *
 * <p>The archive is first unpacked into a staging directory next to its final location, which is
 * then moved into place. The completion markers are written last, so concurrent readers either see
 * a fully installed package or none at all. Extracting an already installed package is a no-op.
 * Callers are expected to hold the cache lock, this class does not lock on its own.
 */
public class PackageExtractor {

    @NotNull
    private static String contentHash(byte @NotNull[] data) {
        try {
            return Base64.getEncoder().encodeToString(MessageDigest.getInstance("SHA-512").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 is not available", e);
        }
    }

    private static void deleteRecursively(@NotNull Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(directory)) {
            for (Path path : (Iterable<Path>) stream.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
        }
    }

    @NotNull
    private static String escapeJson(@NotNull String string) {
        return string.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static boolean isPackagingMetadata(@NotNull String entry) {
        String lower = entry.toLowerCase(Locale.ROOT);
        return lower.equals("[content_types].xml")
                || lower.startsWith("_rels/")
                || lower.startsWith("package/services/metadata/");
    }

    /**
     * Extracts the archive of the given package into the folder.
     *
     * @param archive The downloaded archive
     * @param identity The identity of the package
     * @param source The identifier of the registry the archive was downloaded from
     * @param folder The folder to install the package into
     * @param token The cancellation signal, checked between entries
     * @return The installation directory
     * @throws IOException If writing to the folder fails
     */
    @NotNull
    public Path extract(@NotNull PackageArchive archive, @NotNull PackageIdentity identity, @NotNull String source, @NotNull PackageFolder folder, @NotNull CancellationToken token) throws IOException {
        Path installed = folder.getInstalledPath(identity);
        if (installed != null) {
            return installed;
        }

        Path target = folder.getPackageDirectory(identity);
        // A directory without marker was left behind by an interrupted extraction
        PackageExtractor.deleteRecursively(target);
        Files.createDirectories(target.getParent());

        Path staging = target.resolveSibling(".staging-" + UUID.randomUUID());
        LoggingAdapter.getDefaultLogger().info(PackageExtractor.class, "Extracting {} to {}", identity, target);
        try {
            Files.createDirectories(staging);
            for (String entry : archive.getFiles()) {
                token.throwIfCancellationRequested();
                if (PackageExtractor.isPackagingMetadata(entry)) {
                    continue;
                }
                Path file = staging.resolve(entry).normalize();
                if (!file.startsWith(staging)) {
                    throw new IOException("Archive entry " + entry + " of " + identity + " escapes the package directory");
                }
                Files.createDirectories(file.getParent());
                Files.write(file, archive.getEntry(entry), StandardOpenOption.CREATE_NEW);
            }
            byte[] data = archive.getRawData();
            String contentHash = PackageExtractor.contentHash(data);
            Files.write(staging.resolve(PackageFolder.getArchiveFileName(identity)), data);
            Files.write(staging.resolve(PackageFolder.getHashFileName(identity)), contentHash.getBytes(StandardCharsets.US_ASCII));
            Files.write(staging.resolve(PackageFolder.METADATA_FILE_NAME),
                    ("{\"version\":2,\"contentHash\":\"" + contentHash + "\",\"source\":\"" + PackageExtractor.escapeJson(source) + "\"}").getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staging, target);
            }
        } catch (FileAlreadyExistsException e) {
            // Someone else installed the package in the meantime
            Path other = folder.getInstalledPath(identity);
            if (other == null) {
                throw e;
            }
            return other;
        } finally {
            PackageExtractor.deleteRecursively(staging);
        }
        return target;
    }
}
