package com.eyelevel.pdftoolkit.service.storage;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.OperationException;
import com.eyelevel.pdftoolkit.exception.apiclient.NotFoundException;
import com.eyelevel.pdftoolkit.model.Artifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Keeps generated files on ephemeral storage until they are downloaded or expire.
 *
 * <p>Every artifact gets a name made of a random token and a sanitized suffix, so names never
 * collide between concurrent requests and user-supplied names cannot escape the store directory.
 * There is no ownership tracking: whoever holds a name can fetch the artifact until it is swept.
 */
@Slf4j
@Service
public class ArtifactStore {

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");
    private static final int MAX_SUFFIX_LENGTH = 100;
    private static final String DEFAULT_SUFFIX = "artifact.pdf";
    private static final int TOKEN_LENGTH = 36;

    private final Path root;
    private final Clock clock;

    public ArtifactStore(ToolkitProcessingConfig config, Clock clock) {
        this.root = Path.of(config.getArtifacts().getDirectory()).toAbsolutePath().normalize();
        this.clock = clock;
        try {
            Files.createDirectories(root);
            log.info("Artifact store initialized at '{}'.", root);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create artifact directory " + root, e);
        }
    }

    /**
     * Stores the given bytes as a new artifact.
     *
     * @param content       The file content.
     * @param suggestedName A display name hint; only its safe characters are kept.
     * @return The stored artifact.
     */
    public Artifact put(byte[] content, String suggestedName) {
        String name = newName(suggestedName);
        Path target = root.resolve(name);
        try {
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return register(name, target);
        } catch (IOException e) {
            log.error("Failed to write artifact '{}'.", name, e);
            throw new OperationException("Could not store the generated file.", e);
        }
    }

    /**
     * Moves an existing file into the store as a new artifact.
     *
     * @param source        A file produced in a scratch directory. It no longer exists after the call.
     * @param suggestedName A display name hint; only its safe characters are kept.
     * @return The stored artifact.
     */
    public Artifact put(Path source, String suggestedName) {
        String name = newName(suggestedName);
        Path target = root.resolve(name);
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            return register(name, target);
        } catch (IOException e) {
            log.error("Failed to move '{}' into the artifact store.", source.getFileName(), e);
            throw new OperationException("Could not store the generated file.", e);
        }
    }

    /**
     * Reads an artifact's content.
     *
     * @throws NotFoundException when the name is unknown, expired, or not a name this store issues.
     */
    public byte[] get(String name) {
        Path path = resolve(name);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("File not found or expired");
        } catch (IOException e) {
            log.error("Failed to read artifact '{}'.", name, e);
            throw new OperationException("Could not read the requested file.", e);
        }
    }

    /**
     * Resolves an artifact name to its location, rejecting anything that is not a bare safe name.
     *
     * @throws NotFoundException when the name is invalid or the artifact does not exist.
     */
    public Path resolve(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            log.warn("Rejected artifact lookup for unsafe name '{}'.", name);
            throw new NotFoundException("File not found or expired");
        }
        Path path = root.resolve(name).normalize();
        if (!root.equals(path.getParent()) || !Files.isRegularFile(path)) {
            throw new NotFoundException("File not found or expired");
        }
        return path;
    }

    /**
     * Removes an artifact. Unknown or unsafe names are ignored.
     */
    public void delete(String name) {
        Path path;
        try {
            path = resolve(name);
        } catch (NotFoundException e) {
            log.debug("Nothing to delete for artifact '{}'.", name);
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete artifact '{}': {}", name, e.getMessage());
        }
    }

    /**
     * Deletes every artifact older than {@code maxAge}. Failures on individual files are logged
     * and the sweep continues with the next file.
     *
     * @return The number of artifacts deleted.
     */
    public int sweep(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int deleted = 0;
        long freedBytes = 0;

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                try {
                    if (!Files.isRegularFile(entry)) {
                        continue;
                    }
                    Instant lastModified = Files.getLastModifiedTime(entry).toInstant();
                    if (lastModified.isBefore(cutoff)) {
                        long size = Files.size(entry);
                        if (Files.deleteIfExists(entry)) {
                            deleted++;
                            freedBytes += size;
                            log.debug("Deleted expired artifact '{}'.", entry.getFileName());
                        }
                    }
                } catch (IOException e) {
                    log.warn("Failed to delete expired artifact '{}': {}", entry.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Artifact sweep could not list '{}'.", root, e);
        }

        if (deleted > 0) {
            log.info("Artifact sweep: deleted {} file(s), freed {} bytes.", deleted, freedBytes);
        }
        return deleted;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * The part of an artifact name after the random token, suitable as a download file name.
     */
    public static String displayName(String name) {
        int separator = name.indexOf('_');
        if (separator == TOKEN_LENGTH && name.length() > separator + 1) {
            return name.substring(separator + 1);
        }
        return name;
    }

    private Artifact register(String name, Path target) throws IOException {
        Instant now = clock.instant();
        Files.setLastModifiedTime(target, FileTime.from(now));
        long size = Files.size(target);
        log.debug("Stored artifact '{}' ({} bytes).", name, size);
        return new Artifact(name, target, size, now);
    }

    private String newName(String suggestedName) {
        return UUID.randomUUID() + "_" + sanitize(suggestedName);
    }

    static String sanitize(String suggestedName) {
        if (suggestedName == null) {
            return DEFAULT_SUFFIX;
        }
        String cleaned = UNSAFE_CHARACTERS.matcher(suggestedName).replaceAll("");
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.length() > MAX_SUFFIX_LENGTH) {
            cleaned = cleaned.substring(cleaned.length() - MAX_SUFFIX_LENGTH);
        }
        return cleaned.isEmpty() ? DEFAULT_SUFFIX : cleaned;
    }
}
