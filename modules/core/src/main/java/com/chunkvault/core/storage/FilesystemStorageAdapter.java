package com.chunkvault.core.storage;

import com.chunkvault.core.concurrent.StripedLocks;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.commons.codec.digest.DigestUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed StorageAdapter.
 *
 * <p>Layout: {@code {root}/{key}.json}, so {@code content/ab/abcd.../metadata} becomes
 * {@code {root}/content/ab/abcd.../metadata.json}.
 *
 * <p>Every file is an envelope {@code {version, checksum, timestamp, data}} where the
 * checksum is the SHA-256 of the serialized data. Writes go to a temp file that is then
 * moved over the target; the previous version is kept next to it as {@code .json.backup}.
 * A load whose checksum does not verify falls back to the backup and restores it.
 */
@Singleton
@IfBuildProperty(name = "chunkvault.storage.type", stringValue = "filesystem", enableIfMissing = true)
public class FilesystemStorageAdapter implements StorageAdapter {

    private static final Logger log = Logger.getLogger(FilesystemStorageAdapter.class);

    static final int FORMAT_VERSION = 1;
    static final String DATA_SUFFIX = ".json";
    static final String BACKUP_SUFFIX = ".json.backup";
    private static final String TEMP_SUFFIX = ".tmp";

    record Envelope(int version, String checksum, long timestamp, JsonNode data) {}

    private final Path root;
    private final ObjectMapper mapper;
    private final ObjectReader envelopeReader;
    private final StripedLocks locks = new StripedLocks(64);

    @Inject
    public FilesystemStorageAdapter(
            @ConfigProperty(name = "chunkvault.storage.filesystem.root", defaultValue = "data/chunkvault")
            String root,
            ObjectMapper mapper) {
        this(Path.of(root), mapper);
    }

    public FilesystemStorageAdapter(Path root, ObjectMapper mapper) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = mapper;
        // decimals stay exact so a re-read serializes to the same checksummed text
        this.envelopeReader = mapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        log.infof("Filesystem storage rooted at %s", this.root);
    }

    Path dataPath(String key) {
        return root.resolve(StorageKeys.requireValid(key) + DATA_SUFFIX);
    }

    Path backupPath(String key) {
        return root.resolve(StorageKeys.requireValid(key) + BACKUP_SUFFIX);
    }

    @Override
    public Uni<Void> save(String key, Object value) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path target = dataPath(key);
            byte[] payload = encode(key, value);
            locks.runWithLock(key, () -> writeAtomically(key, target, payload));
        });
    }

    @Override
    public <T> Uni<Optional<T>> load(String key, Class<T> type) {
        return Uni.createFrom().item(() -> {
            Path target = dataPath(key);
            if (!Files.exists(target)) {
                return Optional.<T>empty();
            }
            Optional<JsonNode> data = readVerified(target);
            if (data.isEmpty()) {
                data = recoverFromBackup(key, target);
            }
            try {
                return Optional.of(mapper.treeToValue(data.get(), type));
            } catch (JsonProcessingException e) {
                throw new StorageException("Failed to read " + type.getSimpleName() + " from: " + key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> Files.exists(dataPath(key)));
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> locks.withLock(key, () -> {
            Path target = dataPath(key);
            try {
                boolean deleted = Files.deleteIfExists(target);
                Files.deleteIfExists(backupPath(key));
                pruneEmptyParents(target.getParent(), root);
                return deleted;
            } catch (IOException e) {
                throw new StorageException("Failed to delete: " + key, e);
            }
        }));
    }

    @Override
    public Multi<String> listKeys(String prefix) {
        return Multi.createFrom().items(() -> {
            if (!Files.isDirectory(root)) {
                return Stream.<String>empty();
            }
            List<String> keys;
            try (Stream<Path> files = Files.walk(root)) {
                keys = files
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(DATA_SUFFIX))
                        .map(this::toKey)
                        .filter(k -> k.startsWith(prefix))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new StorageException("Failed to list keys under: " + prefix, e);
            }
            return keys.stream();
        });
    }

    // -- internals --

    /** Data is parsed back from its own JSON so the checksum sees exactly what a later read sees. */
    private byte[] encode(String key, Object value) {
        try {
            JsonNode data = envelopeReader.readTree(mapper.writeValueAsBytes(value));
            Envelope envelope = new Envelope(FORMAT_VERSION, checksum(data),
                    System.currentTimeMillis(), data);
            return mapper.writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new StorageException("Failed to serialize value for: " + key, e);
        }
    }

    private String checksum(JsonNode data) throws JsonProcessingException {
        return DigestUtils.sha256Hex(mapper.writeValueAsBytes(data));
    }

    private void writeAtomically(String key, Path target, byte[] payload) {
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
            Files.write(tmp, payload);
            if (Files.exists(target)) {
                Files.copy(target, backupPath(key), StandardCopyOption.REPLACE_EXISTING);
            }
            move(tmp, target);
        } catch (IOException e) {
            throw new StorageException("Failed to write: " + key, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warnf("Could not remove temp file %s: %s", tmp, e.getMessage());
                }
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Returns the envelope data if the file parses and its checksum verifies. */
    private Optional<JsonNode> readVerified(Path file) {
        try {
            Envelope envelope = envelopeReader.forType(Envelope.class).readValue(Files.readAllBytes(file));
            if (envelope.data() == null || envelope.checksum() == null) {
                return Optional.empty();
            }
            if (!envelope.checksum().equals(checksum(envelope.data()))) {
                log.warnf("Checksum mismatch in %s", file);
                return Optional.empty();
            }
            return Optional.of(envelope.data());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warnf("Unreadable storage file %s: %s", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<JsonNode> recoverFromBackup(String key, Path target) {
        return Optional.of(locks.withLock(key, () -> {
            Path backup = backupPath(key);
            Optional<JsonNode> data = readVerified(backup);
            if (data.isEmpty()) {
                throw new StorageException("Entry is corrupt and has no valid backup: " + key);
            }
            try {
                Files.copy(backup, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new StorageException("Failed to restore backup for: " + key, e);
            }
            log.warnf("Restored %s from backup", key);
            return data.get();
        }));
    }

    private String toKey(Path file) {
        String relative = root.relativize(file).toString().replace(File.separatorChar, StorageKeys.SEPARATOR);
        return relative.substring(0, relative.length() - DATA_SUFFIX.length());
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop) && Files.isDirectory(current)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }
}
