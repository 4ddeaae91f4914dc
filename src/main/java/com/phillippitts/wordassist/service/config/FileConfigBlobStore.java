package com.phillippitts.wordassist.service.config;

import com.phillippitts.wordassist.config.properties.ConfigStoreProperties;
import com.phillippitts.wordassist.exception.ConfigStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Stores the configuration blob in a single JSON file.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the target,
 * so readers never observe a partially written blob.
 */
@Component
public class FileConfigBlobStore implements ConfigBlobStore {

    private static final Logger LOG = LogManager.getLogger(FileConfigBlobStore.class);

    private final Path path;

    public FileConfigBlobStore(ConfigStoreProperties props) {
        this.path = Paths.get(props.getPath()).toAbsolutePath();
    }

    @Override
    public Optional<String> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigStorageException("Failed to read configuration", path.toString(), e);
        }
    }

    @Override
    public void write(String blob) {
        Path tmp = null;
        try {
            Path dir = path.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(tmp, blob, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ConfigStorageException("Failed to write configuration", path.toString(), e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", tmp, e.toString());
        }
    }

    @Override
    public long modificationStamp() {
        try {
            return Files.exists(path) ? Files.getLastModifiedTime(path).to(TimeUnit.NANOSECONDS) : 0L;
        } catch (IOException e) {
            LOG.debug("Could not stat {}: {}", path, e.toString());
            return 0L;
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
