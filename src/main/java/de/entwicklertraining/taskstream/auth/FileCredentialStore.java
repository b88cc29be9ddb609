package de.entwicklertraining.taskstream.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Persists the credential in a properties file with the keys {@code access_token} and
 * {@code refresh_token}.
 *
 * <p>Writes go to a temporary file in the same directory which then replaces the target
 * with an atomic move, so a concurrent reader (in this or another process) never sees a
 * half-written pair.
 */
public final class FileCredentialStore implements CredentialStore {
    private static final Logger logger = LoggerFactory.getLogger(FileCredentialStore.class);

    static final String ACCESS_TOKEN_KEY = "access_token";
    static final String REFRESH_TOKEN_KEY = "refresh_token";

    private final Path file;

    public FileCredentialStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized Optional<Credential> get() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read credentials from " + file, e);
        }
        String access = properties.getProperty(ACCESS_TOKEN_KEY);
        if (access == null || access.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new Credential(access, properties.getProperty(REFRESH_TOKEN_KEY)));
    }

    @Override
    public synchronized void set(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        Properties properties = new Properties();
        properties.setProperty(ACCESS_TOKEN_KEY, credential.accessToken());
        if (credential.refreshToken() != null) {
            properties.setProperty(REFRESH_TOKEN_KEY, credential.refreshToken());
        }
        write(properties);
        logger.debug("Stored credential {} in {}", credential, file);
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete credentials at " + file, e);
        }
        logger.debug("Cleared credential file {}", file);
    }

    private void write(Properties properties) {
        Path directory = file.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                properties.store(out, null);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to a plain replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Could not write credentials to " + file, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary credential file {}: {}", temp, e.getMessage());
        }
    }
}
