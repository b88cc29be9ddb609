package de.entwicklertraining.taskstream.auth;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the credential in memory only. Suitable for tests and short-lived processes.
 */
public final class InMemoryCredentialStore implements CredentialStore {
    private final AtomicReference<Credential> current = new AtomicReference<>();

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(Credential initial) {
        current.set(initial);
    }

    @Override
    public Optional<Credential> get() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void set(Credential credential) {
        current.set(Objects.requireNonNull(credential, "credential"));
    }

    @Override
    public void clear() {
        current.set(null);
    }
}
