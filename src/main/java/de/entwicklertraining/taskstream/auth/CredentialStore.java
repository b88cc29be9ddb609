package de.entwicklertraining.taskstream.auth;

import java.util.Optional;

/**
 * Holds the current {@link Credential}. The store is the only place a credential is changed.
 *
 * <p>Implementations must make {@link #set(Credential)} atomic with respect to {@link #get()}:
 * a reader sees either the old pair or the new pair, never a mix.
 */
public interface CredentialStore {

    Optional<Credential> get();

    void set(Credential credential);

    void clear();
}
