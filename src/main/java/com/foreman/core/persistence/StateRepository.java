package com.foreman.core.persistence;

import com.foreman.core.model.SessionState;

import java.util.Optional;

/**
 * Persists the single {@link SessionState} of a workspace.
 */
public interface StateRepository {

    Optional<SessionState> get();

    void save(SessionState state);

    void clear();

    boolean exists();
}
