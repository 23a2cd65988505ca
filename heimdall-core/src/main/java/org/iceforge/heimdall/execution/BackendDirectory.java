package org.iceforge.heimdall.execution;

import org.iceforge.heimdall.model.BackendInstance;

import java.util.Optional;

/**
 * Resolves registered backend instances and their credentials.
 */
public interface BackendDirectory {

    Optional<BackendInstance> findInstance(String instanceId);

    /** Credentials for the instance; {@link BackendCredentials#none()} when it needs none. */
    BackendCredentials credentialsFor(BackendInstance instance);
}
