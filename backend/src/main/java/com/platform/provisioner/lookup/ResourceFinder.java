package com.platform.provisioner.lookup;

/**
 * Fetches the current representation of a remote object.
 *
 * @param <S> snapshot type
 */
@FunctionalInterface
public interface ResourceFinder<S> {
    
    /**
     * Decodes the identifier and issues one describe call.
     *
     * @return the snapshot, or a not-found lookup when the object or its parent container is absent
     * @throws com.platform.provisioner.error.MalformedIdentifierException when the identifier does not decode
     * @throws com.platform.provisioner.error.RemoteOperationException for any other remote failure
     */
    Lookup<S> find(String id);
}
