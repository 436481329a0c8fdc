package org.dxworks.codemod.request;

/**
 * One queued, not yet resolved modification. Requests only carry parameters; targets are looked up
 * against the session's original tree when code is generated.
 */
public interface ModificationRequest {

    RequestType getType();

    /** Short human-readable form used in logs and error messages. */
    String describe();
}
