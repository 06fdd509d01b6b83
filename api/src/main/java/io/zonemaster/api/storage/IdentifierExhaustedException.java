package io.zonemaster.api.storage;

/**
 * Thrown when an {@link ObjectIdAllocator} has no identifiers left.
 *
 * <p>Not recoverable: the master terminates when it sees this.</p>
 */
public class IdentifierExhaustedException extends RuntimeException {

    public IdentifierExhaustedException(String message) {
        super(message);
    }
}
