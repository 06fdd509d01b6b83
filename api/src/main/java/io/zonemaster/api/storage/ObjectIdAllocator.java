package io.zonemaster.api.storage;

/**
 * Cluster-wide generator of persistent object identifiers.
 *
 * <p>Identifiers are unsigned 32-bit values carried in a {@code long}. An
 * identifier handed out once is never handed out again, including after a
 * restart of the master: implementations persist their high-water mark.</p>
 */
public interface ObjectIdAllocator {

    /**
     * Largest identifier an allocator may hand out.
     */
    long MAX_ID = 0xFFFF_FFFFL;

    /**
     * Generate a previously unused identifier.
     *
     * @return identifier in {@code [1, MAX_ID]}
     * @throws IdentifierExhaustedException if the identifier space is used up
     */
    long generate();

    /**
     * Persist the current high-water mark.
     *
     * <p>Called once during cluster teardown.</p>
     */
    void save();
}
