/**
 * Binary control protocol spoken between the master and its workers.
 *
 * <p>All fields are little-endian. {@link io.zonemaster.master.protocol.ControlDispatcher}
 * decodes inbound packets and routes them to the registry, the affirmation
 * engine, the session registry and the object id allocator.</p>
 */
package io.zonemaster.master.protocol;
