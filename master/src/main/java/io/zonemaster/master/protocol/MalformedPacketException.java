package io.zonemaster.master.protocol;

/**
 * Thrown when a control packet cannot be decoded.
 *
 * <p>Covers truncated payloads, negative or oversized string lengths and
 * headers that do not belong to the master protocol.</p>
 */
public class MalformedPacketException extends Exception {

    public MalformedPacketException(String message) {
        super(message);
    }
}
