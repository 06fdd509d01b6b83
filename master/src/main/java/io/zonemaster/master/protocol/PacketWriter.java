package io.zonemaster.master.protocol;

import org.agrona.ExpandableArrayBuffer;
import org.agrona.MutableDirectBuffer;

import javax.annotation.Nonnull;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Little-endian builder for outgoing control packets.
 */
public final class PacketWriter {

    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private final MutableDirectBuffer buffer = new ExpandableArrayBuffer(64);
    private int offset;

    /**
     * Start a packet with the master header for a message type.
     *
     * @param type message type
     * @return a writer positioned after the header
     */
    @Nonnull
    public static PacketWriter forMessage(@Nonnull MessageType type) {
        Objects.requireNonNull(type, "type");
        PacketWriter writer = new PacketWriter();
        PacketHeader.master(type).write(writer);
        return writer;
    }

    public PacketWriter writeU8(int value) {
        buffer.putByte(offset, (byte) value);
        offset += Byte.BYTES;
        return this;
    }

    public PacketWriter writeBoolean(boolean value) {
        return writeU8(value ? 1 : 0);
    }

    public PacketWriter writeU16(int value) {
        buffer.putShort(offset, (short) value, ORDER);
        offset += Short.BYTES;
        return this;
    }

    public PacketWriter writeI32(int value) {
        buffer.putInt(offset, value, ORDER);
        offset += Integer.BYTES;
        return this;
    }

    public PacketWriter writeU32(long value) {
        return writeI32((int) value);
    }

    public PacketWriter writeU64(long value) {
        buffer.putLong(offset, value, ORDER);
        offset += Long.BYTES;
        return this;
    }

    /**
     * Write a {@code u32} length-prefixed US-ASCII string.
     */
    public PacketWriter writeString(@Nonnull String value) {
        byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
        writeU32(bytes.length);
        buffer.putBytes(offset, bytes);
        offset += bytes.length;
        return this;
    }

    /**
     * Write a US-ASCII string zero-padded (or truncated) to a fixed width.
     */
    public PacketWriter writeFixedString(@Nonnull String value, int width) {
        byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
        int length = Math.min(bytes.length, width);
        buffer.putBytes(offset, bytes, 0, length);
        buffer.setMemory(offset + length, width - length, (byte) 0);
        offset += width;
        return this;
    }

    @Nonnull
    public byte[] toByteArray() {
        byte[] out = new byte[offset];
        buffer.getBytes(0, out);
        return out;
    }

    @Override
    public String toString() {
        return "PacketWriter{length=" + offset + ", bytes=" + Arrays.toString(toByteArray()) + '}';
    }
}
