package io.zonemaster.master.protocol;

import org.agrona.DirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import javax.annotation.Nonnull;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sequential little-endian reader over a received control packet.
 *
 * <p>Every read checks the remaining length first and fails with
 * {@link MalformedPacketException} instead of reading past the end.</p>
 */
public final class PacketReader {

    /**
     * Upper bound for length-prefixed strings. Account names, passwords and
     * addresses are far shorter; anything larger is a corrupt length.
     */
    public static final int MAX_STRING_LENGTH = 4096;

    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private final DirectBuffer buffer;
    private final int limit;
    private int offset;

    public PacketReader(@Nonnull byte[] data) {
        Objects.requireNonNull(data, "data");
        this.buffer = new UnsafeBuffer(data);
        this.limit = data.length;
        this.offset = 0;
    }

    public int readU8() throws MalformedPacketException {
        require(Byte.BYTES, "u8");
        int value = buffer.getByte(offset) & 0xFF;
        offset += Byte.BYTES;
        return value;
    }

    public boolean readBoolean() throws MalformedPacketException {
        return readU8() != 0;
    }

    public int readU16() throws MalformedPacketException {
        require(Short.BYTES, "u16");
        int value = buffer.getShort(offset, ORDER) & 0xFFFF;
        offset += Short.BYTES;
        return value;
    }

    public int readI32() throws MalformedPacketException {
        require(Integer.BYTES, "i32");
        int value = buffer.getInt(offset, ORDER);
        offset += Integer.BYTES;
        return value;
    }

    public long readU32() throws MalformedPacketException {
        return Integer.toUnsignedLong(readI32());
    }

    /**
     * Read an unsigned 64-bit value. Values above {@link Long#MAX_VALUE}
     * come back negative; request ids are only ever echoed, never compared
     * for order.
     */
    public long readU64() throws MalformedPacketException {
        require(Long.BYTES, "u64");
        long value = buffer.getLong(offset, ORDER);
        offset += Long.BYTES;
        return value;
    }

    /**
     * Read a {@code u32} length-prefixed US-ASCII string.
     *
     * @return the string
     * @throws MalformedPacketException if the length is out of bounds
     */
    @Nonnull
    public String readString() throws MalformedPacketException {
        long length = readU32();
        if (length > MAX_STRING_LENGTH) {
            throw new MalformedPacketException("String length " + length + " exceeds " + MAX_STRING_LENGTH);
        }
        return readAscii((int) length, false);
    }

    /**
     * Read a zero-padded fixed-width US-ASCII string.
     *
     * @param width field width in bytes
     * @return the string up to its first zero byte
     */
    @Nonnull
    public String readFixedString(int width) throws MalformedPacketException {
        return readAscii(width, true);
    }

    private String readAscii(int length, boolean stopAtZero) throws MalformedPacketException {
        require(length, "string");
        byte[] bytes = new byte[length];
        buffer.getBytes(offset, bytes);
        offset += length;

        int end = length;
        if (stopAtZero) {
            for (int i = 0; i < length; i++) {
                if (bytes[i] == 0) {
                    end = i;
                    break;
                }
            }
        }
        return new String(bytes, 0, end, StandardCharsets.US_ASCII);
    }

    private void require(int bytes, String field) throws MalformedPacketException {
        if (bytes > remaining()) {
            throw new MalformedPacketException("Truncated " + field + " at offset " + offset
                    + ": need " + bytes + " bytes, " + remaining() + " left");
        }
    }

    public int remaining() {
        return limit - offset;
    }
}
