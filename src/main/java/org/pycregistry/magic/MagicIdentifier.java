package org.pycregistry.magic;

import java.util.Arrays;

/**
 * The four-byte magic tag at the start of a compiled bytecode file.
 *
 * <p>Layout: the magic integer as an unsigned little-endian 16-bit value, followed by a
 * two-byte terminator. The terminator is {@code \r\n} for every format except the two
 * oldest ones (magic integers {@value #LEGACY_MAGIC_1_0} and {@value #LEGACY_MAGIC_1_1}),
 * which used {@code 0x99 0x00}.
 *
 * <p>Instances are immutable; {@link #bytes()} returns a copy.
 */
public final class MagicIdentifier {

    /** Number of bytes in a magic tag. */
    public static final int LENGTH = 4;

    /** Largest magic integer that fits the 16-bit field. */
    public static final int MAX_MAGIC_INT = 0xFFFF;

    /** Magic integer of version 1.0. */
    public static final int LEGACY_MAGIC_1_0 = 39170;

    /** Magic integer of version 1.1 (also used by 1.2). */
    public static final int LEGACY_MAGIC_1_1 = 39171;

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte LEGACY_TERMINATOR_1 = (byte) 0x99;
    private static final byte LEGACY_TERMINATOR_2 = 0x00;

    private final byte[] bytes;

    private MagicIdentifier(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Computes the tag for a magic integer.
     *
     * @param magicInt the magic integer, e.g. 62211.
     * @return the tag, e.g. {@code 03 f3 0d 0a}.
     * @throws IllegalArgumentException if the value does not fit an unsigned 16-bit field.
     */
    public static MagicIdentifier fromInt(int magicInt) {
        if (magicInt < 0 || magicInt > MAX_MAGIC_INT) {
            throw new IllegalArgumentException(
                    "Magic integer must be between 0 and " + MAX_MAGIC_INT + ", got: " + magicInt);
        }
        byte[] b = new byte[LENGTH];
        b[0] = (byte) (magicInt & 0xFF);
        b[1] = (byte) ((magicInt >>> 8) & 0xFF);
        if (magicInt == LEGACY_MAGIC_1_0 || magicInt == LEGACY_MAGIC_1_1) {
            b[2] = LEGACY_TERMINATOR_1;
            b[3] = LEGACY_TERMINATOR_2;
        } else {
            b[2] = CR;
            b[3] = LF;
        }
        return new MagicIdentifier(b);
    }

    /**
     * Wraps a raw tag as read from a file header.
     *
     * @param raw exactly {@value #LENGTH} bytes.
     * @return the identifier.
     * @throws IllegalArgumentException if {@code raw} is null or not {@value #LENGTH} bytes long.
     */
    public static MagicIdentifier fromBytes(byte[] raw) {
        if (raw == null || raw.length != LENGTH) {
            throw new IllegalArgumentException("Magic tag must be exactly " + LENGTH + " bytes, got: "
                    + (raw == null ? "null" : raw.length));
        }
        return new MagicIdentifier(raw.clone());
    }

    /**
     * Decodes the magic integer from the first two bytes.
     *
     * @return the magic integer.
     */
    public int toInt() {
        return (bytes[0] & 0xFF) | ((bytes[1] & 0xFF) << 8);
    }

    /**
     * @return a copy of the four raw bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MagicIdentifier other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MagicIdentifier[");
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xFF));
        }
        return sb.append(", int=").append(toInt()).append(']').toString();
    }
}
