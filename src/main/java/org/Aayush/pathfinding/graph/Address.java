package org.Aayush.pathfinding.graph;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Fixed-length opaque participant identifier (20 bytes), used as graph node key.
 */
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 20;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;
    private final int hash;

    private Address(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * Creates an address from raw bytes (copied).
     *
     * @param bytes exactly {@link #LENGTH} bytes.
     */
    public static Address of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("address must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Address(bytes.clone());
    }

    /**
     * Parses a {@code 0x}-prefixed (or bare) 40 hex digit address.
     */
    public static Address fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("address must have " + (LENGTH * 2) + " hex digits: " + hex);
        }
        return new Address(HEX.parseHex(digits));
    }

    /**
     * Builds an address whose last eight bytes hold {@code value} big-endian.
     * Handy for compact fixtures and demo networks.
     */
    public static Address ofNumber(long value) {
        byte[] raw = new byte[LENGTH];
        for (int i = 0; i < Long.BYTES; i++) {
            raw[LENGTH - 1 - i] = (byte) (value >>> (8 * i));
        }
        return new Address(raw);
    }

    /**
     * Returns a copy of the raw bytes.
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * Lower-case {@code 0x}-prefixed hex form.
     */
    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Address)) {
            return false;
        }
        return Arrays.equals(bytes, ((Address) other).bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toHex();
    }
}
