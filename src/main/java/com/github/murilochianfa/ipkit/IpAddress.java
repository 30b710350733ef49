/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * An immutable IPv4 or IPv6 address.
 * <p>
 * An address is a {@link IpVersion} tag plus an unsigned value of exactly
 * 32 or 128 bits. Instances are created by parsing text, numbers or bytes, or
 * by arithmetic on another address, and are never mutated, so they can be
 * shared between threads freely.
 *
 * <h2>Parsing</h2>
 * <pre>{@code
 * IpAddress a = IpAddress.parse("192.168.1.1");
 * IpAddress b = IpAddress.parse("2001:0db8:0000:0000:0000:0000:0000:0001");
 * b.toString();                                   // "2001:db8::1"
 * IpAddress.parse("::ffff:192.0.2.1").toString(); // "::ffff:192.0.2.1"
 * }</pre>
 *
 * <h2>Formatting</h2>
 * {@link #toString()} yields dotted decimal for IPv4 and the RFC 5952
 * canonical form for IPv6, so {@code parse(s).toString()} re-parses to the
 * same value and formatting is idempotent.
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 * @see Cidr
 */
public final class IpAddress implements Comparable<IpAddress> {

    private final IpVersion version;
    private final BigInteger value;

    private IpAddress(IpVersion version, BigInteger value) {
        this.version = version;
        this.value = value;
    }

    // ========================================================================
    // Factory methods
    // ========================================================================

    /**
     * Parses an IPv4 or IPv6 address, choosing the family from the text.
     *
     * @param text dotted-decimal IPv4 or colon-hex IPv6
     * @return the address
     * @throws AddressParseException if the text is not a valid address
     */
    public static IpAddress parse(String text) {
        Objects.requireNonNull(text, "Address cannot be null");
        if (text.indexOf(':') >= 0) {
            return parseIPv6(text);
        }
        return parseIPv4(text);
    }

    /**
     * Parses a dotted-decimal IPv4 address.
     *
     * @param text the address, e.g. {@code "10.0.0.1"}
     * @return the address
     * @throws AddressParseException on a bad octet count, a non-decimal or
     *         out-of-range octet, or a leading zero
     */
    public static IpAddress parseIPv4(String text) {
        Objects.requireNonNull(text, "Address cannot be null");
        long value = AddressText.parseDottedQuad(text, text);
        return new IpAddress(IpVersion.V4, BigInteger.valueOf(value));
    }

    /**
     * Parses an IPv6 address, including {@code ::} compression and a
     * dotted-decimal IPv4 tail.
     *
     * @param text the address, e.g. {@code "2001:db8::1"}
     * @return the address
     * @throws AddressParseException if the text violates the IPv6 grammar
     */
    public static IpAddress parseIPv6(String text) {
        Objects.requireNonNull(text, "Address cannot be null");
        return new IpAddress(IpVersion.V6, AddressText.parseIPv6(text));
    }

    /**
     * Creates an IPv4 address from its 32-bit unsigned value.
     *
     * @param value the value, {@code 0 <= value <= 0xFFFFFFFF}
     * @return the address
     * @throws AddressParseException if the value is out of range
     */
    public static IpAddress fromLong(long value) {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new AddressParseException("IPv4 value out of range: " + value);
        }
        return new IpAddress(IpVersion.V4, BigInteger.valueOf(value));
    }

    /**
     * Creates an address of the given version from an unsigned value.
     *
     * @param version the address family
     * @param value the value, {@code 0 <= value <= 2^bits - 1}
     * @return the address
     * @throws AddressParseException if the value is out of range
     */
    public static IpAddress fromBigInteger(IpVersion version, BigInteger value) {
        Objects.requireNonNull(version, "Version cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (!version.inRange(value)) {
            throw new AddressParseException(version + " value out of range: " + value);
        }
        return new IpAddress(version, value);
    }

    /**
     * Creates an address from network-order bytes; 4 bytes give IPv4 and
     * 16 bytes give IPv6.
     *
     * @param bytes the address bytes
     * @return the address
     * @throws AddressParseException if the array is not 4 or 16 bytes long
     */
    public static IpAddress fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "Bytes cannot be null");
        if (bytes.length == IpVersion.V4.byteLength()) {
            return fromBytes(IpVersion.V4, bytes);
        }
        if (bytes.length == IpVersion.V6.byteLength()) {
            return fromBytes(IpVersion.V6, bytes);
        }
        throw new AddressParseException(
            "Invalid address length: expected 4 or 16 bytes, got " + bytes.length);
    }

    /**
     * Creates an address of the given version from network-order bytes.
     *
     * @param version the address family
     * @param bytes exactly {@link IpVersion#byteLength()} bytes
     * @return the address
     * @throws AddressParseException on a length mismatch
     */
    public static IpAddress fromBytes(IpVersion version, byte[] bytes) {
        Objects.requireNonNull(version, "Version cannot be null");
        Objects.requireNonNull(bytes, "Bytes cannot be null");
        if (bytes.length != version.byteLength()) {
            throw new AddressParseException(
                "Invalid " + version + " address length: expected " + version.byteLength()
                + " bytes, got " + bytes.length);
        }
        return new IpAddress(version, new BigInteger(1, bytes));
    }

    /**
     * Converts a JDK {@link InetAddress}. No name lookup is performed.
     *
     * @param address an {@link Inet4Address} or {@link Inet6Address}
     * @return the address
     */
    public static IpAddress fromInetAddress(InetAddress address) {
        Objects.requireNonNull(address, "Address cannot be null");
        return fromBytes(address.getAddress());
    }

    /**
     * Creates an address from a value already known to be in range.
     */
    static IpAddress of(IpVersion version, BigInteger value) {
        return new IpAddress(version, value);
    }

    // ========================================================================
    // Validation predicates
    // ========================================================================

    /**
     * Checks whether the text is a strict dotted-decimal IPv4 address.
     *
     * @param text the candidate
     * @return {@code true} if {@link #parseIPv4} would accept it
     */
    public static boolean isIPv4(String text) {
        if (text == null) {
            return false;
        }
        try {
            AddressText.parseDottedQuad(text, text);
            return true;
        } catch (AddressParseException e) {
            return false;
        }
    }

    /**
     * Checks whether the text is a valid IPv6 address.
     *
     * @param text the candidate
     * @return {@code true} if {@link #parseIPv6} would accept it
     */
    public static boolean isIPv6(String text) {
        if (text == null) {
            return false;
        }
        try {
            AddressText.parseIPv6(text);
            return true;
        } catch (AddressParseException e) {
            return false;
        }
    }

    // ========================================================================
    // Accessors and conversions
    // ========================================================================

    /**
     * Returns the address family.
     *
     * @return the version
     */
    public IpVersion version() {
        return version;
    }

    /**
     * Returns the address width in bits.
     *
     * @return 32 or 128
     */
    public int bits() {
        return version.bits();
    }

    public boolean isIPv4() {
        return version == IpVersion.V4;
    }

    public boolean isIPv6() {
        return version == IpVersion.V6;
    }

    /**
     * Returns the unsigned address value.
     *
     * @return the value
     */
    public BigInteger toBigInteger() {
        return value;
    }

    /**
     * Returns the address in network byte order.
     *
     * @return 4 or 16 bytes
     */
    public byte[] toBytes() {
        int length = version.byteLength();
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[length];
        // BigInteger may add a sign byte or omit leading zero bytes
        int copy = Math.min(raw.length, length);
        System.arraycopy(raw, raw.length - copy, bytes, length - copy, copy);
        return bytes;
    }

    /**
     * Converts to a JDK {@link InetAddress} without a name lookup.
     *
     * @return an {@link Inet4Address} or {@link Inet6Address}
     */
    public InetAddress toInetAddress() {
        try {
            return InetAddress.getByAddress(toBytes());
        } catch (UnknownHostException e) {
            // only thrown for an illegal length, which toBytes() rules out
            throw new IllegalStateException("Unexpected address length for " + this, e);
        }
    }

    /**
     * Returns the reverse DNS owner name ({@code in-addr.arpa} or {@code ip6.arpa}).
     *
     * @return the PTR name
     * @see ReverseDns#ptrName(IpAddress)
     */
    public String toPtrName() {
        return ReverseDns.ptrName(this);
    }

    // ========================================================================
    // Arithmetic
    // ========================================================================

    /**
     * Returns the address {@code delta} positions away.
     *
     * @param delta the signed offset
     * @return the translated address
     * @throws OutOfRangeException if the result leaves the address space
     */
    public IpAddress add(BigInteger delta) {
        Objects.requireNonNull(delta, "Delta cannot be null");
        BigInteger result = value.add(delta);
        if (!version.inRange(result)) {
            throw new OutOfRangeException(
                "Address arithmetic leaves the " + version + " space: " + this + " + " + delta);
        }
        return new IpAddress(version, result);
    }

    /**
     * Returns the following address.
     *
     * @return this + 1
     * @throws OutOfRangeException for the highest address
     */
    public IpAddress next() {
        return add(BigInteger.ONE);
    }

    /**
     * Returns the preceding address.
     *
     * @return this - 1
     * @throws OutOfRangeException for the lowest address
     */
    public IpAddress previous() {
        return add(BigInteger.ONE.negate());
    }

    // ========================================================================
    // Comparison
    // ========================================================================

    /**
     * Orders addresses of the same family by value.
     *
     * @throws VersionMismatchException if the families differ
     */
    @Override
    public int compareTo(IpAddress other) {
        Objects.requireNonNull(other, "Address cannot be null");
        requireSameVersion(other.version, "compare");
        return value.compareTo(other.value);
    }

    void requireSameVersion(IpVersion other, String operation) {
        if (version != other) {
            throw VersionMismatchException.of(operation, version, other);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IpAddress)) {
            return false;
        }
        IpAddress other = (IpAddress) o;
        return version == other.version && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * version.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        if (version == IpVersion.V4) {
            return AddressText.formatDottedQuad(value.longValue());
        }
        return AddressText.formatIPv6(value);
    }
}
