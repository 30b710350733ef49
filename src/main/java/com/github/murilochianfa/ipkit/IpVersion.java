/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;

/**
 * IP address family.
 * <p>
 * Each constant carries the fixed bit width of its address space, which every
 * mask and block computation in {@link Bits} is parameterized by:
 *
 * <dl>
 *   <dt>{@link #V4}</dt>
 *   <dd>32-bit addresses, 4 bytes, prefix lengths 0-32.</dd>
 *
 *   <dt>{@link #V6}</dt>
 *   <dd>128-bit addresses, 16 bytes, prefix lengths 0-128.</dd>
 * </dl>
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 * @see IpAddress
 */
public enum IpVersion {

    /** Internet Protocol version 4. */
    V4(4, 32),

    /** Internet Protocol version 6. */
    V6(6, 128);

    private final int number;
    private final int bits;
    private final BigInteger maxValue;

    IpVersion(int number, int bits) {
        this.number = number;
        this.bits = bits;
        this.maxValue = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    /**
     * Returns the protocol number (4 or 6).
     *
     * @return the version number
     */
    public int number() {
        return number;
    }

    /**
     * Returns the address width in bits.
     *
     * @return 32 for IPv4, 128 for IPv6
     */
    public int bits() {
        return bits;
    }

    /**
     * Returns the address length in bytes.
     *
     * @return 4 for IPv4, 16 for IPv6
     */
    public int byteLength() {
        return bits / 8;
    }

    /**
     * Returns the highest address value, {@code 2^bits - 1}.
     *
     * @return the maximum value
     */
    public BigInteger maxValue() {
        return maxValue;
    }

    /**
     * Checks whether a value lies inside this version's address space.
     *
     * @param value the candidate value
     * @return {@code true} if {@code 0 <= value <= maxValue()}
     */
    public boolean inRange(BigInteger value) {
        return value.signum() >= 0 && value.compareTo(maxValue) <= 0;
    }

    /**
     * Validates a prefix length for this version.
     *
     * @param prefixLength the prefix length
     * @throws OutOfRangeException if it is outside {@code [0, bits]}
     */
    public void validatePrefixLength(int prefixLength) {
        if (prefixLength < 0 || prefixLength > bits) {
            throw new OutOfRangeException(
                "Prefix length out of range: " + prefixLength + " (must be 0-" + bits + ")");
        }
    }

    /**
     * Returns the version whose address width is {@code bits}.
     *
     * @param bits 32 or 128
     * @return the matching version
     * @throws OutOfRangeException for any other width
     */
    public static IpVersion forBits(int bits) {
        if (bits == 32) {
            return V4;
        }
        if (bits == 128) {
            return V6;
        }
        throw new OutOfRangeException("Unsupported bit width: " + bits + " (must be 32 or 128)");
    }

    @Override
    public String toString() {
        return "IPv" + number;
    }
}
