/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-width bit-mask arithmetic over unsigned address values.
 * <p>
 * Values are non-negative {@link BigInteger}s interpreted as unsigned integers
 * of exactly {@code width} bits, where {@code width} is 32 (IPv4) or 128 (IPv6).
 * All methods validate their numeric arguments and throw
 * {@link OutOfRangeException} for:
 * <ul>
 *   <li>a width other than 32 or 128</li>
 *   <li>a prefix length outside {@code [0, width]}</li>
 *   <li>a bit index outside {@code [0, width)}</li>
 * </ul>
 * 
 * <h2>Example Usage</h2>
 * <pre>{@code
 * BigInteger ip = BigInteger.valueOf(0xC0A80101L);      // 192.168.1.1
 * Bits.networkOf(ip, 24, 32);                            // 0xC0A80100
 * Bits.broadcastOf(ip, 24, 32);                          // 0xC0A801FF
 * }</pre>
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public final class Bits {
    
    /** Private constructor to prevent instantiation */
    private Bits() {
        throw new AssertionError("Bits cannot be instantiated");
    }
    
    /**
     * Returns {@code 2^width - 1}.
     * 
     * @param width 32 or 128
     * @return the all-ones value of the width
     */
    public static BigInteger maxValue(int width) {
        return IpVersion.forBits(width).maxValue();
    }
    
    /**
     * Returns a mask with the top {@code prefix} bits set.
     * 
     * @param prefix the prefix length
     * @param width 32 or 128
     * @return the network mask
     */
    public static BigInteger prefixMask(int prefix, int width) {
        validatePrefix(prefix, width);
        return BigInteger.ONE.shiftLeft(prefix).subtract(BigInteger.ONE).shiftLeft(width - prefix);
    }
    
    /**
     * Returns the complement of {@link #prefixMask}, confined to {@code width} bits.
     * 
     * @param prefix the prefix length
     * @param width 32 or 128
     * @return the host mask
     */
    public static BigInteger hostMask(int prefix, int width) {
        validatePrefix(prefix, width);
        return BigInteger.ONE.shiftLeft(width - prefix).subtract(BigInteger.ONE);
    }
    
    /**
     * Clears the host bits of {@code value}.
     * 
     * @param value the address value
     * @param prefix the prefix length
     * @param width 32 or 128
     * @return the network address value
     */
    public static BigInteger networkOf(BigInteger value, int prefix, int width) {
        Objects.requireNonNull(value, "Value cannot be null");
        return value.and(prefixMask(prefix, width));
    }
    
    /**
     * Sets the host bits of {@code value}.
     * 
     * @param value the address value
     * @param prefix the prefix length
     * @param width 32 or 128
     * @return the broadcast (last) address value
     */
    public static BigInteger broadcastOf(BigInteger value, int prefix, int width) {
        Objects.requireNonNull(value, "Value cannot be null");
        return value.or(hostMask(prefix, width));
    }
    
    /**
     * Tests a bit counted from the most significant end.
     * 
     * @param value the address value
     * @param bit index from the MSB, {@code 0} being the top bit
     * @param width 32 or 128
     * @return {@code true} if the bit is set
     */
    public static boolean bitAtMsb(BigInteger value, int bit, int width) {
        Objects.requireNonNull(value, "Value cannot be null");
        validateWidth(width);
        if (bit < 0 || bit >= width) {
            throw new OutOfRangeException(
                "Bit index out of range: " + bit + " (must be 0-" + (width - 1) + ")");
        }
        return value.testBit(width - 1 - bit);
    }
    
    /**
     * Finds the largest power-of-two sized, aligned block lying inside
     * {@code [start, end]}.
     * <p>
     * Block sizes are tried from the largest to the smallest. For each size the
     * first aligned position at or after {@code start} is taken, and the first
     * block that ends at or before {@code end} wins. The returned block does not
     * necessarily begin at {@code start}: for {@code [5, 20]} it is {@code 8/29}.
     * 
     * @param start first value of the interval
     * @param end last value of the interval (inclusive)
     * @param width 32 or 128
     * @return the block, or {@code null} if {@code end < start}
     */
    public static AlignedBlock maxAlignedBlock(BigInteger start, BigInteger end, int width) {
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        validateWidth(width);
        if (end.compareTo(start) < 0) {
            return null;
        }
        
        // no block larger than the interval can fit, so start the scan there
        int largest = end.subtract(start).add(BigInteger.ONE).bitLength() - 1;
        for (int prefix = width - Math.min(largest, width); prefix <= width; prefix++) {
            int hostBits = width - prefix;
            BigInteger size = BigInteger.ONE.shiftLeft(hostBits);
            BigInteger blockStart = start.add(size).subtract(BigInteger.ONE)
                .shiftRight(hostBits).shiftLeft(hostBits);
            if (blockStart.add(size).subtract(BigInteger.ONE).compareTo(end) <= 0) {
                return new AlignedBlock(prefix, blockStart);
            }
        }
        // unreachable: the single-address block always fits
        throw new IllegalStateException("No aligned block in [" + start + ", " + end + "]");
    }
    
    /**
     * Finds the largest aligned block that begins exactly at {@code start}
     * and ends at or before {@code end}.
     * <p>
     * Repeated application from the start of an interval yields its minimal
     * exact CIDR cover (see {@link IpRange#toCidrs()}).
     * 
     * @param start first value of the block
     * @param end last permitted value (inclusive)
     * @param width 32 or 128
     * @return the block, or {@code null} if {@code end < start}
     */
    public static AlignedBlock alignedBlockAt(BigInteger start, BigInteger end, int width) {
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        validateWidth(width);
        if (end.compareTo(start) < 0) {
            return null;
        }
        
        int alignment = start.signum() == 0 ? width : Math.min(start.getLowestSetBit(), width);
        int fit = end.subtract(start).add(BigInteger.ONE).bitLength() - 1;
        int hostBits = Math.min(alignment, Math.min(fit, width));
        return new AlignedBlock(width - hostBits, start);
    }
    
    // ========================================================================
    // Validation helpers
    // ========================================================================
    
    static void validateWidth(int width) {
        IpVersion.forBits(width);
    }
    
    static void validatePrefix(int prefix, int width) {
        IpVersion.forBits(width).validatePrefixLength(prefix);
    }
}
