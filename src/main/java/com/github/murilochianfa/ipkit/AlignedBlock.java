/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A power-of-two sized block that starts on a multiple of its own size,
 * as returned by {@link Bits#maxAlignedBlock} and {@link Bits#alignedBlockAt}.
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public final class AlignedBlock {
    
    private final int prefixLength;
    private final BigInteger start;
    
    AlignedBlock(int prefixLength, BigInteger start) {
        this.prefixLength = prefixLength;
        this.start = start;
    }
    
    /**
     * Returns the prefix length describing the block size.
     * 
     * @return the prefix length
     */
    public int prefixLength() {
        return prefixLength;
    }
    
    /**
     * Returns the first address of the block.
     * 
     * @return the block start
     */
    public BigInteger start() {
        return start;
    }
    
    /**
     * Returns the number of addresses in the block for the given width.
     * 
     * @param width 32 or 128
     * @return {@code 2^(width - prefixLength)}
     */
    public BigInteger size(int width) {
        return BigInteger.ONE.shiftLeft(width - prefixLength);
    }
    
    /**
     * Returns the last address of the block for the given width.
     * 
     * @param width 32 or 128
     * @return {@code start + size - 1}
     */
    public BigInteger end(int width) {
        return start.add(size(width)).subtract(BigInteger.ONE);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlignedBlock)) {
            return false;
        }
        AlignedBlock other = (AlignedBlock) o;
        return prefixLength == other.prefixLength && start.equals(other.start);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(prefixLength, start);
    }
    
    @Override
    public String toString() {
        return "AlignedBlock[start=" + start + ", prefixLength=" + prefixLength + "]";
    }
}
