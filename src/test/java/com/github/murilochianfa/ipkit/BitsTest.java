/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Bits.
 */
@DisplayName("Bits")
class BitsTest {
    
    private static final BigInteger MAX6 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
    
    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
    
    @Nested
    @DisplayName("Masks")
    class MaskTests {
        
        @Test
        @DisplayName("prefixMask sets the top bits")
        void prefixMask() {
            assertEquals(big(0xFFFFFF00L), Bits.prefixMask(24, 32));
            assertEquals(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE).shiftLeft(64),
                Bits.prefixMask(64, 128));
        }
        
        @Test
        @DisplayName("prefixMask handles /0 and full width")
        void prefixMaskEdges() {
            assertEquals(BigInteger.ZERO, Bits.prefixMask(0, 32));
            assertEquals(big(0xFFFFFFFFL), Bits.prefixMask(32, 32));
            assertEquals(MAX6, Bits.prefixMask(128, 128));
        }
        
        @Test
        @DisplayName("hostMask is the complement within the width")
        void hostMask() {
            assertEquals(big(0xFF), Bits.hostMask(24, 32));
            assertEquals(MAX6, Bits.hostMask(0, 128));
            assertEquals(BigInteger.ZERO, Bits.hostMask(32, 32));
        }
        
        @Test
        @DisplayName("networkOf and broadcastOf apply the masks")
        void networkAndBroadcast() {
            BigInteger ip = big(0xC0A80101L); // 192.168.1.1
            assertEquals(big(0xC0A80100L), Bits.networkOf(ip, 24, 32));
            assertEquals(big(0xC0A801FFL), Bits.broadcastOf(ip, 24, 32));
        }
        
        @Test
        @DisplayName("maxValue matches the width")
        void maxValue() {
            assertEquals(big(0xFFFFFFFFL), Bits.maxValue(32));
            assertEquals(MAX6, Bits.maxValue(128));
        }
    }
    
    @Nested
    @DisplayName("Bit testing")
    class BitTests {
        
        @Test
        @DisplayName("bitAtMsb counts from the top")
        void bitAtMsb() {
            assertTrue(Bits.bitAtMsb(big(0x80000000L), 0, 32));
            assertFalse(Bits.bitAtMsb(big(0x40000000L), 0, 32));
            assertTrue(Bits.bitAtMsb(BigInteger.ONE, 127, 128));
        }
        
        @Test
        @DisplayName("bitAtMsb rejects indexes outside the width")
        void bitAtMsbRejectsBadIndex() {
            assertThrows(OutOfRangeException.class, () -> Bits.bitAtMsb(BigInteger.ONE, 32, 32));
            assertThrows(OutOfRangeException.class, () -> Bits.bitAtMsb(BigInteger.ONE, -1, 32));
        }
    }
    
    @Nested
    @DisplayName("Validation")
    class ValidationTests {
        
        @Test
        @DisplayName("rejects unsupported widths")
        void rejectsWidth() {
            assertThrows(OutOfRangeException.class, () -> Bits.prefixMask(8, 64));
            assertThrows(OutOfRangeException.class, () -> Bits.maxValue(16));
            assertThrows(OutOfRangeException.class,
                () -> Bits.maxAlignedBlock(BigInteger.ZERO, BigInteger.TEN, 48));
        }
        
        @Test
        @DisplayName("rejects prefixes outside [0, width]")
        void rejectsPrefix() {
            assertThrows(OutOfRangeException.class, () -> Bits.prefixMask(33, 32));
            assertThrows(OutOfRangeException.class, () -> Bits.hostMask(-1, 32));
            assertThrows(OutOfRangeException.class, () -> Bits.networkOf(BigInteger.ONE, 129, 128));
        }
    }
    
    @Nested
    @DisplayName("Aligned blocks")
    class AlignedBlockTests {
        
        @Test
        @DisplayName("aligned range yields a single block")
        void alignedStart() {
            AlignedBlock block = Bits.maxAlignedBlock(big(0), big(255), 32);
            assertNotNull(block);
            assertEquals(24, block.prefixLength());
            assertEquals(BigInteger.ZERO, block.start());
            assertEquals(big(256), block.size(32));
            assertEquals(big(255), block.end(32));
        }
        
        @Test
        @DisplayName("largest block may start after an unaligned start")
        void unalignedStart() {
            AlignedBlock block = Bits.maxAlignedBlock(big(5), big(20), 32);
            assertNotNull(block);
            assertEquals(big(8), block.start());
            assertEquals(29, block.prefixLength());
        }
        
        @Test
        @DisplayName("single address is a full-width block")
        void singleAddress() {
            AlignedBlock block = Bits.maxAlignedBlock(big(1000), big(1000), 32);
            assertNotNull(block);
            assertEquals(32, block.prefixLength());
            assertEquals(big(1000), block.start());
        }
        
        @Test
        @DisplayName("whole IPv6 space is the /0 block")
        void wholeSpace() {
            AlignedBlock block = Bits.maxAlignedBlock(BigInteger.ZERO, MAX6, 128);
            assertEquals(new AlignedBlock(0, BigInteger.ZERO), block);
        }
        
        @Test
        @DisplayName("empty interval has no block")
        void emptyInterval() {
            assertNull(Bits.maxAlignedBlock(big(10), big(9), 32));
            assertNull(Bits.alignedBlockAt(big(10), big(9), 32));
        }
        
        @Test
        @DisplayName("alignedBlockAt is anchored at the start")
        void anchored() {
            assertEquals(new AlignedBlock(32, big(5)), Bits.alignedBlockAt(big(5), big(20), 32));
            assertEquals(new AlignedBlock(31, big(6)), Bits.alignedBlockAt(big(6), big(20), 32));
            assertEquals(new AlignedBlock(29, big(8)), Bits.alignedBlockAt(big(8), big(20), 32));
            assertEquals(new AlignedBlock(30, big(16)), Bits.alignedBlockAt(big(16), big(20), 32));
        }
        
        @Test
        @DisplayName("alignedBlockAt from zero is limited by the interval size")
        void anchoredAtZero() {
            assertEquals(new AlignedBlock(0, BigInteger.ZERO),
                Bits.alignedBlockAt(BigInteger.ZERO, big(0xFFFFFFFFL), 32));
            assertEquals(new AlignedBlock(25, BigInteger.ZERO),
                Bits.alignedBlockAt(BigInteger.ZERO, big(200), 32));
        }
    }
}
