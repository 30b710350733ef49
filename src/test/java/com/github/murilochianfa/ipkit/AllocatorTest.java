/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Allocator.
 */
@DisplayName("Allocator")
class AllocatorTest {
    
    private Allocator allocator;
    
    @BeforeAll
    static void configureLogging() {
        LoggerConfig.initialize();
    }
    
    @BeforeEach
    void setUp() {
        allocator = new Allocator(Cidr.parse("192.168.1.0/24"));
    }
    
    private static IpAddress ip(String text) {
        return IpAddress.parse(text);
    }
    
    // ========================================================================
    // Construction
    // ========================================================================
    
    @Nested
    @DisplayName("Construction")
    class ConstructionTests {
        
        @Test
        @DisplayName("starts with nothing taken")
        void startsEmpty() {
            assertTrue(allocator.taken().isEmpty());
            assertEquals(IpVersion.V4, allocator.version());
            assertEquals(Cidr.parse("192.168.1.0/24"), allocator.parent());
        }
        
        @Test
        @DisplayName("accepts taken ranges inside the parent")
        void takenInside() {
            Allocator a = new Allocator(Cidr.parse("10.0.0.0/24"), RangeSet.parseCidrs("10.0.0.0/25"));
            assertEquals(BigInteger.valueOf(128), a.availableCount());
        }
        
        @Test
        @DisplayName("rejects taken ranges outside the parent")
        void takenOutside() {
            assertThrows(AddressParseException.class,
                () -> new Allocator(Cidr.parse("10.0.0.0/24"), RangeSet.parseCidrs("10.0.0.0/23")));
            assertThrows(AddressParseException.class,
                () -> new Allocator(Cidr.parse("10.0.0.0/24"), RangeSet.parseCidrs("2001:db8::/64")));
        }
    }
    
    // ========================================================================
    // Next available
    // ========================================================================
    
    @Nested
    @DisplayName("Next available")
    class NextAvailableTests {
        
        @Test
        @DisplayName("starts at the first host")
        void firstHost() {
            assertEquals(ip("192.168.1.1"), allocator.nextAvailable());
        }
        
        @Test
        @DisplayName("skips taken addresses")
        void skipsTaken() {
            allocator.allocateIP(ip("192.168.1.1"));
            allocator.allocateIP(ip("192.168.1.2"));
            assertEquals(ip("192.168.1.3"), allocator.nextAvailable());
        }
        
        @Test
        @DisplayName("starts from a given address")
        void fromAddress() {
            assertEquals(ip("192.168.1.50"), allocator.nextAvailable(ip("192.168.1.50")));
            allocator.allocateCidr(Cidr.parse("192.168.1.48/28"));
            assertEquals(ip("192.168.1.64"), allocator.nextAvailable(ip("192.168.1.50")));
        }
        
        @Test
        @DisplayName("returns null past the free space")
        void exhausted() {
            assertNull(allocator.nextAvailable(ip("192.168.2.0")));
        }
        
        @Test
        @DisplayName("refuses a start address of the other family")
        void otherFamily() {
            assertThrows(VersionMismatchException.class, () -> allocator.nextAvailable(ip("::1")));
        }
        
        @Test
        @DisplayName("IPv6 parents start at the network address")
        void ipv6() {
            Allocator v6 = new Allocator(Cidr.parse("2001:db8::/32"));
            assertEquals(ip("2001:db8::"), v6.nextAvailable());
            v6.allocateNext();
            assertEquals(ip("2001:db8::1"), v6.nextAvailable());
        }
    }
    
    // ========================================================================
    // Allocation
    // ========================================================================
    
    @Nested
    @DisplayName("Allocation")
    class AllocationTests {
        
        @Test
        @DisplayName("allocateNext hands out ascending addresses until full")
        void allocateNext() {
            Allocator small = new Allocator(Cidr.parse("10.0.0.0/30"));
            assertEquals(ip("10.0.0.1"), small.allocateNext());
            assertEquals(ip("10.0.0.2"), small.allocateNext());
            assertEquals(ip("10.0.0.3"), small.allocateNext());
            assertNull(small.allocateNext());
        }
        
        @Test
        @DisplayName("allocateIP refuses taken and foreign addresses")
        void allocateIP() {
            assertTrue(allocator.allocateIP(ip("192.168.1.10")));
            assertFalse(allocator.allocateIP(ip("192.168.1.10")));
            assertFalse(allocator.allocateIP(ip("192.168.2.10")));
            assertFalse(allocator.allocateIP(ip("::1")));
            assertEquals(BigInteger.ONE, allocator.taken().size());
        }
        
        @Test
        @DisplayName("allocateCidr takes a whole block")
        void allocateCidr() {
            assertTrue(allocator.allocateCidr(Cidr.parse("192.168.1.64/26")));
            assertEquals(BigInteger.valueOf(64), allocator.taken().size());
        }
        
        @Test
        @DisplayName("allocateCidr refuses overlapping blocks")
        void allocateCidrOverlap() {
            assertTrue(allocator.allocateCidr(Cidr.parse("192.168.1.64/26")));
            assertFalse(allocator.allocateCidr(Cidr.parse("192.168.1.64/27")));
            assertFalse(allocator.allocateCidr(Cidr.parse("192.168.1.0/25")));
            assertEquals(BigInteger.valueOf(64), allocator.taken().size());
        }
        
        @Test
        @DisplayName("allocateCidr refuses blocks not inside the parent")
        void allocateCidrOutside() {
            assertFalse(allocator.allocateCidr(Cidr.parse("192.168.0.0/16")));
            assertFalse(allocator.allocateCidr(Cidr.parse("192.168.2.0/24")));
            assertFalse(allocator.allocateCidr(Cidr.parse("2001:db8::/64")));
            assertTrue(allocator.taken().isEmpty());
        }
        
        @Test
        @DisplayName("taken snapshots are not changed by later allocations")
        void snapshots() {
            RangeSet before = allocator.taken();
            allocator.allocateNext();
            assertTrue(before.isEmpty());
            assertFalse(allocator.taken().isEmpty());
        }
    }
    
    // ========================================================================
    // Reporting
    // ========================================================================
    
    @Nested
    @DisplayName("Reporting")
    class ReportingTests {
        
        @Test
        @DisplayName("availableCount and utilization track allocations")
        void counts() {
            allocator.allocateIP(ip("192.168.1.1"));
            assertEquals(BigInteger.valueOf(255), allocator.availableCount());
            
            Allocator half = new Allocator(Cidr.parse("192.168.1.0/24"));
            half.allocateCidr(Cidr.parse("192.168.1.0/25"));
            assertEquals(0.5, half.utilization(), 1e-9);
        }
        
        @Test
        @DisplayName("utilization works for huge IPv6 blocks")
        void utilizationIPv6() {
            Allocator v6 = new Allocator(Cidr.parse("2001:db8::/32"));
            assertEquals(0.0, v6.utilization(), 0.0);
            v6.allocateCidr(Cidr.parse("2001:db8::/33"));
            assertEquals(0.5, v6.utilization(), 1e-9);
        }
        
        @Test
        @DisplayName("freeRanges is the complement of taken")
        void freeRanges() {
            allocator.allocateCidr(Cidr.parse("192.168.1.64/26"));
            assertEquals(
                Arrays.asList(IpRange.parse("192.168.1.0-192.168.1.63"), IpRange.parse("192.168.1.128-192.168.1.255")),
                allocator.freeRanges().ranges());
        }
        
        @Test
        @DisplayName("freeBlocks filters by minimum prefix")
        void freeBlocks() {
            allocator.allocateCidr(Cidr.parse("192.168.1.64/26"));
            assertEquals(Arrays.asList(Cidr.parse("192.168.1.0/26"), Cidr.parse("192.168.1.128/25")),
                allocator.freeBlocks());
            assertEquals(Collections.singletonList(Cidr.parse("192.168.1.0/26")),
                allocator.freeBlocks(26, Allocator.DEFAULT_MAX_RESULTS));
        }
        
        @Test
        @DisplayName("freeBlocks stops at the result cap")
        void freeBlocksCap() {
            allocator.allocateIP(ip("192.168.1.1"));
            List<Cidr> blocks = allocator.freeBlocks(24, 2);
            assertEquals(Arrays.asList(Cidr.parse("192.168.1.0/32"), Cidr.parse("192.168.1.2/31")), blocks);
            assertTrue(allocator.freeBlocks(24, 0).isEmpty());
        }
        
        @Test
        @DisplayName("freeBlocks validates its arguments")
        void freeBlocksInvalid() {
            assertThrows(OutOfRangeException.class, () -> allocator.freeBlocks(33, 10));
            assertThrows(OutOfRangeException.class, () -> allocator.freeBlocks(24, -1));
        }
    }
}
