/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the exception hierarchy.
 */
@DisplayName("IpKitException")
class IpKitExceptionTest {
    
    @Test
    @DisplayName("every library failure is an IpKitException")
    void commonSupertype() {
        assertThrows(IpKitException.class, () -> IpAddress.parse("1.2.3"));
        assertThrows(IpKitException.class, () -> Cidr.parse("10.0.0.0/8").subnets(8));
        assertThrows(IpKitException.class, () -> Cidr.of(IpAddress.parse("10.0.0.0"), 40));
        assertThrows(IpKitException.class,
            () -> IpAddress.parse("10.0.0.0").compareTo(IpAddress.parse("::")));
    }
    
    @Test
    @DisplayName("version mismatch names both families")
    void versionMismatchMessage() {
        VersionMismatchException e = assertThrows(VersionMismatchException.class,
            () -> new RadixTrie<String>(IpVersion.V4).longestMatch(IpAddress.parse("::1")));
        assertTrue(e.getMessage().contains("IPv4"));
        assertTrue(e.getMessage().contains("IPv6"));
    }
    
    @Test
    @DisplayName("preserves the cause")
    void cause() {
        IllegalStateException cause = new IllegalStateException("boom");
        AddressParseException e = new AddressParseException("bad address", cause);
        assertSame(cause, e.getCause());
        assertEquals("bad address", e.getMessage());
    }
}
