/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reverse DNS (PTR) owner names for addresses and blocks.
 * <p>
 * Only names are produced; nothing is resolved.
 * <ul>
 *   <li>IPv4: octets in reverse order under {@code in-addr.arpa}</li>
 *   <li>IPv6: all 32 nibbles in reverse order under {@code ip6.arpa}</li>
 * </ul>
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public final class ReverseDns {

    private static final String IPV4_SUFFIX = "in-addr.arpa";
    private static final String IPV6_SUFFIX = "ip6.arpa";

    /** Widest IPv4 zone cut */
    private static final int IPV4_ZONE_PREFIX = 24;

    /** Narrowest nibble-aligned IPv6 zone cut */
    private static final int IPV6_MAX_ZONE_PREFIX = 124;

    /** Private constructor to prevent instantiation */
    private ReverseDns() {
        throw new AssertionError("ReverseDns cannot be instantiated");
    }

    /**
     * Returns the PTR name of an address.
     * <pre>{@code
     * ReverseDns.ptrName(IpAddress.parse("192.168.1.1")); // "1.1.168.192.in-addr.arpa"
     * }</pre>
     *
     * @param address the address
     * @return the owner name
     */
    public static String ptrName(IpAddress address) {
        Objects.requireNonNull(address, "Address cannot be null");
        if (address.isIPv4()) {
            byte[] octets = address.toBytes();
            StringBuilder sb = new StringBuilder();
            for (int i = octets.length - 1; i >= 0; i--) {
                sb.append(octets[i] & 0xFF).append('.');
            }
            return sb.append(IPV4_SUFFIX).toString();
        }
        return nibbleName(address.toBigInteger(), 32);
    }

    /**
     * Returns the reverse zones that delegate a block.
     * <p>
     * IPv4 blocks map to the name of their network truncated to at most /24.
     * IPv6 blocks round the prefix down to a nibble boundary, capped at /124,
     * and name only the nibbles the zone covers.
     *
     * @param cidr the block
     * @return the zone names
     */
    public static List<String> zonesFor(Cidr cidr) {
        Objects.requireNonNull(cidr, "CIDR cannot be null");
        int prefix = cidr.prefixLength();
        BigInteger value = cidr.address().toBigInteger();
        if (cidr.version() == IpVersion.V4) {
            int zonePrefix = Math.min(prefix, IPV4_ZONE_PREFIX);
            BigInteger network = Bits.networkOf(value, zonePrefix, 32);
            return Collections.singletonList(ptrName(IpAddress.of(IpVersion.V4, network)));
        }
        int zonePrefix = Math.min(prefix / 4 * 4, IPV6_MAX_ZONE_PREFIX);
        return Collections.singletonList(nibbleName(value, zonePrefix / 4));
    }

    /**
     * Names the leading {@code nibbles} nibbles of a 128-bit value, least
     * significant first.
     */
    private static String nibbleName(BigInteger value, int nibbles) {
        StringBuilder sb = new StringBuilder();
        for (int i = nibbles - 1; i >= 0; i--) {
            int nibble = value.shiftRight((31 - i) * 4).intValue() & 0xF;
            sb.append(Character.forDigit(nibble, 16)).append('.');
        }
        return sb.append(IPV6_SUFFIX).toString();
    }
}
