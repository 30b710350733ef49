/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An immutable CIDR block: an address plus a prefix length.
 * <p>
 * The stored address may be any address inside the block; {@link #network()}
 * derives the canonical network address on demand and {@link #toString()}
 * prints the address as given ({@code 192.168.1.77/24} stays as written).
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Cidr block = Cidr.parse("192.168.1.0/24");
 * block.network();      // 192.168.1.0
 * block.broadcast();    // 192.168.1.255
 * block.size();         // 256
 * block.firstHost();    // 192.168.1.1
 * for (Cidr sub : block.subnets(26)) {
 *     // 192.168.1.0/26, .64/26, .128/26, .192/26
 * }
 * }</pre>
 *
 * <h2>Host defaults</h2>
 * Host methods without an {@code includeEdges} argument include the network
 * and broadcast addresses for IPv6 and for point-to-point blocks
 * (/31, /32, /127, /128), and exclude them otherwise.
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 * @see IpRange
 */
public final class Cidr {

    private final IpAddress address;
    private final int prefixLength;

    private Cidr(IpAddress address, int prefixLength) {
        this.address = address;
        this.prefixLength = prefixLength;
    }

    // ========================================================================
    // Factory methods
    // ========================================================================

    /**
     * Parses CIDR notation.
     *
     * @param text the block, e.g. {@code "10.0.0.0/8"} or {@code "2001:db8::/32"}
     * @return the block
     * @throws AddressParseException if the notation, address or prefix is invalid
     */
    public static Cidr parse(String text) {
        Objects.requireNonNull(text, "CIDR cannot be null");

        int slashIdx = text.indexOf('/');
        if (slashIdx < 0 || slashIdx != text.lastIndexOf('/')) {
            throw new AddressParseException("Invalid CIDR notation, expected one '/': " + text);
        }

        String addrPart = text.substring(0, slashIdx);
        String lenPart = text.substring(slashIdx + 1);

        IpAddress address = IpAddress.parse(addrPart);
        int prefixLength = parsePrefixLength(lenPart, text);
        if (prefixLength > address.bits()) {
            throw new AddressParseException(
                address.version() + " prefix length must be 0-" + address.bits() + ": " + text);
        }
        return new Cidr(address, prefixLength);
    }

    private static int parsePrefixLength(String lenPart, String text) {
        if (lenPart.isEmpty() || lenPart.length() > 3) {
            throw new AddressParseException("Invalid prefix length '" + lenPart + "' in: " + text);
        }
        for (int i = 0; i < lenPart.length(); i++) {
            char c = lenPart.charAt(i);
            if (c < '0' || c > '9') {
                throw new AddressParseException("Invalid prefix length '" + lenPart + "' in: " + text);
            }
        }
        if (lenPart.length() > 1 && lenPart.charAt(0) == '0') {
            throw new AddressParseException(
                "Prefix length has a leading zero '" + lenPart + "' in: " + text);
        }
        return Integer.parseInt(lenPart);
    }

    /**
     * Creates a block from an address and prefix length.
     *
     * @param address any address inside the block
     * @param prefixLength 0-32 for IPv4, 0-128 for IPv6
     * @return the block
     * @throws OutOfRangeException if the prefix length is out of range
     */
    public static Cidr of(IpAddress address, int prefixLength) {
        Objects.requireNonNull(address, "Address cannot be null");
        address.version().validatePrefixLength(prefixLength);
        return new Cidr(address, prefixLength);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    /**
     * Returns the address this block was created with.
     *
     * @return the stored address
     */
    public IpAddress address() {
        return address;
    }

    public int prefixLength() {
        return prefixLength;
    }

    public IpVersion version() {
        return address.version();
    }

    /**
     * Returns the address width in bits.
     *
     * @return 32 or 128
     */
    public int bits() {
        return address.bits();
    }

    /**
     * Returns the number of addresses in the block.
     *
     * @return {@code 2^(bits - prefixLength)}
     */
    public BigInteger size() {
        return BigInteger.ONE.shiftLeft(bits() - prefixLength);
    }

    // ========================================================================
    // Network math
    // ========================================================================

    /**
     * Returns the lowest address of the block.
     *
     * @return the network address
     */
    public IpAddress network() {
        return IpAddress.of(version(), networkValue());
    }

    /**
     * Returns the highest address of an IPv4 block.
     *
     * @return the broadcast address
     * @throws InvariantViolationException for IPv6, which has no broadcast
     */
    public IpAddress broadcast() {
        if (version() == IpVersion.V6) {
            throw new InvariantViolationException("IPv6 has no broadcast address: " + this);
        }
        return IpAddress.of(IpVersion.V4, lastValue());
    }

    /**
     * Returns the first host with the default edge handling.
     *
     * @return the first host
     * @throws InvariantViolationException never for the default; see {@link #firstHost(boolean)}
     */
    public IpAddress firstHost() {
        return firstHost(defaultIncludeEdges());
    }

    /**
     * Returns the first host.
     *
     * @param includeEdges whether the network address counts as a host
     * @return the network address, or the one after it
     * @throws InvariantViolationException if edges are excluded on a
     *         /31, /32, /127 or /128 block
     */
    public IpAddress firstHost(boolean includeEdges) {
        requireHosts(includeEdges);
        BigInteger first = networkValue();
        return IpAddress.of(version(), includeEdges ? first : first.add(BigInteger.ONE));
    }

    /**
     * Returns the last host with the default edge handling.
     *
     * @return the last host
     */
    public IpAddress lastHost() {
        return lastHost(defaultIncludeEdges());
    }

    /**
     * Returns the last host.
     *
     * @param includeEdges whether the broadcast (highest) address counts as a host
     * @return the highest address, or the one before it
     * @throws InvariantViolationException if edges are excluded on a
     *         /31, /32, /127 or /128 block
     */
    public IpAddress lastHost(boolean includeEdges) {
        requireHosts(includeEdges);
        BigInteger last = lastValue();
        return IpAddress.of(version(), includeEdges ? last : last.subtract(BigInteger.ONE));
    }

    /**
     * Checks whether an address lies in this block. Addresses of the other
     * family are never contained.
     *
     * @param candidate the address
     * @return {@code true} if contained
     */
    public boolean contains(IpAddress candidate) {
        Objects.requireNonNull(candidate, "Address cannot be null");
        if (candidate.version() != version()) {
            return false;
        }
        return Bits.networkOf(candidate.toBigInteger(), prefixLength, bits()).equals(networkValue());
    }

    /**
     * Checks whether another block lies entirely in this one.
     *
     * @param other the block
     * @return {@code true} if both its network and its last address are contained
     */
    public boolean contains(Cidr other) {
        Objects.requireNonNull(other, "CIDR cannot be null");
        if (other.version() != version()) {
            return false;
        }
        return contains(other.network()) && contains(IpAddress.of(version(), other.lastValue()));
    }

    /**
     * Checks whether two blocks share any address. Blocks of different
     * families never overlap.
     *
     * @param other the block
     * @return {@code true} if one block contains the other's network
     */
    public boolean overlaps(Cidr other) {
        Objects.requireNonNull(other, "CIDR cannot be null");
        if (other.version() != version()) {
            return false;
        }
        int width = bits();
        BigInteger thisNet = networkValue();
        BigInteger otherNet = other.networkValue();
        return Bits.networkOf(thisNet, other.prefixLength, width).equals(otherNet)
            || Bits.networkOf(otherNet, prefixLength, width).equals(thisNet);
    }

    // ========================================================================
    // Enumeration
    // ========================================================================

    /**
     * Returns the hosts with the default edge handling.
     *
     * @return a lazy, restartable sequence
     */
    public Iterable<IpAddress> hosts() {
        return hosts(defaultIncludeEdges());
    }

    /**
     * Returns the hosts of this block in ascending order.
     * <p>
     * The sequence is lazy; an IPv6 /0 is effectively endless, so callers
     * must stop on their own.
     *
     * @param includeEdges whether network and broadcast addresses are included
     * @return a lazy, restartable sequence
     * @throws InvariantViolationException if edges are excluded on a block
     *         with no such hosts
     */
    public Iterable<IpAddress> hosts(boolean includeEdges) {
        BigInteger first = firstHost(includeEdges).toBigInteger();
        BigInteger last = lastHost(includeEdges).toBigInteger();
        return new AddressSequence(version(), first, last, AddressSequence.UNLIMITED);
    }

    /**
     * Returns the {@code 2^(newPrefix - prefixLength)} subnets of the given
     * length, in ascending order.
     *
     * @param newPrefix the subnet prefix length
     * @return a lazy, restartable sequence
     * @throws InvariantViolationException unless
     *         {@code prefixLength < newPrefix <= bits}
     */
    public Iterable<Cidr> subnets(int newPrefix) {
        if (newPrefix <= prefixLength) {
            throw new InvariantViolationException(
                "New prefix " + newPrefix + " must be greater than current prefix " + prefixLength);
        }
        if (newPrefix > bits()) {
            throw new InvariantViolationException(
                "New prefix " + newPrefix + " exceeds " + version() + " width " + bits());
        }
        final IpVersion version = version();
        final BigInteger first = networkValue();
        final BigInteger last = lastValue();
        final BigInteger step = BigInteger.ONE.shiftLeft(bits() - newPrefix);
        return () -> new Iterator<Cidr>() {
            private BigInteger cursor = first;

            @Override
            public boolean hasNext() {
                return cursor.compareTo(last) <= 0;
            }

            @Override
            public Cidr next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Cidr subnet = new Cidr(IpAddress.of(version, cursor), newPrefix);
                cursor = cursor.add(step);
                return subnet;
            }
        };
    }

    /**
     * Splits the block into {@code parts} equally sized subnets.
     * <p>
     * The subnet length is the smallest one giving at least {@code parts}
     * blocks; the first {@code parts} of them are returned.
     *
     * @param parts the number of subnets
     * @return the subnets in ascending order
     * @throws InvariantViolationException if {@code parts <= 0} or the split
     *         would need a prefix longer than the address width
     */
    public List<Cidr> split(int parts) {
        if (parts <= 0) {
            throw new InvariantViolationException("Parts must be positive: " + parts);
        }
        if (parts == 1) {
            return Collections.singletonList(this);
        }
        int extraBits = 32 - Integer.numberOfLeadingZeros(parts - 1);
        int newPrefix = prefixLength + extraBits;
        if (newPrefix > bits()) {
            throw new InvariantViolationException(
                "Cannot split " + this + " into " + parts + " parts: /" + newPrefix
                + " exceeds " + version() + " width");
        }
        List<Cidr> result = new ArrayList<>(parts);
        Iterator<Cidr> subnets = subnets(newPrefix).iterator();
        while (result.size() < parts) {
            result.add(subnets.next());
        }
        return result;
    }

    /**
     * Translates the block by {@code n} block sizes.
     *
     * @param n the signed number of blocks to move
     * @return the block at the new position, expressed by its network address
     * @throws OutOfRangeException if the result leaves the address space
     */
    public Cidr move(long n) {
        BigInteger moved = networkValue().add(size().multiply(BigInteger.valueOf(n)));
        BigInteger movedLast = moved.add(size()).subtract(BigInteger.ONE);
        if (moved.signum() < 0 || !version().inRange(movedLast)) {
            throw new OutOfRangeException(
                "Moving " + this + " by " + n + " blocks leaves the " + version() + " space");
        }
        return new Cidr(IpAddress.of(version(), moved), prefixLength);
    }

    /**
     * Returns the full span of the block, edges included.
     *
     * @return {@code [network, last address]}
     */
    public IpRange toRange() {
        return IpRange.ofValues(version(), networkValue(), lastValue());
    }

    /**
     * Returns the reverse DNS zones delegating this block.
     *
     * @return zone names
     * @see ReverseDns#zonesFor(Cidr)
     */
    public List<String> toPtrZones() {
        return ReverseDns.zonesFor(this);
    }

    // ========================================================================
    // Internal helpers
    // ========================================================================

    BigInteger networkValue() {
        return Bits.networkOf(address.toBigInteger(), prefixLength, bits());
    }

    BigInteger lastValue() {
        return Bits.broadcastOf(address.toBigInteger(), prefixLength, bits());
    }

    private boolean defaultIncludeEdges() {
        return version() == IpVersion.V6 || prefixLength >= bits() - 1;
    }

    private void requireHosts(boolean includeEdges) {
        if (!includeEdges && prefixLength >= bits() - 1) {
            throw new InvariantViolationException(
                "No hosts without network/broadcast addresses in " + this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cidr)) {
            return false;
        }
        Cidr other = (Cidr) o;
        return prefixLength == other.prefixLength && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return 31 * address.hashCode() + prefixLength;
    }

    @Override
    public String toString() {
        return address + "/" + prefixLength;
    }
}
