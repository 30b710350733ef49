/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * First-fit address allocator over a parent CIDR block.
 * <p>
 * The allocator tracks the taken addresses of its parent as a
 * {@link RangeSet}. Each successful allocation replaces that set with a new
 * one; the previous set is never modified, so a {@link #taken()} snapshot
 * stays valid.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Allocator pool = new Allocator(Cidr.parse("192.168.1.0/24"));
 * pool.allocateNext();                          // 192.168.1.1
 * pool.allocateCidr(Cidr.parse("192.168.1.128/25"));
 * pool.freeBlocks(26, 10);                      // free /26 and longer blocks
 * pool.utilization();                           // ~0.504
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * Allocators are <strong>NOT</strong> thread-safe. Concurrent allocation
 * from several threads requires external synchronization.
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 * @see RangeSet
 */
public class Allocator {

    private static final Logger LOGGER = Logger.getLogger(Allocator.class.getName());

    /** Default cap on {@link #freeBlocks()} results */
    public static final int DEFAULT_MAX_RESULTS = 100;

    /** Largest integer a double represents exactly, 2^53 - 1 */
    private static final BigInteger MAX_SAFE_INTEGER = BigInteger.ONE.shiftLeft(53).subtract(BigInteger.ONE);

    private final Cidr parent;
    private RangeSet taken;

    /**
     * Creates an allocator with nothing taken.
     *
     * @param parent the block to allocate from
     */
    public Allocator(Cidr parent) {
        this(parent, RangeSet.empty());
    }

    /**
     * Creates an allocator with some addresses already taken.
     *
     * @param parent the block to allocate from
     * @param taken addresses already in use
     * @throws AddressParseException if any taken range lies outside {@code parent}
     */
    public Allocator(Cidr parent, RangeSet taken) {
        this.parent = Objects.requireNonNull(parent, "Parent cannot be null");
        this.taken = Objects.requireNonNull(taken, "Taken cannot be null");

        IpRange span = parent.toRange();
        for (IpRange range : taken.ranges()) {
            if (!span.contains(range)) {
                throw new AddressParseException(
                    "Taken range " + range + " lies outside parent " + parent);
            }
        }
    }

    public Cidr parent() {
        return parent;
    }

    /**
     * Returns the current set of taken addresses.
     *
     * @return an immutable snapshot
     */
    public RangeSet taken() {
        return taken;
    }

    public IpVersion version() {
        return parent.version();
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * Returns the first free address at or after the parent's first host.
     *
     * @return the address, or {@code null} if none is free
     */
    public IpAddress nextAvailable() {
        return nextAvailable(parent.firstHost());
    }

    /**
     * Returns the first free address at or after {@code from}.
     *
     * @param from where to start looking
     * @return the address, or {@code null} if none is free
     * @throws VersionMismatchException if {@code from} is of the other family
     */
    public IpAddress nextAvailable(IpAddress from) {
        Objects.requireNonNull(from, "From cannot be null");
        if (from.version() != version()) {
            throw VersionMismatchException.of("nextAvailable", version(), from.version());
        }

        BigInteger floor = from.toBigInteger();
        for (IpRange free : freeRanges().ranges()) {
            if (free.endValue().compareTo(floor) < 0) {
                continue;
            }
            return IpAddress.of(version(), free.startValue().max(floor));
        }
        return null;
    }

    // ========================================================================
    // Allocation
    // ========================================================================

    /**
     * Takes the address {@link #nextAvailable()} would return.
     *
     * @return the allocated address, or {@code null} if the parent is full
     */
    public IpAddress allocateNext() {
        IpAddress next = nextAvailable();
        if (next == null) {
            LOGGER.fine(() -> "Allocator for " + parent + " is exhausted");
            return null;
        }
        allocateIP(next);
        return next;
    }

    /**
     * Takes a specific address.
     *
     * @param address the address
     * @return {@code false} if it lies outside the parent or is already taken
     */
    public boolean allocateIP(IpAddress address) {
        Objects.requireNonNull(address, "Address cannot be null");
        if (!parent.contains(address) || taken.contains(address)) {
            LOGGER.fine(() -> "Rejected allocation of " + address + " in " + parent);
            return false;
        }
        taken = taken.union(RangeSet.fromRanges(IpRange.of(address, address)));
        LOGGER.fine(() -> "Allocated " + address + " in " + parent);
        return true;
    }

    /**
     * Takes a whole block.
     *
     * @param cidr the block
     * @return {@code false} if it is of the other family, not inside the
     *         parent, or shares any address with the taken set
     */
    public boolean allocateCidr(Cidr cidr) {
        Objects.requireNonNull(cidr, "CIDR cannot be null");
        if (cidr.version() != version() || !parent.contains(cidr)) {
            LOGGER.fine(() -> "Rejected allocation of " + cidr + " outside " + parent);
            return false;
        }
        RangeSet block = RangeSet.fromCidrs(cidr);
        if (!taken.intersect(block).isEmpty()) {
            LOGGER.fine(() -> "Rejected allocation of " + cidr + ", overlaps taken addresses");
            return false;
        }
        taken = taken.union(block);
        LOGGER.fine(() -> "Allocated " + cidr + " in " + parent);
        return true;
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    /**
     * Returns the addresses of the parent not yet taken.
     *
     * @return the free set
     */
    public RangeSet freeRanges() {
        return RangeSet.fromRanges(parent.toRange()).subtract(taken);
    }

    /**
     * Returns up to {@link #DEFAULT_MAX_RESULTS} free blocks of any size.
     *
     * @return the free blocks in ascending order
     */
    public List<Cidr> freeBlocks() {
        return freeBlocks(parent.prefixLength(), DEFAULT_MAX_RESULTS);
    }

    /**
     * Decomposes the free space into aligned blocks and returns those with
     * a prefix length of at least {@code minPrefix}.
     *
     * @param minPrefix the shortest prefix (largest block) to report
     * @param maxResults the maximum number of blocks
     * @return the free blocks in ascending order
     * @throws OutOfRangeException if {@code minPrefix} is not a valid prefix
     *         length or {@code maxResults} is negative
     */
    public List<Cidr> freeBlocks(int minPrefix, int maxResults) {
        version().validatePrefixLength(minPrefix);
        if (maxResults < 0) {
            throw new OutOfRangeException("Max results must not be negative: " + maxResults);
        }
        List<Cidr> result = new ArrayList<>();
        for (IpRange free : freeRanges().ranges()) {
            for (Cidr block : free.toCidrs()) {
                if (result.size() >= maxResults) {
                    return result;
                }
                if (block.prefixLength() >= minPrefix) {
                    result.add(block);
                }
            }
        }
        return result;
    }

    /**
     * Returns the number of free addresses.
     *
     * @return parent size minus taken size
     */
    public BigInteger availableCount() {
        return parent.size().subtract(taken.size());
    }

    /**
     * Returns the taken fraction of the parent, from 0.0 to 1.0.
     * <p>
     * For blocks larger than 2^53 addresses both counts are scaled down by
     * the same power of two first, so the ratio is approximate.
     *
     * @return the utilization
     */
    public double utilization() {
        BigInteger total = parent.size();
        BigInteger used = taken.size();
        while (total.compareTo(MAX_SAFE_INTEGER) > 0) {
            total = total.shiftRight(1);
            used = used.shiftRight(1);
        }
        return used.doubleValue() / total.doubleValue();
    }

    @Override
    public String toString() {
        return "Allocator[" +
               "parent=" + parent +
               ", taken=" + taken.size() +
               "]";
    }
}
