/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An immutable, normalized set of addresses of one family, stored as ranges.
 * <p>
 * The member ranges are always sorted by start, pairwise disjoint, and never
 * adjacent: every factory and every operation merges touching ranges, so two
 * sets holding the same addresses are {@link #equals equal}.
 *
 * <h2>Set algebra</h2>
 * <pre>{@code
 * RangeSet a = RangeSet.parseCidrs("192.168.1.0/25", "192.168.2.0/24");
 * RangeSet b = RangeSet.parseCidrs("192.168.1.128/25");
 * a.union(b).size();           // 512
 * a.union(b).ranges();         // [192.168.1.0-192.168.2.255]
 * a.subtract(b).intersect(b);  // empty
 * }</pre>
 *
 * An empty set has no family and combines with sets of either family.
 * Combining non-empty sets of different families throws
 * {@link VersionMismatchException}.
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public final class RangeSet {

    private static final RangeSet EMPTY = new RangeSet(Collections.<IpRange>emptyList());

    private static final Comparator<IpRange> BY_START =
        (a, b) -> a.startValue().compareTo(b.startValue());

    /** Normalized; never handed out directly */
    private final List<IpRange> ranges;

    private RangeSet(List<IpRange> ranges) {
        this.ranges = ranges;
    }

    // ========================================================================
    // Factory methods
    // ========================================================================

    public static RangeSet empty() {
        return EMPTY;
    }

    public static RangeSet fromRanges(IpRange... ranges) {
        Objects.requireNonNull(ranges, "Ranges cannot be null");
        return fromRanges(Arrays.asList(ranges));
    }

    /**
     * Creates a set holding every address of the given ranges.
     *
     * @param ranges ranges of one family, in any order, possibly overlapping
     * @return the normalized set
     * @throws VersionMismatchException if the ranges mix families
     */
    public static RangeSet fromRanges(Collection<IpRange> ranges) {
        Objects.requireNonNull(ranges, "Ranges cannot be null");
        List<IpRange> copy = new ArrayList<>(ranges.size());
        IpVersion version = null;
        for (IpRange range : ranges) {
            Objects.requireNonNull(range, "Range cannot be null");
            version = checkVersion(version, range.version());
            copy.add(range);
        }
        return normalized(copy);
    }

    public static RangeSet fromCidrs(Cidr... cidrs) {
        Objects.requireNonNull(cidrs, "CIDRs cannot be null");
        return fromCidrs(Arrays.asList(cidrs));
    }

    /**
     * Creates a set holding every address of the given blocks.
     *
     * @param cidrs blocks of one family
     * @return the normalized set
     * @throws VersionMismatchException if the blocks mix families
     */
    public static RangeSet fromCidrs(Collection<Cidr> cidrs) {
        Objects.requireNonNull(cidrs, "CIDRs cannot be null");
        List<IpRange> ranges = new ArrayList<>(cidrs.size());
        for (Cidr cidr : cidrs) {
            Objects.requireNonNull(cidr, "CIDR cannot be null");
            ranges.add(cidr.toRange());
        }
        return fromRanges(ranges);
    }

    /**
     * Creates a set from CIDR strings.
     *
     * @param cidrs blocks in CIDR notation
     * @return the normalized set
     * @throws AddressParseException if a block is malformed
     * @throws VersionMismatchException if the blocks mix families
     */
    public static RangeSet parseCidrs(String... cidrs) {
        Objects.requireNonNull(cidrs, "CIDRs cannot be null");
        List<Cidr> parsed = new ArrayList<>(cidrs.length);
        for (String cidr : cidrs) {
            parsed.add(Cidr.parse(cidr));
        }
        return fromCidrs(parsed);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    /**
     * Returns a copy of the member ranges in ascending order.
     *
     * @return the ranges
     */
    public List<IpRange> ranges() {
        return new ArrayList<>(ranges);
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Returns the family of the members.
     *
     * @return the version, or {@code null} for the empty set
     */
    public IpVersion version() {
        return ranges.isEmpty() ? null : ranges.get(0).version();
    }

    /**
     * Returns the number of addresses in the set.
     *
     * @return the total size
     */
    public BigInteger size() {
        BigInteger total = BigInteger.ZERO;
        for (IpRange range : ranges) {
            total = total.add(range.size());
        }
        return total;
    }

    // ========================================================================
    // Set algebra
    // ========================================================================

    /**
     * Returns every address in either set.
     *
     * @param other the other set
     * @return the union
     */
    public RangeSet union(RangeSet other) {
        requireCompatible(other, "union");
        List<IpRange> all = new ArrayList<>(ranges.size() + other.ranges.size());
        all.addAll(ranges);
        all.addAll(other.ranges);
        return normalized(all);
    }

    /**
     * Returns every address in both sets.
     *
     * @param other the other set
     * @return the intersection
     */
    public RangeSet intersect(RangeSet other) {
        requireCompatible(other, "intersect");
        List<IpRange> result = new ArrayList<>();
        for (IpRange a : ranges) {
            for (IpRange b : other.ranges) {
                if (!a.overlaps(b)) {
                    continue;
                }
                BigInteger start = a.startValue().max(b.startValue());
                BigInteger end = a.endValue().min(b.endValue());
                result.add(IpRange.ofValues(a.version(), start, end));
            }
        }
        return normalized(result);
    }

    /**
     * Returns every address in this set but not in {@code other}.
     *
     * @param other the addresses to remove
     * @return the difference
     */
    public RangeSet subtract(RangeSet other) {
        requireCompatible(other, "subtract");
        List<IpRange> result = new ArrayList<>(ranges);
        for (IpRange cut : other.ranges) {
            result = subtractRange(result, cut);
        }
        return normalized(result);
    }

    private static List<IpRange> subtractRange(List<IpRange> ranges, IpRange cut) {
        List<IpRange> remaining = new ArrayList<>(ranges.size() + 1);
        for (IpRange range : ranges) {
            if (!range.overlaps(cut)) {
                remaining.add(range);
                continue;
            }
            if (range.startValue().compareTo(cut.startValue()) < 0) {
                remaining.add(IpRange.ofValues(range.version(),
                    range.startValue(), cut.startValue().subtract(BigInteger.ONE)));
            }
            if (range.endValue().compareTo(cut.endValue()) > 0) {
                remaining.add(IpRange.ofValues(range.version(),
                    cut.endValue().add(BigInteger.ONE), range.endValue()));
            }
        }
        return remaining;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Checks whether an address is in the set.
     *
     * @param address the address
     * @return {@code true} if some member range contains it
     */
    public boolean contains(IpAddress address) {
        Objects.requireNonNull(address, "Address cannot be null");
        if (address.version() != version()) {
            return false;
        }
        BigInteger value = address.toBigInteger();
        int low = 0;
        int high = ranges.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            IpRange range = ranges.get(mid);
            if (value.compareTo(range.startValue()) < 0) {
                high = mid - 1;
            } else if (value.compareTo(range.endValue()) > 0) {
                low = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a whole block lies in the set. Because members are
     * never adjacent, a block inside the set always lies inside a single
     * member range.
     *
     * @param cidr the block
     * @return {@code true} if one member range holds every address of the block
     */
    public boolean containsCidr(Cidr cidr) {
        Objects.requireNonNull(cidr, "CIDR cannot be null");
        IpRange span = cidr.toRange();
        for (IpRange range : ranges) {
            if (range.contains(span)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the minimal CIDR cover of every member range, in ascending order.
     *
     * @return the blocks
     */
    public List<Cidr> toCidrs() {
        List<Cidr> cidrs = new ArrayList<>();
        for (IpRange range : ranges) {
            cidrs.addAll(range.toCidrs());
        }
        return cidrs;
    }

    /**
     * Returns every address of the set in ascending order.
     *
     * @return a lazy, restartable sequence
     */
    public Iterable<IpAddress> ips() {
        return () -> new SetIterator(AddressSequence.UNLIMITED);
    }

    /**
     * Returns at most {@code limit} addresses from the bottom of the set.
     *
     * @param limit the maximum number of addresses
     * @return a lazy, restartable sequence
     * @throws OutOfRangeException if {@code limit} is negative
     */
    public Iterable<IpAddress> ips(long limit) {
        if (limit < 0) {
            throw new OutOfRangeException("Limit must not be negative: " + limit);
        }
        return () -> new SetIterator(limit);
    }

    /** Walks member ranges one after another, stopping at the limit. */
    private final class SetIterator implements Iterator<IpAddress> {

        private final long limit;
        private int rangeIndex = 0;
        private Iterator<IpAddress> current = Collections.emptyIterator();
        private long emitted = 0;

        SetIterator(long limit) {
            this.limit = limit;
        }

        @Override
        public boolean hasNext() {
            if (limit >= 0 && emitted >= limit) {
                return false;
            }
            while (!current.hasNext() && rangeIndex < ranges.size()) {
                current = ranges.get(rangeIndex++).ips().iterator();
            }
            return current.hasNext();
        }

        @Override
        public IpAddress next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            emitted++;
            return current.next();
        }
    }

    // ========================================================================
    // Normalization
    // ========================================================================

    /**
     * Sorts by start and merges overlapping or adjacent ranges.
     */
    private static RangeSet normalized(List<IpRange> input) {
        if (input.isEmpty()) {
            return EMPTY;
        }
        List<IpRange> sorted = new ArrayList<>(input);
        sorted.sort(BY_START);

        List<IpRange> merged = new ArrayList<>(sorted.size());
        IpRange last = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            IpRange current = sorted.get(i);
            if (current.startValue().compareTo(last.endValue().add(BigInteger.ONE)) <= 0) {
                if (current.endValue().compareTo(last.endValue()) > 0) {
                    last = IpRange.ofValues(last.version(), last.startValue(), current.endValue());
                }
            } else {
                merged.add(last);
                last = current;
            }
        }
        merged.add(last);
        return new RangeSet(Collections.unmodifiableList(merged));
    }

    private void requireCompatible(RangeSet other, String operation) {
        Objects.requireNonNull(other, "RangeSet cannot be null");
        IpVersion mine = version();
        IpVersion theirs = other.version();
        if (mine != null && theirs != null && mine != theirs) {
            throw VersionMismatchException.of(operation, mine, theirs);
        }
    }

    private static IpVersion checkVersion(IpVersion expected, IpVersion actual) {
        if (expected != null && expected != actual) {
            throw VersionMismatchException.of("mixed address families", expected, actual);
        }
        return actual;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeSet)) {
            return false;
        }
        return ranges.equals(((RangeSet) o).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (IpRange range : ranges) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(range);
        }
        return sb.toString();
    }
}
