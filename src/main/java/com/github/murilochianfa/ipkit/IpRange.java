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

/**
 * An immutable inclusive address range {@code [start, end]} of one family.
 *
 * <pre>{@code
 * IpRange range = IpRange.parse("192.168.0.5 - 192.168.0.20");
 * range.size();     // 16
 * range.toCidrs();  // [192.168.0.5/32, 192.168.0.6/31, 192.168.0.8/29,
 *                   //  192.168.0.16/30, 192.168.0.20/32]
 * }</pre>
 *
 * @author Murilo Chianfa
 * @since 1.0.0
 * @see RangeSet
 */
public final class IpRange {

    private final IpAddress start;
    private final IpAddress end;

    private IpRange(IpAddress start, IpAddress end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Parses {@code start - end}; spaces around the dash are optional.
     *
     * @param text the range
     * @return the range
     * @throws AddressParseException if the text is malformed, mixes families,
     *         or has {@code start > end}
     */
    public static IpRange parse(String text) {
        Objects.requireNonNull(text, "Range cannot be null");

        int dashIdx = text.indexOf('-');
        if (dashIdx < 0 || dashIdx != text.lastIndexOf('-')) {
            throw new AddressParseException("Invalid range notation, expected one '-': " + text);
        }

        IpAddress first = IpAddress.parse(text.substring(0, dashIdx).trim());
        IpAddress last = IpAddress.parse(text.substring(dashIdx + 1).trim());
        if (first.version() != last.version()) {
            throw new AddressParseException("Mixed address families in range: " + text);
        }
        return of(first, last);
    }

    /**
     * Creates a range from its endpoints.
     *
     * @param start the first address
     * @param end the last address
     * @return the range
     * @throws VersionMismatchException if the endpoints differ in family
     * @throws AddressParseException if {@code start > end}
     */
    public static IpRange of(IpAddress start, IpAddress end) {
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        start.requireSameVersion(end.version(), "range");
        if (start.compareTo(end) > 0) {
            throw new AddressParseException(
                "Range start must not exceed end: " + start + " > " + end);
        }
        return new IpRange(start, end);
    }

    static IpRange ofValues(IpVersion version, BigInteger start, BigInteger end) {
        return new IpRange(IpAddress.of(version, start), IpAddress.of(version, end));
    }

    public IpAddress start() {
        return start;
    }

    public IpAddress end() {
        return end;
    }

    public IpVersion version() {
        return start.version();
    }

    /**
     * Returns the number of addresses in the range.
     *
     * @return {@code end - start + 1}
     */
    public BigInteger size() {
        return endValue().subtract(startValue()).add(BigInteger.ONE);
    }

    public boolean contains(IpAddress address) {
        Objects.requireNonNull(address, "Address cannot be null");
        if (address.version() != version()) {
            return false;
        }
        BigInteger value = address.toBigInteger();
        return value.compareTo(startValue()) >= 0 && value.compareTo(endValue()) <= 0;
    }

    /**
     * Checks whether another range lies entirely in this one.
     *
     * @param other the range
     * @return {@code true} if contained
     */
    public boolean contains(IpRange other) {
        Objects.requireNonNull(other, "Range cannot be null");
        return other.version() == version()
            && other.startValue().compareTo(startValue()) >= 0
            && other.endValue().compareTo(endValue()) <= 0;
    }

    public boolean overlaps(IpRange other) {
        Objects.requireNonNull(other, "Range cannot be null");
        return other.version() == version()
            && endValue().compareTo(other.startValue()) >= 0
            && startValue().compareTo(other.endValue()) <= 0;
    }

    /**
     * Checks whether the two ranges touch without overlapping.
     *
     * @param other the range
     * @return {@code true} if one ends immediately before the other starts
     */
    public boolean isAdjacentTo(IpRange other) {
        Objects.requireNonNull(other, "Range cannot be null");
        if (other.version() != version()) {
            return false;
        }
        return endValue().add(BigInteger.ONE).equals(other.startValue())
            || other.endValue().add(BigInteger.ONE).equals(startValue());
    }

    /**
     * Returns every address of the range in ascending order.
     *
     * @return a lazy, restartable sequence
     */
    public Iterable<IpAddress> ips() {
        return new AddressSequence(version(), startValue(), endValue(), AddressSequence.UNLIMITED);
    }

    /**
     * Returns at most {@code limit} addresses from the start of the range.
     *
     * @param limit the maximum number of addresses
     * @return a lazy, restartable sequence
     * @throws OutOfRangeException if {@code limit} is negative
     */
    public Iterable<IpAddress> ips(long limit) {
        if (limit < 0) {
            throw new OutOfRangeException("Limit must not be negative: " + limit);
        }
        return new AddressSequence(version(), startValue(), endValue(), limit);
    }

    /**
     * Returns the minimal list of CIDR blocks covering exactly this range, in
     * ascending order.
     *
     * @return the covering blocks
     */
    public List<Cidr> toCidrs() {
        int width = start.bits();
        BigInteger last = endValue();
        BigInteger current = startValue();
        List<Cidr> result = new ArrayList<>();
        while (current.compareTo(last) <= 0) {
            AlignedBlock block = Bits.alignedBlockAt(current, last, width);
            result.add(Cidr.of(IpAddress.of(version(), block.start()), block.prefixLength()));
            current = block.end(width).add(BigInteger.ONE);
        }
        return result;
    }

    BigInteger startValue() {
        return start.toBigInteger();
    }

    BigInteger endValue() {
        return end.toBigInteger();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IpRange)) {
            return false;
        }
        IpRange other = (IpRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
