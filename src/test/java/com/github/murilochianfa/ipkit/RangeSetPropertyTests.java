/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property tests for RangeSet algebra. Sets are drawn from a small window
 * above 10.0.0.0 so that random operands overlap often.
 */
class RangeSetPropertyTests {
    
    private static final long BASE = 0x0A000000L; // 10.0.0.0
    private static final int WINDOW = 1024;
    
    @Property
    void unionIsCommutative(@ForAll("sets") RangeSet a, @ForAll("sets") RangeSet b) {
        assertThat(a.union(b)).isEqualTo(b.union(a));
    }
    
    @Property
    void unionIsIdempotent(@ForAll("sets") RangeSet a) {
        assertThat(a.union(a)).isEqualTo(a);
        assertThat(a.intersect(a)).isEqualTo(a);
    }
    
    @Property
    void differenceAndIntersectionAreDisjoint(@ForAll("sets") RangeSet a, @ForAll("sets") RangeSet b) {
        RangeSet difference = a.subtract(b);
        
        assertThat(difference.intersect(b).isEmpty()).isTrue();
        assertThat(difference.union(a.intersect(b))).isEqualTo(a);
    }
    
    @Property
    void sizesFollowInclusionExclusion(@ForAll("sets") RangeSet a, @ForAll("sets") RangeSet b) {
        BigInteger lhs = a.union(b).size().add(a.intersect(b).size());
        
        assertThat(lhs).isEqualTo(a.size().add(b.size()));
    }
    
    @Property
    void rangesStaySortedAndSeparated(@ForAll("sets") RangeSet a, @ForAll("sets") RangeSet b) {
        for (RangeSet set : new RangeSet[] {a, b, a.union(b), a.intersect(b), a.subtract(b)}) {
            List<IpRange> ranges = set.ranges();
            for (int i = 1; i < ranges.size(); i++) {
                BigInteger gapStart = ranges.get(i - 1).endValue().add(BigInteger.ONE);
                assertThat(ranges.get(i).startValue()).isGreaterThan(gapStart);
            }
        }
    }
    
    @Property
    void membershipFollowsTheOperations(@ForAll("sets") RangeSet a, @ForAll("sets") RangeSet b,
                                        @ForAll("probes") IpAddress probe) {
        boolean inA = a.contains(probe);
        boolean inB = b.contains(probe);
        
        assertThat(a.union(b).contains(probe)).isEqualTo(inA || inB);
        assertThat(a.intersect(b).contains(probe)).isEqualTo(inA && inB);
        assertThat(a.subtract(b).contains(probe)).isEqualTo(inA && !inB);
    }
    
    @Property
    void toCidrsRebuildsTheSet(@ForAll("sets") RangeSet a) {
        assertThat(RangeSet.fromCidrs(a.toCidrs())).isEqualTo(a);
    }
    
    @Provide
    Arbitrary<RangeSet> sets() {
        Arbitrary<IpRange> range = Combinators.combine(
            Arbitraries.integers().between(0, WINDOW - 1),
            Arbitraries.integers().between(0, 63)
        ).as((offset, length) -> IpRange.of(
            IpAddress.fromLong(BASE + offset),
            IpAddress.fromLong(BASE + offset + length)));
        return range.list().ofMaxSize(6).map(ranges -> RangeSet.fromRanges(ranges));
    }
    
    @Provide
    Arbitrary<IpAddress> probes() {
        return Arbitraries.integers().between(0, WINDOW + 64)
            .map(offset -> IpAddress.fromLong(BASE + offset));
    }
}
