/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy ascending walk over {@code [first, last]}, optionally capped at
 * {@code limit} addresses. Every {@link #iterator()} starts a fresh pass;
 * nothing is cached between passes.
 */
final class AddressSequence implements Iterable<IpAddress> {

    /** No cap beyond the interval itself */
    static final long UNLIMITED = -1;

    private final IpVersion version;
    private final BigInteger first;
    private final BigInteger last;
    private final long limit;

    AddressSequence(IpVersion version, BigInteger first, BigInteger last, long limit) {
        this.version = version;
        this.first = first;
        this.last = last;
        this.limit = limit;
    }

    @Override
    public Iterator<IpAddress> iterator() {
        return new Iterator<IpAddress>() {
            private BigInteger cursor = first;
            private long emitted = 0;

            @Override
            public boolean hasNext() {
                return cursor.compareTo(last) <= 0 && (limit < 0 || emitted < limit);
            }

            @Override
            public IpAddress next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                IpAddress address = IpAddress.of(version, cursor);
                cursor = cursor.add(BigInteger.ONE);
                emitted++;
                return address;
            }
        };
    }
}
