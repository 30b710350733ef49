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
 * Binary radix trie for longest prefix match (LPM) lookups.
 * <p>
 * Each inserted CIDR block occupies the node reached by following its
 * network address bits, most significant first, for {@code prefixLength}
 * levels. The node stores the exact block and its value; lookups walk the
 * query address's bits and remember the deepest occupied node passed.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * RadixTrie<String> routes = new RadixTrie<>(IpVersion.V4);
 * routes.insert(Cidr.parse("10.0.0.0/8"), "core");
 * routes.insert(Cidr.parse("10.1.0.0/16"), "branch");
 *
 * routes.longestMatch(IpAddress.parse("10.1.2.3")).value();  // "branch"
 * routes.longestMatch(IpAddress.parse("10.2.2.3")).value();  // "core"
 * routes.longestMatch(IpAddress.parse("192.0.2.1"));         // null
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li><strong>Read operations</strong> ({@code longestMatch}, {@code get},
 *       {@code getCidrs}): safe to run concurrently with each other.</li>
 *   <li><strong>Write operations</strong> ({@code insert}, {@code remove}):
 *       NOT thread-safe. Concurrent writes, or reads during a write, require
 *       external synchronization.</li>
 * </ul>
 *
 * @param <T> the value type; {@code null} values are allowed and still count
 *            as entries
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public class RadixTrie<T> {

    private static final Logger LOGGER = Logger.getLogger(RadixTrie.class.getName());

    private final IpVersion version;
    private final Node<T> root = new Node<>();
    private int size;

    /**
     * Creates an empty trie for one address family.
     *
     * @param version the family of every block and query
     */
    public RadixTrie(IpVersion version) {
        this.version = Objects.requireNonNull(version, "Version cannot be null");
    }

    public IpVersion version() {
        return version;
    }

    // ========================================================================
    // Insert / remove
    // ========================================================================

    /**
     * Inserts a block with a {@code null} value.
     *
     * @param cidr the block
     * @return this trie
     * @throws VersionMismatchException if the block is of the other family
     */
    public RadixTrie<T> insert(Cidr cidr) {
        return insert(cidr, null);
    }

    /**
     * Inserts a block, replacing the value of an existing identical block.
     *
     * @param cidr the block; only its network matters
     * @param value the value to associate
     * @return this trie
     * @throws VersionMismatchException if the block is of the other family
     */
    public RadixTrie<T> insert(Cidr cidr, T value) {
        requireVersion(cidr);
        BigInteger network = cidr.networkValue();
        int width = version.bits();

        Node<T> node = root;
        for (int depth = 0; depth < cidr.prefixLength(); depth++) {
            int bit = bitAt(network, depth, width);
            if (node.child(bit) == null) {
                node.setChild(bit, new Node<>());
            }
            node = node.child(bit);
        }

        if (!node.occupied) {
            size++;
        }
        node.occupied = true;
        node.value = value;
        node.prefixLength = cidr.prefixLength();
        node.network = network;
        LOGGER.finer(() -> "Inserted " + cidr + " (" + size + " entries)");
        return this;
    }

    /**
     * Removes a block and prunes nodes left without children or entries.
     *
     * @param cidr the block; only its network matters
     * @return {@code true} if the block was present
     * @throws VersionMismatchException if the block is of the other family
     */
    public boolean remove(Cidr cidr) {
        requireVersion(cidr);
        BigInteger network = cidr.networkValue();
        int width = version.bits();
        int prefixLength = cidr.prefixLength();

        // no parent links, so keep the path for pruning
        List<Node<T>> path = new ArrayList<>(prefixLength + 1);
        Node<T> node = root;
        path.add(node);
        for (int depth = 0; depth < prefixLength; depth++) {
            node = node.child(bitAt(network, depth, width));
            if (node == null) {
                return false;
            }
            path.add(node);
        }
        if (!node.occupied) {
            return false;
        }

        node.clear();
        size--;

        for (int depth = prefixLength; depth > 0; depth--) {
            Node<T> current = path.get(depth);
            if (current.occupied || current.hasChildren()) {
                break;
            }
            path.get(depth - 1).setChild(bitAt(network, depth - 1, width), null);
        }
        LOGGER.finer(() -> "Removed " + cidr + " (" + size + " entries)");
        return true;
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * Finds the most specific block containing an address.
     *
     * @param address the query address
     * @return the match, or {@code null} if no block contains the address
     * @throws VersionMismatchException if the address is of the other family
     */
    public Match<T> longestMatch(IpAddress address) {
        Objects.requireNonNull(address, "Address cannot be null");
        if (address.version() != version) {
            throw VersionMismatchException.of("longestMatch", version, address.version());
        }
        BigInteger value = address.toBigInteger();
        int width = version.bits();

        Node<T> best = null;
        Node<T> node = root;
        for (int depth = 0; ; depth++) {
            if (node.occupied) {
                best = node;
            }
            if (depth == width) {
                break;
            }
            node = node.child(bitAt(value, depth, width));
            if (node == null) {
                break;
            }
        }
        return best == null ? null : best.toMatch(version);
    }

    /**
     * Returns the value stored for exactly this block.
     *
     * @param cidr the block
     * @return the value, or {@code null} if absent (or stored as {@code null})
     */
    public T get(Cidr cidr) {
        Node<T> node = find(cidr);
        return node == null ? null : node.value;
    }

    /**
     * Checks whether exactly this block has been inserted.
     *
     * @param cidr the block
     * @return {@code true} if present
     */
    public boolean containsCidr(Cidr cidr) {
        return find(cidr) != null;
    }

    private Node<T> find(Cidr cidr) {
        requireVersion(cidr);
        BigInteger network = cidr.networkValue();
        int width = version.bits();
        Node<T> node = root;
        for (int depth = 0; depth < cidr.prefixLength() && node != null; depth++) {
            node = node.child(bitAt(network, depth, width));
        }
        return node != null && node.occupied ? node : null;
    }

    // ========================================================================
    // Traversal
    // ========================================================================

    /**
     * Returns every inserted block, ordered by network address and then by
     * prefix length.
     *
     * @return the blocks
     */
    public List<Cidr> getCidrs() {
        List<Cidr> result = new ArrayList<>(size);
        collect(root, result);
        return result;
    }

    private void collect(Node<T> node, List<Cidr> result) {
        if (node.occupied) {
            result.add(node.toCidr(version));
        }
        if (node.zero != null) {
            collect(node.zero, result);
        }
        if (node.one != null) {
            collect(node.one, result);
        }
    }

    /**
     * Returns the number of inserted blocks, not the number of nodes.
     *
     * @return the entry count
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private void requireVersion(Cidr cidr) {
        Objects.requireNonNull(cidr, "CIDR cannot be null");
        if (cidr.version() != version) {
            throw VersionMismatchException.of("trie", version, cidr.version());
        }
    }

    private static int bitAt(BigInteger value, int depth, int width) {
        return value.testBit(width - 1 - depth) ? 1 : 0;
    }

    @Override
    public String toString() {
        return "RadixTrie[" +
               "version=" + version +
               ", size=" + size +
               "]";
    }

    // ========================================================================
    // Nested types
    // ========================================================================

    private static final class Node<T> {

        Node<T> zero;
        Node<T> one;

        boolean occupied;
        T value;
        int prefixLength;
        BigInteger network;

        Node<T> child(int bit) {
            return bit == 0 ? zero : one;
        }

        void setChild(int bit, Node<T> child) {
            if (bit == 0) {
                zero = child;
            } else {
                one = child;
            }
        }

        boolean hasChildren() {
            return zero != null || one != null;
        }

        void clear() {
            occupied = false;
            value = null;
            prefixLength = 0;
            network = null;
        }

        Cidr toCidr(IpVersion version) {
            return Cidr.of(IpAddress.of(version, network), prefixLength);
        }

        Match<T> toMatch(IpVersion version) {
            return new Match<>(toCidr(version), value);
        }
    }

    /**
     * Result of a {@link #longestMatch} lookup.
     *
     * @param <T> the value type
     */
    public static final class Match<T> {

        private final Cidr cidr;
        private final T value;

        Match(Cidr cidr, T value) {
            this.cidr = cidr;
            this.value = value;
        }

        /**
         * Returns the matching block, expressed by its network address.
         *
         * @return the block
         */
        public Cidr cidr() {
            return cidr;
        }

        public T value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Match)) {
                return false;
            }
            Match<?> other = (Match<?>) o;
            return cidr.equals(other.cidr) && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cidr, value);
        }

        @Override
        public String toString() {
            return "Match[cidr=" + cidr + ", value=" + value + "]";
        }
    }
}
