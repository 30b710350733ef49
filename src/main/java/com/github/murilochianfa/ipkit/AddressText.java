/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

import java.math.BigInteger;

/**
 * Textual grammar for IPv4 dotted-decimal and IPv6 colon-hex addresses.
 * <p>
 * IPv6 parsing follows RFC 4291 section 2.2, including the mixed form with a
 * dotted-decimal tail. Formatting follows RFC 5952: lowercase hex, no leading
 * zeros, the longest run of two or more zero groups (leftmost on ties)
 * compressed to {@code ::}, and the mixed form for IPv4-mapped
 * ({@code ::ffff:a.b.c.d}) and IPv4-compatible ({@code ::a.b.c.d}) addresses.
 * The compatible form is not used for {@code ::} and {@code ::1}.
 */
final class AddressText {

    private static final int IPV6_GROUPS = 8;

    /** Groups preceding a dotted-decimal tail */
    private static final int IPV6_HEAD_GROUPS = 6;

    private AddressText() {
        throw new AssertionError("AddressText cannot be instantiated");
    }

    // ========================================================================
    // IPv4
    // ========================================================================

    /**
     * Parses strict dotted-decimal: four decimal octets 0-255, no sign and no
     * leading zeros except a lone {@code 0}.
     */
    static long parseDottedQuad(String text, String original) {
        String[] octets = text.split("\\.", -1);
        if (octets.length != 4) {
            throw new AddressParseException(
                "Invalid IPv4 address, expected 4 octets: " + original);
        }
        long value = 0;
        for (String octet : octets) {
            value = (value << 8) | parseOctet(octet, original);
        }
        return value;
    }

    private static int parseOctet(String octet, String original) {
        if (octet.isEmpty() || octet.length() > 3) {
            throw new AddressParseException("Invalid IPv4 octet '" + octet + "' in: " + original);
        }
        for (int i = 0; i < octet.length(); i++) {
            char c = octet.charAt(i);
            if (c < '0' || c > '9') {
                throw new AddressParseException(
                    "Invalid IPv4 octet '" + octet + "' in: " + original);
            }
        }
        if (octet.length() > 1 && octet.charAt(0) == '0') {
            throw new AddressParseException(
                "IPv4 octet has a leading zero '" + octet + "' in: " + original);
        }
        int value = Integer.parseInt(octet);
        if (value > 255) {
            throw new AddressParseException(
                "IPv4 octet out of range (0-255) '" + octet + "' in: " + original);
        }
        return value;
    }

    static String formatDottedQuad(long value) {
        return ((value >>> 24) & 0xFF) + "." +
               ((value >>> 16) & 0xFF) + "." +
               ((value >>> 8) & 0xFF) + "." +
               (value & 0xFF);
    }

    // ========================================================================
    // IPv6 parsing
    // ========================================================================

    /**
     * Parses an IPv6 address into its 128-bit value.
     */
    static BigInteger parseIPv6(String text) {
        int[] groups = parseIPv6Groups(text);
        BigInteger value = BigInteger.ZERO;
        for (int group : groups) {
            value = value.shiftLeft(16).or(BigInteger.valueOf(group));
        }
        return value;
    }

    static int[] parseIPv6Groups(String text) {
        if (text.contains(":::")) {
            throw new AddressParseException(
                "Invalid IPv6 address, too many consecutive colons: " + text);
        }
        int lastColon = text.lastIndexOf(':');
        if (lastColon < 0) {
            throw new AddressParseException("Invalid IPv6 address, no colon: " + text);
        }

        String tail = text.substring(lastColon + 1);
        if (tail.indexOf('.') < 0) {
            return expandGroups(text, IPV6_GROUPS, text);
        }

        long v4 = parseDottedQuad(tail, text);
        String head = text.substring(0, lastColon);
        // the last colon may be the second half of a "::"
        if (head.endsWith(":")) {
            head = head + ":";
        }
        int[] headGroups = expandGroups(head, IPV6_HEAD_GROUPS, text);

        int[] groups = new int[IPV6_GROUPS];
        System.arraycopy(headGroups, 0, groups, 0, IPV6_HEAD_GROUPS);
        groups[6] = (int) ((v4 >>> 16) & 0xFFFF);
        groups[7] = (int) (v4 & 0xFFFF);
        return groups;
    }

    /**
     * Expands a colon-hex section with at most one {@code ::} into exactly
     * {@code expected} groups. A {@code ::} stands for at least one group.
     */
    private static int[] expandGroups(String section, int expected, String original) {
        int compression = section.indexOf("::");
        if (compression >= 0 && section.indexOf("::", compression + 1) >= 0) {
            throw new AddressParseException(
                "Invalid IPv6 address, multiple :: compressions: " + original);
        }

        int[] groups = new int[expected];
        if (compression < 0) {
            String[] parts = section.split(":", -1);
            if (parts.length != expected) {
                throw new AddressParseException(
                    "Invalid IPv6 address, expected " + expected + " groups but found "
                    + parts.length + ": " + original);
            }
            for (int i = 0; i < parts.length; i++) {
                groups[i] = parseHexGroup(parts[i], original);
            }
            return groups;
        }

        String[] left = splitGroups(section.substring(0, compression));
        String[] right = splitGroups(section.substring(compression + 2));
        if (left.length + right.length >= expected) {
            throw new AddressParseException(
                "Invalid IPv6 address, too many groups around '::': " + original);
        }
        for (int i = 0; i < left.length; i++) {
            groups[i] = parseHexGroup(left[i], original);
        }
        int offset = expected - right.length;
        for (int i = 0; i < right.length; i++) {
            groups[offset + i] = parseHexGroup(right[i], original);
        }
        return groups;
    }

    private static String[] splitGroups(String part) {
        return part.isEmpty() ? new String[0] : part.split(":", -1);
    }

    private static int parseHexGroup(String group, String original) {
        if (group.isEmpty() || group.length() > 4) {
            throw new AddressParseException(
                "Invalid IPv6 group '" + group + "' (must be 1-4 hex digits) in: " + original);
        }
        int value = 0;
        for (int i = 0; i < group.length(); i++) {
            int digit = hexDigit(group.charAt(i));
            if (digit < 0) {
                throw new AddressParseException(
                    "Invalid IPv6 group '" + group + "' (must be 1-4 hex digits) in: " + original);
            }
            value = (value << 4) | digit;
        }
        return value;
    }

    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    // ========================================================================
    // IPv6 formatting
    // ========================================================================

    static String formatIPv6(BigInteger value) {
        int[] groups = new int[IPV6_GROUPS];
        for (int i = 0; i < IPV6_GROUPS; i++) {
            groups[i] = value.shiftRight(112 - i * 16).intValue() & 0xFFFF;
        }
        return formatIPv6Groups(groups);
    }

    static String formatIPv6Groups(int[] groups) {
        long low32 = ((long) groups[6] << 16) | groups[7];

        if (allZero(groups, 5) && groups[5] == 0xFFFF) {
            return "::ffff:" + formatDottedQuad(low32);
        }
        if (allZero(groups, 6) && low32 > 1) {
            return "::" + formatDottedQuad(low32);
        }

        // longest run of >= 2 zero groups, leftmost wins
        int bestStart = -1;
        int bestLength = 1;
        int i = 0;
        while (i < IPV6_GROUPS) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int start = i;
            while (i < IPV6_GROUPS && groups[i] == 0) {
                i++;
            }
            if (i - start > bestLength) {
                bestStart = start;
                bestLength = i - start;
            }
        }

        if (bestStart < 0) {
            return joinHex(groups, 0, IPV6_GROUPS);
        }
        return joinHex(groups, 0, bestStart) + "::" + joinHex(groups, bestStart + bestLength, IPV6_GROUPS);
    }

    private static boolean allZero(int[] groups, int count) {
        for (int i = 0; i < count; i++) {
            if (groups[i] != 0) {
                return false;
            }
        }
        return true;
    }

    private static String joinHex(int[] groups, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }
}
