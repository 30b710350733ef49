/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

/**
 * Exception thrown when IPv4 and IPv6 operands are combined in an operation
 * that requires a single address family (ordering, range construction, set
 * algebra, trie insert and lookup).
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public class VersionMismatchException extends IpKitException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a new VersionMismatchException with the specified detail message.
     * 
     * @param message the detail message
     */
    public VersionMismatchException(String message) {
        super(message);
    }
    
    static VersionMismatchException of(String operation, IpVersion expected, IpVersion actual) {
        return new VersionMismatchException(
            operation + ": expected " + expected + ", got " + actual);
    }
}
