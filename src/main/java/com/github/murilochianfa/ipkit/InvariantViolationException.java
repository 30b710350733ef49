/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

/**
 * Exception thrown when a well-typed operation has no defined result for the
 * receiver's state.
 * <p>
 * Examples: asking an IPv6 block for its broadcast address, excluding the
 * network and broadcast addresses of a /31 or /32, or subnetting to a prefix
 * that is not longer than the current one.
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public class InvariantViolationException extends IpKitException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a new InvariantViolationException with the specified detail message.
     * 
     * @param message the detail message
     */
    public InvariantViolationException(String message) {
        super(message);
    }
}
