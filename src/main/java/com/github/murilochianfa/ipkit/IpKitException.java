/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

/**
 * Base exception class for ipkit operations.
 * <p>
 * Every failure raised by this library is a subclass of this type, so callers
 * can catch a specific kind ({@link AddressParseException},
 * {@link VersionMismatchException}, {@link OutOfRangeException},
 * {@link InvariantViolationException}) or all of them at once.
 * <p>
 * Operations never leave partial state behind: when one of these is thrown,
 * the receiver is unchanged.
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public class IpKitException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a new IpKitException with the specified detail message.
     * 
     * @param message the detail message
     */
    public IpKitException(String message) {
        super(message);
    }
    
    /**
     * Constructs a new IpKitException with the specified detail message and cause.
     * 
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval by {@link #getCause()})
     */
    public IpKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
