/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

/**
 * Exception thrown when a numeric argument lies outside its valid domain:
 * a bit width other than 32 or 128, a prefix length outside {@code [0, width]},
 * a bit index outside {@code [0, width)}, or address arithmetic that would
 * leave the address space.
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public class OutOfRangeException extends IpKitException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a new OutOfRangeException with the specified detail message.
     * 
     * @param message the detail message
     */
    public OutOfRangeException(String message) {
        super(message);
    }
}
