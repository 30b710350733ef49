/*
 * Copyright (c) 2024 Murilo Chianfa
 * 
 * Licensed under the MIT License.
 */
package com.github.murilochianfa.ipkit;

/**
 * Exception thrown when textual, numeric or byte input cannot be turned into
 * an address, CIDR block or range.
 * <p>
 * This exception is thrown when:
 * <ul>
 *   <li>An IPv4 octet is out of range, signed, or has a leading zero</li>
 *   <li>An IPv6 string violates the RFC 4291 grammar (bad group, second {@code ::},
 *       {@code :::}, wrong group count, malformed IPv4 tail)</li>
 *   <li>A byte array is not 4 or 16 bytes long</li>
 *   <li>A numeric value is outside the address space of its version</li>
 *   <li>A CIDR or range string is malformed</li>
 *   <li>An allocator is given taken ranges outside its parent block</li>
 * </ul>
 * 
 * @author Murilo Chianfa
 * @since 1.0.0
 */
public class AddressParseException extends IpKitException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a new AddressParseException with the specified detail message.
     * 
     * @param message the detail message
     */
    public AddressParseException(String message) {
        super(message);
    }
    
    /**
     * Constructs a new AddressParseException with the specified detail message and cause.
     * 
     * @param message the detail message
     * @param cause the cause
     */
    public AddressParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
