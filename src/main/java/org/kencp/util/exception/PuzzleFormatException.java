/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

/**
 * Raised when a serialized puzzle cannot be read.
 */
public class PuzzleFormatException extends RuntimeException {

    public PuzzleFormatException(String message) {
        super(message);
    }

    public PuzzleFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
