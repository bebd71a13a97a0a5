package com.protein.network.core;

/**
 * Runtime exception thrown when strict edge validation is enabled and an
 * interaction is a self-edge or a duplicate of an earlier one.
 */
public class InvalidInteractionException extends RuntimeException {

    public InvalidInteractionException(String message) {
        super(message);
    }
}
