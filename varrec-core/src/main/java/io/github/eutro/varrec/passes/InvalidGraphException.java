package io.github.eutro.varrec.passes;

/**
 * Thrown when a function's block graph is structurally broken,
 * e.g. a successor that isn't one of the function's blocks.
 */
public class InvalidGraphException extends RuntimeException {
    public InvalidGraphException(String message) {
        super(message);
    }
}
