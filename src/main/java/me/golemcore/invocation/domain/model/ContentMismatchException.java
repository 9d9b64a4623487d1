package me.golemcore.invocation.domain.model;

/**
 * Thrown when two content fragments that are expected to describe the same item
 * cannot be merged, for example function call fragments with different call ids.
 */
public class ContentMismatchException extends RuntimeException {

    public ContentMismatchException(String message) {
        super(message);
    }
}
