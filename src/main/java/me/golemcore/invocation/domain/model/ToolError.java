package me.golemcore.invocation.domain.model;

/**
 * Failure captured on a function result instead of being thrown.
 *
 * @param kind
 *            machine-readable failure classification
 * @param message
 *            the text sent back to the model
 * @param cause
 *            the underlying exception, if any
 */
public record ToolError(ToolFailureKind kind, String message, Throwable cause) {

    public static ToolError of(ToolFailureKind kind, String message) {
        return new ToolError(kind, message, null);
    }
}
