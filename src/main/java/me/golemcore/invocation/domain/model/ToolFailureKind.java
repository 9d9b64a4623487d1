package me.golemcore.invocation.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The tool is declared for the model but has no local implementation.
     */
    DECLARATION_ONLY,

    /**
     * The tool reached its configured maximum number of invocations.
     */
    INVOCATION_LIMIT_EXCEEDED,

    /**
     * The tool reached its configured maximum number of failed invocations.
     */
    EXCEPTION_LIMIT_EXCEEDED,

    /**
     * Arguments could not be parsed or did not satisfy the input schema.
     */
    ARGUMENT_VALIDATION_FAILED,

    /**
     * The model requested a function that is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, etc.).
     */
    EXECUTION_FAILED
}
