package me.golemcore.invocation.domain.model;

/**
 * Why the model stopped generating.
 */
public enum FinishReason {
    STOP, LENGTH, TOOL_CALLS, CONTENT_FILTER
}
