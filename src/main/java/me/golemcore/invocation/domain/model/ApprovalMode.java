package me.golemcore.invocation.domain.model;

/**
 * Whether a tool needs explicit caller approval before each invocation.
 */
public enum ApprovalMode {
    NEVER_REQUIRE, ALWAYS_REQUIRE
}
