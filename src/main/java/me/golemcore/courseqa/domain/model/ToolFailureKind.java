package me.golemcore.courseqa.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The model requested a tool name that is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * The tool is registered but switched off by configuration.
     */
    DISABLED,

    /**
     * Tool execution failed during runtime (exceptions, failed futures, missing
     * output).
     */
    EXECUTION_FAILED,

    /**
     * Tool did not settle within the per-tool timeout.
     */
    TIMEOUT
}
