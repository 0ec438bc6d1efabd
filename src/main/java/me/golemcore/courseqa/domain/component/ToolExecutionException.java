package me.golemcore.courseqa.domain.component;

/**
 * Raised by a tool when an invocation cannot produce output. Never escapes the
 * dispatcher: it is converted into a failed tool result.
 */
public class ToolExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
