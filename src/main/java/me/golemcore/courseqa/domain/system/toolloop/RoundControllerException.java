package me.golemcore.courseqa.domain.system.toolloop;

/**
 * Failure of a whole query. Tool failures never surface here; only problems
 * talking to the model and deadline expiry do.
 */
public class RoundControllerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RoundControllerException(String message) {
        super(message);
    }

    public RoundControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
