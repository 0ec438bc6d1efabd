package me.golemcore.courseqa.domain.system.toolloop;

/** The query deadline elapsed; the in-flight round was abandoned. */
public class DeadlineExceededException extends RoundControllerException {

    private static final long serialVersionUID = 1L;

    private final RoundState state;

    public DeadlineExceededException(RoundState state) {
        super("Deadline exceeded while " + describe(state));
        this.state = state;
    }

    public RoundState getState() {
        return state;
    }

    private static String describe(RoundState state) {
        return state == RoundState.DISPATCHING_TOOLS ? "executing tools" : "waiting for the model";
    }
}
