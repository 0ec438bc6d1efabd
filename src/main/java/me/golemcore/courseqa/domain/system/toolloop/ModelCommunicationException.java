package me.golemcore.courseqa.domain.system.toolloop;

/** The model service could not be reached or returned no usable response. Not retried. */
public class ModelCommunicationException extends RoundControllerException {

    private static final long serialVersionUID = 1L;

    public ModelCommunicationException(String message) {
        super(message);
    }

    public ModelCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
