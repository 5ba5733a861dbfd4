package io.github.hotbrkm.routersim.simulator.router.log;

/**
 * Exception indicating that the activity log could not be opened or written.
 */
public class ActivityLogException extends RuntimeException {
    public ActivityLogException(String message) {
        super(message);
    }

    public ActivityLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
