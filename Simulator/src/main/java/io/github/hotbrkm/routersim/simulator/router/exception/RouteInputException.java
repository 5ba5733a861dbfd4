package io.github.hotbrkm.routersim.simulator.router.exception;

/**
 * Base type for rejected router input.
 * <p>
 * Thrown before any change is made to the routing table, so the caller can report
 * the message and keep the session running.
 */
public abstract class RouteInputException extends IllegalArgumentException {

    protected RouteInputException(String message) {
        super(message);
    }

    protected RouteInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
