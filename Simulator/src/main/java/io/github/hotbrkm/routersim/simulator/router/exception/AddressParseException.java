package io.github.hotbrkm.routersim.simulator.router.exception;

/**
 * Exception indicating that an address is not a valid dotted quad
 * (optionally followed by {@code /prefix}).
 */
public class AddressParseException extends RouteInputException {

    public AddressParseException(String message) {
        super(message);
    }

    public AddressParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
