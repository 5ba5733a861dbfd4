package io.github.hotbrkm.routersim.simulator.router.exception;

import lombok.Getter;

/**
 * Exception indicating a prefix length outside the range 0-32.
 */
@Getter
public class InvalidPrefixException extends RouteInputException {

    private final int prefixLength;

    public InvalidPrefixException(int prefixLength) {
        super("Invalid prefix length: " + prefixLength + ". Allowed range: 0-32.");
        this.prefixLength = prefixLength;
    }
}
