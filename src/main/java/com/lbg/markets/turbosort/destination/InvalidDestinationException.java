package com.lbg.markets.turbosort.destination;

/**
 * A marker destination that cannot be turned into a directory under the destination root.
 */
public class InvalidDestinationException extends RuntimeException {

    public InvalidDestinationException(String message) {
        super(message);
    }

    public InvalidDestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
