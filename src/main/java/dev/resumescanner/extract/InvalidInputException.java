package dev.resumescanner.extract;

/**
 * Thrown when the engine is handed input it cannot work with at all, such as null text.
 * Malformed content never raises this; extractors degrade to empty values instead.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
