package io.cronlog4j.core;

/**
 * Thrown when something handed to the runner is not a usable job definition.
 */
public class InvalidJobException extends RuntimeException {

    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
