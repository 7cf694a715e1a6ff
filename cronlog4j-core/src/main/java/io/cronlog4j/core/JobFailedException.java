package io.cronlog4j.core;

import java.util.Objects;

/**
 * Lets a job fail while keeping the status text it produced so far.
 *
 * <p>The runner stores {@link #partialMessage()} in front of the failure detail of the cause.
 */
public class JobFailedException extends Exception {

    private final String partialMessage;

    public JobFailedException(String partialMessage, Throwable cause) {
        super(partialMessage, Objects.requireNonNull(cause, "cause must not be null"));
        this.partialMessage = partialMessage;
    }

    public String partialMessage() {
        return partialMessage;
    }
}
