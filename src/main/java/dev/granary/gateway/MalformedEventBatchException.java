package dev.granary.gateway;

/** The webhook body is not JSON, or not a JSON array of events. */
public class MalformedEventBatchException extends RuntimeException {

    public MalformedEventBatchException(String message) {
        super(message);
    }

    public MalformedEventBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
