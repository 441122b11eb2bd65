package dev.granary.pull;

/** The tool providing the iteration items could not be called. */
public class IterationResolutionException extends RuntimeException {

    public IterationResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
