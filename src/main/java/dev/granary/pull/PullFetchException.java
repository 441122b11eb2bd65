package dev.granary.pull;

/** A pull request kept failing on connection or timeout errors until retries ran out. */
public class PullFetchException extends RuntimeException {

    private final int attempts;

    public PullFetchException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
