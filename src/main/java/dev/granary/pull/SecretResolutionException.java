package dev.granary.pull;

public class SecretResolutionException extends RuntimeException {

    public SecretResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
