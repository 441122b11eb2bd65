package dev.granary.gateway;

/** A dependency of the gateway is not initialised yet; the caller should redeliver later. */
public class ServiceNotReadyException extends RuntimeException {

    public ServiceNotReadyException(String message) {
        super(message);
    }
}
