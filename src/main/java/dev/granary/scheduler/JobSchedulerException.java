package dev.granary.scheduler;

/** The job scheduler could not be queried. */
public class JobSchedulerException extends RuntimeException {

    public JobSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
