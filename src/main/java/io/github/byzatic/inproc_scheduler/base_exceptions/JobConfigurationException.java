package io.github.byzatic.inproc_scheduler.base_exceptions;

/**
 * Raised synchronously when a job is configured in a way the scheduler cannot accept,
 * e.g. changing the first run of a registered job or registering a job twice.
 */
public class JobConfigurationException extends RuntimeException {
    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(Throwable cause) {
        super(cause);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobConfigurationException(Throwable cause, String message) {
        super(message, cause);
    }
}
