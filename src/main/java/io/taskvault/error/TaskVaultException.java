package io.taskvault.error;

/**
 * Root of every failure the persistence core reports to its callers.
 */
public class TaskVaultException extends RuntimeException {
    public TaskVaultException(String message) {
        super(message);
    }

    public TaskVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
