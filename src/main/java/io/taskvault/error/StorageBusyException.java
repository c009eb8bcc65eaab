package io.taskvault.error;

public final class StorageBusyException extends TaskVaultException {
    public StorageBusyException(String operation, long waitedMs) {
        super(operation + " could not acquire the storage lock within " + waitedMs + "ms");
    }
}
