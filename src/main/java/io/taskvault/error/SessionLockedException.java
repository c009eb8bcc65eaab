package io.taskvault.error;

public final class SessionLockedException extends TaskVaultException {
    public SessionLockedException() {
        super("Storage is locked; initialize or log in first");
    }
}
