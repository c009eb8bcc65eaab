package io.taskvault.error;

public final class NotFoundException extends TaskVaultException {
    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
