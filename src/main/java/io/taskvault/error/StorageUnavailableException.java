package io.taskvault.error;

import io.taskvault.storage.StorageLocation;

import java.util.List;
import java.util.stream.Collectors;

public final class StorageUnavailableException extends TaskVaultException {
    private final List<StorageLocation.Attempt> attempts;

    public StorageUnavailableException(List<StorageLocation.Attempt> attempts) {
        super("No writable storage location found. Tried: " + describe(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<StorageLocation.Attempt> attempts() {
        return attempts;
    }

    private static String describe(List<StorageLocation.Attempt> attempts) {
        if (attempts.isEmpty()) {
            return "(no candidates)";
        }
        return attempts.stream()
                .map(a -> a.path() + " [" + a.reason() + (a.detail().isBlank() ? "" : ": " + a.detail()) + "]")
                .collect(Collectors.joining("; "));
    }
}
