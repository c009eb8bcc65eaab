package io.taskvault.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of storage resolution: the candidates in probe order, the root that passed and the
 * diagnostic trail of every candidate that was tried.
 */
public record StorageLocation(List<Path> candidates, Path activeRoot, List<Attempt> attempts) {
    public StorageLocation {
        candidates = List.copyOf(candidates);
        attempts = List.copyOf(attempts);
    }

    public record Attempt(Path path, FailureReason reason, String detail) {
        public boolean succeeded() {
            return reason == FailureReason.NONE;
        }
    }

    public enum FailureReason {
        NONE,
        PERMISSION_DENIED,
        READ_ONLY_FILESYSTEM,
        PATH_TOO_LONG,
        DISK_FULL,
        NOT_A_DIRECTORY,
        PROBE_MISMATCH,
        IO_ERROR
    }
}
