package io.taskvault.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A staged commit passed its commit point but the live files could not all be replaced. The
 * journal stays on disk and {@link StagedCommit#recover(Path)} finishes the work on the next start.
 */
public final class IncompleteCommitException extends IOException {
    private final String operation;
    private final Path stagingDir;

    public IncompleteCommitException(String operation, Path stagingDir, IOException cause) {
        super("Commit '" + operation + "' is incomplete; pending files remain in " + stagingDir, cause);
        this.operation = operation;
        this.stagingDir = stagingDir;
    }

    public String operation() {
        return operation;
    }

    public Path stagingDir() {
        return stagingDir;
    }
}
