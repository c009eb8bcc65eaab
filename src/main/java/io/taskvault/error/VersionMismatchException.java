package io.taskvault.error;

public final class VersionMismatchException extends TaskVaultException {
    private final int found;
    private final int expected;

    public VersionMismatchException(String backup, int found, int expected) {
        super("Backup " + backup + " has format version " + found + ", expected " + expected);
        this.found = found;
        this.expected = expected;
    }

    public int found() {
        return found;
    }

    public int expected() {
        return expected;
    }
}
