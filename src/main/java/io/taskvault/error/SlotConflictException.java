package io.taskvault.error;

public final class SlotConflictException extends TaskVaultException {
    private final String occupyingTaskId;
    private final String occupyingTitle;

    public SlotConflictException(String occupyingTaskId, String occupyingTitle) {
        super("Slot is already taken by task " + occupyingTaskId + " (" + occupyingTitle + ")");
        this.occupyingTaskId = occupyingTaskId;
        this.occupyingTitle = occupyingTitle;
    }

    public String occupyingTaskId() {
        return occupyingTaskId;
    }

    public String occupyingTitle() {
        return occupyingTitle;
    }
}
