package io.taskvault.error;

public final class LimitExceededException extends TaskVaultException {
    private final String taskId;
    private final int limit;

    public LimitExceededException(String taskId, int limit) {
        super("Task " + taskId + " already has " + limit + " strikes today");
        this.taskId = taskId;
        this.limit = limit;
    }

    public String taskId() {
        return taskId;
    }

    public int limit() {
        return limit;
    }
}
