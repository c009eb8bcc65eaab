package io.taskvault.model;

public enum TaskState {
    ACTIVE,
    STRUCK_TODAY,
    COMPLETED
}
