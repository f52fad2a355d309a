package com.webmon.service.runtime;

public enum TaskState {
    NOT_STARTED,
    RUNNING,
    FINISHED,
    CANCELLED,
    FAILED;

    public boolean terminal() {
        return this == FINISHED || this == CANCELLED || this == FAILED;
    }
}
