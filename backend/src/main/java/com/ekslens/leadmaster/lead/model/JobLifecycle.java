package com.ekslens.leadmaster.lead.model;

public enum JobLifecycle {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
