package com.example.tripstate.speculative;

public enum JobStatus {
    RUNNING,
    COMPLETE,
    ABORTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
