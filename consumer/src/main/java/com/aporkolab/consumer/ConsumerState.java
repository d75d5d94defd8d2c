package com.aporkolab.consumer;

public enum ConsumerState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}
