package com.marketsim.simulation;

public enum RunState {
    CONFIGURED,
    RUNNING,
    COMPLETED,
    FAILED
}
