package com.polyfetch.orchestrator;

public enum OrchestrationState {
    NOT_STARTED,
    ALL_DISPATCHED,
    ALL_COMPLETED
}
