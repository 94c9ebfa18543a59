package com.example.llmexplorer.executor;

public enum ActionOutcome {
    SUCCESS,
    ELEMENT_STALE,
    APP_CRASHED,
    DRIVER_TIMEOUT,
    LEFT_APP
}
