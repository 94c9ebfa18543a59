package com.example.llmexplorer.session;

public enum SessionStatus {
    DONE,
    FAILED
}
