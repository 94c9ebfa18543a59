package com.example.llmexplorer.session;

/**
 * 会话状态机的状态
 */
public enum SessionState {
    OBSERVING,
    DECIDING,
    ACTING,
    RECORDING,
    RECOVERING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
