package com.example.llmexplorer.graph;

public enum EdgeOutcome {
    SUCCESS,
    FAILURE,
    CRASH
}
