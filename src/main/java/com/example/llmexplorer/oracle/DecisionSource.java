package com.example.llmexplorer.oracle;

public enum DecisionSource {
    ORACLE,
    FALLBACK,
    NO_ELEMENTS,
    LOOP_ESCAPE
}
