package com.example.llmexplorer.fingerprint;

public enum ElementRole {
    BUTTON,
    TEXT_FIELD,
    LIST_ITEM,
    CHECKABLE,
    IMAGE,
    SCROLL_CONTAINER,
    OTHER
}
