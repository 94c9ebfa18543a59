package com.example.llmexplorer.fingerprint;

import java.util.Locale;

public enum SwipeDirection {
    UP, DOWN, LEFT, RIGHT;

    public static SwipeDirection fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
