package com.example.llmexplorer.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeviceType {
    EMULATOR,
    PHYSICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 兼容 "emulator" / "physical" / "real_device" 等写法
     */
    @JsonCreator
    public static DeviceType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("emu")) {
            return EMULATOR;
        }
        if ("physical".equals(normalized) || normalized.startsWith("real") || "device".equals(normalized)) {
            return PHYSICAL;
        }
        throw new IllegalArgumentException("unknown device type: " + value);
    }
}
