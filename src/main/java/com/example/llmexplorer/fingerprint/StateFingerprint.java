package com.example.llmexplorer.fingerprint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

/**
 * 界面状态指纹（SHA-256 十六进制），不可变
 */
@EqualsAndHashCode
public final class StateFingerprint {

    private final String value;

    private StateFingerprint(String value) {
        this.value = value;
    }

    @JsonCreator
    public static StateFingerprint of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be blank");
        }
        return new StateFingerprint(value);
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** 日志里用的短形式 */
    public String shortValue() {
        return value.length() > 10 ? value.substring(0, 10) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
