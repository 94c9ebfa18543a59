package com.example.llmexplorer.fingerprint;

import java.util.Locale;

/**
 * 可对界面执行的交互；BACK 是全局动作，不属于任何元素
 */
public enum Interaction {
    TAP("tap"),
    LONG_PRESS("long_press"),
    TYPE_TEXT("type_text"),
    SWIPE("swipe"),
    BACK("back");

    private final String wireName;

    Interaction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isGlobal() {
        return this == BACK;
    }

    /**
     * 按 LLM 回复里的写法解析（tap、long_press、long-press、LONG_PRESS 都认），不认识返回 null
     */
    public static Interaction fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Interaction interaction : values()) {
            if (interaction.wireName.equals(normalized)) {
                return interaction;
            }
        }
        return null;
    }
}
