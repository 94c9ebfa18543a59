package com.example.llmexplorer.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 一次观察中可交互的元素，id 形如 E0、E1，只在本次观察内有效
 *
 * structuralKey 不含下标，跨会话稳定，用来生成动作 key；同一界面上重复的 key 按出现顺序加序号
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionableElement {

    public static final String BACK_ACTION_KEY = "global::BACK";

    private String id;
    private ElementRole role;
    private Bounds bounds;
    private String label;
    private String resourceId;
    private String className;
    private String text;
    private boolean password;
    @Builder.Default
    private Set<Interaction> interactions = EnumSet.noneOf(Interaction.class);
    private String structuralKey;

    public boolean supports(Interaction interaction) {
        return interactions.contains(interaction);
    }

    public String actionKey(Interaction interaction) {
        return structuralKey + "::" + interaction.name();
    }

    public static String actionKeyFor(ActionableElement element, Interaction interaction) {
        if (interaction == Interaction.BACK || element == null) {
            return BACK_ACTION_KEY;
        }
        return element.actionKey(interaction);
    }
}
