package com.example.llmexplorer.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UI 层级树中的一个节点（对应 uiautomator dump 里的一个 node）
 *
 * bounds / focused / selected / checked / extras 属于易变属性，不参与指纹计算
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UiElementNode {

    private String className;
    private String resourceId;
    private String text;
    private String contentDesc;
    private String packageName;
    private Bounds bounds;

    private boolean clickable;
    private boolean longClickable;
    private boolean checkable;
    private boolean scrollable;
    private boolean editable;
    private boolean password;
    @Builder.Default
    private boolean enabled = true;

    private boolean focused;
    private boolean selected;
    private boolean checked;

    /** 其余原样保留的属性（index、时间戳之类） */
    @Builder.Default
    private Map<String, String> extras = new LinkedHashMap<>();

    @Builder.Default
    private List<UiElementNode> children = new ArrayList<>();

    public UiElementNode addChild(UiElementNode child) {
        children.add(child);
        return this;
    }

    public String simpleClassName() {
        if (className == null || className.isBlank()) {
            return "View";
        }
        int dot = className.lastIndexOf('.');
        return dot >= 0 ? className.substring(dot + 1) : className;
    }

    public boolean isTextInput() {
        return editable || (className != null && className.endsWith("EditText"));
    }
}
