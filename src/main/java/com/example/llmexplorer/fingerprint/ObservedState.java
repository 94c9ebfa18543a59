package com.example.llmexplorer.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 指纹器的输出：指纹 + 按文档顺序编号的可交互元素 + 特征摘要
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedState {

    private StateFingerprint fingerprint;
    private String screenName;
    private String packageName;
    @Builder.Default
    private List<ActionableElement> elements = new ArrayList<>();
    private FeatureSummary summary;

    public Optional<ActionableElement> findElement(String elementId) {
        if (elementId == null) {
            return Optional.empty();
        }
        return elements.stream()
                .filter(e -> elementId.equalsIgnoreCase(e.getId()))
                .findFirst();
    }

    /**
     * 当前界面全部已知动作 key，元素顺序在前，BACK 在最后
     */
    public Set<String> actionKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (ActionableElement element : elements) {
            for (Interaction interaction : element.getInteractions()) {
                keys.add(element.actionKey(interaction));
            }
        }
        keys.add(ActionableElement.BACK_ACTION_KEY);
        return keys;
    }
}
