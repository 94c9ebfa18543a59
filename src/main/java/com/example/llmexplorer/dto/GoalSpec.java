package com.example.llmexplorer.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 可选的探索目标：到达某个界面，或一段给 LLM 的自然语言描述
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoalSpec {

    private String screen;
    private String description;

    public boolean isReachedBy(String screenName) {
        if (screen == null || screen.isBlank() || screenName == null) {
            return false;
        }
        return screenName.equals(screen) || screenName.endsWith("." + screen) || screenName.endsWith("/" + screen);
    }

    /**
     * 给 LLM 看的目标描述
     */
    public String describe() {
        if (description != null && !description.isBlank()) {
            return screen == null ? description : description + " (target screen: " + screen + ")";
        }
        return screen == null ? null : "reach the screen " + screen;
    }
}
