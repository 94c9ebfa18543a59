package com.example.llmexplorer.graph;

import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 边上记录的动作描述
 *
 * actionKey 为空表示这一步没有真正执行动作（比如 LLM 回复始终无效）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionDescriptor {

    private String actionKey;
    private Interaction interaction;
    private String elementId;
    private String label;
    private String text;
    private SwipeDirection direction;
    private String note;

    public static ActionDescriptor notPerformed(String reason) {
        return ActionDescriptor.builder().note(reason).build();
    }

    @JsonIgnore
    public boolean isAttempt() {
        return actionKey != null;
    }

    public String describe() {
        if (!isAttempt()) {
            return "(no action: " + note + ")";
        }
        StringBuilder sb = new StringBuilder(interaction.name());
        if (label != null) {
            sb.append(" \"").append(label).append('"');
        }
        if (elementId != null) {
            sb.append(" (").append(elementId).append(')');
        }
        if (text != null) {
            sb.append(" text=\"").append(text).append('"');
        }
        if (direction != null) {
            sb.append(" ").append(direction.name().toLowerCase());
        }
        return sb.toString();
    }
}
