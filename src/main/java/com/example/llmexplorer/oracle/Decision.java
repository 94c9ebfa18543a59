package com.example.llmexplorer.oracle;

import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.example.llmexplorer.graph.ActionDescriptor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 一步的决定：执行一个动作，或者停止探索
 */
@Getter
@Builder
@ToString
public class Decision {

    public enum Kind {
        ACTION,
        STOP
    }

    private final Kind kind;
    /** BACK 时为 null */
    private final ActionableElement element;
    private final Interaction interaction;
    private final String text;
    private final SwipeDirection direction;
    private final StopVerdict verdict;
    private final DecisionSource source;
    private final String reason;
    /** 得到这个决定之前 LLM 给出的无效回复数 */
    private final int invalidReplies;
    private final String screenDescription;

    public static Decision back(DecisionSource source, String reason) {
        return Decision.builder()
                .kind(Kind.ACTION)
                .interaction(Interaction.BACK)
                .source(source)
                .reason(reason)
                .build();
    }

    public static Decision act(ActionableElement element, Interaction interaction, DecisionSource source, String reason) {
        Decision.DecisionBuilder builder = Decision.builder()
                .kind(Kind.ACTION)
                .element(element)
                .interaction(interaction)
                .source(source)
                .reason(reason);
        if (interaction == Interaction.SWIPE) {
            builder.direction(SwipeDirection.UP);
        }
        return builder.build();
    }

    public boolean isStop() {
        return kind == Kind.STOP;
    }

    public String actionKey() {
        return ActionableElement.actionKeyFor(element, interaction);
    }

    public ActionDescriptor toDescriptor() {
        return ActionDescriptor.builder()
                .actionKey(actionKey())
                .interaction(interaction)
                .elementId(element == null ? null : element.getId())
                .label(element == null ? null : element.getLabel())
                .text(text)
                .direction(direction)
                .note(source == null ? null : source.name())
                .build();
    }
}
