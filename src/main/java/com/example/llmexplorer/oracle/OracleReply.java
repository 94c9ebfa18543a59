package com.example.llmexplorer.oracle;

import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import lombok.Getter;
import lombok.ToString;

/**
 * 解析后的 LLM 回复：ACTION / STOP / INVALID 三选一
 */
@Getter
@ToString
public class OracleReply {

    public enum Kind {
        ACTION,
        STOP,
        INVALID
    }

    private final Kind kind;
    private final Interaction interaction;
    private final String elementId;
    private final String text;
    private final SwipeDirection direction;
    private final StopVerdict verdict;
    private final String reason;
    private final String problem;
    /** 模型顺带给出的当前界面描述，可选 */
    private String screenDescription;

    private OracleReply(Kind kind, Interaction interaction, String elementId, String text,
                        SwipeDirection direction, StopVerdict verdict, String reason, String problem) {
        this.kind = kind;
        this.interaction = interaction;
        this.elementId = elementId;
        this.text = text;
        this.direction = direction;
        this.verdict = verdict;
        this.reason = reason;
        this.problem = problem;
    }

    public static OracleReply action(Interaction interaction, String elementId, String text,
                                     SwipeDirection direction, String reason) {
        return new OracleReply(Kind.ACTION, interaction, elementId, text, direction, null, reason, null);
    }

    public static OracleReply stop(StopVerdict verdict, String reason) {
        return new OracleReply(Kind.STOP, null, null, null, null, verdict, reason, null);
    }

    OracleReply describing(String description) {
        this.screenDescription = description;
        return this;
    }

    public static OracleReply invalid(String problem) {
        return new OracleReply(Kind.INVALID, null, null, null, null, null, null, problem);
    }
}
