package com.example.llmexplorer.session;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.ToString;

/**
 * 会话结束的原因：机器可读的 code + 给人看的说明
 */
@Getter
@ToString
public class TerminalReason {

    public enum Code {
        GOAL_REACHED("goal-reached", false),
        ORACLE_DONE("oracle-done", false),
        BUDGET_EXHAUSTED("budget-exhausted", false),
        TIME_BUDGET_EXHAUSTED("time-budget-exhausted", false),
        STOPPED("stopped", false),
        CAPTURE("capture", true),
        ORACLE_UNAVAILABLE("oracle-unavailable", true),
        RECOVERY("recovery", true),
        DRIVER_UNAVAILABLE("driver-unavailable", true),
        INTERNAL_ERROR("internal-error", true);

        private final String wireName;
        private final boolean failure;

        Code(String wireName, boolean failure) {
            this.wireName = wireName;
            this.failure = failure;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public boolean isFailure() {
            return failure;
        }
    }

    private final Code code;
    private final String message;

    private TerminalReason(Code code, String message) {
        this.code = code;
        this.message = message;
    }

    public static TerminalReason of(Code code, String message) {
        return new TerminalReason(code, message == null ? code.wireName() : message);
    }

    public SessionStatus getStatus() {
        return code.isFailure() ? SessionStatus.FAILED : SessionStatus.DONE;
    }
}
