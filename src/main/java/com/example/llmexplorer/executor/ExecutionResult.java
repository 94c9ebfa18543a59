package com.example.llmexplorer.executor;

import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.ObservedState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ExecutionResult {

    private final ActionOutcome outcome;
    /** 实际操作的元素（元素失效后重新定位时与决策中的不同） */
    private final ActionableElement target;
    /** 元素失效时重新抓取到的界面，没有则为 null */
    private final ObservedState refreshed;
    private final String detail;

    public boolean isSuccess() {
        return outcome == ActionOutcome.SUCCESS;
    }

    public boolean needsRecovery() {
        return outcome == ActionOutcome.APP_CRASHED || outcome == ActionOutcome.LEFT_APP;
    }
}
