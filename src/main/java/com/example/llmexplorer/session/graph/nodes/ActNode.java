package com.example.llmexplorer.session.graph.nodes;

import com.example.llmexplorer.executor.ActionExecutor;
import com.example.llmexplorer.executor.ExecutionResult;
import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.oracle.Decision;
import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.graph.SessionNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 执行节点
 */
@Slf4j
@RequiredArgsConstructor
public class ActNode implements SessionNode {

    private final ActionExecutor actionExecutor;

    @Override
    public NodeResult execute(SessionContext context) {
        Decision decision = context.getDecision();
        ExecutionResult result = actionExecutor.execute(context.getDriver(), decision,
                context.getCurrentObservation(), context.getAppId());
        context.setExecutionResult(result);

        String actionKey = decision.actionKey();
        switch (result.getOutcome()) {
            case APP_CRASHED:
                context.setCrashes(context.getCrashes() + 1);
                context.getDelta().recordCrash(context.getCurrentObservation().getFingerprint(), actionKey);
                context.setRecoveringFromLeftApp(false);
                context.setRecordAfterRecovery(true);
                log.warn("[Session] {} 动作 {} 导致崩溃", context.getSessionId(), actionKey);
                break;
            case LEFT_APP:
                if (ActionableElement.BACK_ACTION_KEY.equals(actionKey)) {
                    // 返回键只在这个界面上会离开 App
                    context.banOnScreen(context.getCurrentObservation().getFingerprint(), actionKey);
                } else {
                    context.banEverywhere(actionKey);
                }
                context.setRecoveringFromLeftApp(true);
                context.setRecordAfterRecovery(true);
                log.info("[Session] {} 动作 {} 离开了被测 App，已禁用", context.getSessionId(), actionKey);
                break;
            default:
                break;
        }
        return result.isSuccess() ? NodeResult.success() : NodeResult.failure(result.getOutcome().name());
    }
}
