package com.example.llmexplorer.session.graph.nodes;

import com.example.llmexplorer.executor.ActionExecutionException;
import com.example.llmexplorer.executor.ActionExecutor;
import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.TerminalReason;
import com.example.llmexplorer.session.graph.SessionNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 恢复节点：崩溃、离开 App 或循环逃逸时把 App 带回可探索状态
 */
@Slf4j
@RequiredArgsConstructor
public class RecoverNode implements SessionNode {

    private final ActionExecutor actionExecutor;

    @Override
    public NodeResult execute(SessionContext context) {
        log.info("[Session] {} 开始恢复 {}", context.getSessionId(),
                context.isRecoveringFromLeftApp() ? "(离开了 App)" : "(重启 App)");
        try {
            actionExecutor.recover(context.getDriver(), context.getAppId(),
                    context.getJob().getEntryActivity(), context.isRecoveringFromLeftApp());
        } catch (ActionExecutionException e) {
            log.error("[Session] {} 恢复失败，会话失败", context.getSessionId(), e);
            context.terminate(TerminalReason.Code.RECOVERY, e.getMessage());
            return NodeResult.failure(e.getMessage());
        }

        context.setRecoveryRequested(false);
        context.setRecoveringFromLeftApp(false);
        context.setPendingObservation(null);
        context.setPendingNode(null);
        context.getLoopDetector().reset();
        return NodeResult.success();
    }
}
