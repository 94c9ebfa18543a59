package com.example.llmexplorer.session;

import com.example.llmexplorer.dto.SessionResult;
import com.example.llmexplorer.session.graph.SessionGraph;
import lombok.extern.slf4j.Slf4j;

/**
 * 一台设备上的一次探索会话
 *
 * 任何意外异常都只会让本会话以 FAILED(internal-error) 结束，不影响其他会话
 */
@Slf4j
public class ExplorationSession {

    private final SessionContext context;
    private final SessionGraph graph;

    public ExplorationSession(SessionContext context, SessionGraph graph) {
        this.context = context;
        this.graph = graph;
    }

    public SessionResult run() {
        log.info("[Session] {} 开始探索 {}，步数预算 {}，时间预算 {}s", context.getSessionId(),
                context.getAppId(), context.getJob().getStepBudget(), context.getJob().getTimeBudgetSeconds());
        try {
            graph.execute(context);
            if (!context.isTerminated()) {
                context.terminate(TerminalReason.Code.INTERNAL_ERROR, "state machine stopped without a terminal state");
            }
        } catch (RuntimeException e) {
            log.error("[Session] {} 出现未预期的异常", context.getSessionId(), e);
            context.terminate(TerminalReason.Code.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        SessionResult result = SessionResult.from(context);
        log.info("[Session] {} 结束: {} ({}), {} 步, {} 个界面, {} 次崩溃, {} 次 LLM 错误",
                context.getSessionId(), result.getTerminalReason().getCode().wireName(),
                result.getTerminalReason().getMessage(), result.getStepsTaken(), result.getVisitedNodes(),
                result.getCrashes(), result.getOracleErrors());
        return result;
    }

    public SessionContext getContext() {
        return context;
    }
}
