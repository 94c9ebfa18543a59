package com.example.llmexplorer.session.graph.nodes;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.fingerprint.StateFingerprint;
import com.example.llmexplorer.knowledge.KnowledgeRecord;
import com.example.llmexplorer.oracle.Decision;
import com.example.llmexplorer.oracle.DecisionOracle;
import com.example.llmexplorer.oracle.DecisionSource;
import com.example.llmexplorer.oracle.OracleRequest;
import com.example.llmexplorer.oracle.OracleRetriesExhaustedException;
import com.example.llmexplorer.oracle.OracleUnavailableException;
import com.example.llmexplorer.oracle.StopVerdict;
import com.example.llmexplorer.session.FallbackPolicy;
import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.TerminalReason;
import com.example.llmexplorer.session.graph.SessionNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 决策节点：强制动作 > 无元素时返回 > 兜底策略 > 询问 LLM
 */
@Slf4j
@RequiredArgsConstructor
public class DecideNode implements SessionNode {

    private final DecisionOracle decisionOracle;
    private final FallbackPolicy fallbackPolicy;
    private final ExplorerProperties properties;

    @Override
    public NodeResult execute(SessionContext context) {
        context.setDecision(null);
        context.setDecisionFailure(null);
        context.setExecutionResult(null);
        ObservedState observed = context.getCurrentObservation();

        Decision decision;
        if (context.getForcedDecision() != null) {
            decision = context.getForcedDecision();
            context.setForcedDecision(null);
        } else if (observed.getElements().isEmpty()) {
            decision = Decision.back(DecisionSource.NO_ELEMENTS, "no actionable elements on screen");
        } else if (context.isUseFallbackNext()) {
            context.setUseFallbackNext(false);
            decision = fallbackPolicy.choose(context.getGraph(), context.getCurrentNode(), observed,
                    context.getKnowledge(), context.bannedActionsAt(observed.getFingerprint()));
        } else {
            try {
                decision = decisionOracle.decide(buildRequest(context));
                context.setOracleErrors(context.getOracleErrors() + decision.getInvalidReplies());
                rememberDescription(context, decision.getScreenDescription());
            } catch (OracleRetriesExhaustedException e) {
                context.setOracleErrors(context.getOracleErrors() + e.getAttempts());
                context.setDecisionFailure(e.getMessage());
                context.setUseFallbackNext(true);
                log.warn("[Session] {} LLM 回复始终无效，记录失败步并在下一步使用兜底策略", context.getSessionId());
                return NodeResult.failure(e.getMessage());
            } catch (OracleUnavailableException e) {
                context.setOracleErrors(context.getOracleErrors() + 1);
                log.error("[Session] {} LLM 不可用，会话失败: {}", context.getSessionId(), e.getMessage());
                context.terminate(TerminalReason.Code.ORACLE_UNAVAILABLE, e.getMessage());
                return NodeResult.failure(e.getMessage());
            }
        }

        if (decision.isStop()) {
            context.getCurrentNode().setTerminal(true);
            TerminalReason.Code code = codeOf(decision.getVerdict());
            log.info("[Session] {} LLM 决定停止: {} ({})", context.getSessionId(), code.wireName(), decision.getReason());
            context.terminate(code, decision.getReason() == null ? "oracle stopped: " + code.wireName() : decision.getReason());
            return NodeResult.success();
        }

        context.setDecision(decision);
        log.debug("[Session] {} 决定 [{}]: {}", context.getSessionId(), decision.getSource(),
                decision.toDescriptor().describe());
        return NodeResult.success();
    }

    /**
     * 界面还没有描述时记下模型给的描述，已有描述的界面不覆盖
     */
    private void rememberDescription(SessionContext context, String description) {
        if (description == null || description.isBlank()) {
            return;
        }
        StateFingerprint fingerprint = context.getCurrentObservation().getFingerprint();
        if (context.getKnowledge().annotation(fingerprint, KnowledgeRecord.DESCRIPTION) != null
                || context.getDelta().annotation(fingerprint, KnowledgeRecord.DESCRIPTION) != null) {
            return;
        }
        context.getDelta().annotate(fingerprint, KnowledgeRecord.DESCRIPTION, description.trim());
        log.debug("[Session] {} 记录界面描述 {}: {}", context.getSessionId(),
                context.getCurrentObservation().getScreenName(), description);
    }

    private OracleRequest buildRequest(SessionContext context) {
        ObservedState observed = context.getCurrentObservation();
        return OracleRequest.builder()
                .appId(context.getAppId())
                .node(context.getCurrentNode())
                .observed(observed)
                .recentEdges(context.getGraph().recentEdges(properties.getOracle().getHistoryLength()))
                .pastTriedActions(context.getKnowledge().triedActions(observed.getFingerprint()))
                .crashActions(context.getKnowledge().crashActions(observed.getFingerprint()))
                .bannedActions(context.bannedActionsAt(observed.getFingerprint()))
                .goal(context.getJob().getGoal() == null ? null : context.getJob().getGoal().describe())
                .loopHint(context.getLoopHint())
                .screenDescription(context.getKnowledge()
                        .annotation(observed.getFingerprint(), KnowledgeRecord.DESCRIPTION))
                .build();
    }

    private static TerminalReason.Code codeOf(StopVerdict verdict) {
        if (verdict == StopVerdict.GOAL_REACHED) {
            return TerminalReason.Code.GOAL_REACHED;
        }
        if (verdict == StopVerdict.BUDGET_EXHAUSTED) {
            return TerminalReason.Code.BUDGET_EXHAUSTED;
        }
        return TerminalReason.Code.ORACLE_DONE;
    }
}
