package com.example.llmexplorer.session.graph.nodes;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.GoalSpec;
import com.example.llmexplorer.executor.AppCrashedException;
import com.example.llmexplorer.fingerprint.CaptureException;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.graph.GraphNode;
import com.example.llmexplorer.session.ScreenObserver;
import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.TerminalReason;
import com.example.llmexplorer.session.graph.SessionNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * 观察节点：确定当前界面（复用上一步 Recording 的抓取结果，或重新抓取）
 */
@Slf4j
@RequiredArgsConstructor
public class ObserveNode implements SessionNode {

    private final ScreenObserver screenObserver;
    private final ExplorerProperties properties;

    @Override
    public NodeResult execute(SessionContext context) {
        context.setStepStartedAt(Instant.now());

        ObservedState observed;
        GraphNode node;
        if (context.getPendingObservation() != null) {
            observed = context.getPendingObservation();
            node = context.getPendingNode();
            context.setPendingObservation(null);
            context.setPendingNode(null);
        } else {
            try {
                observed = screenObserver.capture(context);
            } catch (CaptureException e) {
                log.error("[Session] {} 无法获取界面，会话失败: {}", context.getSessionId(), e.getMessage());
                context.terminate(TerminalReason.Code.CAPTURE, e.getMessage());
                return NodeResult.failure(e.getMessage());
            } catch (AppCrashedException e) {
                log.warn("[Session] {} 观察时发现 App 已崩溃: {}", context.getSessionId(), e.getMessage());
                context.setCrashes(context.getCrashes() + 1);
                int crashesInRow = context.getConsecutiveObserveCrashes() + 1;
                context.setConsecutiveObserveCrashes(crashesInRow);
                int limit = Math.max(0, properties.getSession().getRecoveryRetries());
                if (crashesInRow > limit) {
                    log.error("[Session] {} App 连续 {} 次重启后仍然崩溃，会话失败", context.getSessionId(), limit);
                    context.terminate(TerminalReason.Code.RECOVERY,
                            "app still crashing after " + limit + " restarts: " + e.getMessage());
                    return NodeResult.failure(e.getMessage());
                }
                context.setRecoveryRequested(true);
                context.setRecoveringFromLeftApp(false);
                return NodeResult.failure(e.getMessage());
            }
            context.setConsecutiveObserveCrashes(0);
            node = screenObserver.arrive(context, observed);
        }

        context.setCurrentObservation(observed);
        context.setCurrentNode(node);
        log.debug("[Session] {} 第 {} 步，当前界面 {} (#{}, 访问 {} 次)", context.getSessionId(),
                context.getStepsTaken() + 1, observed.getScreenName(), node.getId(), node.getVisitCount());

        GoalSpec goal = context.getJob().getGoal();
        if (goal != null && goal.isReachedBy(observed.getScreenName())) {
            node.setTerminal(true);
            log.info("[Session] {} 到达目标界面 {}", context.getSessionId(), observed.getScreenName());
            context.terminate(TerminalReason.Code.GOAL_REACHED, "reached goal screen " + observed.getScreenName());
        }
        return NodeResult.success();
    }
}
