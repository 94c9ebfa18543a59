package com.example.llmexplorer.session.graph.nodes;

import com.example.llmexplorer.dto.StepTrace;
import com.example.llmexplorer.executor.ActionOutcome;
import com.example.llmexplorer.executor.AppCrashedException;
import com.example.llmexplorer.executor.ExecutionResult;
import com.example.llmexplorer.fingerprint.CaptureException;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.graph.ActionDescriptor;
import com.example.llmexplorer.graph.EdgeOutcome;
import com.example.llmexplorer.graph.GraphEdge;
import com.example.llmexplorer.graph.GraphNode;
import com.example.llmexplorer.graph.LoopDetector;
import com.example.llmexplorer.oracle.Decision;
import com.example.llmexplorer.oracle.DecisionSource;
import com.example.llmexplorer.session.ScreenObserver;
import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.TerminalReason;
import com.example.llmexplorer.session.graph.SessionNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * 记录节点：每一步恰好追加一条边（失败步也不例外），并更新知识增量与循环检测
 */
@Slf4j
@RequiredArgsConstructor
public class RecordNode implements SessionNode {

    private final ScreenObserver screenObserver;

    @Override
    public NodeResult execute(SessionContext context) {
        GraphNode source = context.getCurrentNode();
        Decision decision = context.getDecision();
        context.setRecordAfterRecovery(false);

        if (decision == null) {
            ActionDescriptor failed = ActionDescriptor.notPerformed(context.getDecisionFailure());
            GraphEdge edge = context.getGraph().recordEdge(source, failed, source, EdgeOutcome.FAILURE);
            context.setPendingObservation(context.getCurrentObservation());
            context.setPendingNode(source);
            finishStep(context, edge, null, false);
            return NodeResult.failure(context.getDecisionFailure());
        }

        ExecutionResult execution = context.getExecutionResult();
        ActionDescriptor descriptor = describe(decision, execution);

        ObservedState observed;
        try {
            observed = screenObserver.capture(context);
        } catch (CaptureException e) {
            GraphEdge edge = context.getGraph().recordEdge(source, descriptor, source, EdgeOutcome.FAILURE);
            context.getDelta().recordTried(source.getFingerprint(), descriptor.getActionKey());
            finishStep(context, edge, decision, false);
            log.error("[Session] {} 动作后无法获取界面，会话失败: {}", context.getSessionId(), e.getMessage());
            context.terminate(TerminalReason.Code.CAPTURE, e.getMessage());
            return NodeResult.failure(e.getMessage());
        } catch (AppCrashedException e) {
            GraphEdge edge = context.getGraph().recordEdge(source, descriptor, source, EdgeOutcome.CRASH);
            context.getDelta().recordCrash(source.getFingerprint(), descriptor.getActionKey());
            context.setCrashes(context.getCrashes() + 1);
            context.setRecoveryRequested(true);
            context.setRecoveringFromLeftApp(false);
            finishStep(context, edge, decision, false);
            log.warn("[Session] {} 动作后 App 崩溃: {}", context.getSessionId(), e.getMessage());
            return NodeResult.failure(e.getMessage());
        }

        GraphNode destination = screenObserver.arrive(context, observed);
        boolean newNode = destination != source && destination.getVisitCount() == 1;
        GraphEdge edge = context.getGraph().recordEdge(source, descriptor, destination, outcomeOf(execution));
        context.getDelta().recordTried(source.getFingerprint(), descriptor.getActionKey());

        context.setPendingObservation(observed);
        context.setPendingNode(destination);
        finishStep(context, edge, decision, newNode);
        return NodeResult.success();
    }

    private ActionDescriptor describe(Decision decision, ExecutionResult execution) {
        ActionDescriptor descriptor = decision.toDescriptor();
        if (execution != null && execution.getTarget() != null) {
            descriptor.setElementId(execution.getTarget().getId());
        }
        return descriptor;
    }

    private EdgeOutcome outcomeOf(ExecutionResult execution) {
        if (execution == null) {
            return EdgeOutcome.FAILURE;
        }
        if (execution.getOutcome() == ActionOutcome.APP_CRASHED) {
            return EdgeOutcome.CRASH;
        }
        return execution.isSuccess() ? EdgeOutcome.SUCCESS : EdgeOutcome.FAILURE;
    }

    private void finishStep(SessionContext context, GraphEdge edge, Decision decision, boolean newNode) {
        context.setStepsTaken(context.getStepsTaken() + 1);

        GraphNode source = edge.getSource();
        if (context.getGraph().isDeadEnd(source)) {
            context.getDelta().markDeadEnd(source.getFingerprint());
        }

        Instant started = context.getStepStartedAt();
        context.getTraces().add(StepTrace.builder()
                .step(edge.getStep())
                .fromScreen(edge.getSourceScreen())
                .toScreen(edge.getDestinationScreen())
                .action(edge.getAction().describe())
                .decisionSource(decision == null ? null : decision.getSource().name())
                .outcome(edge.getOutcome().name())
                .newScreen(newNode)
                .durationMs(started == null ? null : Duration.between(started, Instant.now()).toMillis())
                .build());
        log.debug("[Session] {} 第 {} 步: {} -[{}]-> {} {}", context.getSessionId(), edge.getStep(),
                edge.getSourceScreen(), edge.getAction().describe(), edge.getDestinationScreen(), edge.getOutcome());

        updateLoopState(context, edge, newNode);
    }

    /**
     * 第一次发现循环提示 LLM，第二次强制返回，第三次重启 App
     */
    private void updateLoopState(SessionContext context, GraphEdge edge, boolean newNode) {
        LoopDetector detector = context.getLoopDetector();
        detector.record(edge.getDestinationFingerprint(), newNode);

        if (newNode) {
            context.setLoopStrikes(0);
            context.setLoopHint(null);
            return;
        }
        if (!detector.isLooping()) {
            return;
        }

        String screens = context.getGraph().getNodes().stream()
                .filter(node -> detector.loopFingerprints().contains(node.getFingerprint()))
                .map(GraphNode::getScreenName)
                .distinct()
                .collect(Collectors.joining(", "));
        context.setLoopsDetected(context.getLoopsDetected() + 1);
        context.setLoopStrikes(context.getLoopStrikes() + 1);
        detector.reset();
        log.info("[Session] {} 检测到导航循环（第 {} 次）: {}", context.getSessionId(), context.getLoopStrikes(), screens);

        if (context.getLoopStrikes() == 1) {
            context.setLoopHint("you keep going back and forth between " + screens
                    + " without finding anything new; pick an action you have not tried yet");
        } else if (context.getLoopStrikes() == 2) {
            context.setForcedDecision(Decision.back(DecisionSource.LOOP_ESCAPE, "escape navigation loop"));
        } else {
            context.setRecoveryRequested(true);
            context.setRecoveringFromLeftApp(false);
            context.setLoopStrikes(0);
            context.setLoopHint(null);
        }
    }
}
