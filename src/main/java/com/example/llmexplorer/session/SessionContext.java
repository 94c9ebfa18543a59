package com.example.llmexplorer.session;

import com.example.llmexplorer.dto.DeviceHandle;
import com.example.llmexplorer.dto.JobDescriptor;
import com.example.llmexplorer.dto.StepTrace;
import com.example.llmexplorer.executor.DeviceDriver;
import com.example.llmexplorer.executor.ExecutionResult;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.fingerprint.StateFingerprint;
import com.example.llmexplorer.graph.ActivityGraph;
import com.example.llmexplorer.graph.GraphNode;
import com.example.llmexplorer.graph.LoopDetector;
import com.example.llmexplorer.knowledge.KnowledgeDelta;
import com.example.llmexplorer.knowledge.KnowledgeSnapshot;
import com.example.llmexplorer.oracle.Decision;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 会话上下文 - 一次探索会话的全部可变状态
 * 这是会话的"短期记忆"，只被所属会话的线程访问
 */
@Data
public class SessionContext {

    // ==================== 会话身份 ====================

    private String sessionId;
    private JobDescriptor job;
    private DeviceHandle device;
    private DeviceDriver driver;
    private StopSignal stopSignal;

    // ==================== 探索状态 ====================

    private ActivityGraph graph;
    private LoopDetector loopDetector;
    /** 会话开始时的知识快照，之后不变 */
    private KnowledgeSnapshot knowledge;
    /** 本会话产生的知识增量 */
    private KnowledgeDelta delta;

    private SessionState state = SessionState.OBSERVING;
    private Instant startedAt;
    private Instant deadline;

    /**
     * 当前所在界面
     */
    private ObservedState currentObservation;
    private GraphNode currentNode;

    /**
     * Recording 阶段已抓取到的下一个界面，Observing 直接复用，避免重复抓取
     */
    private ObservedState pendingObservation;
    private GraphNode pendingNode;

    // ==================== 单步状态 ====================

    private Decision decision;
    /** 本步没有得到决定时的原因（LLM 回复始终无效） */
    private String decisionFailure;
    private ExecutionResult executionResult;
    private Instant stepStartedAt;

    /** 下一步使用兜底策略而不是询问 LLM */
    private boolean useFallbackNext;
    /** 下一步强制执行的决定（循环逃逸） */
    private Decision forcedDecision;
    private String loopHint;
    private int loopStrikes;

    /** 需要进入 Recovering：观察时崩溃或循环逃逸需要重启 */
    private boolean recoveryRequested;
    /** 恢复原因是离开了被测 App */
    private boolean recoveringFromLeftApp;
    /** 恢复完成后还要记录本步的边 */
    private boolean recordAfterRecovery;
    /** 观察时连续发现崩溃的次数，成功观察后清零 */
    private int consecutiveObserveCrashes;

    /** 本会话中发现会离开 App 的元素动作，全 App 禁用 */
    private final Set<String> sessionBannedActions = new LinkedHashSet<>();
    /** 本会话中只在某个界面禁用的动作：指纹 -> 动作 key */
    private final Map<String, Set<String>> screenBannedActions = new HashMap<>();

    // ==================== 统计 ====================

    private int stepsTaken;
    private int oracleErrors;
    private int crashes;
    private int loopsDetected;
    private final List<StepTrace> traces = new ArrayList<>();

    private TerminalReason terminalReason;

    public void terminate(TerminalReason.Code code, String message) {
        if (terminalReason != null) {
            return;
        }
        this.terminalReason = TerminalReason.of(code, message);
        this.state = code.isFailure() ? SessionState.FAILED : SessionState.DONE;
    }

    public boolean isTerminated() {
        return terminalReason != null;
    }

    public void banOnScreen(StateFingerprint fingerprint, String actionKey) {
        screenBannedActions.computeIfAbsent(fingerprint.value(), fp -> new LinkedHashSet<>()).add(actionKey);
        delta.banOn(fingerprint, actionKey);
    }

    public void banEverywhere(String actionKey) {
        sessionBannedActions.add(actionKey);
        delta.ban(actionKey);
    }

    /**
     * 当前在该界面上不能选的动作：以往会话 + 本会话，全 App 的 + 只针对该界面的
     */
    public Set<String> bannedActionsAt(StateFingerprint fingerprint) {
        Set<String> banned = new LinkedHashSet<>(knowledge.bannedActions(fingerprint));
        banned.addAll(sessionBannedActions);
        banned.addAll(screenBannedActions.getOrDefault(fingerprint.value(), Set.of()));
        return banned;
    }

    public String getAppId() {
        return job.getAppId();
    }
}
