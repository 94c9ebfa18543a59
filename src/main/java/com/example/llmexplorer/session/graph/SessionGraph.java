package com.example.llmexplorer.session.graph;

import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.SessionState;
import com.example.llmexplorer.session.TerminalReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * 会话状态图
 *
 * 每次状态转换前检查步数预算；进入 OBSERVING（步与步之间）时再检查时间预算与全局停止信号
 */
@Slf4j
public class SessionGraph {

    private final Map<SessionState, SessionNode> nodes = new EnumMap<>(SessionState.class);
    private final Map<SessionState, SessionEdge> edges = new EnumMap<>(SessionState.class);
    private SessionState startState;

    public SessionGraph addNode(SessionState state, SessionNode node) {
        nodes.put(state, node);
        return this;
    }

    public SessionGraph addEdge(SessionState from, SessionEdge edge) {
        edges.put(from, edge);
        return this;
    }

    public SessionGraph setStart(SessionState state) {
        this.startState = state;
        return this;
    }

    public void execute(SessionContext context) {
        if (startState == null) {
            throw new IllegalStateException("起始状态未设置");
        }

        SessionState current = startState;
        long maxIterations = (long) context.getJob().getStepBudget() * 10 + 50;
        long iterations = 0;

        while (current != null && !context.isTerminated()) {
            if (++iterations > maxIterations) {
                log.error("[Graph] 达到最大迭代次数，可能存在死循环: {}", context.getSessionId());
                context.terminate(TerminalReason.Code.INTERNAL_ERROR, "state machine exceeded " + maxIterations + " transitions");
                break;
            }
            if (checkBudgets(context, current)) {
                break;
            }

            SessionNode node = nodes.get(current);
            if (node == null) {
                throw new IllegalStateException("状态没有对应节点: " + current);
            }
            context.setState(current);
            log.debug("[Graph] 执行节点: {}", current);
            SessionNode.NodeResult result = node.execute(context);

            if (context.isTerminated()) {
                log.debug("[Graph] 节点 {} 结束了会话: {}", current, context.getTerminalReason());
                break;
            }
            SessionEdge edge = edges.get(current);
            if (edge == null) {
                log.debug("[Graph] 节点 {} 没有出边，执行结束", current);
                break;
            }
            SessionState next = edge.decide(context, result);
            log.debug("[Graph] 从 {} -> {}", current, next);
            current = next;
        }
        log.debug("[Graph] 状态图执行完成，共 {} 次转换", iterations);
    }

    /**
     * @return 是否已因预算或停止信号结束
     */
    private boolean checkBudgets(SessionContext context, SessionState next) {
        int stepBudget = context.getJob().getStepBudget();
        if (context.getStepsTaken() >= stepBudget) {
            context.terminate(TerminalReason.Code.BUDGET_EXHAUSTED, "step budget of " + stepBudget + " reached");
            return true;
        }
        if (next != SessionState.OBSERVING) {
            return false;
        }
        if (context.getStopSignal() != null && context.getStopSignal().isStopRequested()) {
            context.terminate(TerminalReason.Code.STOPPED, "stopped: " + context.getStopSignal().getReason());
            return true;
        }
        if (context.getDeadline() != null && !Instant.now().isBefore(context.getDeadline())) {
            context.terminate(TerminalReason.Code.TIME_BUDGET_EXHAUSTED,
                    "time budget of " + context.getJob().getTimeBudgetSeconds() + "s reached");
            return true;
        }
        return false;
    }
}
