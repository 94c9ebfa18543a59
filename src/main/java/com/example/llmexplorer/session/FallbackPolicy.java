package com.example.llmexplorer.session;

import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.graph.ActivityGraph;
import com.example.llmexplorer.graph.GraphNode;
import com.example.llmexplorer.knowledge.KnowledgeSnapshot;
import com.example.llmexplorer.oracle.Decision;
import com.example.llmexplorer.oracle.DecisionSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * LLM 给不出有效决定时的兜底策略
 *
 * 1. 当前界面本次和以往都没试过的动作（按元素顺序）
 * 2. 本次没试过的动作
 * 3. 有更浅的未探索界面时按返回键
 * 4. 尝试次数最少的动作
 * 被禁用（会离开 App）的动作始终跳过，返回键在本界面被禁用时只作为最后手段
 */
@Slf4j
@Component
public class FallbackPolicy {

    public Decision choose(ActivityGraph graph, GraphNode node, ObservedState observed,
                           KnowledgeSnapshot knowledge, Set<String> banned) {
        Set<String> pastTried = knowledge.triedActions(observed.getFingerprint());
        Set<String> crashed = knowledge.crashActions(observed.getFingerprint());

        ActionableElement leastTriedElement = null;
        Interaction leastTriedInteraction = null;
        int leastAttempts = Integer.MAX_VALUE;
        ActionableElement sessionUntriedElement = null;
        Interaction sessionUntriedInteraction = null;

        for (ActionableElement element : observed.getElements()) {
            for (Interaction interaction : element.getInteractions()) {
                String key = element.actionKey(interaction);
                if (banned.contains(key)) {
                    continue;
                }
                int attempts = node.attemptsOf(key);
                if (attempts == 0 && !pastTried.contains(key) && !crashed.contains(key)) {
                    return Decision.act(element, interaction, DecisionSource.FALLBACK, "untried action");
                }
                if (attempts == 0 && sessionUntriedElement == null) {
                    sessionUntriedElement = element;
                    sessionUntriedInteraction = interaction;
                }
                if (attempts < leastAttempts) {
                    leastAttempts = attempts;
                    leastTriedElement = element;
                    leastTriedInteraction = interaction;
                }
            }
        }

        if (sessionUntriedElement != null) {
            return Decision.act(sessionUntriedElement, sessionUntriedInteraction, DecisionSource.FALLBACK,
                    "untried in this session");
        }

        boolean backBanned = banned.contains(ActionableElement.BACK_ACTION_KEY);
        List<GraphNode> frontier = graph.shortestUnexploredFrontier();
        if (!backBanned && !frontier.isEmpty() && frontier.get(0) != node) {
            log.debug("[Session] 兜底：返回以靠近深度 {} 的未探索界面 {}",
                    frontier.get(0).getDepth(), frontier.get(0).getScreenName());
            return Decision.back(DecisionSource.FALLBACK, "head towards unexplored " + frontier.get(0).getScreenName());
        }

        if (leastTriedElement != null
                && (backBanned || leastAttempts < node.attemptsOf(ActionableElement.BACK_ACTION_KEY))) {
            return Decision.act(leastTriedElement, leastTriedInteraction, DecisionSource.FALLBACK, "least tried action");
        }
        return Decision.back(DecisionSource.FALLBACK, "nothing left to try here");
    }
}
