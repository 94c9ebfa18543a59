package com.example.llmexplorer.graph;

import com.example.llmexplorer.fingerprint.StateFingerprint;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单个会话的活动图（界面 = 节点，动作 = 边）
 *
 * 每个会话独占一张图，不跨线程共享，因此不加锁
 */
@Slf4j
public class ActivityGraph {

    private final Map<StateFingerprint, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Map<Integer, List<GraphNode>> adjacency = new LinkedHashMap<>();
    private final int deadEndRetryBudget;
    private GraphNode entry;

    public ActivityGraph(int deadEndRetryBudget) {
        if (deadEndRetryBudget < 1) {
            throw new IllegalArgumentException("deadEndRetryBudget must be >= 1");
        }
        this.deadEndRetryBudget = deadEndRetryBudget;
    }

    /**
     * 按指纹查找节点，不存在则创建；每次调用访问计数 +1
     */
    public GraphNode lookupOrCreate(StateFingerprint fingerprint, String screenName, Collection<String> actionKeys) {
        GraphNode node = nodes.get(fingerprint);
        if (node == null) {
            node = new GraphNode(nodes.size(), fingerprint, screenName);
            nodes.put(fingerprint, node);
            if (entry == null) {
                entry = node;
                node.setDepth(0);
            }
            log.debug("[Graph] 新节点 #{} {}", node.getId(), screenName);
        }
        node.visit();
        node.registerActions(actionKeys);
        return node;
    }

    public GraphEdge recordEdge(GraphNode source, ActionDescriptor action, GraphNode destination, EdgeOutcome outcome) {
        requireOwned(source, "source");
        requireOwned(destination, "destination");

        GraphEdge edge = new GraphEdge(edges.size() + 1, source, action, destination, outcome, Instant.now());
        edges.add(edge);
        adjacency.computeIfAbsent(source.getId(), k -> new ArrayList<>()).add(destination);

        if (action != null && action.isAttempt()) {
            source.recordAttempt(action.getActionKey());
        }
        if (destination != source && destination.getVisitCount() == 1) {
            source.setDiscoveredNew(true);
        }
        recomputeDepths();
        return edge;
    }

    /**
     * 所有已知动作都试够了次数，且从未通往新节点
     *
     * 观察得到的节点至少有 BACK，没有元素的界面在 BACK 试够次数后成为死胡同；
     * 完全没有动作的节点只会来自直接构造，访问过即算死胡同
     */
    public boolean isDeadEnd(GraphNode node) {
        requireOwned(node, "node");
        boolean deadEnd;
        if (node.getActionAttempts().isEmpty()) {
            deadEnd = node.getVisitCount() > 0;
        } else {
            boolean exhausted = node.getActionAttempts().values().stream()
                    .allMatch(attempts -> attempts >= deadEndRetryBudget);
            deadEnd = exhausted && !node.isDiscoveredNew();
        }
        if (deadEnd) {
            node.setDeadEnd(true);
        }
        return deadEnd;
    }

    /**
     * 仍有未尝试动作的节点，按深度升序、创建顺序排列
     */
    public List<GraphNode> shortestUnexploredFrontier() {
        List<GraphNode> frontier = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (!node.untriedActions().isEmpty()) {
                frontier.add(node);
            }
        }
        frontier.sort(Comparator.comparingInt(GraphNode::getDepth).thenComparingInt(GraphNode::getId));
        return frontier;
    }

    public List<GraphEdge> recentEdges(int count) {
        if (count <= 0 || edges.isEmpty()) {
            return List.of();
        }
        return List.copyOf(edges.subList(Math.max(0, edges.size() - count), edges.size()));
    }

    public Optional<GraphNode> find(StateFingerprint fingerprint) {
        return Optional.ofNullable(nodes.get(fingerprint));
    }

    public boolean contains(GraphNode node) {
        return node != null && nodes.get(node.getFingerprint()) == node;
    }

    public List<GraphNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public List<GraphEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public GraphNode getEntry() {
        return entry;
    }

    private void requireOwned(GraphNode node, String role) {
        if (!contains(node)) {
            throw new IllegalArgumentException(role + " node does not belong to this graph: " + node);
        }
    }

    private void recomputeDepths() {
        if (entry == null) {
            return;
        }
        for (GraphNode node : nodes.values()) {
            node.setDepth(Integer.MAX_VALUE);
        }
        entry.setDepth(0);
        Deque<GraphNode> queue = new ArrayDeque<>();
        queue.add(entry);
        while (!queue.isEmpty()) {
            GraphNode current = queue.poll();
            for (GraphNode next : adjacency.getOrDefault(current.getId(), List.of())) {
                if (next.getDepth() == Integer.MAX_VALUE) {
                    next.setDepth(current.getDepth() + 1);
                    queue.add(next);
                }
            }
        }
    }
}
