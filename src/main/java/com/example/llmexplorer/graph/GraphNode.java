package com.example.llmexplorer.graph;

import com.example.llmexplorer.fingerprint.StateFingerprint;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 活动图中的一个界面状态，首次访问时创建，会话内不删除
 */
@Getter
public class GraphNode {

    private final int id;
    private final StateFingerprint fingerprint;
    private final String screenName;
    private int visitCount;
    /** 距会话入口的 BFS 距离，不可达时为 Integer.MAX_VALUE */
    @Setter
    private int depth = Integer.MAX_VALUE;
    @Setter
    private boolean deadEnd;
    @Setter
    private boolean terminal;
    /** 是否有出边到达过当时的新节点 */
    @Setter
    private boolean discoveredNew;
    private final Map<String, Integer> actionAttempts = new LinkedHashMap<>();

    GraphNode(int id, StateFingerprint fingerprint, String screenName) {
        this.id = id;
        this.fingerprint = fingerprint;
        this.screenName = screenName;
    }

    void visit() {
        visitCount++;
    }

    void registerActions(Collection<String> actionKeys) {
        if (actionKeys == null) {
            return;
        }
        for (String key : actionKeys) {
            actionAttempts.putIfAbsent(key, 0);
        }
    }

    void recordAttempt(String actionKey) {
        actionAttempts.merge(actionKey, 1, Integer::sum);
    }

    public int attemptsOf(String actionKey) {
        return actionAttempts.getOrDefault(actionKey, 0);
    }

    public Map<String, Integer> getActionAttempts() {
        return Collections.unmodifiableMap(actionAttempts);
    }

    public List<String> untriedActions() {
        List<String> untried = new ArrayList<>();
        actionAttempts.forEach((key, attempts) -> {
            if (attempts == 0) {
                untried.add(key);
            }
        });
        return untried;
    }

    @Override
    public String toString() {
        return "GraphNode{" + id + ", " + screenName + ", " + fingerprint.shortValue() + "}";
    }
}
