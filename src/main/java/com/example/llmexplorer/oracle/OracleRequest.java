package com.example.llmexplorer.oracle;

import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.graph.GraphEdge;
import com.example.llmexplorer.graph.GraphNode;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * 一次决策需要的全部输入
 */
@Data
@Builder
public class OracleRequest {

    private String appId;
    private GraphNode node;
    private ObservedState observed;
    @Builder.Default
    private List<GraphEdge> recentEdges = List.of();
    /** 以往会话在该界面尝试过的动作 */
    @Builder.Default
    private Set<String> pastTriedActions = Set.of();
    @Builder.Default
    private Set<String> crashActions = Set.of();
    @Builder.Default
    private Set<String> bannedActions = Set.of();
    private String goal;
    /** 以往会话对该界面的描述 */
    private String screenDescription;
    private String loopHint;
}
