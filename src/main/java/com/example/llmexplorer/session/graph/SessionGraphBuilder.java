package com.example.llmexplorer.session.graph;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.executor.ActionExecutor;
import com.example.llmexplorer.oracle.DecisionOracle;
import com.example.llmexplorer.session.FallbackPolicy;
import com.example.llmexplorer.session.ScreenObserver;
import com.example.llmexplorer.session.SessionState;
import com.example.llmexplorer.session.graph.edges.AfterActingEdge;
import com.example.llmexplorer.session.graph.edges.AfterDecidingEdge;
import com.example.llmexplorer.session.graph.nodes.ActNode;
import com.example.llmexplorer.session.graph.nodes.DecideNode;
import com.example.llmexplorer.session.graph.nodes.ObserveNode;
import com.example.llmexplorer.session.graph.nodes.RecordNode;
import com.example.llmexplorer.session.graph.nodes.RecoverNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 会话状态图构建器
 *
 * OBSERVING -> DECIDING -> ACTING -> RECORDING -> OBSERVING，
 * 崩溃 / 离开 App / 循环逃逸经 RECOVERING 回到主循环
 */
@Component
@RequiredArgsConstructor
public class SessionGraphBuilder {

    private final ScreenObserver screenObserver;
    private final DecisionOracle decisionOracle;
    private final FallbackPolicy fallbackPolicy;
    private final ActionExecutor actionExecutor;
    private final ExplorerProperties properties;

    public SessionGraph build() {
        SessionGraph graph = new SessionGraph();

        // 1. 添加所有节点
        graph.addNode(SessionState.OBSERVING, new ObserveNode(screenObserver, properties));
        graph.addNode(SessionState.DECIDING, new DecideNode(decisionOracle, fallbackPolicy, properties));
        graph.addNode(SessionState.ACTING, new ActNode(actionExecutor));
        graph.addNode(SessionState.RECORDING, new RecordNode(screenObserver));
        graph.addNode(SessionState.RECOVERING, new RecoverNode(actionExecutor));

        // 2. 添加条件边

        // observing -> deciding / recovering（观察时发现崩溃）
        graph.addEdge(SessionState.OBSERVING,
                (context, result) -> context.isRecoveryRequested() ? SessionState.RECOVERING : SessionState.DECIDING);

        graph.addEdge(SessionState.DECIDING, new AfterDecidingEdge());

        graph.addEdge(SessionState.ACTING, new AfterActingEdge());

        // recording -> observing / recovering（循环逃逸需要重启、动作后崩溃）
        graph.addEdge(SessionState.RECORDING,
                (context, result) -> context.isRecoveryRequested() ? SessionState.RECOVERING : SessionState.OBSERVING);

        // recovering -> recording（补记本步）/ observing
        graph.addEdge(SessionState.RECOVERING,
                (context, result) -> context.isRecordAfterRecovery() ? SessionState.RECORDING : SessionState.OBSERVING);

        // 3. 设置起始状态
        graph.setStart(SessionState.OBSERVING);
        return graph;
    }
}
