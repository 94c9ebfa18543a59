package com.example.llmexplorer.session.graph.edges;

import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.SessionState;
import com.example.llmexplorer.session.graph.SessionEdge;
import com.example.llmexplorer.session.graph.SessionNode;

/**
 * ACTING -> RECOVERING / RECORDING
 *
 * 崩溃或离开 App 先恢复，恢复完成后再记录本步的边
 */
public class AfterActingEdge implements SessionEdge {

    @Override
    public SessionState decide(SessionContext context, SessionNode.NodeResult lastResult) {
        if (context.getExecutionResult() != null && context.getExecutionResult().needsRecovery()) {
            return SessionState.RECOVERING;
        }
        return SessionState.RECORDING;
    }
}
