package com.example.llmexplorer.session.graph.edges;

import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.SessionState;
import com.example.llmexplorer.session.graph.SessionEdge;
import com.example.llmexplorer.session.graph.SessionNode;

/**
 * DECIDING -> ACTING / RECORDING
 *
 * 没拿到决定时直接去记录一条失败边
 */
public class AfterDecidingEdge implements SessionEdge {

    @Override
    public SessionState decide(SessionContext context, SessionNode.NodeResult lastResult) {
        return context.getDecision() == null ? SessionState.RECORDING : SessionState.ACTING;
    }
}
