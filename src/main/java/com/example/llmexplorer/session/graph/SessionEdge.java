package com.example.llmexplorer.session.graph;

import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.SessionState;

/**
 * 条件边 - 根据上下文决定下一个状态，不修改上下文
 */
@FunctionalInterface
public interface SessionEdge {

    /**
     * @return 下一个状态，null 表示结束
     */
    SessionState decide(SessionContext context, SessionNode.NodeResult lastResult);
}
