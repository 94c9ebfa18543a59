package com.example.llmexplorer.session.graph;

import com.example.llmexplorer.session.SessionContext;

/**
 * 会话状态机节点
 *
 * 节点的职责：
 * 1. 读取并修改 SessionContext
 * 2. 不决定下一步走哪（由条件边决定）
 */
@FunctionalInterface
public interface SessionNode {

    /**
     * 执行节点逻辑
     *
     * @param context 当前会话上下文
     * @return 执行结果（用于条件边判断）
     */
    NodeResult execute(SessionContext context);

    /**
     * 节点执行结果
     */
    class NodeResult {
        private final boolean success;
        private final String detail;

        private NodeResult(boolean success, String detail) {
            this.success = success;
            this.detail = detail;
        }

        public static NodeResult success() {
            return new NodeResult(true, null);
        }

        public static NodeResult failure(String reason) {
            return new NodeResult(false, reason);
        }

        public boolean isSuccess() {
            return success;
        }

        public String getDetail() {
            return detail;
        }
    }
}
