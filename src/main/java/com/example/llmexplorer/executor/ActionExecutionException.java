package com.example.llmexplorer.executor;

import com.example.llmexplorer.common.ExplorerException;

/**
 * 驱动执行动作失败，具体原因见子类
 */
public class ActionExecutionException extends ExplorerException {

    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
