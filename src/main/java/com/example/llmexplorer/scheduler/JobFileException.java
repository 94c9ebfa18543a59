package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.common.ExplorerException;

/**
 * 任务文件或其中某个任务不合法
 */
public class JobFileException extends ExplorerException {

    public JobFileException(String message) {
        super(message);
    }

    public JobFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
