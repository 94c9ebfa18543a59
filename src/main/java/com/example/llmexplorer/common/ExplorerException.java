package com.example.llmexplorer.common;

/**
 * 探索引擎所有业务异常的根类型
 */
public class ExplorerException extends RuntimeException {

    public ExplorerException(String message) {
        super(message);
    }

    public ExplorerException(String message, Throwable cause) {
        super(message, cause);
    }
}
