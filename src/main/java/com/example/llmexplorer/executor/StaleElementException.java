package com.example.llmexplorer.executor;

/**
 * 目标元素已不在当前界面
 */
public class StaleElementException extends ActionExecutionException {

    public StaleElementException(String message) {
        super(message);
    }

    public StaleElementException(String message, Throwable cause) {
        super(message, cause);
    }
}
