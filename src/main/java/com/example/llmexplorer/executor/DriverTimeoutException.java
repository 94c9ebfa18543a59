package com.example.llmexplorer.executor;

/**
 * 驱动调用超时
 */
public class DriverTimeoutException extends ActionExecutionException {

    public DriverTimeoutException(String message) {
        super(message);
    }

    public DriverTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
