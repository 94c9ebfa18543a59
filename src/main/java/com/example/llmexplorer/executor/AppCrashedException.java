package com.example.llmexplorer.executor;

/**
 * 被测 App 崩溃或被系统杀死
 */
public class AppCrashedException extends ActionExecutionException {

    public AppCrashedException(String message) {
        super(message);
    }

    public AppCrashedException(String message, Throwable cause) {
        super(message, cause);
    }
}
