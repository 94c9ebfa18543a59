package com.example.llmexplorer.fingerprint;

import com.example.llmexplorer.common.ExplorerException;

/**
 * 抓取结果为空、没有根节点或无法解析
 */
public class CaptureException extends ExplorerException {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
