package com.example.llmexplorer.oracle;

import com.example.llmexplorer.common.ExplorerException;

/**
 * LLM 接口不可用（网络、超时、5xx）
 */
public class OracleUnavailableException extends ExplorerException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
