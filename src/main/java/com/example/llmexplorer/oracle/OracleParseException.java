package com.example.llmexplorer.oracle;

import com.example.llmexplorer.common.ExplorerException;

/**
 * LLM 回复格式不对
 */
public class OracleParseException extends ExplorerException {

    public OracleParseException(String message) {
        super(message);
    }
}
