package com.example.llmexplorer.oracle;

import com.example.llmexplorer.common.ExplorerException;

/**
 * 回复格式正确，但元素不存在或交互不被支持
 */
public class OracleInvalidActionException extends ExplorerException {

    public OracleInvalidActionException(String message) {
        super(message);
    }
}
