package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.common.ExplorerException;

public class KnowledgePersistenceException extends ExplorerException {

    public KnowledgePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
