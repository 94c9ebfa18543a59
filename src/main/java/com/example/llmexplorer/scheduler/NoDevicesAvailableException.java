package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.common.ExplorerException;

public class NoDevicesAvailableException extends ExplorerException {

    public NoDevicesAvailableException(String message) {
        super(message);
    }
}
