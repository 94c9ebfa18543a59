package com.example.llmexplorer.oracle;

import com.example.llmexplorer.common.ExplorerException;
import lombok.Getter;

/**
 * 重试若干次后 LLM 仍未给出有效回复
 */
@Getter
public class OracleRetriesExhaustedException extends ExplorerException {

    private final int attempts;

    public OracleRetriesExhaustedException(int attempts, ExplorerException lastError) {
        super("LLM 连续 " + attempts + " 次回复无效，最后一次: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }
}
