package com.example.llmexplorer.knowledge;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 合并时同一注释 key 出现不同值；以后写入者为准，只记日志
 */
@Getter
@ToString
@AllArgsConstructor
public class KnowledgeMergeConflict {

    private final String appId;
    private final String fingerprint;
    private final String annotationKey;
    private final String previousValue;
    private final String newValue;
    private final String sessionId;
}
