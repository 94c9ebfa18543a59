package com.example.llmexplorer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次调度运行的汇总
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    @Builder.Default
    private List<SessionResult> results = new ArrayList<>();

    /**
     * 没有任何设备能满足要求的任务：jobId -> 原因
     */
    @Builder.Default
    private Map<String, String> skippedJobs = new LinkedHashMap<>();

    /**
     * 因全局超时或停止信号未能开始的任务
     */
    @Builder.Default
    private List<String> notStartedJobs = new ArrayList<>();

    private int doneSessions;
    private int failedSessions;
    private int totalSteps;
    private int totalVisitedNodes;
    private int mergeConflicts;
    private boolean globalTimeoutHit;
    private boolean knowledgePersisted;

    private Instant startedAt;
    private Instant finishedAt;
    private long elapsedMs;
}
