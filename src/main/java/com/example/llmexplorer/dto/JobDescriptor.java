package com.example.llmexplorer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 一个探索任务
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDescriptor {

    private String id;
    /** 被测 App 的包名 */
    private String appId;
    private String entryActivity;
    @Builder.Default
    private DeviceSelector device = DeviceSelector.any();
    private int stepBudget;
    private long timeBudgetSeconds;
    private GoalSpec goal;
    /** 任务来自哪个文件，便于定位问题 */
    private String source;

    public Duration timeBudget() {
        return Duration.ofSeconds(timeBudgetSeconds);
    }
}
